package dev.ossaudit.license;

import java.io.IOException;
import java.util.Optional;

/** Read access to repositories on a source-hosting platform. */
public interface SourceHost {

    /**
     * Raw content of {@code path} on the repository's default branch.
     *
     * @return empty if the file does not exist
     * @throws IOException on transport failures or unexpected HTTP statuses
     */
    Optional<String> fetchRawFile(RepositoryId repository, String path) throws IOException;

    /**
     * The license text the platform detected for the repository, already decoded.
     *
     * @return empty if the platform reports no license
     * @throws IOException on transport failures, unexpected HTTP statuses, or undecodable payloads
     */
    Optional<String> fetchDetectedLicense(RepositoryId repository) throws IOException;
}
