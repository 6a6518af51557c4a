package dev.ossaudit.license;

import java.io.IOException;
import java.util.Optional;

/** One way of obtaining a repository's license text; a link in the resolver's fallback chain. */
public interface LicenseSource {

    /** Short name shown in diagnostics and recorded as {@link LicenseDocument#source()}. */
    String name();

    /** @return the license text, or empty if this source has none for the repository */
    Optional<String> fetch(RepositoryId repository) throws IOException;
}
