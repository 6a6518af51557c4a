package dev.ossaudit.license;

import java.io.IOException;
import java.util.Optional;

/** A license file with a fixed name at the root of the default branch. */
public record RawLicenseFileSource(SourceHost host, String fileName) implements LicenseSource {

    @Override
    public String name() {
        return fileName;
    }

    @Override
    public Optional<String> fetch(RepositoryId repository) throws IOException {
        return host.fetchRawFile(repository, fileName);
    }
}
