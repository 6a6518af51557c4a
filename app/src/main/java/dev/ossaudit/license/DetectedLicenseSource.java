package dev.ossaudit.license;

import java.io.IOException;
import java.util.Optional;

/** The platform's own license detection. Rate-limited more strictly than raw downloads. */
public record DetectedLicenseSource(SourceHost host) implements LicenseSource {

    @Override
    public String name() {
        return "license API";
    }

    @Override
    public Optional<String> fetch(RepositoryId repository) throws IOException {
        return host.fetchDetectedLicense(repository);
    }
}
