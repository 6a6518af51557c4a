package dev.ossaudit.license;

import dev.ossaudit.license.LicenseResolutionExhaustedException.FailedAttempt;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves a repository's license text by trying an ordered list of {@link LicenseSource}s, one at a time, stopping at
 * the first that yields non-blank text.
 */
public class LicenseTextResolver {
    private static final Logger logger = LogManager.getLogger(LicenseTextResolver.class);

    /** Explicit MIT/Apache files win over a generic LICENSE file. */
    public static final List<String> CANDIDATE_FILES = List.of("LICENSE-MIT", "LICENSE-APACHE", "LICENSE", "LICENSE.md");

    private final List<LicenseSource> sources;

    public LicenseTextResolver(List<LicenseSource> sources) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("at least one license source is required");
        }
        this.sources = List.copyOf(sources);
    }

    /** The candidate files in order, then the platform's license API as the last resort. */
    public static LicenseTextResolver forHost(SourceHost host) {
        var chain = new ArrayList<LicenseSource>();
        for (var file : CANDIDATE_FILES) {
            chain.add(new RawLicenseFileSource(host, file));
        }
        chain.add(new DetectedLicenseSource(host));
        return new LicenseTextResolver(chain);
    }

    public List<LicenseSource> sources() {
        return sources;
    }

    public LicenseDocument resolve(RepositoryId repository) throws LicenseResolutionExhaustedException {
        var failures = new ArrayList<FailedAttempt>();
        for (var source : sources) {
            Optional<String> text;
            try {
                text = source.fetch(repository);
            } catch (IOException e) {
                logger.debug("{}: {} failed: {}", repository, source.name(), e.getMessage());
                failures.add(new FailedAttempt(source.name(), e.getMessage() == null ? e.toString() : e.getMessage()));
                continue;
            }

            if (text.isPresent() && !text.get().isBlank()) {
                if (!failures.isEmpty()) {
                    logger.debug("{}: resolved from {} after {} failed attempt(s)", repository, source.name(), failures.size());
                }
                return new LicenseDocument(text.get(), source.name());
            }
            failures.add(new FailedAttempt(source.name(), text.isPresent() ? "empty" : "not found"));
        }
        throw new LicenseResolutionExhaustedException(repository, failures);
    }
}
