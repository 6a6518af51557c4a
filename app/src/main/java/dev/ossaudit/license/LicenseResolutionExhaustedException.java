package dev.ossaudit.license;

import dev.ossaudit.AuditErrorKind;
import dev.ossaudit.AuditException;
import java.util.List;
import java.util.stream.Collectors;

/** Every source in the fallback chain failed to produce license text for a repository. */
public class LicenseResolutionExhaustedException extends AuditException {

    /** Why one source did not yield a license. */
    public record FailedAttempt(String source, String reason) {
        @Override
        public String toString() {
            return source + " (" + reason + ")";
        }
    }

    private final RepositoryId repository;
    private final List<FailedAttempt> attempts;

    public LicenseResolutionExhaustedException(RepositoryId repository, List<FailedAttempt> attempts) {
        super("Could not find license text for " + repository + "; tried "
                + attempts.stream().map(FailedAttempt::toString).collect(Collectors.joining(", ")));
        this.repository = repository;
        this.attempts = List.copyOf(attempts);
    }

    public RepositoryId repository() {
        return repository;
    }

    public List<FailedAttempt> attempts() {
        return attempts;
    }

    @Override
    public AuditErrorKind kind() {
        return AuditErrorKind.LICENSE_RESOLUTION_EXHAUSTED;
    }
}
