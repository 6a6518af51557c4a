package dev.ossaudit.audit;

import dev.ossaudit.AuditErrorKind;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** How an audit run ended. Only the CLI turns this into a process exit code. */
public sealed interface AuditOutcome permits AuditOutcome.Completed, AuditOutcome.Aborted {
    int EXIT_OK = 0;
    int EXIT_FAILURE = 1;

    int exitCode();

    /**
     * Every dependency was classified.
     *
     * @param audits per-dependency results in manifest order
     * @param report rendered attribution report, when requested
     */
    record Completed(List<DependencyAudit> audits, boolean approved, @Nullable String report) implements AuditOutcome {
        public Completed {
            audits = List.copyOf(audits);
        }

        public Optional<String> reportText() {
            return Optional.ofNullable(report);
        }

        public List<DependencyAudit> violations() {
            return audits.stream().filter(a -> !a.approved()).toList();
        }

        @Override
        public int exitCode() {
            return approved ? EXIT_OK : EXIT_FAILURE;
        }
    }

    /** The run stopped before a verdict could be reached. */
    record Aborted(AuditErrorKind kind, String message, @Nullable Throwable cause) implements AuditOutcome {
        @Override
        public int exitCode() {
            return EXIT_FAILURE;
        }
    }
}
