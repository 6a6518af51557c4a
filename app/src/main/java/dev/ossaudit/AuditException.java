package dev.ossaudit;

/**
 * Base type for every failure that prevents the auditor from making a policy determination.
 * A negative policy verdict is not an exception; see {@link dev.ossaudit.audit.AuditOutcome}.
 */
public abstract class AuditException extends Exception {
    protected AuditException(String message) {
        super(message);
    }

    protected AuditException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract AuditErrorKind kind();
}
