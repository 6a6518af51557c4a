package dev.ossaudit.manifest;

import dev.ossaudit.AuditErrorKind;
import dev.ossaudit.AuditException;

/** The lock file is missing, unreadable, or not a well-formed Cargo lock file. */
public class ManifestException extends AuditException {
    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public AuditErrorKind kind() {
        return AuditErrorKind.MANIFEST;
    }
}
