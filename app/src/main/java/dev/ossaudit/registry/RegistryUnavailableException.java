package dev.ossaudit.registry;

import dev.ossaudit.AuditErrorKind;
import dev.ossaudit.AuditException;

/** Network failure, error status, or unreadable response from the registry. */
public class RegistryUnavailableException extends AuditException {
    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public AuditErrorKind kind() {
        return AuditErrorKind.REGISTRY_UNAVAILABLE;
    }
}
