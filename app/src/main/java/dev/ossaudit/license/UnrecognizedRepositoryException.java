package dev.ossaudit.license;

import dev.ossaudit.AuditErrorKind;
import dev.ossaudit.AuditException;
import org.jetbrains.annotations.Nullable;

/** A registry-reported repository URL does not point at a repository on the supported source host. */
public class UnrecognizedRepositoryException extends AuditException {
    private final @Nullable String url;

    public UnrecognizedRepositoryException(@Nullable String url, String reason) {
        super("Unrecognized repository URL '" + url + "': " + reason);
        this.url = url;
    }

    public @Nullable String url() {
        return url;
    }

    @Override
    public AuditErrorKind kind() {
        return AuditErrorKind.UNRECOGNIZED_REPOSITORY;
    }
}
