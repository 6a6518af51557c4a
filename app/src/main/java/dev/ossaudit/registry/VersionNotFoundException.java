package dev.ossaudit.registry;

import dev.ossaudit.AuditErrorKind;
import dev.ossaudit.AuditException;

public class VersionNotFoundException extends AuditException {
    private final String packageName;
    private final String version;

    public VersionNotFoundException(String packageName, String version) {
        super("Registry has no version " + version + " of " + packageName);
        this.packageName = packageName;
        this.version = version;
    }

    public String packageName() {
        return packageName;
    }

    public String version() {
        return version;
    }

    @Override
    public AuditErrorKind kind() {
        return AuditErrorKind.VERSION_NOT_FOUND;
    }
}
