package dev.ossaudit;

/** Categories of failure that abort an audit run before a verdict can be reached. */
public enum AuditErrorKind {
    MANIFEST,
    VERSION_NOT_FOUND,
    REGISTRY_UNAVAILABLE,
    UNRECOGNIZED_REPOSITORY,
    LICENSE_RESOLUTION_EXHAUSTED
}
