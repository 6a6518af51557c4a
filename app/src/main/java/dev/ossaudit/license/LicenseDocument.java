package dev.ossaudit.license;

/**
 * License text of a repository.
 *
 * @param source which {@link LicenseSource} produced the text
 */
public record LicenseDocument(String text, String source) {}
