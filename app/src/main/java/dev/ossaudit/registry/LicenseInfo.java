package dev.ossaudit.registry;

import org.jetbrains.annotations.Nullable;

/**
 * License metadata the registry reports for one exact package version.
 *
 * @param licenseString the declared license expression; null when the version declares none
 * @param repositoryUrl the source repository the registry lists for the package, if any
 */
public record LicenseInfo(
        String packageName, String version, @Nullable String licenseString, @Nullable String repositoryUrl) {}
