package dev.ossaudit.registry;

/** Looks up license metadata for a package version in a public package registry. */
public interface RegistryClient {

    /**
     * Fetches the metadata of exactly {@code version} of {@code name}; never the latest or a nearby version.
     *
     * @throws VersionNotFoundException if the registry knows the package but lists no such version
     * @throws RegistryUnavailableException if the registry cannot be reached or answers with an error
     */
    LicenseInfo fetchLicense(String name, String version)
            throws VersionNotFoundException, RegistryUnavailableException;
}
