package dev.ossaudit.manifest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Loads a {@code Cargo.lock} into the flat, ordered list of third-party packages to audit.
 *
 * <p>The audited project's own package appears in its lock file like any other entry; it is excluded by name.
 */
public final class ManifestReader {
    private static final Logger logger = LogManager.getLogger(ManifestReader.class);

    static final String CARGO_MANIFEST = "Cargo.toml";

    private final @Nullable String selfPackage;

    /**
     * @param selfPackage name of the audited project's own package, or null to exclude nothing
     */
    public ManifestReader(@Nullable String selfPackage) {
        this.selfPackage = (selfPackage == null || selfPackage.isBlank()) ? null : selfPackage.trim();
    }

    /**
     * Creates a reader that excludes {@code explicitSelf} when given, otherwise the {@code [package].name} declared by
     * a {@code Cargo.toml} sitting next to the lock file.
     */
    public static ManifestReader forLockFile(Path lockFile, @Nullable String explicitSelf) {
        if (explicitSelf != null && !explicitSelf.isBlank()) {
            return new ManifestReader(explicitSelf);
        }
        var detected = detectSelfPackage(lockFile);
        detected.ifPresentOrElse(
                name -> logger.debug("Excluding own package '{}' declared in {}", name, CARGO_MANIFEST),
                () -> logger.debug("No {} next to {}; no package will be excluded", CARGO_MANIFEST, lockFile));
        return new ManifestReader(detected.orElse(null));
    }

    public @Nullable String selfPackage() {
        return selfPackage;
    }

    public List<DependencyEntry> read(Path lockFile) throws ManifestException {
        String raw;
        try {
            raw = Files.readString(lockFile);
        } catch (IOException e) {
            throw new ManifestException("Cannot read lock file " + lockFile + ": " + e.getMessage(), e);
        }
        return parse(raw, lockFile.toString());
    }

    List<DependencyEntry> parse(String raw, String origin) throws ManifestException {
        TomlParseResult toml = Toml.parse(raw);
        if (toml.hasErrors()) {
            var problems = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ManifestException("Lock file " + origin + " is not valid TOML: " + problems);
        }

        if (!toml.isArray("package")) {
            throw new ManifestException("Lock file " + origin + " has no [[package]] entries");
        }
        TomlArray packages = Objects.requireNonNull(toml.getArray("package"));

        var entries = new ArrayList<DependencyEntry>(packages.size());
        for (int i = 0; i < packages.size(); i++) {
            if (!(packages.get(i) instanceof TomlTable table)) {
                throw new ManifestException("Lock file " + origin + ": package #" + (i + 1) + " is not a table");
            }
            var name = stringField(table, "name", i, origin);
            var version = stringField(table, "version", i, origin);
            if (name.equals(selfPackage)) {
                logger.debug("Skipping own package {}@{}", name, version);
                continue;
            }
            entries.add(new DependencyEntry(name, version));
        }
        logger.debug("Read {} dependencies from {}", entries.size(), origin);
        return List.copyOf(entries);
    }

    private static String stringField(TomlTable table, String key, int index, String origin) throws ManifestException {
        if (!table.isString(key)) {
            throw new ManifestException(
                    "Lock file " + origin + ": package #" + (index + 1) + " has no string '" + key + "'");
        }
        return Objects.requireNonNull(table.getString(key));
    }

    static Optional<String> detectSelfPackage(Path lockFile) {
        var parent = lockFile.toAbsolutePath().getParent();
        if (parent == null) {
            return Optional.empty();
        }
        var cargoToml = parent.resolve(CARGO_MANIFEST);
        if (!Files.isRegularFile(cargoToml)) {
            return Optional.empty();
        }
        try {
            var toml = Toml.parse(cargoToml);
            if (toml.hasErrors()) {
                logger.warn("Ignoring unparseable {}: {}", cargoToml, toml.errors().get(0));
                return Optional.empty();
            }
            return Optional.ofNullable(toml.getString("package.name"));
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", cargoToml, e.getMessage());
            return Optional.empty();
        }
    }
}
