package dev.ossaudit.manifest;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestReaderTest {

    private static final String LOCK = """
            # This file is automatically @generated by Cargo.
            version = 3

            [[package]]
            name = "winapi"
            version = "0.3.9"
            source = "registry+https://github.com/rust-lang/crates.io-index"
            dependencies = [
             "winapi-i686-pc-windows-gnu",
            ]

            [[package]]
            name = "inno_updater"
            version = "0.11.1"
            dependencies = [
             "winapi",
            ]

            [[package]]
            name = "byteorder"
            version = "1.4.3"
            source = "registry+https://github.com/rust-lang/crates.io-index"

            [[package]]
            name = "crc"
            version = "1.8.1"
            source = "registry+https://github.com/rust-lang/crates.io-index"
            """;

    @TempDir
    Path tempDir;

    @Test
    void excludesOnlySelfPackageAndKeepsOrder() throws Exception {
        var lock = write("Cargo.lock", LOCK);

        var entries = new ManifestReader("inno_updater").read(lock);

        assertEquals(
                List.of(
                        new DependencyEntry("winapi", "0.3.9"),
                        new DependencyEntry("byteorder", "1.4.3"),
                        new DependencyEntry("crc", "1.8.1")),
                entries);
    }

    @Test
    void keepsEverythingWithoutSelfPackage() throws Exception {
        var lock = write("Cargo.lock", LOCK);

        var entries = new ManifestReader(null).read(lock);

        assertEquals(4, entries.size());
        assertEquals("inno_updater", entries.get(1).name());
    }

    @Test
    void detectsSelfPackageFromSiblingCargoToml() throws Exception {
        var lock = write("Cargo.lock", LOCK);
        write("Cargo.toml", """
                [package]
                name = "inno_updater"
                version = "0.11.1"
                edition = "2018"
                """);

        var reader = ManifestReader.forLockFile(lock, null);

        assertEquals("inno_updater", reader.selfPackage());
        assertTrue(reader.read(lock).stream().noneMatch(e -> e.name().equals("inno_updater")));
    }

    @Test
    void explicitSelfPackageWinsOverCargoToml() throws Exception {
        var lock = write("Cargo.lock", LOCK);
        write("Cargo.toml", "[package]\nname = \"inno_updater\"\n");

        var reader = ManifestReader.forLockFile(lock, "crc");

        assertEquals("crc", reader.selfPackage());
        assertEquals(3, reader.read(lock).size());
    }

    @Test
    void missingFileIsManifestError() {
        var ex = assertThrows(ManifestException.class, () -> new ManifestReader(null).read(tempDir.resolve("nope.lock")));
        assertTrue(ex.getMessage().contains("nope.lock"));
    }

    @Test
    void invalidTomlIsManifestError() throws Exception {
        var lock = write("Cargo.lock", "[[package]\nname = ");

        assertThrows(ManifestException.class, () -> new ManifestReader(null).read(lock));
    }

    @Test
    void lockWithoutPackagesIsManifestError() throws Exception {
        var lock = write("Cargo.lock", "version = 3\n");

        var ex = assertThrows(ManifestException.class, () -> new ManifestReader(null).read(lock));
        assertTrue(ex.getMessage().contains("[[package]]"));
    }

    @Test
    void packageWithoutVersionIsManifestError() throws Exception {
        var lock = write("Cargo.lock", "[[package]]\nname = \"winapi\"\n");

        var ex = assertThrows(ManifestException.class, () -> new ManifestReader(null).read(lock));
        assertTrue(ex.getMessage().contains("'version'"));
    }

    private Path write(String name, String content) throws IOException {
        var path = tempDir.resolve(name);
        Files.writeString(path, content);
        return path;
    }
}
