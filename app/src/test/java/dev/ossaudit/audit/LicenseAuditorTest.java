package dev.ossaudit.audit;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ossaudit.AuditErrorKind;
import dev.ossaudit.exec.BoundedTaskScheduler;
import dev.ossaudit.license.LicenseTextResolver;
import dev.ossaudit.license.RepositoryId;
import dev.ossaudit.license.SourceHost;
import dev.ossaudit.manifest.DependencyEntry;
import dev.ossaudit.policy.PolicyEvaluator;
import dev.ossaudit.registry.LicenseInfo;
import dev.ossaudit.registry.RegistryClient;
import dev.ossaudit.registry.RegistryUnavailableException;
import dev.ossaudit.registry.VersionNotFoundException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class LicenseAuditorTest {

    private static class FakeRegistry implements RegistryClient {
        private final Map<String, LicenseInfo> infos;

        FakeRegistry(LicenseInfo... infos) {
            this.infos = Arrays.stream(infos)
                    .collect(Collectors.toMap(i -> i.packageName() + "@" + i.version(), i -> i));
        }

        @Override
        public LicenseInfo fetchLicense(String name, String version)
                throws VersionNotFoundException, RegistryUnavailableException {
            if (name.equals("offline")) {
                throw new RegistryUnavailableException("connection refused");
            }
            var info = infos.get(name + "@" + version);
            if (info == null) {
                throw new VersionNotFoundException(name, version);
            }
            return info;
        }
    }

    /** Every repository has a plain LICENSE file naming itself. */
    private static class FakeSourceHost implements SourceHost {
        @Override
        public Optional<String> fetchRawFile(RepositoryId repository, String path) {
            return path.equals("LICENSE") ? Optional.of("MIT License\n\n(c) " + repository.slug()) : Optional.empty();
        }

        @Override
        public Optional<String> fetchDetectedLicense(RepositoryId repository) {
            return Optional.empty();
        }
    }

    private final ByteArrayOutputStream diagnostics = new ByteArrayOutputStream();

    private LicenseAuditor auditor(RegistryClient registry) {
        var stream = new PrintStream(diagnostics, true, StandardCharsets.UTF_8);
        return new LicenseAuditor(
                registry,
                LicenseTextResolver.forHost(new FakeSourceHost()),
                new PolicyEvaluator(PolicyEvaluator.DEFAULT_MARKER, stream),
                new BoundedTaskScheduler(3),
                "github.com",
                stream);
    }

    private String diagnostics() {
        return diagnostics.toString(StandardCharsets.UTF_8);
    }

    private static LicenseInfo info(String name, String version, String license) {
        return new LicenseInfo(name, version, license, "https://github.com/owner/" + name);
    }

    @Test
    void allApprovedCompletesWithoutReport() {
        var registry = new FakeRegistry(info("winapi", "0.3.9", "MIT/Apache-2.0"), info("crc", "1.8.1", "MIT"));

        var outcome = auditor(registry).audit(
                List.of(new DependencyEntry("winapi", "0.3.9"), new DependencyEntry("crc", "1.8.1")), false);

        var completed = assertInstanceOf(AuditOutcome.Completed.class, outcome);
        assertTrue(completed.approved());
        assertEquals(0, completed.exitCode());
        assertTrue(completed.reportText().isEmpty());
        assertEquals(
                List.of("winapi", "crc"),
                completed.audits().stream().map(a -> a.entry().name()).toList());
        assertTrue(diagnostics().startsWith("Checking OSS dependencies for MIT license..."));
        assertFalse(diagnostics().contains("Some dependencies are not MIT!"));
    }

    @Test
    void oneViolationFailsTheVerdict() {
        var registry = new FakeRegistry(info("good", "1.0.0", "MIT"), info("bad", "2.0.0", "GPL-3.0"));

        var outcome = auditor(registry).audit(
                List.of(new DependencyEntry("good", "1.0.0"), new DependencyEntry("bad", "2.0.0")), false);

        var completed = assertInstanceOf(AuditOutcome.Completed.class, outcome);
        assertFalse(completed.approved());
        assertEquals(1, completed.exitCode());
        assertEquals(List.of("bad"), completed.violations().stream().map(a -> a.entry().name()).toList());
        assertTrue(diagnostics().contains("bad 2.0.0 GPL-3.0 ✖︎"));
        assertTrue(diagnostics().contains("good 1.0.0 MIT ✔︎"));
        assertTrue(diagnostics().contains("Some dependencies are not MIT!"));
    }

    @Test
    void missingVersionAbortsInsteadOfFailingPolicy() {
        var registry = new FakeRegistry(info("good", "1.0.0", "MIT"));

        var outcome = auditor(registry).audit(
                List.of(new DependencyEntry("good", "1.0.0"), new DependencyEntry("good", "9.9.9")), false);

        var aborted = assertInstanceOf(AuditOutcome.Aborted.class, outcome);
        assertEquals(AuditErrorKind.VERSION_NOT_FOUND, aborted.kind());
        assertEquals(1, aborted.exitCode());
        assertTrue(aborted.message().contains("9.9.9"));
    }

    @Test
    void registryOutageAborts() {
        var outcome = auditor(new FakeRegistry()).audit(List.of(new DependencyEntry("offline", "1.0.0")), false);

        assertEquals(AuditErrorKind.REGISTRY_UNAVAILABLE, assertInstanceOf(AuditOutcome.Aborted.class, outcome).kind());
    }

    @Test
    void reportModeBuildsSortedAttribution() throws Exception {
        var registry = new FakeRegistry(
                info("zeta", "0.10.0", "MIT"), info("alpha", "1.0.0", "MIT"), new LicenseInfo(
                        "zeta-old", "0.9.0", "MIT", "https://github.com/owner/zeta"));

        var outcome = auditor(registry).audit(
                List.of(
                        new DependencyEntry("zeta", "0.10.0"),
                        new DependencyEntry("alpha", "1.0.0"),
                        new DependencyEntry("zeta-old", "0.9.0")),
                true);

        var completed = assertInstanceOf(AuditOutcome.Completed.class, outcome);
        var report = new ObjectMapper().readTree(completed.reportText().orElseThrow());
        assertEquals(3, report.size());
        assertEquals("owner/alpha", report.get(0).get("name").asText());
        assertEquals("owner/zeta", report.get(1).get("name").asText());
        assertEquals("0.9.0", report.get(1).get("version").asText());
        assertEquals("0.10.0", report.get(2).get("version").asText());
        assertEquals("(c) owner/alpha", report.get(0).get("licenseDetail").get(2).asText());
    }

    @Test
    void reportModeAbortsOnForeignRepository() {
        var registry = new FakeRegistry(new LicenseInfo("hosted", "1.0.0", "MIT", "https://gitlab.com/owner/hosted"));

        var outcome = auditor(registry).audit(List.of(new DependencyEntry("hosted", "1.0.0")), true);

        var aborted = assertInstanceOf(AuditOutcome.Aborted.class, outcome);
        assertEquals(AuditErrorKind.UNRECOGNIZED_REPOSITORY, aborted.kind());
        assertTrue(aborted.message().contains("gitlab.com"));
    }

    @Test
    void repositoryUrlIsIgnoredWithoutReport() {
        var registry = new FakeRegistry(new LicenseInfo("hosted", "1.0.0", "MIT", "https://gitlab.com/owner/hosted"));

        var outcome = auditor(registry).audit(List.of(new DependencyEntry("hosted", "1.0.0")), false);

        assertEquals(0, outcome.exitCode());
    }

    @Test
    void emptyManifestPasses() {
        var outcome = auditor(new FakeRegistry()).audit(List.of(), true);

        var completed = assertInstanceOf(AuditOutcome.Completed.class, outcome);
        assertTrue(completed.approved());
        assertEquals("[ ]", completed.reportText().orElseThrow());
    }
}
