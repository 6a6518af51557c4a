package dev.ossaudit.license;

import static org.junit.jupiter.api.Assertions.*;

import dev.ossaudit.AuditErrorKind;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

class LicenseTextResolverTest {

    private static final RepositoryId REPO = new RepositoryId("owner", "repo");
    private static final String API = "<api>";

    /** Serves only the files it was given and records every attempt in order. */
    private static class FakeSourceHost implements SourceHost {
        private final Map<String, String> files = new HashMap<>();
        private final Set<String> broken;
        private @Nullable String detected;
        final List<String> attempts = new ArrayList<>();

        FakeSourceHost(Set<String> broken) {
            this.broken = broken;
        }

        FakeSourceHost() {
            this(Set.of());
        }

        FakeSourceHost file(String name, String text) {
            files.put(name, text);
            return this;
        }

        FakeSourceHost detected(String text) {
            detected = text;
            return this;
        }

        @Override
        public Optional<String> fetchRawFile(RepositoryId repository, String path) throws IOException {
            attempts.add(path);
            if (broken.contains(path)) {
                throw new IOException("HTTP 500");
            }
            return Optional.ofNullable(files.get(path));
        }

        @Override
        public Optional<String> fetchDetectedLicense(RepositoryId repository) throws IOException {
            attempts.add(API);
            if (broken.contains(API)) {
                throw new IOException("HTTP 403 rate limited");
            }
            return Optional.ofNullable(detected);
        }
    }

    @Test
    void triesCandidatesInOrderAndStopsAtFirstHit() throws Exception {
        var host = new FakeSourceHost().file("LICENSE", "MIT License\n\nCopyright (c) owner").file("LICENSE.md", "unused");

        var document = LicenseTextResolver.forHost(host).resolve(REPO);

        assertEquals(List.of("LICENSE-MIT", "LICENSE-APACHE", "LICENSE"), host.attempts);
        assertEquals("LICENSE", document.source());
        assertTrue(document.text().startsWith("MIT License"));
    }

    @Test
    void mitFileIsPreferredOverEverythingElse() throws Exception {
        var host = new FakeSourceHost().file("LICENSE-MIT", "mit text").file("LICENSE", "generic text");

        var document = LicenseTextResolver.forHost(host).resolve(REPO);

        assertEquals(List.of("LICENSE-MIT"), host.attempts);
        assertEquals("mit text", document.text());
    }

    @Test
    void transportErrorsFallThroughToNextCandidate() throws Exception {
        var host = new FakeSourceHost(Set.of("LICENSE-MIT")).file("LICENSE-APACHE", "apache text");

        var document = LicenseTextResolver.forHost(host).resolve(REPO);

        assertEquals(List.of("LICENSE-MIT", "LICENSE-APACHE"), host.attempts);
        assertEquals("LICENSE-APACHE", document.source());
    }

    @Test
    void blankFileCountsAsMissing() throws Exception {
        var host = new FakeSourceHost().file("LICENSE-MIT", "  \n").file("LICENSE-APACHE", "apache text");

        assertEquals("LICENSE-APACHE", LicenseTextResolver.forHost(host).resolve(REPO).source());
    }

    @Test
    void fallsBackToLicenseApiLast() throws Exception {
        var host = new FakeSourceHost().detected("detected text");

        var document = LicenseTextResolver.forHost(host).resolve(REPO);

        assertEquals(List.of("LICENSE-MIT", "LICENSE-APACHE", "LICENSE", "LICENSE.md", API), host.attempts);
        assertEquals("license API", document.source());
        assertEquals("detected text", document.text());
    }

    @Test
    void exhaustedChainListsEveryAttempt() {
        var host = new FakeSourceHost(Set.of("LICENSE", API));

        var ex = assertThrows(
                LicenseResolutionExhaustedException.class, () -> LicenseTextResolver.forHost(host).resolve(REPO));

        assertEquals(AuditErrorKind.LICENSE_RESOLUTION_EXHAUSTED, ex.kind());
        assertEquals(REPO, ex.repository());
        assertEquals(
                List.of("LICENSE-MIT", "LICENSE-APACHE", "LICENSE", "LICENSE.md", "license API"),
                ex.attempts().stream().map(LicenseResolutionExhaustedException.FailedAttempt::source).toList());
        assertEquals("HTTP 500", ex.attempts().get(2).reason());
        assertEquals("not found", ex.attempts().get(0).reason());
        assertTrue(ex.getMessage().contains("owner/repo"));
    }

    @Test
    void hostChainListsCandidateFilesThenLicenseApi() {
        var names = LicenseTextResolver.forHost(new FakeSourceHost()).sources().stream()
                .map(LicenseSource::name)
                .toList();

        assertEquals(List.of("LICENSE-MIT", "LICENSE-APACHE", "LICENSE", "LICENSE.md", "license API"), names);
    }

    @Test
    void customChainIsHonored() throws Exception {
        var host = new FakeSourceHost().file("COPYING", "gpl text");
        var resolver = new LicenseTextResolver(List.of(new RawLicenseFileSource(host, "COPYING")));

        assertEquals("COPYING", resolver.resolve(REPO).source());
    }

    @Test
    void emptyChainIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LicenseTextResolver(List.of()));
    }
}
