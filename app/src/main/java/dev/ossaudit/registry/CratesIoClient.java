package dev.ossaudit.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * {@link RegistryClient} backed by the crates.io JSON API ({@code GET /api/v1/crates/{name}}).
 *
 * <p>The crate document lists every published version; the requested one is picked by exact match on {@code num}.
 */
public class CratesIoClient implements RegistryClient {
    private static final Logger logger = LogManager.getLogger(CratesIoClient.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String userAgent;

    public CratesIoClient(OkHttpClient httpClient, String baseUrl, String userAgent) {
        this.httpClient = httpClient;
        this.baseUrl = Objects.requireNonNull(HttpUrl.parse(baseUrl), () -> "Invalid registry URL: " + baseUrl);
        this.userAgent = userAgent;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CrateDocument(
            @JsonProperty("crate") @Nullable CrateMeta crate,
            @JsonProperty("versions") @Nullable List<VersionMeta> versions) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CrateMeta(@JsonProperty("name") String name, @JsonProperty("repository") @Nullable String repository) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VersionMeta(
            @JsonProperty("crate") @Nullable String crate,
            @JsonProperty("num") String num,
            @JsonProperty("license") @Nullable String license) {}

    @Override
    public LicenseInfo fetchLicense(String name, String version)
            throws VersionNotFoundException, RegistryUnavailableException {
        var document = fetchCrate(name);
        return selectVersion(document, name, version);
    }

    CrateDocument fetchCrate(String name) throws RegistryUnavailableException {
        var url = baseUrl.newBuilder()
                .addPathSegments("api/v1/crates")
                .addPathSegment(name)
                .build();
        var request = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .get()
                .build();

        logger.debug("GET {}", url);
        try (var response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new RegistryUnavailableException(
                        "Registry lookup for " + name + " failed: HTTP " + response.code() + " from " + url);
            }
            var body = response.body();
            if (body == null) {
                throw new RegistryUnavailableException("Registry lookup for " + name + " returned no body");
            }
            var document = mapper.readValue(body.string(), CrateDocument.class);
            if (document.versions() != null && document.versions().contains(null)) {
                throw new RegistryUnavailableException("Registry returned a null version entry for " + name);
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new RegistryUnavailableException("Registry returned malformed metadata for " + name, e);
        } catch (IOException e) {
            throw new RegistryUnavailableException(
                    "Registry lookup for " + name + " failed: " + e.getMessage(), e);
        }
    }

    static LicenseInfo selectVersion(CrateDocument document, String name, String version)
            throws VersionNotFoundException {
        var versions = document.versions() == null ? List.<VersionMeta>of() : document.versions();
        var match = versions.stream()
                .filter(v -> version.equals(v.num()))
                .findFirst()
                .orElseThrow(() -> new VersionNotFoundException(name, version));

        var crate = document.crate();
        var crateName = match.crate() != null ? match.crate() : (crate != null ? crate.name() : name);
        var repository = crate != null ? crate.repository() : null;
        return new LicenseInfo(crateName, match.num(), match.license(), repository);
    }
}
