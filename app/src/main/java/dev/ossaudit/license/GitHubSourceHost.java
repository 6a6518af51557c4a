package dev.ossaudit.license;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * GitHub access through two endpoints: raw file downloads ({@code {raw}/{owner}/{repo}/HEAD/{path}}) and the
 * repository license API ({@code {api}/repos/{owner}/{repo}/license}).
 *
 * <p>Requests carry a bearer token when one is configured; without it GitHub applies the anonymous rate limit.
 */
public class GitHubSourceHost implements SourceHost {
    private static final Logger logger = LogManager.getLogger(GitHubSourceHost.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    /** Ref that raw.githubusercontent.com resolves to the default branch. */
    static final String DEFAULT_BRANCH_REF = "HEAD";

    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]");

    private final OkHttpClient httpClient;
    private final HttpUrl apiUrl;
    private final HttpUrl rawUrl;
    private final String userAgent;
    private final @Nullable String token;

    public GitHubSourceHost(
            OkHttpClient httpClient, String apiUrl, String rawUrl, String userAgent, @Nullable String token) {
        this.httpClient = httpClient;
        this.apiUrl = Objects.requireNonNull(HttpUrl.parse(apiUrl), () -> "Invalid GitHub API URL: " + apiUrl);
        this.rawUrl = Objects.requireNonNull(HttpUrl.parse(rawUrl), () -> "Invalid GitHub raw URL: " + rawUrl);
        this.userAgent = userAgent;
        this.token = token;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LicenseContent(
            @JsonProperty("path") @Nullable String path,
            @JsonProperty("content") @Nullable String content,
            @JsonProperty("encoding") @Nullable String encoding) {}

    @Override
    public Optional<String> fetchRawFile(RepositoryId repository, String path) throws IOException {
        var url = rawUrl.newBuilder()
                .addPathSegment(repository.owner())
                .addPathSegment(repository.repo())
                .addPathSegment(DEFAULT_BRANCH_REF)
                .addPathSegments(path)
                .build();
        return get(url, "text/plain");
    }

    @Override
    public Optional<String> fetchDetectedLicense(RepositoryId repository) throws IOException {
        var url = apiUrl.newBuilder()
                .addPathSegment("repos")
                .addPathSegment(repository.owner())
                .addPathSegment(repository.repo())
                .addPathSegment("license")
                .build();
        var body = get(url, "application/vnd.github+json");
        if (body.isEmpty()) {
            return Optional.empty();
        }

        var payload = mapper.readValue(body.get(), LicenseContent.class);
        if (payload.content() == null || payload.content().isBlank()) {
            return Optional.empty();
        }
        var encoding = payload.encoding() == null ? "base64" : payload.encoding().toLowerCase(Locale.ROOT);
        if (!encoding.equals("base64")) {
            throw new IOException("Unsupported license content encoding '" + encoding + "' for " + repository);
        }
        try {
            // GitHub wraps base64 content at 60 columns; anything else in the payload is corruption
            var unwrapped = LINE_BREAKS.matcher(payload.content()).replaceAll("");
            var decoded = Base64.getDecoder().decode(unwrapped);
            return Optional.of(new String(decoded, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new IOException("License content for " + repository + " is not valid base64", e);
        }
    }

    private Optional<String> get(HttpUrl url, String accept) throws IOException {
        var builder = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent)
                .header("Accept", accept)
                .get();
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }

        logger.debug("GET {}", url);
        try (var response = httpClient.newCall(builder.build()).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + url);
            }
            var body = response.body();
            return body == null ? Optional.empty() : Optional.of(body.string());
        }
    }
}
