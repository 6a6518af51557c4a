package dev.ossaudit.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable settings for one audit run.
 *
 * <p>Resolution order, lowest to highest precedence: bundled {@value #DEFAULTS_RESOURCE}, environment
 * ({@value #TOKEN_ENV} only), command-line overrides applied through the {@code with*} methods.
 */
public record AuditSettings(
        String registryUrl,
        String githubApiUrl,
        String githubRawUrl,
        String sourceHost,
        String userAgent,
        int concurrency,
        String approvedMarker,
        Duration connectTimeout,
        Duration readTimeout,
        @Nullable String githubToken) {
    private static final Logger logger = LogManager.getLogger(AuditSettings.class);

    public static final String DEFAULTS_RESOURCE = "/oss-audit.properties";
    public static final String TOKEN_ENV = "GITHUB_TOKEN";

    public AuditSettings {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
        if (approvedMarker.isEmpty()) {
            throw new IllegalArgumentException("approved license marker must not be empty");
        }
        registryUrl = stripTrailingSlash(registryUrl);
        githubApiUrl = stripTrailingSlash(githubApiUrl);
        githubRawUrl = stripTrailingSlash(githubRawUrl);
        githubToken = (githubToken == null || githubToken.isBlank()) ? null : githubToken.trim();
    }

    /** Bundled defaults plus the token from {@code env}. */
    public static AuditSettings load(Map<String, String> env) {
        var props = loadDefaults();
        var settings = new AuditSettings(
                require(props, "registry.url"),
                require(props, "github.api.url"),
                require(props, "github.raw.url"),
                require(props, "source.host"),
                require(props, "http.user-agent"),
                Integer.parseInt(require(props, "audit.concurrency")),
                require(props, "policy.marker"),
                Duration.ofSeconds(Long.parseLong(require(props, "http.connect-timeout-seconds"))),
                Duration.ofSeconds(Long.parseLong(require(props, "http.read-timeout-seconds"))),
                env.get(TOKEN_ENV));
        if (settings.githubToken() == null) {
            logger.debug("{} not set; source-hosting requests are unauthenticated", TOKEN_ENV);
        }
        return settings;
    }

    static Properties loadDefaults() {
        var props = new Properties();
        try (InputStream in = AuditSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled settings resource " + DEFAULTS_RESOURCE);
            }
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
        return props;
    }

    private static String require(Properties props, String key) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Setting '" + key + "' missing from " + DEFAULTS_RESOURCE);
        }
        return value.trim();
    }

    private static String stripTrailingSlash(String url) {
        var trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public AuditSettings withRegistryUrl(String url) {
        return new AuditSettings(
                url, githubApiUrl, githubRawUrl, sourceHost, userAgent, concurrency, approvedMarker,
                connectTimeout, readTimeout, githubToken);
    }

    public AuditSettings withGithubApiUrl(String url) {
        return new AuditSettings(
                registryUrl, url, githubRawUrl, sourceHost, userAgent, concurrency, approvedMarker,
                connectTimeout, readTimeout, githubToken);
    }

    public AuditSettings withGithubRawUrl(String url) {
        return new AuditSettings(
                registryUrl, githubApiUrl, url, sourceHost, userAgent, concurrency, approvedMarker,
                connectTimeout, readTimeout, githubToken);
    }

    public AuditSettings withConcurrency(int limit) {
        return new AuditSettings(
                registryUrl, githubApiUrl, githubRawUrl, sourceHost, userAgent, limit, approvedMarker,
                connectTimeout, readTimeout, githubToken);
    }

    @Override
    public String toString() {
        // keep the token out of debug logs
        return "AuditSettings[registryUrl=" + registryUrl
                + ", githubApiUrl=" + githubApiUrl
                + ", githubRawUrl=" + githubRawUrl
                + ", sourceHost=" + sourceHost
                + ", concurrency=" + concurrency
                + ", approvedMarker=" + approvedMarker
                + ", githubToken=" + (githubToken == null ? "<unset>" : "<redacted>")
                + "]";
    }
}
