package dev.ossaudit.license;

import com.google.common.base.Splitter;
import java.util.Locale;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * An {@code owner/repo} pair on the source-hosting platform.
 *
 * <p>Accepted URL shapes, for host {@code github.com}:
 * <ul>
 *   <li>{@code https://github.com/OWNER/REPO}
 *   <li>{@code https://github.com/OWNER/REPO.git}
 *   <li>{@code https://www.github.com/OWNER/REPO/tree/master/sub-crate}
 *   <li>{@code github.com/OWNER/REPO}
 * </ul>
 */
public record RepositoryId(String owner, String repo) {
    private static final Pattern SEGMENT = Pattern.compile("^[A-Za-z0-9_.-]+$");

    public RepositoryId {
        if (!SEGMENT.matcher(owner).matches() || !SEGMENT.matcher(repo).matches()) {
            throw new IllegalArgumentException("Invalid owner/repo: " + owner + "/" + repo);
        }
    }

    /**
     * Extracts the repository identifier from {@code url}, which must have the form {@code host/owner/repo[/...]}.
     *
     * @throws UnrecognizedRepositoryException if the URL is missing or is not on {@code host}
     */
    public static RepositoryId parse(@Nullable String url, String host) throws UnrecognizedRepositoryException {
        if (url == null || url.isBlank()) {
            throw new UnrecognizedRepositoryException(url, "no repository URL reported");
        }

        String cleaned = url.trim();
        int protocolIndex = cleaned.indexOf("://");
        if (protocolIndex >= 0) {
            cleaned = cleaned.substring(protocolIndex + 3);
        }

        var segments = Splitter.on('/').omitEmptyStrings().trimResults().splitToList(cleaned);
        if (segments.size() < 3) {
            throw new UnrecognizedRepositoryException(url, "expected " + host + "/owner/repo");
        }

        var urlHost = segments.get(0).toLowerCase(Locale.ROOT);
        if (urlHost.startsWith("www.")) {
            urlHost = urlHost.substring(4);
        }
        if (!urlHost.equals(host.toLowerCase(Locale.ROOT))) {
            throw new UnrecognizedRepositoryException(url, "not hosted on " + host);
        }

        var owner = segments.get(1);
        var repo = segments.get(2);
        if (repo.endsWith(".git")) {
            repo = repo.substring(0, repo.length() - 4);
        }
        if (!SEGMENT.matcher(owner).matches() || !SEGMENT.matcher(repo).matches()) {
            throw new UnrecognizedRepositoryException(url, "malformed owner or repository name");
        }
        return new RepositoryId(owner, repo);
    }

    /** The {@code owner/repo} slug. */
    public String slug() {
        return owner + "/" + repo;
    }

    @Override
    public String toString() {
        return slug();
    }
}
