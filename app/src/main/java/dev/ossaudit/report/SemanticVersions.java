package dev.ossaudit.report;

import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;
import java.util.Comparator;
import java.util.Optional;

/** Semantic version precedence, including pre-release ordering ({@code 1.0.0-alpha < 1.0.0}). */
public final class SemanticVersions {
    private SemanticVersions() {}

    /** Valid versions by precedence; versions that do not parse sort after them, as plain strings. */
    public static final Comparator<String> COMPARATOR = SemanticVersions::compare;

    public static int compare(String a, String b) {
        var left = parse(a);
        var right = parse(b);
        if (left.isPresent() && right.isPresent()) {
            return left.get().compareTo(right.get());
        }
        if (left.isPresent()) {
            return -1;
        }
        if (right.isPresent()) {
            return 1;
        }
        return a.compareTo(b);
    }

    static Optional<Semver> parse(String version) {
        try {
            return Optional.of(new Semver(version, Semver.SemverType.STRICT));
        } catch (SemverException e) {
            return Optional.empty();
        }
    }
}
