package dev.ossaudit.policy;

import dev.ossaudit.registry.LicenseInfo;
import java.io.PrintStream;
import java.util.Collection;
import org.jetbrains.annotations.Nullable;

/**
 * License allow-list check. A license is approved when its declared expression contains the marker, so
 * {@code "MIT OR Apache-2.0"} passes under the default {@code MIT} marker.
 */
public class PolicyEvaluator {
    public static final String DEFAULT_MARKER = "MIT";

    static final String PASS_GLYPH = "✔︎";
    static final String FAIL_GLYPH = "✖︎";

    private final String marker;
    private final PrintStream diagnostics;

    public PolicyEvaluator(String marker, PrintStream diagnostics) {
        if (marker.isEmpty()) {
            throw new IllegalArgumentException("marker must not be empty");
        }
        this.marker = marker;
        this.diagnostics = diagnostics;
    }

    public String marker() {
        return marker;
    }

    /** Case-sensitive substring test; a missing license is never approved. */
    public boolean isApproved(@Nullable String licenseString) {
        return licenseString != null && licenseString.contains(marker);
    }

    /** Evaluates and writes the diagnostic line for one dependency. */
    public boolean evaluate(LicenseInfo info) {
        boolean approved = isApproved(info.licenseString());
        report(info, approved);
        return approved;
    }

    void report(LicenseInfo info, boolean approved) {
        diagnostics.println(info.packageName() + " " + info.version() + " " + info.licenseString() + " "
                + (approved ? PASS_GLYPH : FAIL_GLYPH));
    }

    /** True only if every dependency is approved. */
    public static boolean verdict(Collection<Boolean> approvals) {
        return approvals.stream().allMatch(Boolean::booleanValue);
    }
}
