package dev.ossaudit.audit;

import dev.ossaudit.manifest.DependencyEntry;
import dev.ossaudit.registry.LicenseInfo;
import dev.ossaudit.report.AttributionRecord;
import org.jetbrains.annotations.Nullable;

/**
 * Result of auditing one dependency.
 *
 * @param attribution present only when the attribution report was requested
 */
public record DependencyAudit(
        DependencyEntry entry, LicenseInfo info, boolean approved, @Nullable AttributionRecord attribution) {}
