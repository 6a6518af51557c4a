package dev.ossaudit.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Splitter;
import dev.ossaudit.license.LicenseDocument;
import dev.ossaudit.license.RepositoryId;
import dev.ossaudit.registry.LicenseInfo;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** One entry of the OSS readme attribution report. */
@JsonPropertyOrder({"name", "version", "repositoryURL", "licenseDetail", "isProd"})
public record AttributionRecord(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("repositoryURL") @Nullable String repositoryUrl,
        @JsonProperty("licenseDetail") List<String> licenseDetail,
        @JsonProperty("isProd") boolean isProd) {

    private static final Splitter LINES = Splitter.onPattern("\r?\n");

    public AttributionRecord {
        if (licenseDetail.isEmpty()) {
            throw new IllegalArgumentException("licenseDetail must not be empty for " + name);
        }
        licenseDetail = List.copyOf(licenseDetail);
    }

    /** Lock-file dependencies ship with the product, so records built here are always production. */
    public static AttributionRecord of(RepositoryId repository, LicenseInfo info, LicenseDocument document) {
        var trimmed = document.text().trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("blank license text for " + repository);
        }
        return new AttributionRecord(
                repository.slug(), info.version(), info.repositoryUrl(), LINES.splitToList(trimmed), true);
    }
}
