package dev.ossaudit.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/** Builds the attribution report: records sorted by repository, then by semantic version, rendered as JSON. */
public class OssReadmeAssembler {
    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final Comparator<AttributionRecord> ORDER = Comparator.comparing(AttributionRecord::name)
            .thenComparing(AttributionRecord::version, SemanticVersions.COMPARATOR);

    public List<AttributionRecord> sort(Collection<AttributionRecord> records) {
        return records.stream().sorted(ORDER).toList();
    }

    public String render(Collection<AttributionRecord> records) {
        try {
            return mapper.writeValueAsString(sort(records));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize attribution report", e);
        }
    }
}
