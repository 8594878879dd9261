package io.helios.streaming.domain.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One generated sample of a source. Transient: built per tick, never stored.
 *
 * @param timestamp ISO-8601 local timestamp of generation
 * @param source    source name the generator is registered under
 * @param values    field name to value (rounded to 2 decimals), in the generator's field order
 * @param metadata  sequence / quality / anomaly score
 */
public record DataPoint(
    String timestamp,
    String source,
    Map<String, Double> values,
    Metadata metadata
) {
    public DataPoint {
        if (timestamp == null || source == null || values == null || metadata == null) {
            throw new IllegalArgumentException("timestamp, source, values and metadata cannot be null");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Double value(String field) {
        return values.get(field);
    }

    public record Metadata(long sequence, double quality, double anomalyScore) {}
}
