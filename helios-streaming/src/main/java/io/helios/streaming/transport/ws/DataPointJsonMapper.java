package io.helios.streaming.transport.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.helios.streaming.domain.data.DataPoint;

import java.util.Map;

/**
 * DataPoint -> wire JSON: {timestamp, source, data:{field: value}, metadata:{sequence, quality, anomaly_score}}.
 */
public final class DataPointJsonMapper {
    private DataPointJsonMapper() {}

    public static ObjectNode toJson(ObjectMapper mapper, DataPoint p) {
        ObjectNode o = mapper.createObjectNode();
        o.put("timestamp", p.timestamp());
        o.put("source", p.source());

        ObjectNode data = o.putObject("data");
        for (Map.Entry<String, Double> e : p.values().entrySet()) {
            data.put(e.getKey(), e.getValue());
        }

        ObjectNode meta = o.putObject("metadata");
        meta.put("sequence", p.metadata().sequence());
        meta.put("quality", p.metadata().quality());
        meta.put("anomaly_score", p.metadata().anomalyScore());
        return o;
    }
}
