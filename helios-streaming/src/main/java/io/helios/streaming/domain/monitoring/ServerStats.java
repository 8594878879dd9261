package io.helios.streaming.domain.monitoring;

import java.util.List;

/**
 * Aggregate statistics pushed to every client by the stats broadcaster.
 *
 * @param clientsConnected live sessions in the snapshot being broadcast to
 * @param activeSources    source names with a live generator
 * @param uptimeSeconds    seconds since server start
 * @param memoryUsedBytes  JVM heap in use
 * @param dataPointsSent   data messages delivered since start
 */
public record ServerStats(
    int clientsConnected,
    List<String> activeSources,
    double uptimeSeconds,
    long memoryUsedBytes,
    long dataPointsSent
) {
    public ServerStats {
        activeSources = List.copyOf(activeSources);
    }
}
