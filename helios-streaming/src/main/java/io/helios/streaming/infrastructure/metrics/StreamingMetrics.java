package io.helios.streaming.infrastructure.metrics;

import io.helios.streaming.domain.data.SourceKind;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus counters for the streaming core.
 *
 * Key Metrics:
 * - helios_clients_connected - live sessions
 * - helios_data_points_sent_total{kind} - data frames accepted by a client channel
 * - helios_subscriptions_total{kind} - subscribe requests handled
 * - helios_protocol_errors_total{reason} - inbound messages answered with an error
 * - helios_delivery_failures_total - sends rejected because the peer was gone
 *
 * Source series are labelled by {@link SourceKind}, never by the client-supplied
 * source name, so label cardinality stays fixed.
 *
 * Nothing is exposed over HTTP; the server_stats broadcast reads these values.
 */
public class StreamingMetrics {

    private final CollectorRegistry registry;

    private final Gauge clientsConnected;
    private final Counter dataPointsSent;
    private final Counter subscriptions;
    private final Counter protocolErrors;
    private final Counter deliveryFailures;

    public StreamingMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public StreamingMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.clientsConnected = Gauge.build()
            .name("helios_clients_connected")
            .help("Number of connected streaming clients")
            .register(registry);

        this.dataPointsSent = Counter.build()
            .name("helios_data_points_sent_total")
            .help("Data messages delivered to subscribers")
            .labelNames("kind")
            .register(registry);

        this.subscriptions = Counter.build()
            .name("helios_subscriptions_total")
            .help("Subscribe requests handled")
            .labelNames("kind")
            .register(registry);

        this.protocolErrors = Counter.build()
            .name("helios_protocol_errors_total")
            .help("Inbound messages answered with an error")
            .labelNames("reason")
            .register(registry);

        this.deliveryFailures = Counter.build()
            .name("helios_delivery_failures_total")
            .help("Outbound sends rejected because the peer was gone")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    public void setClientsConnected(int count) {
        clientsConnected.set(count);
    }

    public void recordDataPointSent(SourceKind kind) {
        dataPointsSent.labels(kind.wireName()).inc();
    }

    public void recordSubscription(SourceKind kind) {
        subscriptions.labels(kind.wireName()).inc();
    }

    public void recordProtocolError(String reason) {
        protocolErrors.labels(reason).inc();
    }

    public void recordDeliveryFailure() {
        deliveryFailures.inc();
    }

    /**
     * Total data points delivered across all sources.
     */
    public long totalDataPointsSent() {
        Double total = sumSamples("helios_data_points_sent_total");
        return total == null ? 0L : total.longValue();
    }

    public double subscriptionCount(SourceKind kind) {
        Double v = registry.getSampleValue("helios_subscriptions_total",
            new String[]{"kind"}, new String[]{kind.wireName()});
        return v == null ? 0.0 : v;
    }

    public double protocolErrorCount(String reason) {
        Double v = registry.getSampleValue("helios_protocol_errors_total",
            new String[]{"reason"}, new String[]{reason});
        return v == null ? 0.0 : v;
    }

    public double deliveryFailureCount() {
        Double v = registry.getSampleValue("helios_delivery_failures_total");
        return v == null ? 0.0 : v;
    }

    private Double sumSamples(String sampleName) {
        double sum = 0.0;
        boolean found = false;
        for (Collector.MetricFamilySamples family : dataPointsSent.collect()) {
            for (Collector.MetricFamilySamples.Sample sample : family.samples) {
                if (sample.name.equals(sampleName)) {
                    sum += sample.value;
                    found = true;
                }
            }
        }
        return found ? sum : null;
    }
}
