package io.helios.streaming.service.signal;

import io.helios.streaming.domain.data.DataPoint;
import io.helios.streaming.domain.data.SourceKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Synthetic time-series generator for one source.
 *
 * Model per field: {@code new = base * (1 + trend + seasonal + noise)} where
 * seasonal is an hourly sine wave and noise is Gaussian with fixed volatility.
 * The trend random-walks once per data point inside [-MAX_TREND, MAX_TREND].
 *
 * Clamp policy:
 * - price: if negative, becomes 10% of the prior value
 * - humidity, dominance: [0, 100]
 * - temperature: [-50, 60]
 * - everything else: unclamped
 *
 * Instances are shared by every client subscribed to the same source, so all
 * state mutation happens under the instance lock.
 */
public final class SignalGenerator {

    public static final double VOLATILITY = 0.02;
    public static final double MAX_TREND = 0.005;
    public static final double TREND_STEP = 0.0001;
    public static final double INITIAL_TREND_RANGE = 0.001;
    public static final double SEASONAL_AMPLITUDE = 0.1;
    public static final double SEASONAL_PERIOD_SECONDS = 3600.0;

    public static final double PRICE_FLOOR_RATIO = 0.1;
    public static final double PERCENT_MIN = 0.0;
    public static final double PERCENT_MAX = 100.0;
    public static final double TEMPERATURE_MIN = -50.0;
    public static final double TEMPERATURE_MAX = 60.0;

    private static final long SEQUENCE_MODULUS = 1_000_000L;

    private final String source;
    private final SourceKind kind;
    private final Random random;
    private final Clock clock;

    // guarded by this
    private final LinkedHashMap<String, Double> fields;
    private double trend;

    public SignalGenerator(String source, SourceKind kind) {
        this(source, kind, new Random(), Clock.systemDefaultZone());
    }

    public SignalGenerator(String source, SourceKind kind, Random random, Clock clock) {
        this.source = source;
        this.kind = kind;
        this.random = random;
        this.clock = clock;
        this.fields = initialFields(kind, random);
        this.trend = uniform(random, -INITIAL_TREND_RANGE, INITIAL_TREND_RANGE);
    }

    public String getSource() {
        return source;
    }

    public SourceKind getKind() {
        return kind;
    }

    public synchronized double getTrend() {
        return trend;
    }

    /**
     * Snapshot of the current field values (the bases for the next tick).
     */
    public synchronized Map<String, Double> getFields() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public int fieldCount() {
        // field set is fixed at construction
        return fields.size();
    }

    /**
     * Compute the next value of one field from its current base, using the current trend.
     * Does not store the result.
     *
     * @return the clamped value rounded to 2 decimal places
     */
    public synchronized double nextValue(String field, double base) {
        double nowSeconds = clock.millis() / 1000.0;
        double seasonal = SEASONAL_AMPLITUDE * Math.sin(nowSeconds / SEASONAL_PERIOD_SECONDS);
        double noise = random.nextGaussian() * VOLATILITY;
        double candidate = base * (1 + trend + seasonal + noise);
        return round2(clamp(field, base, candidate));
    }

    /**
     * Advance every field by one tick and return the resulting data point.
     */
    public synchronized DataPoint generateDataPoint() {
        LocalDateTime now = LocalDateTime.now(clock);

        trend += uniform(random, -TREND_STEP, TREND_STEP);
        trend = Math.max(-MAX_TREND, Math.min(MAX_TREND, trend));

        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : fields.entrySet()) {
            double next = nextValue(entry.getKey(), entry.getValue());
            entry.setValue(next);
            values.put(entry.getKey(), next);
        }

        DataPoint.Metadata metadata = new DataPoint.Metadata(
            clock.millis() % SEQUENCE_MODULUS,
            uniform(random, 0.95, 1.0),
            uniform(random, 0.0, 0.1)
        );

        return new DataPoint(now.toString(), source, values, metadata);
    }

    /**
     * Apply the per-field bounds.
     *
     * @param base      value before this tick
     * @param candidate unclamped value for this tick
     */
    static double clamp(String field, double base, double candidate) {
        switch (field) {
            case "price":
                return candidate < 0 ? base * PRICE_FLOOR_RATIO : candidate;
            case "humidity":
            case "dominance":
                return Math.max(PERCENT_MIN, Math.min(PERCENT_MAX, candidate));
            case "temperature":
                return Math.max(TEMPERATURE_MIN, Math.min(TEMPERATURE_MAX, candidate));
            default:
                return candidate;
        }
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static LinkedHashMap<String, Double> initialFields(SourceKind kind, Random r) {
        LinkedHashMap<String, Double> f = new LinkedHashMap<>();
        switch (kind) {
            case STOCK -> {
                f.put("price", 100.0 + uniform(r, -20, 20));
                f.put("volume", 1_000_000.0);
                f.put("market_cap", 1_000_000_000.0);
            }
            case SENSOR -> {
                f.put("temperature", 20.0 + uniform(r, -5, 15));
                f.put("humidity", 50.0 + uniform(r, -20, 20));
                f.put("pressure", 1013.25 + uniform(r, -50, 50));
                f.put("light", uniform(r, 0, 1000));
            }
            case NETWORK -> {
                f.put("bandwidth", uniform(r, 100, 1000));
                f.put("latency", 10.0 + uniform(r, 0, 50));
                f.put("packets", uniform(r, 1000, 10000));
                f.put("errors", uniform(r, 0, 10));
            }
            case CRYPTO -> {
                f.put("price", 50_000.0 + uniform(r, -10_000, 20_000));
                f.put("volume", uniform(r, 100_000_000, 1_000_000_000));
                f.put("market_cap", 1_000_000_000_000.0);
                f.put("dominance", uniform(r, 40, 60));
            }
            case WEATHER -> {
                f.put("temperature", 15.0 + uniform(r, -10, 25));
                f.put("humidity", 40.0 + uniform(r, -20, 40));
                f.put("wind_speed", uniform(r, 0, 30));
                f.put("pressure", 1013.25 + uniform(r, -40, 40));
                f.put("precipitation", uniform(r, 0, 10));
            }
            case GENERIC -> f.put("value", 50.0);
        }
        return f;
    }

    private static double uniform(Random r, double min, double max) {
        return min + (max - min) * r.nextDouble();
    }
}
