package io.helios.streaming.service.signal;

import io.helios.streaming.domain.data.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Source name -> live generator. Generators are created lazily on first
 * subscription and live for the rest of the process.
 *
 * Concurrent first subscriptions to the same source share one generator:
 * the first creator wins and later callers reuse it.
 */
public final class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final ConcurrentHashMap<String, SignalGenerator> generators = new ConcurrentHashMap<>();
    private final List<String> creationOrder = new CopyOnWriteArrayList<>();
    private final Function<String, SignalGenerator> factory;

    public SourceRegistry() {
        this(source -> new SignalGenerator(source, SourceKind.fromName(source)));
    }

    /**
     * @param factory builds a generator for a source name; invoked at most once per name
     */
    public SourceRegistry(Function<String, SignalGenerator> factory) {
        this.factory = factory;
    }

    public SignalGenerator getOrCreate(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return generators.computeIfAbsent(source, s -> {
            SignalGenerator generator = factory.apply(s);
            creationOrder.add(s);
            log.info("[SOURCES] Created generator source={} kind={} fields={}",
                s, generator.getKind().wireName(), generator.getFields().keySet());
            return generator;
        });
    }

    public SignalGenerator get(String source) {
        return generators.get(source);
    }

    /**
     * Names of sources with a live generator, in creation order.
     */
    public List<String> activeSources() {
        return new ArrayList<>(creationOrder);
    }

    public int size() {
        return generators.size();
    }

    /**
     * Sum of field counts across all live generators.
     */
    public int totalFieldCount() {
        int total = 0;
        for (Map.Entry<String, SignalGenerator> e : generators.entrySet()) {
            total += e.getValue().fieldCount();
        }
        return total;
    }
}
