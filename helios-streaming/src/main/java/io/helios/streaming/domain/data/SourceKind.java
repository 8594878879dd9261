package io.helios.streaming.domain.data;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Category of synthetic data feed.
 * GENERIC backs any source name that is not one of the advertised kinds.
 */
public enum SourceKind {
    STOCK("stock"),
    SENSOR("sensor"),
    NETWORK("network"),
    CRYPTO("crypto"),
    WEATHER("weather"),
    GENERIC("generic");

    private static final List<String> ADVERTISED = Arrays.stream(values())
        .filter(k -> k != GENERIC)
        .map(SourceKind::wireName)
        .toList();

    private final String wireName;

    SourceKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a client-supplied source name. Unknown names map to GENERIC.
     */
    public static SourceKind fromName(String name) {
        if (name == null) {
            return GENERIC;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        return GENERIC;
    }

    /**
     * Source names announced to clients in the welcome message, in declaration order.
     */
    public static List<String> advertised() {
        return ADVERTISED;
    }
}
