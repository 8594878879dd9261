package io.helios.streaming.config;

import io.helios.streaming.util.Env;

import java.time.Duration;

/**
 * Process-level configuration for the streaming server.
 *
 * Values come from the environment (see {@link Env}) and may be overridden
 * on the command line with {@code --host} and {@code --port}.
 */
public record StreamingConfig(
    String host,
    int port,
    Duration statsInterval,
    Duration pingInterval,
    Duration pingTimeout,
    int dispatcherThreads,
    boolean rejectUnknownTypes
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8083;

    /**
     * Defaults matching the reference deployment: stats every 5s, ping every 20s, 10s pong timeout.
     */
    public static StreamingConfig defaults() {
        return new StreamingConfig(
            DEFAULT_HOST,
            DEFAULT_PORT,
            Duration.ofSeconds(5),
            Duration.ofSeconds(20),
            Duration.ofSeconds(10),
            Runtime.getRuntime().availableProcessors(),
            false
        );
    }

    /**
     * Read configuration from environment variables / system properties.
     */
    public static StreamingConfig fromEnv() {
        StreamingConfig d = defaults();
        return new StreamingConfig(
            Env.get("HELIOS_HOST", d.host()),
            Env.getInt("HELIOS_PORT", d.port()),
            Duration.ofMillis(Env.getLong("HELIOS_STATS_INTERVAL_MS", d.statsInterval().toMillis())),
            Duration.ofMillis(Env.getLong("HELIOS_PING_INTERVAL_MS", d.pingInterval().toMillis())),
            Duration.ofMillis(Env.getLong("HELIOS_PING_TIMEOUT_MS", d.pingTimeout().toMillis())),
            Env.getInt("HELIOS_DISPATCHER_THREADS", d.dispatcherThreads()),
            Env.getBool("HELIOS_REJECT_UNKNOWN_TYPES", d.rejectUnknownTypes())
        );
    }

    /**
     * Apply {@code --host <h>} / {@code --port <p>} overrides (also {@code --host=h}).
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a non-numeric port
     */
    public StreamingConfig withArgs(String[] args) {
        String newHost = host;
        int newPort = port;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String value = null;

            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }

            switch (name) {
                case "--host" -> {
                    if (value == null) {
                        value = requireValue(args, ++i, name);
                    }
                    newHost = value;
                }
                case "--port" -> {
                    if (value == null) {
                        value = requireValue(args, ++i, name);
                    }
                    try {
                        newPort = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid port: " + value, e);
                    }
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }

        return new StreamingConfig(newHost, newPort, statsInterval, pingInterval, pingTimeout,
            dispatcherThreads, rejectUnknownTypes);
    }

    /**
     * Validate configuration values.
     *
     * @throws IllegalStateException describing the first invalid value
     */
    public void validate() {
        if (host == null || host.isBlank()) {
            throw new IllegalStateException("Bind host must not be empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("Bind port out of range: " + port);
        }
        requirePositive("Stats interval", statsInterval);
        requirePositive("Ping interval", pingInterval);
        requirePositive("Ping timeout", pingTimeout);
        if (dispatcherThreads < 1) {
            throw new IllegalStateException("Dispatcher threads must be >= 1: " + dispatcherThreads);
        }
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalStateException(name + " must be positive: " + d);
        }
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }
}
