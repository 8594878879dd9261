package io.helios.streaming.bootstrap;

import io.helios.streaming.config.StreamingConfig;
import io.helios.streaming.domain.data.SourceKind;
import io.helios.streaming.infrastructure.metrics.StreamingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Core Java entry point (NO Spring).
 *
 * Usage: {@code java -jar helios-streaming.jar [--host <host>] [--port <port>]}
 * See {@link StreamingConfig} for environment variables.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Helios Streaming Server Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        StreamingConfig config;
        try {
            config = StreamingConfig.fromEnv().withArgs(args);
            config.validate();
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("❌ CONFIGURATION INVALID: {}", e.getMessage());
            System.exit(1);
            return;
        }

        StreamingServer server = new StreamingServer(config, new StreamingMetrics());
        try {
            server.start();
        } catch (StreamingServerException e) {
            log.error("❌ STARTUP FAILED", e);
            System.exit(1);
            return;
        }

        log.info("📊 Available data sources: {}", SourceKind.advertised());
        log.info("🔗 WebSocket URL: ws://{}:{}", config.host(), server.getPort());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("🛑 Shutdown signal received");
            try {
                server.stop();
            } catch (Exception e) {
                log.error("Error during shutdown", e);
            } finally {
                stopped.countDown();
            }
        }, "shutdown-hook"));

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private App() {}
}
