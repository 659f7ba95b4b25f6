package io.trading.analytics.gateway;

import io.trading.analytics.gateway.config.GatewayConfig;
import io.trading.analytics.gateway.core.AnalyticsController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Trade Analytics Gateway.
 */
public class TradeAnalyticsGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(TradeAnalyticsGateway.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Trade Analytics Gateway Starting...");
        LOGGER.info("========================================");

        try {
            GatewayConfig config = GatewayConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Gateway ID: {}", config.gatewayId());
            LOGGER.info("  Feed: {}", config.feed().streamUri());
            LOGGER.info("  Correlation pairs: {}", config.correlationPairs());
            LOGGER.info("  Flush interval: {} ms", config.flushIntervalMs());
            LOGGER.info("  Sinks: {}", config.sinks());

            AnalyticsController controller = new AnalyticsController(config);
            controller.start();

            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.waitForShutdown();
            controller.close();
        } catch (Exception e) {
            LOGGER.error("Fatal error in Trade Analytics Gateway", e);
            System.exit(1);
        }

        LOGGER.info("Trade Analytics Gateway exited");
    }
}
