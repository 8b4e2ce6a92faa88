package org.harmar.kv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            ServerConfig config = ServerConfig.load();
            logger.info("Starting with {}", config);

            HarmarKvServer server = new HarmarKvServer(config);
            server.start();

            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "harmar-kv-shutdown"));
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Server failed to start", e);
            System.exit(1);
        }
    }
}
