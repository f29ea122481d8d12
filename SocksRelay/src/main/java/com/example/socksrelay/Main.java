package com.example.socksrelay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : "config.yaml";
        Config cfg = Config.loadOrDefault(configPath);

        ACLManager aclManager = new ACLManager(cfg.acl);

        Socks5Server server = new Socks5Server(cfg, aclManager);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.stop(cfg.shutdownTimeout);
            } catch (InterruptedException e) {
                logger.warn("Interrupted while waiting for connections to finish");
                Thread.currentThread().interrupt();
            }
        }, "socks5-shutdown"));
    }
}
