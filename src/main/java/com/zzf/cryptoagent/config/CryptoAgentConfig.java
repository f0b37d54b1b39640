package com.zzf.cryptoagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cryptoagent")
public class CryptoAgentConfig {
    private String defaultQuote = "USDT";
    private final RateLimit rateLimit = new RateLimit();
    private final Wallet wallet = new Wallet();
    private final Exchange exchange = new Exchange();
    private final Storage storage = new Storage();

    public String getDefaultQuote() {
        return defaultQuote;
    }

    public void setDefaultQuote(String defaultQuote) {
        this.defaultQuote = defaultQuote;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Wallet getWallet() {
        return wallet;
    }

    public Exchange getExchange() {
        return exchange;
    }

    public Storage getStorage() {
        return storage;
    }

    public static class RateLimit {
        private int maxCalls = 1200;
        private long windowSeconds = 60;

        public int getMaxCalls() {
            return maxCalls;
        }

        public void setMaxCalls(int maxCalls) {
            this.maxCalls = maxCalls;
        }

        public long getWindowSeconds() {
            return windowSeconds;
        }

        public void setWindowSeconds(long windowSeconds) {
            this.windowSeconds = windowSeconds;
        }
    }

    public static class Wallet {
        private double initialUsd = 10_000.0;
        private String defaultUserId = "user_default";

        public double getInitialUsd() {
            return initialUsd;
        }

        public void setInitialUsd(double initialUsd) {
            this.initialUsd = initialUsd;
        }

        public String getDefaultUserId() {
            return defaultUserId;
        }

        public void setDefaultUserId(String defaultUserId) {
            this.defaultUserId = defaultUserId;
        }
    }

    public static class Exchange {
        private String baseUrl = "https://api.binance.com";
        private int timeoutSeconds = 10;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Storage {
        private String directory = System.getProperty("user.home") + "/.crypto-agent/storage";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }
}
