package com.geico.poc.faunasql.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Fauna SQL translator
 */
@Configuration
@ConfigurationProperties(prefix = "fauna-sql")
public class FaunaSqlConfig {

    private StoreConfig store = new StoreConfig();
    private RetryConfig retry = new RetryConfig();
    private TranslationConfig translation = new TranslationConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry;
    }

    public TranslationConfig getTranslation() {
        return translation;
    }

    public void setTranslation(TranslationConfig translation) {
        this.translation = translation;
    }

    /**
     * Connection to the document store's HTTP query endpoint
     */
    public static class StoreConfig {
        private String endpoint = "https://db.fauna.com";
        private String secret = "";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 60000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }

    /**
     * Retries of "document data is not valid" errors, raised while the store still
     * provisions a new collection or index
     */
    public static class RetryConfig {
        private int maxRetries = 10;
        private long backoffStepMs = 1000;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBackoffStepMs() {
            return backoffStepMs;
        }

        public void setBackoffStepMs(long backoffStepMs) {
            this.backoffStepMs = backoffStepMs;
        }
    }

    public static class TranslationConfig {
        // most documents read from one set in a single call
        private int maxPageSize = 100000;

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }
}
