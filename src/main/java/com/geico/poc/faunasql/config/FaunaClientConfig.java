package com.geico.poc.faunasql.config;

import com.geico.poc.faunasql.client.BoundedLinearRetryPolicy;
import com.geico.poc.faunasql.client.HttpStoreTransport;
import com.geico.poc.faunasql.client.RetryPolicy;
import com.geico.poc.faunasql.client.StoreTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the store transport and retry policy from {@link FaunaSqlConfig}
 */
@Configuration
public class FaunaClientConfig {

    private static final Logger log = LoggerFactory.getLogger(FaunaClientConfig.class);

    @Bean
    public StoreTransport storeTransport(FaunaSqlConfig config) {
        FaunaSqlConfig.StoreConfig store = config.getStore();
        log.info("Configuring store transport: endpoint={}, connectTimeout={}ms, readTimeout={}ms",
            store.getEndpoint(), store.getConnectTimeoutMs(), store.getReadTimeoutMs());
        if (store.getSecret() == null || store.getSecret().isEmpty()) {
            log.warn("No store secret configured (fauna-sql.store.secret); queries will be rejected by the store");
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(store.getConnectTimeoutMs());
        requestFactory.setReadTimeout(store.getReadTimeoutMs());

        RestClient restClient = RestClient.builder()
            .baseUrl(store.getEndpoint())
            .requestFactory(requestFactory)
            .build();
        return new HttpStoreTransport(restClient, store.getSecret());
    }

    @Bean
    public RetryPolicy retryPolicy(FaunaSqlConfig config) {
        return new BoundedLinearRetryPolicy(config.getRetry().getMaxRetries(), config.getRetry().getBackoffStepMs());
    }
}
