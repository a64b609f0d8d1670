package com.geico.poc.faunasql.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geico.poc.faunasql.errors.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.InputStream;

/**
 * Talks to the store's HTTP query endpoint: {@code POST /} with a bearer secret. Successful
 * responses carry {@code {"resource": ...}}, failed ones {@code {"errors": [{code, description}]}}.
 */
public class HttpStoreTransport implements StoreTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpStoreTransport.class);

    private final RestClient restClient;
    private final String secret;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HttpStoreTransport(RestClient restClient, String secret) {
        this.restClient = restClient;
        this.secret = secret;
    }

    @Override
    public JsonNode query(JsonNode expression) {
        JsonNode body;
        int status;
        try {
            ResponseBody response = restClient.post()
                .uri("/")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + secret)
                .contentType(MediaType.APPLICATION_JSON)
                .body(expression)
                .exchange((request, clientResponse) -> {
                    try (InputStream stream = clientResponse.getBody()) {
                        return new ResponseBody(clientResponse.getStatusCode().value(), objectMapper.readTree(stream));
                    }
                });
            body = response.json;
            status = response.status;
        } catch (RestClientException e) {
            throw new StoreException("unavailable", "Could not reach the store: " + e.getMessage(), e);
        }

        if (body != null && body.has("errors")) {
            JsonNode error = body.get("errors").path(0);
            String code = error.path("code").asText("unknown");
            String description = error.path("description").asText("");
            log.debug("Store returned HTTP {} {}: {}", status, code, description);
            throw new StoreException(code, description);
        }
        if (body == null || !body.has("resource")) {
            throw new StoreException("invalid response", "HTTP " + status + " without a resource: " + body);
        }
        return body.get("resource");
    }

    private static final class ResponseBody {
        private final int status;
        private final JsonNode json;

        private ResponseBody(int status, JsonNode json) {
            this.status = status;
            this.json = json;
        }
    }
}
