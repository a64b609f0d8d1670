package com.geico.poc.faunasql.dbapi;

import com.geico.poc.faunasql.client.FaunaClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Opens {@link Connection}s sharing the application's store client.
 */
@Component
public class ConnectionFactory {

    private final FaunaClient client;

    @Autowired
    public ConnectionFactory(FaunaClient client) {
        this.client = client;
    }

    public Connection connect() {
        return new Connection(client);
    }
}
