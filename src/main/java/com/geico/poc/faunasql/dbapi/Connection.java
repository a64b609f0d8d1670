package com.geico.poc.faunasql.dbapi;

import com.geico.poc.faunasql.client.FaunaClient;
import com.geico.poc.faunasql.errors.UsageException;

import java.util.ArrayList;
import java.util.List;

/**
 * A session against the store. The store has no cross-statement transactions, so commit and
 * rollback do nothing; each statement is applied as it runs.
 */
public class Connection implements AutoCloseable {

    private final FaunaClient client;
    private final List<Cursor> cursors = new ArrayList<>();
    private boolean closed;

    public Connection(FaunaClient client) {
        this.client = client;
    }

    public Cursor cursor() {
        checkOpen();
        Cursor cursor = new Cursor(this, client);
        cursors.add(cursor);
        return cursor;
    }

    public void commit() {
        checkOpen();
    }

    public void rollback() {
        checkOpen();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the connection and every cursor it opened.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        for (Cursor cursor : cursors) {
            cursor.close();
        }
        cursors.clear();
        closed = true;
    }

    private void checkOpen() {
        if (closed) {
            throw new UsageException("Connection is closed");
        }
    }
}
