package com.geico.poc.faunasql.dbapi;

import com.geico.poc.faunasql.client.FaunaClient;
import com.geico.poc.faunasql.client.QueryResult;
import com.geico.poc.faunasql.errors.UsageException;
import com.geico.poc.faunasql.sql.ParsedStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Executes statements and hands back their rows one batch at a time.
 *
 * States: open, executed, closed. Fetching before the first execute, or using a closed
 * cursor, raises {@link UsageException}. Not thread-safe.
 */
public class Cursor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Cursor.class);

    private final Connection connection;
    private final FaunaClient client;

    private boolean closed;
    private boolean executed;
    private Deque<List<Object>> pending = new ArrayDeque<>();
    private List<ColumnDescription> description;
    private long rowcount = -1;
    private Object lastrowid;
    private int arraysize = 1;

    Cursor(Connection connection, FaunaClient client) {
        this.connection = connection;
        this.client = client;
    }

    public Cursor execute(String sql) {
        checkOpen();
        return run(sql);
    }

    public Cursor execute(String sql, List<?> parameters) {
        checkOpen();
        return run(ParameterEscaper.bind(sql, parameters));
    }

    public Cursor execute(String sql, Map<String, ?> parameters) {
        checkOpen();
        return run(ParameterEscaper.bind(sql, parameters));
    }

    /**
     * Runs the statement once per parameter set; {@link #getRowcount()} is the total.
     */
    public Cursor executemany(String sql, List<? extends List<?>> parameterSets) {
        checkOpen();
        long total = 0;
        for (List<?> parameters : parameterSets) {
            run(ParameterEscaper.bind(sql, parameters));
            total += Math.max(rowcount, 0);
        }
        rowcount = total;
        return this;
    }

    private Cursor run(String sql) {
        QueryResult result = client.execute(sql);
        executed = true;
        pending = new ArrayDeque<>(result.getTuples());
        description = describe(result);
        lastrowid = null;

        ParsedStatement.Type type = result.getType();
        if ((type == ParsedStatement.Type.UPDATE || type == ParsedStatement.Type.DELETE) && !result.isEmpty()) {
            Object count = result.first("count");
            rowcount = count instanceof Number ? ((Number) count).longValue() : -1;
        } else {
            rowcount = result.size();
        }
        if (type == ParsedStatement.Type.INSERT && !result.isEmpty()) {
            lastrowid = result.first("id");
        }
        log.debug("Executed {} ({} rows)", type, rowcount);
        return this;
    }

    private static List<ColumnDescription> describe(QueryResult result) {
        if (result.getColumns().isEmpty()) {
            return null;
        }
        List<Object> first = result.isEmpty() ? null : result.getTuples().get(0);
        List<ColumnDescription> columns = new ArrayList<>();
        for (int i = 0; i < result.getColumns().size(); i++) {
            columns.add(new ColumnDescription(result.getColumns().get(i), typeCode(first == null ? null : first.get(i))));
        }
        return columns;
    }

    private static String typeCode(Object value) {
        if (value instanceof String) {
            return ColumnDescription.STRING;
        }
        if (value instanceof Number) {
            return ColumnDescription.NUMBER;
        }
        if (value instanceof Boolean) {
            return ColumnDescription.BOOLEAN;
        }
        if (value instanceof LocalDate) {
            return ColumnDescription.DATE;
        }
        if (value instanceof OffsetDateTime) {
            return ColumnDescription.DATETIME;
        }
        return ColumnDescription.UNKNOWN;
    }

    /**
     * Next row, its values in {@link #getDescription()} order, or null when all rows were fetched.
     */
    public List<Object> fetchone() {
        checkFetchable();
        return pending.pollFirst();
    }

    public List<List<Object>> fetchmany() {
        return fetchmany(arraysize);
    }

    public List<List<Object>> fetchmany(int size) {
        checkFetchable();
        List<List<Object>> rows = new ArrayList<>();
        while (rows.size() < size && !pending.isEmpty()) {
            rows.add(pending.pollFirst());
        }
        return rows;
    }

    public List<List<Object>> fetchall() {
        checkFetchable();
        List<List<Object>> rows = new ArrayList<>(pending);
        pending.clear();
        return rows;
    }

    /**
     * Rows returned or affected by the last execute; -1 before any.
     */
    public long getRowcount() {
        return rowcount;
    }

    /**
     * Id of the document created by the last INSERT, or null.
     */
    public Object getLastrowid() {
        return lastrowid;
    }

    /**
     * Column descriptions of the last result, or null when it had no columns or nothing ran yet.
     */
    public List<ColumnDescription> getDescription() {
        return description;
    }

    public int getArraysize() {
        return arraysize;
    }

    public void setArraysize(int arraysize) {
        if (arraysize < 1) {
            throw new UsageException("arraysize must be at least 1, got " + arraysize);
        }
        this.arraysize = arraysize;
    }

    public Connection getConnection() {
        return connection;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        pending.clear();
    }

    private void checkOpen() {
        if (closed) {
            throw new UsageException("Cursor is closed");
        }
        if (connection.isClosed()) {
            throw new UsageException("Connection is closed");
        }
    }

    private void checkFetchable() {
        checkOpen();
        if (!executed) {
            throw new UsageException("No statement executed yet; call execute() before fetching");
        }
    }
}
