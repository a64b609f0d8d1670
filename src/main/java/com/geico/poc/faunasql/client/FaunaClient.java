package com.geico.poc.faunasql.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.geico.poc.faunasql.errors.SchemaNotReadyException;
import com.geico.poc.faunasql.errors.StoreException;
import com.geico.poc.faunasql.errors.TransientStoreException;
import com.geico.poc.faunasql.errors.UniquenessViolationException;
import com.geico.poc.faunasql.fql.Expr;
import com.geico.poc.faunasql.fql.FqlSerializer;
import com.geico.poc.faunasql.fql.Ref;
import com.geico.poc.faunasql.translation.CompiledStatement;
import com.geico.poc.faunasql.translation.JoinKeyCheck;
import com.geico.poc.faunasql.translation.SqlTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Executes SQL against the document store: translates the statement, sends each compiled
 * step, and turns the final result into rows.
 */
@Component
public class FaunaClient {

    private static final Logger log = LoggerFactory.getLogger(FaunaClient.class);

    static final String NOT_YET_VALID = "document data is not valid";
    static final String NOT_UNIQUE = "document is not unique";
    static final String INSTANCE_NOT_UNIQUE = "instance not unique";
    static final String INVALID_REF = "invalid ref";
    static final String NOT_FOUND = "not found";

    private final SqlTranslator translator;
    private final StoreTransport transport;
    private final RetryPolicy retryPolicy;

    @Autowired
    public FaunaClient(SqlTranslator translator, StoreTransport transport, RetryPolicy retryPolicy) {
        this.translator = translator;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
    }

    public QueryResult execute(String sql) {
        return execute(translator.translate(sql));
    }

    public QueryResult execute(CompiledStatement statement) {
        return execute(statement, false);
    }

    /**
     * Runs a query over the information schema. A missing collection or index means no table
     * was created yet and raises {@link SchemaNotReadyException} instead of {@link StoreException}.
     */
    QueryResult introspect(String sql) {
        return execute(translator.translate(sql), true);
    }

    private QueryResult execute(CompiledStatement statement, boolean introspecting) {
        checkJoinKeys(statement.getJoinKeyChecks(), introspecting);
        Object result = null;
        for (Expr step : statement.getSteps()) {
            result = ResultDecoder.decode(send(FqlSerializer.serialize(step), introspecting));
        }
        List<List<Object>> tuples = toTuples(result);
        Integer limit = statement.getLimit();
        if (limit != null && tuples.size() > limit) {
            tuples = new ArrayList<>(tuples.subList(0, limit));
        }

        List<String> columns = statement.getColumns();
        if (columns == null) {
            columns = columnNames(result);
        }
        log.debug("{} returned {} row(s)", statement.getType(), tuples.size());
        return new QueryResult(statement.getType(), columns, tuples);
    }

    @SuppressWarnings("unchecked")
    private void checkJoinKeys(List<JoinKeyCheck> checks, boolean introspecting) {
        if (checks.isEmpty()) {
            return;
        }
        Object targets = ResultDecoder.decode(send(FqlSerializer.serialize(JoinKeyCheck.lookup(checks)), introspecting));
        for (int i = 0; i < checks.size(); i++) {
            checks.get(i).verify(((List<Object>) targets).get(i));
        }
        log.debug("Join keys verified: {}", checks);
    }

    private JsonNode send(JsonNode expression, boolean introspecting) {
        int retries = 0;
        while (true) {
            try {
                return transport.query(expression);
            } catch (StoreException e) {
                if (!isNotYetValid(e)) {
                    throw translate(e, introspecting);
                }
                if (retries >= retryPolicy.getMaxRetries()) {
                    throw new TransientStoreException(
                        "Store data still not valid after " + retries + " retries: " + e.getDescription(),
                        retries + 1, e);
                }
                retries++;
                long backoff = retryPolicy.backoffMillis(retries);
                log.warn("Store is still provisioning ({}); retry {}/{} in {}ms",
                    e.getDescription(), retries, retryPolicy.getMaxRetries(), backoff);
                pause(backoff);
            }
        }
    }

    private static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while waiting to retry", 0, e);
        }
    }

    private static boolean isNotYetValid(StoreException e) {
        return contains(e.getDescription(), NOT_YET_VALID);
    }

    private static RuntimeException translate(StoreException e, boolean introspecting) {
        if (contains(e.getDescription(), NOT_UNIQUE) || contains(e.getCode(), INSTANCE_NOT_UNIQUE)) {
            return new UniquenessViolationException(e.getDescription(), e);
        }
        if (introspecting && (contains(e.getCode(), INVALID_REF) || contains(e.getCode(), NOT_FOUND))) {
            return new SchemaNotReadyException(e.getCode() + ": " + e.getDescription(), e);
        }
        return e;
    }

    private static boolean contains(String text, String fragment) {
        return text != null && text.toLowerCase().contains(fragment);
    }

    /**
     * Each row arrives as a list of {@code [name, value]} pairs; the values are kept by position.
     */
    @SuppressWarnings("unchecked")
    static List<List<Object>> toTuples(Object result) {
        List<List<Object>> tuples = new ArrayList<>();
        if (!(result instanceof List)) {
            return tuples;
        }
        for (Object rowValue : (List<Object>) result) {
            List<Object> tuple = new ArrayList<>();
            if (rowValue instanceof List) {
                for (Object pairValue : (List<Object>) rowValue) {
                    tuple.add(rowValue(((List<Object>) pairValue).get(1)));
                }
            } else if (rowValue instanceof Map) {
                for (Object value : ((Map<String, Object>) rowValue).values()) {
                    tuple.add(rowValue(value));
                }
            }
            tuples.add(tuple);
        }
        return tuples;
    }

    /**
     * Column names read from the first row, for statements whose columns are only known once they ran.
     */
    @SuppressWarnings("unchecked")
    static List<String> columnNames(Object result) {
        List<String> names = new ArrayList<>();
        if (!(result instanceof List) || ((List<Object>) result).isEmpty()) {
            return names;
        }
        Object first = ((List<Object>) result).get(0);
        if (first instanceof List) {
            for (Object pairValue : (List<Object>) first) {
                names.add(String.valueOf(((List<Object>) pairValue).get(0)));
            }
        } else if (first instanceof Map) {
            names.addAll(((Map<String, Object>) first).keySet());
        }
        return names;
    }

    private static Object rowValue(Object value) {
        return value instanceof Ref ? ((Ref) value).getId() : value;
    }
}
