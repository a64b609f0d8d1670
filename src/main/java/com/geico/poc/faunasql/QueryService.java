package com.geico.poc.faunasql;

import com.geico.poc.faunasql.client.FaunaClient;
import com.geico.poc.faunasql.client.QueryResult;
import com.geico.poc.faunasql.client.SchemaIntrospector;
import com.geico.poc.faunasql.dto.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    @Autowired
    private FaunaClient client;

    @Autowired
    private SchemaIntrospector introspector;

    /**
     * Execute one SQL statement
     */
    public QueryResponse execute(String sql) {
        log.debug("Executing SQL: {}", sql);
        QueryResult result = client.execute(sql);
        return QueryResponse.from(result);
    }

    /**
     * List all user tables, from the information schema
     */
    public List<String> listTables() {
        return introspector.listTables();
    }
}
