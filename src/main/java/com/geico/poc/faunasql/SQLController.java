package com.geico.poc.faunasql;

import com.geico.poc.faunasql.dto.QueryRequest;
import com.geico.poc.faunasql.dto.QueryResponse;
import com.geico.poc.faunasql.errors.FaunaSqlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sql")
public class SQLController {

    private static final Logger log = LoggerFactory.getLogger(SQLController.class);

    @Autowired
    private QueryService queryService;

    @PostMapping("/execute")
    public ResponseEntity<QueryResponse> executeQuery(@RequestBody QueryRequest request) {
        try {
            return ResponseEntity.ok(queryService.execute(request.getSql()));
        } catch (FaunaSqlException e) {
            log.info("Statement failed: {}", e.getMessage());
            return ResponseEntity.badRequest().body(QueryResponse.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing statement", e);
            return ResponseEntity.badRequest().body(QueryResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/tables")
    public ResponseEntity<List<String>> listTables() {
        return ResponseEntity.ok(queryService.listTables());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
