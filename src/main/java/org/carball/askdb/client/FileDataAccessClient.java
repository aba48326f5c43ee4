package org.carball.askdb.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.executor.DataAccessClient;
import org.carball.askdb.executor.FilterQuery;
import org.carball.askdb.executor.QueryExecutionException;
import org.carball.askdb.model.filter.FilterOperation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Serves rows exported to a JSON file of the form
 * {@code {"tables": {"record_palletinfo": [ {...}, ... ]}}} and filters them in memory.
 */
@Slf4j
public class FileDataAccessClient implements DataAccessClient {

    private final Map<String, List<Map<String, Object>>> tables;

    public FileDataAccessClient(Map<String, List<Map<String, Object>>> tables) {
        this.tables = new LinkedHashMap<>();
        tables.forEach((name, rows) -> this.tables.put(name.toLowerCase(), Collections.unmodifiableList(new ArrayList<>(rows))));
    }

    public static FileDataAccessClient load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Data file not found: " + file);
        }

        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
        ExportFile export = mapper.readValue(file.toFile(), ExportFile.class);
        if (export.tables == null) {
            throw new IOException("Data file has no \"tables\" object: " + file);
        }

        log.info("Loaded {} table(s) from {}", export.tables.size(), file);
        export.tables.forEach((name, rows) -> log.debug("  {}: {} row(s)", name, rows.size()));
        return new FileDataAccessClient(export.tables);
    }

    @Override
    public FilterQuery from(String table) {
        return new FileQuery(table);
    }

    static class ExportFile {
        public Map<String, List<Map<String, Object>>> tables;
    }

    private class FileQuery implements FilterQuery {

        private final String table;
        private final List<FilterOperation> operations = new ArrayList<>();

        FileQuery(String table) {
            this.table = table;
        }

        @Override
        public FilterQuery gte(String field, Instant value) {
            operations.add(FilterOperation.gte(field, value));
            return this;
        }

        @Override
        public FilterQuery lt(String field, Instant value) {
            operations.add(FilterOperation.lt(field, value));
            return this;
        }

        @Override
        public FilterQuery like(String field, String pattern) {
            operations.add(FilterOperation.like(field, pattern));
            return this;
        }

        @Override
        public FilterQuery notLike(String field, String pattern) {
            operations.add(FilterOperation.notLike(field, pattern));
            return this;
        }

        @Override
        public FilterQuery ilike(String field, String value) {
            operations.add(FilterOperation.ilike(field, value));
            return this;
        }

        @Override
        public FilterQuery eq(String field, Object value) {
            operations.add(FilterOperation.eq(field, value));
            return this;
        }

        @Override
        public FilterQuery isNull(String field) {
            operations.add(FilterOperation.isNull(field));
            return this;
        }

        @Override
        public FilterQuery or(List<FilterOperation> operands) {
            operations.add(FilterOperation.or(operands));
            return this;
        }

        @Override
        public List<Map<String, Object>> rows() throws QueryExecutionException {
            List<Map<String, Object>> source = tables.get(table.toLowerCase());
            if (source == null) {
                throw new QueryExecutionException("Table not present in data file: " + table);
            }
            try {
                return source.stream()
                        .filter(row -> operations.stream().allMatch(op -> RowFilterEvaluator.matches(op, row)))
                        .collect(Collectors.toList());
            } catch (IllegalArgumentException e) {
                throw new QueryExecutionException("Cannot evaluate filters on " + table + ": " + e.getMessage(), e);
            }
        }

        @Override
        public long count() throws QueryExecutionException {
            return rows().size();
        }
    }
}
