package org.carball.askdb.executor;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class ExecutionResult {
    String targetTable;
    ExecutionMode mode;
    List<Map<String, Object>> rows;
    long count;

    public static ExecutionResult ofRows(String targetTable, List<Map<String, Object>> rows) {
        return new ExecutionResult(targetTable, ExecutionMode.ROWS, List.copyOf(rows), rows.size());
    }

    public static ExecutionResult ofCount(String targetTable, long count) {
        return new ExecutionResult(targetTable, ExecutionMode.COUNT, List.of(), count);
    }

    public boolean hasRows() {
        return mode == ExecutionMode.ROWS;
    }
}
