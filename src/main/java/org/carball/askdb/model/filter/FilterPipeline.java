package org.carball.askdb.model.filter;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only list of filter operations for one question against one table.
 * A pipeline is consumed by exactly one execution and then discarded.
 */
public class FilterPipeline {

    @Getter
    private final String targetTable;
    private final List<FilterOperation> operations = new ArrayList<>();
    private boolean consumed;

    public FilterPipeline(String targetTable) {
        if (targetTable == null || targetTable.isBlank()) {
            throw new IllegalArgumentException("Target table must not be blank");
        }
        this.targetTable = targetTable;
    }

    public FilterPipeline append(FilterOperation operation) {
        if (consumed) {
            throw new IllegalStateException("Pipeline for " + targetTable + " has already been executed");
        }
        operations.add(operation);
        return this;
    }

    public FilterPipeline appendAll(List<FilterOperation> toAppend) {
        toAppend.forEach(this::append);
        return this;
    }

    public List<FilterOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public boolean isConsumed() {
        return consumed;
    }

    /**
     * Marks the pipeline as consumed; a second call fails.
     */
    public List<FilterOperation> consume() {
        if (consumed) {
            throw new IllegalStateException("Pipeline for " + targetTable + " has already been executed");
        }
        consumed = true;
        return getOperations();
    }

    @Override
    public String toString() {
        return "FilterPipeline{" + targetTable + ", " + operations + "}";
    }
}
