package org.carball.askdb.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import org.carball.askdb.model.aggregate.AggregateResult;
import org.carball.askdb.model.filter.FilterOperation;

import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AskDatabaseResponse {
    private String targetTable;
    private String whereClause;
    private List<FilterOperation> appliedFilters;
    private List<Map<String, Object>> rows;
    private AggregateResult aggregate;
    private TranslationDiagnostics diagnostics;
    private long executionTimeMs;
}
