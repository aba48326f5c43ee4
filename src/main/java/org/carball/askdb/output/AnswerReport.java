package org.carball.askdb.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.model.aggregate.AggregateResult;
import org.carball.askdb.model.filter.FilterOperation;
import org.carball.askdb.model.query.AskDatabaseResponse;
import org.carball.askdb.model.query.TranslationDiagnostics;
import org.carball.askdb.model.query.UnrecognizedCondition;
import org.carball.askdb.validation.ConsistencyOutcome;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class AnswerReport {

    private static final int MAX_MARKDOWN_ROWS = 50;

    private final AskDatabaseResponse answer;
    private final List<AskDatabaseResponse> partitions;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AnswerReport(AskDatabaseResponse answer) {
        this(answer, List.of());
    }

    public AnswerReport(AskDatabaseResponse answer, List<AskDatabaseResponse> partitions) {
        this.answer = answer;
        this.partitions = partitions;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            ReportData reportData = new ReportData();
            reportData.setGeneratedAt(timestamp);
            reportData.setAnswer(answer);
            reportData.setPartitions(partitions.isEmpty() ? null : partitions);
            return objectMapper.writeValueAsString(reportData);
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Ask Database Answer\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Table:** `").append(answer.getTargetTable()).append("`  \n");
        md.append("**WHERE clause:** `").append(answer.getWhereClause() == null ? "" : answer.getWhereClause())
                .append("`  \n");
        md.append("**Execution time:** ").append(answer.getExecutionTimeMs()).append(" ms\n\n");

        appendFilters(md, answer.getAppliedFilters());

        if (answer.getAggregate() != null) {
            md.append("## Result\n\n");
            appendAggregate(md, answer.getAggregate());
        } else if (answer.getRows() != null) {
            md.append("## Rows (").append(answer.getRows().size()).append(")\n\n");
            appendRows(md, answer.getRows());
        }

        if (!partitions.isEmpty()) {
            md.append("## Partitions\n\n");
            for (AskDatabaseResponse partition : partitions) {
                md.append("### `").append(partition.getWhereClause()).append("`\n\n");
                if (partition.getAggregate() != null) {
                    appendAggregate(md, partition.getAggregate());
                }
            }
        }

        appendDiagnostics(md, answer.getDiagnostics());
        return md.toString();
    }

    private void appendFilters(StringBuilder md, List<FilterOperation> filters) {
        md.append("## Filters Applied\n\n");
        if (filters == null || filters.isEmpty()) {
            md.append("_None, every row of the table matches._\n\n");
            return;
        }
        for (FilterOperation filter : filters) {
            md.append("- `").append(filter).append("`\n");
        }
        md.append("\n");
    }

    private void appendAggregate(StringBuilder md, AggregateResult aggregate) {
        Set<String> labels = new LinkedHashSet<>();
        aggregate.getGroups().values().forEach(values -> labels.addAll(values.keySet()));

        md.append("| ").append(aggregate.isGrouped() ? aggregate.getGroupBy() : "Group");
        labels.forEach(label -> md.append(" | ").append(label));
        md.append(" |\n|---");
        labels.forEach(label -> md.append("|---"));
        md.append("|\n");

        for (Map.Entry<String, Map<String, BigDecimal>> group : aggregate.getGroups().entrySet()) {
            md.append("| ").append(group.getKey());
            for (String label : labels) {
                BigDecimal value = group.getValue().get(label);
                md.append(" | ").append(value == null ? "" : value.toPlainString());
            }
            md.append(" |\n");
        }
        md.append("\n");
    }

    private void appendRows(StringBuilder md, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            md.append("_No matching rows._\n\n");
            return;
        }

        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        md.append("| ").append(String.join(" | ", columns)).append(" |\n");
        md.append("|").append("---|".repeat(columns.size())).append("\n");

        rows.stream().limit(MAX_MARKDOWN_ROWS).forEach(row -> {
            md.append("|");
            for (String column : columns) {
                Object value = row.get(column);
                md.append(" ").append(value == null ? "" : value.toString().replace("|", "\\|")).append(" |");
            }
            md.append("\n");
        });
        if (rows.size() > MAX_MARKDOWN_ROWS) {
            md.append("\n_").append(rows.size() - MAX_MARKDOWN_ROWS).append(" more row(s) not shown._\n");
        }
        md.append("\n");
    }

    private void appendDiagnostics(StringBuilder md, TranslationDiagnostics diagnostics) {
        md.append("## Diagnostics\n\n");
        if (diagnostics == null) {
            md.append("_None._\n");
            return;
        }

        if (diagnostics.isDegraded()) {
            md.append("⚠️ Some conditions were not applied, the answer may cover more rows than asked for:\n\n");
            for (UnrecognizedCondition condition : diagnostics.getUnrecognized()) {
                md.append("- `").append(condition.getText()).append("` (").append(condition.getReason()).append(")\n");
            }
            md.append("\n");
        } else {
            md.append("All conditions were applied.\n\n");
        }

        ConsistencyOutcome consistency = diagnostics.getConsistency();
        if (consistency != null) {
            md.append("**Consistency (").append(consistency.getRelation()).append(" on ")
                    .append(consistency.getMetricLabel()).append("):** ");
            if (consistency.isConsistent()) {
                md.append("✅ consistent\n");
            } else {
                md.append("❌ ").append(consistency.getDetail()).append("\n");
            }
        }
    }

    // Inner class for JSON structure
    @lombok.Data
    private static class ReportData {
        private LocalDateTime generatedAt;
        private AskDatabaseResponse answer;
        private List<AskDatabaseResponse> partitions;
    }
}
