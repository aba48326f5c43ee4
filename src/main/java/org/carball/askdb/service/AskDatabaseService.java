package org.carball.askdb.service;

import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.aggregate.Aggregator;
import org.carball.askdb.ai.WhereClauseGenerationException;
import org.carball.askdb.ai.WhereClauseGenerator;
import org.carball.askdb.config.TranslationSettings;
import org.carball.askdb.executor.DataAccessClient;
import org.carball.askdb.executor.ExecutionMode;
import org.carball.askdb.executor.ExecutionResult;
import org.carball.askdb.executor.QueryExecutionException;
import org.carball.askdb.executor.QueryExecutor;
import org.carball.askdb.model.aggregate.AggregateFunction;
import org.carball.askdb.model.aggregate.AggregateRequest;
import org.carball.askdb.model.aggregate.AggregateResult;
import org.carball.askdb.model.aggregate.Metric;
import org.carball.askdb.model.filter.FilterOperation;
import org.carball.askdb.model.query.AskDatabaseRequest;
import org.carball.askdb.model.query.AskDatabaseResponse;
import org.carball.askdb.model.schema.DatabaseSchema;
import org.carball.askdb.model.schema.TableSchema;
import org.carball.askdb.translator.DateWindowResolver;
import org.carball.askdb.translator.TranslationResult;
import org.carball.askdb.translator.WhereClauseTranslator;
import org.carball.askdb.validation.ConsistencyCheck;
import org.carball.askdb.validation.ConsistencyOutcome;
import org.carball.askdb.validation.ConsistencyRelation;
import org.carball.askdb.validation.ConsistencyValidator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Answers one question against one table: translate the WHERE clause, run the filters,
 * aggregate. Holds no per-question state, every call builds its own pipeline.
 */
@Slf4j
public class AskDatabaseService {

    private final DatabaseSchema schema;
    private final WhereClauseTranslator translator;
    private final QueryExecutor executor;
    private final Aggregator aggregator;
    private final ConsistencyValidator validator;
    private final WhereClauseGenerator clauseGenerator;

    public AskDatabaseService(DatabaseSchema schema, DataAccessClient client, TranslationSettings settings) {
        this(schema, client, settings, Clock.systemUTC(), null);
    }

    public AskDatabaseService(DatabaseSchema schema, DataAccessClient client, TranslationSettings settings,
                              Clock clock, WhereClauseGenerator clauseGenerator) {
        settings.validate();
        this.schema = schema;
        this.translator = new WhereClauseTranslator(
                new DateWindowResolver(clock, settings.getMaxOffsetDays()), settings.getTimeZone());
        this.executor = new QueryExecutor(client);
        this.aggregator = new Aggregator();
        this.validator = new ConsistencyValidator();
        this.clauseGenerator = clauseGenerator;
    }

    /**
     * Rows when no aggregate is requested, otherwise only the aggregate.
     *
     * @throws IllegalArgumentException if the target table is blank or unknown, or an aggregate
     *                                  field is not a column of it
     * @throws QueryExecutionException  if the store fails or times out
     */
    public AskDatabaseResponse ask(AskDatabaseRequest request) throws QueryExecutionException {
        long start = System.currentTimeMillis();
        TableSchema table = targetTable(request.getTargetTable());
        AggregateRequest aggregateRequest = resolveFields(request.getAggregateRequest(), table);

        TranslationResult translation = translator.translate(request.getWhereClause(), table);
        List<FilterOperation> filters = translation.getPipeline().getOperations();

        ExecutionMode mode = aggregateRequest == null ? ExecutionMode.ROWS : aggregateRequest.preferredMode();
        ExecutionResult result = executor.execute(translation.getPipeline(), mode);

        AskDatabaseResponse.AskDatabaseResponseBuilder response = AskDatabaseResponse.builder()
                .targetTable(table.getName())
                .whereClause(request.getWhereClause())
                .appliedFilters(filters)
                .diagnostics(translation.getDiagnostics());

        if (aggregateRequest == null) {
            response.rows(result.getRows());
        } else {
            response.aggregate(aggregator.aggregate(result, aggregateRequest));
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("Answered question on {} with {} filter(s) in {} ms{}", table.getName(), filters.size(), elapsed,
                translation.getDiagnostics().isDegraded() ? " (degraded)" : "");
        return response.executionTimeMs(elapsed).build();
    }

    /**
     * Runs sibling questions of one turn and checks the relation between their first metric.
     * Parts without their own aggregate request use the whole's; a part asking for different
     * metrics or grouping is rejected. The outcome is attached to the whole's diagnostics and
     * never changes any answer.
     */
    public ConsistencyReport askWithConsistency(AskDatabaseRequest whole, List<AskDatabaseRequest> parts,
                                                ConsistencyRelation relation) throws QueryExecutionException {
        if (whole.getAggregateRequest() == null) {
            throw new IllegalArgumentException("A consistency check needs an aggregate request on the whole");
        }
        AggregateRequest aggregateRequest = resolveFields(whole.getAggregateRequest(),
                targetTable(whole.getTargetTable()));

        // Every part is aggregated with the whole's request
        List<AskDatabaseRequest> effectiveParts = new ArrayList<>();
        for (AskDatabaseRequest part : parts) {
            if (part.getAggregateRequest() != null) {
                AggregateRequest own = resolveFields(part.getAggregateRequest(), targetTable(part.getTargetTable()));
                if (!own.equals(aggregateRequest)) {
                    throw new IllegalArgumentException("Part [" + part.getWhereClause() + "] aggregates "
                            + describe(own) + " but the whole aggregates " + describe(aggregateRequest));
                }
            }
            effectiveParts.add(AskDatabaseRequest.of(part.getWhereClause(), part.getTargetTable(), aggregateRequest));
        }

        AskDatabaseResponse wholeResponse = ask(whole);
        List<AskDatabaseResponse> partResponses = new ArrayList<>();
        List<AggregateResult> partResults = new ArrayList<>();
        for (AskDatabaseRequest part : effectiveParts) {
            AskDatabaseResponse partResponse = ask(part);
            partResponses.add(partResponse);
            partResults.add(partResponse.getAggregate());
        }

        String metricLabel = aggregateRequest.getMetrics().get(0).getLabel();
        ConsistencyOutcome outcome = validator.check(
                new ConsistencyCheck(wholeResponse.getAggregate(), partResults, relation, metricLabel));
        wholeResponse.getDiagnostics().setConsistency(outcome);

        return new ConsistencyReport(wholeResponse, partResponses, outcome);
    }

    /**
     * Lets the configured generator write the WHERE clause, then answers it like {@link #ask}.
     */
    public AskDatabaseResponse askQuestion(String question, String targetTable, AggregateRequest aggregateRequest)
            throws WhereClauseGenerationException, QueryExecutionException {
        if (clauseGenerator == null) {
            throw new WhereClauseGenerationException("No WHERE clause generator configured");
        }
        TableSchema table = schema.requireTable(targetTable);
        String whereClause = clauseGenerator.generateWhereClause(question, table);
        return ask(AskDatabaseRequest.of(whereClause, table.getName(), aggregateRequest));
    }

    private TableSchema targetTable(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("Target table must not be blank");
        }
        return schema.requireTable(tableName);
    }

    /**
     * Maps SUM and GROUP BY fields to physical columns, accepting the same logical aliases as
     * WHERE clauses. An unknown field would otherwise aggregate to zero.
     */
    private static AggregateRequest resolveFields(AggregateRequest request, TableSchema table) {
        if (request == null) {
            return null;
        }
        List<Metric> metrics = new ArrayList<>();
        for (Metric metric : request.getMetrics()) {
            metrics.add(metric.getFunction() == AggregateFunction.SUM
                    ? Metric.sum(requireField(table, metric.getField(), "Sum"))
                    : metric);
        }
        String groupBy = request.isGrouped() ? requireField(table, request.getGroupBy(), "Group-by") : null;
        return new AggregateRequest(metrics, groupBy);
    }

    private static String requireField(TableSchema table, String name, String role) {
        return table.resolveField(name).orElseThrow(() -> new IllegalArgumentException(
                role + " field " + name + " is not a column of " + table.getName()));
    }

    private static String describe(AggregateRequest request) {
        return request.getMetrics() + (request.isGrouped() ? " by " + request.getGroupBy() : "");
    }

    public DatabaseSchema getSchema() {
        return schema;
    }
}
