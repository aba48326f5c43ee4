package org.carball.askdb.service;

import org.carball.askdb.ai.WhereClauseGenerationException;
import org.carball.askdb.client.FileDataAccessClient;
import org.carball.askdb.config.TranslationSettings;
import org.carball.askdb.model.aggregate.AggregateRequest;
import org.carball.askdb.model.aggregate.AggregateResult;
import org.carball.askdb.model.filter.FilterOperation;
import org.carball.askdb.model.filter.Operator;
import org.carball.askdb.model.query.AskDatabaseRequest;
import org.carball.askdb.model.query.AskDatabaseResponse;
import org.carball.askdb.model.schema.DatabaseSchema;
import org.carball.askdb.parser.SchemaParser;
import org.carball.askdb.validation.ConsistencyRelation;
import org.carball.askdb.validation.ConsistencyStatus;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AskDatabaseServiceTest {

    private static final String TABLE = "record_palletinfo";
    private static final String TODAY = "DATE(generate_time) = CURRENT_DATE";
    private static final String GRN = "plt_remark LIKE '%Material GRN%'";
    private static final String NOT_GRN = "(plt_remark IS NULL OR plt_remark NOT LIKE '%Material GRN%')";

    private static DatabaseSchema schema;

    private AskDatabaseService service;

    @BeforeAll
    static void loadSchema() throws Exception {
        schema = SchemaParser.loadDefault();
    }

    @BeforeEach
    void setUp() {
        // 2024-03-15 10:00 in London (GMT, before the clocks change)
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
        FileDataAccessClient client = new FileDataAccessClient(Map.of(TABLE, palletsPrintedToday()));
        service = new AskDatabaseService(schema, client, TranslationSettings.defaults(), clock,
                (question, table) -> TODAY + " AND " + GRN);
    }

    @Test
    void shouldCountPalletsPrintedToday() throws Exception {
        AskDatabaseResponse response = service.ask(AskDatabaseRequest.of(TODAY, TABLE, AggregateRequest.count()));

        assertThat(response.getAggregate().getTotal("count")).isEqualByComparingTo("28");
        assertThat(response.getAppliedFilters()).containsExactly(
                FilterOperation.gte("generate_time", Instant.parse("2024-03-15T00:00:00Z")),
                FilterOperation.lt("generate_time", Instant.parse("2024-03-16T00:00:00Z")));
        assertThat(response.getDiagnostics().isDegraded()).isFalse();
        assertThat(response.getRows()).isNull();
    }

    @Test
    void shouldKeepGrnAndNonGrnPartsConsistentWithTheWhole() throws Exception {
        // Given
        AskDatabaseRequest whole = AskDatabaseRequest.of(TODAY, TABLE, AggregateRequest.count());
        AskDatabaseRequest grn = AskDatabaseRequest.of(TODAY + " AND " + GRN, TABLE);
        AskDatabaseRequest nonGrn = AskDatabaseRequest.of(TODAY + " AND " + NOT_GRN, TABLE);

        // When
        ConsistencyReport report = service.askWithConsistency(whole, List.of(grn, nonGrn),
                ConsistencyRelation.SUM_OF_PARTS);

        // Then
        assertThat(report.getWhole().getAggregate().getTotal("count")).isEqualByComparingTo("28");
        assertThat(report.getParts().get(0).getAggregate().getTotal("count")).isEqualByComparingTo("14");
        assertThat(report.getParts().get(1).getAggregate().getTotal("count")).isEqualByComparingTo("14");
        assertThat(report.getOutcome().getStatus()).isEqualTo(ConsistencyStatus.CONSISTENT);
        assertThat(report.getWhole().getDiagnostics().getConsistency()).isEqualTo(report.getOutcome());

        FilterOperation exclusion = report.getParts().get(1).getAppliedFilters().get(2);
        assertThat(exclusion.getOperator()).isEqualTo(Operator.OR);
        assertThat(exclusion.getOperands()).containsExactly(
                FilterOperation.isNull("plt_remark"),
                FilterOperation.notLike("plt_remark", "%Material GRN%"));
    }

    @Test
    void shouldFlagPartsThatLoseNullRemarks() throws Exception {
        // A bare NOT LIKE drops the NULL remarks, the exclusion must be written with IS NULL
        AskDatabaseRequest whole = AskDatabaseRequest.of(TODAY, TABLE, AggregateRequest.count());
        AskDatabaseRequest grn = AskDatabaseRequest.of(TODAY + " AND " + GRN, TABLE);
        AskDatabaseRequest finishedOnly = AskDatabaseRequest.of(TODAY + " AND plt_remark LIKE '%Finished%'", TABLE);

        ConsistencyReport report = service.askWithConsistency(whole, List.of(grn, finishedOnly),
                ConsistencyRelation.SUM_OF_PARTS);

        assertThat(report.getOutcome().getStatus()).isEqualTo(ConsistencyStatus.VIOLATED);
        assertThat(report.getOutcome().getDetail()).isEqualTo("28 != 21");
        assertThat(report.getWhole().getAggregate().getTotal("count")).isEqualByComparingTo("28");
    }

    @Test
    void shouldSumQuantitiesPerProductConsistently() throws Exception {
        AskDatabaseRequest whole = AskDatabaseRequest.of(TODAY, TABLE,
                AggregateRequest.sumGroupedBy("product_qty", "product_code"));
        AskDatabaseRequest grn = AskDatabaseRequest.of(TODAY + " AND " + GRN, TABLE);
        AskDatabaseRequest nonGrn = AskDatabaseRequest.of(TODAY + " AND " + NOT_GRN, TABLE);

        ConsistencyReport report = service.askWithConsistency(whole, List.of(grn, nonGrn),
                ConsistencyRelation.SUM_OF_PARTS);

        AggregateResult total = report.getWhole().getAggregate();
        assertThat(total.getValue("MEP9090150", "sum(product_qty)")).isEqualByComparingTo("588");
        assertThat(total.getValue("ME4545150", "sum(product_qty)")).isEqualByComparingTo("168");
        assertThat(report.getOutcome().isConsistent()).isTrue();
    }

    @Test
    void shouldSumAndGroupByLogicalColumnNames() throws Exception {
        // When
        AskDatabaseResponse response = service.ask(AskDatabaseRequest.of(TODAY + " AND " + GRN, TABLE,
                AggregateRequest.sumGroupedBy("quantity", "product_code")));

        // Then - "quantity" is the alias of product_qty
        AggregateResult result = response.getAggregate();
        assertThat(result.getGroupBy()).isEqualTo("product_code");
        assertThat(result.getValue("ME4545150", "sum(product_qty)")).isEqualByComparingTo("96");
        assertThat(result.getValue("MEP9090150", "sum(product_qty)")).isEqualByComparingTo("280");
        assertThat(result.getTotal("sum(product_qty)")).isEqualByComparingTo("376");
    }

    @Test
    void shouldRejectAggregateFieldsOutsideTheTable() {
        assertThatThrownBy(() -> service.ask(AskDatabaseRequest.of(TODAY, TABLE,
                AggregateRequest.sum("no_such_col"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no_such_col");
        assertThatThrownBy(() -> service.ask(AskDatabaseRequest.of(TODAY, TABLE,
                AggregateRequest.sumGroupedBy("product_qty", "supplier_code"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("supplier_code");
    }

    @Test
    void shouldRejectPartsAggregatingDifferentMetrics() {
        AskDatabaseRequest whole = AskDatabaseRequest.of(TODAY, TABLE, AggregateRequest.count());
        AskDatabaseRequest grn = AskDatabaseRequest.of(TODAY + " AND " + GRN, TABLE,
                AggregateRequest.sum("product_qty"));

        assertThatThrownBy(() -> service.askWithConsistency(whole, List.of(grn), ConsistencyRelation.AT_LEAST))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum(product_qty)");
    }

    @Test
    void shouldAcceptPartsNamingTheSameMetricByAlias() throws Exception {
        AskDatabaseRequest whole = AskDatabaseRequest.of(TODAY, TABLE, AggregateRequest.sum("product_qty"));
        AskDatabaseRequest grn = AskDatabaseRequest.of(TODAY + " AND " + GRN, TABLE,
                AggregateRequest.sum("quantity"));
        AskDatabaseRequest nonGrn = AskDatabaseRequest.of(TODAY + " AND " + NOT_GRN, TABLE);

        ConsistencyReport report = service.askWithConsistency(whole, List.of(grn, nonGrn),
                ConsistencyRelation.SUM_OF_PARTS);

        assertThat(report.getOutcome().isConsistent()).isTrue();
        assertThat(report.getOutcome().getMetricLabel()).isEqualTo("sum(product_qty)");
        assertThat(report.getWhole().getAggregate().getTotal("sum(product_qty)")).isEqualByComparingTo("756");
    }

    @Test
    void shouldDropOverflowingOffsetsButAnswerTheRest() throws Exception {
        AskDatabaseResponse response = service.ask(AskDatabaseRequest.of(
                TODAY + " AND DATE(generate_time) = CURRENT_DATE - INTERVAL '613566757 weeks'"
                        + " AND DATE(generate_time) = CURRENT_DATE - INTERVAL '99999999999 days'",
                TABLE, AggregateRequest.count()));

        assertThat(response.getAggregate().getTotal("count")).isEqualByComparingTo("28");
        assertThat(response.getAppliedFilters()).hasSize(2);
        assertThat(response.getDiagnostics().getUnrecognizedCount()).isEqualTo(2);
    }

    @Test
    void shouldReturnRowsWhenNoAggregateRequested() throws Exception {
        AskDatabaseResponse response = service.ask(AskDatabaseRequest.of(TODAY + " AND " + GRN, TABLE));

        assertThat(response.getRows()).hasSize(14)
                .allMatch(row -> row.get("plt_remark").toString().contains("Material GRN"));
        assertThat(response.getAggregate()).isNull();
    }

    @Test
    void shouldResolveLogicalColumnNames() throws Exception {
        AskDatabaseResponse response = service.ask(AskDatabaseRequest.of(
                "DATE(created_at) = CURRENT_DATE AND remark LIKE '%Material GRN%'", TABLE, AggregateRequest.count()));

        assertThat(response.getAggregate().getTotal("count")).isEqualByComparingTo("14");
        assertThat(response.getAppliedFilters()).extracting(FilterOperation::getField)
                .containsExactly("generate_time", "generate_time", "plt_remark");
    }

    @Test
    void shouldAnswerWithRemainingFiltersWhenAConditionIsNotUnderstood() throws Exception {
        // When
        AskDatabaseResponse response = service.ask(AskDatabaseRequest.of(
                TODAY + " AND product_code ~ '^MEP'", TABLE, AggregateRequest.count()));

        // Then
        assertThat(response.getAggregate().getTotal("count")).isEqualByComparingTo("28");
        assertThat(response.getDiagnostics().isDegraded()).isTrue();
        assertThat(response.getDiagnostics().getUnrecognizedConditions()).containsExactly("product_code ~ '^MEP'");
    }

    @Test
    void shouldGiveSameAnswerForRepeatedQuestion() throws Exception {
        AskDatabaseRequest request = AskDatabaseRequest.of(TODAY + " AND " + NOT_GRN, TABLE, AggregateRequest.count());

        AskDatabaseResponse first = service.ask(request);
        AskDatabaseResponse second = service.ask(request);

        assertThat(second.getAppliedFilters()).isEqualTo(first.getAppliedFilters());
        assertThat(second.getAggregate()).isEqualTo(first.getAggregate());
    }

    @Test
    void shouldAnswerGeneratedClause() throws Exception {
        AskDatabaseResponse response = service.askQuestion("How many GRN pallets today?", TABLE,
                AggregateRequest.count());

        assertThat(response.getWhereClause()).isEqualTo(TODAY + " AND " + GRN);
        assertThat(response.getAggregate().getTotal("count")).isEqualByComparingTo("14");
    }

    @Test
    void shouldRefuseQuestionsWithoutGenerator() {
        AskDatabaseService withoutGenerator = new AskDatabaseService(schema,
                new FileDataAccessClient(Map.of()), TranslationSettings.defaults());

        assertThatThrownBy(() -> withoutGenerator.askQuestion("How many pallets?", TABLE, null))
                .isInstanceOf(WhereClauseGenerationException.class);
    }

    @Test
    void shouldRejectBlankOrUnknownTable() {
        assertThatThrownBy(() -> service.ask(AskDatabaseRequest.of(TODAY, " ")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.ask(AskDatabaseRequest.of(TODAY, "record_unknown")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("record_unknown");
    }

    @Test
    void shouldRequireAggregateForConsistencyCheck() {
        assertThatThrownBy(() -> service.askWithConsistency(AskDatabaseRequest.of(TODAY, TABLE),
                List.of(AskDatabaseRequest.of(TODAY + " AND " + GRN, TABLE)), ConsistencyRelation.SUM_OF_PARTS))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * 28 pallets today: 14 GRN, 7 without remark, 7 finished goods. Three more from yesterday.
     */
    private static List<Map<String, Object>> palletsPrintedToday() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 28; i++) {
            String remark;
            if (i < 14) {
                remark = "Material GRN - " + (10000 + i);
            } else if (i < 21) {
                remark = null;
            } else {
                remark = "Finished In";
            }
            String productCode = i % 4 == 0 ? "ME4545150" : "MEP9090150";
            int qty = i % 4 == 0 ? 24 : 28;
            rows.add(pallet("150324/" + (i + 1), String.format("2024-03-15T%02d:30:00Z", i % 24),
                    productCode, qty, remark));
        }
        rows.add(pallet("140324/1", "2024-03-14T23:59:59Z", "MEP9090150", 28, "Material GRN - 9999"));
        rows.add(pallet("140324/2", "2024-03-14T12:00:00Z", "MEP9090150", 28, null));
        rows.add(pallet("160324/1", "2024-03-16T00:00:00Z", "ME4545150", 24, "Finished In"));
        return rows;
    }

    private static Map<String, Object> pallet(String number, String generated, String productCode, int qty,
                                              String remark) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("plt_num", number);
        row.put("generate_time", generated);
        row.put("product_code", productCode);
        row.put("product_qty", qty);
        row.put("plt_remark", remark);
        return row;
    }
}
