package org.carball.askdb.parser;

import org.carball.askdb.model.predicate.CaseInsensitiveEquals;
import org.carball.askdb.model.predicate.ClassifiedPredicate;
import org.carball.askdb.model.predicate.DateEquals;
import org.carball.askdb.model.predicate.DateRange;
import org.carball.askdb.model.predicate.ExactEquals;
import org.carball.askdb.model.predicate.PatternExclude;
import org.carball.askdb.model.predicate.PatternInclude;
import org.carball.askdb.model.predicate.Unrecognized;
import org.carball.askdb.model.predicate.UnrecognizedReason;
import org.carball.askdb.model.query.RawCondition;
import org.carball.askdb.model.schema.TableSchema;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class PredicateClassifierTest {

    private static TableSchema palletInfo;

    private PredicateClassifier classifier;

    @BeforeAll
    static void loadSchema() throws Exception {
        palletInfo = SchemaParser.loadDefault().requireTable("record_palletinfo");
    }

    @BeforeEach
    void setUp() {
        classifier = new PredicateClassifier();
    }

    @Test
    void shouldClassifyToday() {
        ClassifiedPredicate predicate = classify("DATE(generate_time) = CURRENT_DATE");

        assertThat(predicate).isEqualTo(new DateEquals("DATE(generate_time) = CURRENT_DATE", "generate_time", 0));
    }

    @Test
    void shouldClassifyDaysAgo() {
        assertThat(classify("DATE(generate_time) = CURRENT_DATE - INTERVAL '1 day'"))
                .isInstanceOfSatisfying(DateEquals.class, p -> assertThat(p.getRelativeOffsetDays()).isEqualTo(1));
        assertThat(classify("date(generate_time) = current_date - interval '3 days'"))
                .isInstanceOfSatisfying(DateEquals.class, p -> assertThat(p.getRelativeOffsetDays()).isEqualTo(3));
        assertThat(classify("generate_time::date = CURRENT_DATE - 2"))
                .isInstanceOfSatisfying(DateEquals.class, p -> assertThat(p.getRelativeOffsetDays()).isEqualTo(2));
    }

    @Test
    void shouldConvertWeeksToDays() {
        assertThat(classify("DATE(generate_time) = CURRENT_DATE - INTERVAL '2 weeks'"))
                .isInstanceOfSatisfying(DateEquals.class, p -> assertThat(p.getRelativeOffsetDays()).isEqualTo(14));
    }

    @Test
    void shouldLeaveMonthIntervalsUnrecognized() {
        assertThat(classify("DATE(generate_time) = CURRENT_DATE - INTERVAL '1 month'"))
                .isInstanceOf(Unrecognized.class);
        assertThat(classify("DATE_TRUNC('month', generate_time) = DATE_TRUNC('month', CURRENT_DATE)"))
                .isInstanceOf(Unrecognized.class);
    }

    @Test
    void shouldClassifySinceAndBetweenAsRanges() {
        assertThat(classify("DATE(generate_time) >= CURRENT_DATE - INTERVAL '7 days'"))
                .isInstanceOfSatisfying(DateRange.class, p -> {
                    assertThat(p.getStartOffsetDays()).isEqualTo(7);
                    assertThat(p.getEndOffsetDays()).isZero();
                });
        assertThat(classify("generate_time >= CURRENT_DATE"))
                .isInstanceOfSatisfying(DateRange.class, p -> assertThat(p.getStartOffsetDays()).isZero());
        assertThat(classify("DATE(generate_time) BETWEEN CURRENT_DATE - INTERVAL '7 days' AND CURRENT_DATE - INTERVAL '1 day'"))
                .isInstanceOfSatisfying(DateRange.class, p -> {
                    assertThat(p.getStartOffsetDays()).isEqualTo(7);
                    assertThat(p.getEndOffsetDays()).isEqualTo(1);
                });
    }

    @Test
    void shouldRejectBackwardsBetween() {
        assertThat(classify("DATE(generate_time) BETWEEN CURRENT_DATE AND CURRENT_DATE - INTERVAL '7 days'"))
                .isInstanceOf(Unrecognized.class);
    }

    @Test
    void shouldClassifyNullSafeExclusionWithQuotedIdentifiers() {
        ClassifiedPredicate predicate = classify(
                "(\"plt_remark\" IS NULL OR \"plt_remark\" NOT LIKE '%Material GRN%')");

        assertThat(predicate).isInstanceOfSatisfying(PatternExclude.class, p -> {
            assertThat(p.getField()).isEqualTo("plt_remark");
            assertThat(p.getPattern()).isEqualTo("%Material GRN%");
        });
    }

    @Test
    void shouldClassifyExclusionInEitherOperandOrder() {
        assertThat(classify("(plt_remark NOT LIKE '%Material GRN%' OR plt_remark IS NULL)"))
                .isInstanceOf(PatternExclude.class);
    }

    @Test
    void shouldNotMixColumnsInExclusion() {
        assertThat(classify("(plt_remark IS NULL OR series NOT LIKE '%x%')"))
                .isEqualTo(Unrecognized.unsupported("(plt_remark IS NULL OR series NOT LIKE '%x%')"));
    }

    @Test
    void shouldClassifyLikeButNotBareNotLikeOrIlike() {
        assertThat(classify("plt_remark LIKE '%Material GRN%'"))
                .isEqualTo(new PatternInclude("plt_remark LIKE '%Material GRN%'", "plt_remark", "%Material GRN%"));
        assertThat(classify("plt_remark NOT LIKE '%Material GRN%'")).isInstanceOf(Unrecognized.class);
        assertThat(classify("plt_remark ILIKE '%material grn%'")).isInstanceOf(Unrecognized.class);
    }

    @Test
    void shouldClassifyCaseInsensitiveEqualsKeepingLiteralCase() {
        assertThat(classify("UPPER(product_code) = UPPER('mep9090150')"))
                .isInstanceOfSatisfying(CaseInsensitiveEquals.class, p -> {
                    assertThat(p.getField()).isEqualTo("product_code");
                    assertThat(p.getValue()).isEqualTo("mep9090150");
                });
    }

    @Test
    void shouldClassifyBareEquality() {
        assertThat(classify("product_code = 'MEP9090150'"))
                .isInstanceOfSatisfying(ExactEquals.class, p -> assertThat(p.getValue()).isEqualTo("MEP9090150"));
        assertThat(classify("product_qty = 40"))
                .isInstanceOfSatisfying(ExactEquals.class, p -> assertThat(p.getValue()).isEqualTo("40"));
        assertThat(classify("plt_remark = 'O''Brien'"))
                .isInstanceOfSatisfying(ExactEquals.class, p -> assertThat(p.getValue()).isEqualTo("O'Brien"));
    }

    @Test
    void shouldAcceptAliasesAndTableQualifiers() {
        assertThat(classify("DATE(created_at) = CURRENT_DATE"))
                .isInstanceOfSatisfying(DateEquals.class, p -> assertThat(p.getDateField()).isEqualTo("created_at"));
        assertThat(classify("record_palletinfo.product_code = 'X'")).isInstanceOf(ExactEquals.class);
    }

    @Test
    void shouldReportSchemaMismatch() {
        assertThat(reason(classify("DATE(loaded_at) = CURRENT_DATE"))).isEqualTo(UnrecognizedReason.SCHEMA_MISMATCH);
        assertThat(reason(classify("DATE(product_code) = CURRENT_DATE"))).isEqualTo(UnrecognizedReason.SCHEMA_MISMATCH);
        assertThat(reason(classify("supplier = 'ACME'"))).isEqualTo(UnrecognizedReason.SCHEMA_MISMATCH);
    }

    @Test
    void shouldLeaveGarbageUnrecognized() {
        ClassifiedPredicate predicate = classify("foo ~~ bar");

        assertThat(predicate.isRecognized()).isFalse();
        assertThat(reason(predicate)).isEqualTo(UnrecognizedReason.UNSUPPORTED_SHAPE);
        assertThat(predicate.getRawText()).isEqualTo("foo ~~ bar");
    }

    @Test
    void shouldParseOffsets() {
        assertThat(PredicateClassifier.parseOffset("CURRENT_DATE")).isZero();
        assertThat(PredicateClassifier.parseOffset("CURRENT_DATE - INTERVAL '5 days'")).isEqualTo(5L);
        assertThat(PredicateClassifier.parseOffset("CURRENT_DATE - INTERVAL '5' DAY")).isEqualTo(5L);
        assertThat(PredicateClassifier.parseOffset("CURRENT_DATE - INTERVAL '1 week'")).isEqualTo(7L);
        assertThat(PredicateClassifier.parseOffset("CURRENT_DATE - INTERVAL '1 year'")).isNull();
        assertThat(PredicateClassifier.parseOffset("NOW()")).isNull();
    }

    @Test
    void shouldRejectWeekOffsetsThatOverflowInt() {
        // 613566757 weeks wraps to 3 days in 32-bit arithmetic
        ClassifiedPredicate predicate = classify("DATE(generate_time) = CURRENT_DATE - INTERVAL '613566757 weeks'");

        assertThat(reason(predicate)).isEqualTo(UnrecognizedReason.OFFSET_OUT_OF_RANGE);
        assertThat(PredicateClassifier.parseOffset("CURRENT_DATE - INTERVAL '613566757 weeks'"))
                .isEqualTo(4_294_967_299L);
    }

    @Test
    void shouldRejectDayCountsTooLongForAnInt() {
        assertThat(reason(classify("DATE(generate_time) = CURRENT_DATE - INTERVAL '99999999999 days'")))
                .isEqualTo(UnrecognizedReason.OFFSET_OUT_OF_RANGE);
        assertThat(reason(classify("generate_time::date = CURRENT_DATE - 99999999999")))
                .isEqualTo(UnrecognizedReason.OFFSET_OUT_OF_RANGE);
        assertThat(reason(classify("DATE(generate_time) >= CURRENT_DATE - INTERVAL '99999999999 days'")))
                .isEqualTo(UnrecognizedReason.OFFSET_OUT_OF_RANGE);
        assertThat(reason(classify("DATE(generate_time) BETWEEN CURRENT_DATE - INTERVAL '99999999999 days'"
                + " AND CURRENT_DATE")))
                .isEqualTo(UnrecognizedReason.OFFSET_OUT_OF_RANGE);
    }

    @Test
    void shouldSaturateOffsetsBeyondLong() {
        assertThat(PredicateClassifier.parseOffset("CURRENT_DATE - INTERVAL '99999999999999999999999 days'"))
                .isEqualTo(Long.MAX_VALUE);
        assertThat(PredicateClassifier.parseOffset("CURRENT_DATE - INTERVAL '9223372036854775807 weeks'"))
                .isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void shouldNormalizeWhitespaceAndIdentifierQuotesOutsideLiterals() {
        assertThat(PredicateClassifier.normalize("  \"plt_remark\"   LIKE   '%A  \"B\"%' "))
                .isEqualTo("plt_remark LIKE '%A  \"B\"%'");
    }

    private ClassifiedPredicate classify(String text) {
        return classifier.classify(new RawCondition(text, 0), palletInfo);
    }

    private static UnrecognizedReason reason(ClassifiedPredicate predicate) {
        assertThat(predicate).isInstanceOf(Unrecognized.class);
        return ((Unrecognized) predicate).getReason();
    }
}
