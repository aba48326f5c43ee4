package org.carball.askdb.client;

import org.carball.askdb.model.filter.FilterOperation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class RowFilterEvaluatorTest {

    @Test
    void shouldTranslateLikeWildcards() {
        assertThat(RowFilterEvaluator.likePattern("%GRN%", false).matcher("Material GRN - 1").matches()).isTrue();
        assertThat(RowFilterEvaluator.likePattern("A_C", false).matcher("ABC").matches()).isTrue();
        assertThat(RowFilterEvaluator.likePattern("A_C", false).matcher("ABBC").matches()).isFalse();
        assertThat(RowFilterEvaluator.likePattern("50.5%", false).matcher("5005").matches()).isFalse();
        assertThat(RowFilterEvaluator.likePattern("(x)", false).matcher("(x)").matches()).isTrue();
    }

    @Test
    void shouldMatchEscapedWildcardsLiterally() {
        assertThat(RowFilterEvaluator.likePattern("ABC\\_1", true).matcher("abc_1").matches()).isTrue();
        assertThat(RowFilterEvaluator.likePattern("ABC\\_1", true).matcher("ABCX1").matches()).isFalse();
        assertThat(RowFilterEvaluator.likePattern("100\\%", false).matcher("100%").matches()).isTrue();
        assertThat(RowFilterEvaluator.likePattern("100\\%", false).matcher("1000").matches()).isFalse();
        assertThat(RowFilterEvaluator.likePattern("C:\\\\x", false).matcher("C:\\x").matches()).isTrue();
    }

    @Test
    void shouldTreatNullAsUnknownExceptForIsNull() {
        Map<String, Object> row = new HashMap<>();
        row.put("plt_remark", null);

        assertThat(RowFilterEvaluator.matches(FilterOperation.notLike("plt_remark", "%GRN%"), row)).isFalse();
        assertThat(RowFilterEvaluator.matches(FilterOperation.like("plt_remark", "%"), row)).isFalse();
        assertThat(RowFilterEvaluator.matches(FilterOperation.eq("plt_remark", "x"), row)).isFalse();
        assertThat(RowFilterEvaluator.matches(FilterOperation.isNull("plt_remark"), row)).isTrue();
        assertThat(RowFilterEvaluator.matches(FilterOperation.isNull("missing"), row)).isTrue();
    }

    @Test
    void shouldParsePostgresTimestampForms() {
        assertThat(RowFilterEvaluator.toInstant("2024-03-15T08:00:00Z")).isEqualTo(Instant.parse("2024-03-15T08:00:00Z"));
        assertThat(RowFilterEvaluator.toInstant("2024-03-15T09:00:00+01:00")).isEqualTo(Instant.parse("2024-03-15T08:00:00Z"));
        assertThat(RowFilterEvaluator.toInstant("2024-03-15 08:00:00.123+00")).isEqualTo(Instant.parse("2024-03-15T08:00:00.123Z"));
    }
}
