package org.carball.askdb.validation;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.askdb.model.aggregate.AggregateResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConsistencyValidatorTest {

    private ConsistencyValidator validator;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        validator = new ConsistencyValidator();

        logger = (Logger) LoggerFactory.getLogger(ConsistencyValidator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
    }

    @Test
    void shouldAcceptWholeEqualToSumOfParts() {
        // Given - 28 pallets today, 14 GRN and 14 other
        ConsistencyCheck check = new ConsistencyCheck(count(28), List.of(count(14), count(14)),
                ConsistencyRelation.SUM_OF_PARTS, "count");

        // When
        ConsistencyOutcome outcome = validator.check(check);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(ConsistencyStatus.CONSISTENT);
        assertThat(outcome.getDetail()).isNull();
        assertThat(logAppender.list).noneMatch(event -> event.getLevel() == Level.WARN);
    }

    @Test
    void shouldReportMissingPalletsAndWarn() {
        ConsistencyOutcome outcome = validator.check(new ConsistencyCheck(count(28), List.of(count(14), count(13)),
                ConsistencyRelation.SUM_OF_PARTS, "count"));

        assertThat(outcome.isConsistent()).isFalse();
        assertThat(outcome.getDetail()).isEqualTo("28 != 27");
        assertThat(logAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN && event.getFormattedMessage().contains("28 != 27"));
    }

    @Test
    void shouldCheckAtLeast() {
        assertThat(validator.check(new ConsistencyCheck(count(28), List.of(count(14)),
                ConsistencyRelation.AT_LEAST, "count")).isConsistent()).isTrue();
        assertThat(validator.check(new ConsistencyCheck(count(10), List.of(count(14)),
                ConsistencyRelation.AT_LEAST, "count")).getDetail()).isEqualTo("10 < 14");
    }

    @Test
    void shouldCompareGroupByGroupTreatingMissingGroupsAsZero() {
        // Given
        AggregateResult whole = grouped(Map.of("MEP9090150", "80", "ME4545150", "12"));
        AggregateResult grn = grouped(Map.of("MEP9090150", "40"));
        AggregateResult other = grouped(Map.of("MEP9090150", "40", "ME4545150", "10"));

        // When
        ConsistencyOutcome outcome = validator.check(new ConsistencyCheck(whole, List.of(grn, other),
                ConsistencyRelation.SUM_OF_PARTS, "sum(product_qty)"));

        // Then
        assertThat(outcome.isConsistent()).isFalse();
        assertThat(outcome.getDetail()).isEqualTo("[ME4545150] 12 != 10");
    }

    @Test
    void shouldCompareDecimalsByValue() {
        AggregateResult whole = AggregateResult.ungrouped(Map.of("sum(net_weight)", new BigDecimal("10.50")));
        AggregateResult part = AggregateResult.ungrouped(Map.of("sum(net_weight)", new BigDecimal("10.5")));

        assertThat(validator.check(new ConsistencyCheck(whole, List.of(part),
                ConsistencyRelation.SUM_OF_PARTS, "sum(net_weight)")).isConsistent()).isTrue();
    }

    @Test
    void shouldRejectMalformedChecks() {
        assertThatThrownBy(() -> new ConsistencyCheck(count(1), List.of(), ConsistencyRelation.SUM_OF_PARTS, "count"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConsistencyCheck(count(3), List.of(count(1), count(2)),
                ConsistencyRelation.AT_LEAST, "count"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AggregateResult count(long value) {
        return AggregateResult.ungrouped(Map.of("count", BigDecimal.valueOf(value)));
    }

    private static AggregateResult grouped(Map<String, String> sums) {
        Map<String, Map<String, BigDecimal>> groups = new TreeMap<>();
        sums.forEach((key, value) -> groups.put(key, Map.of("sum(product_qty)", new BigDecimal(value))));
        return new AggregateResult("product_code", groups);
    }
}
