package org.carball.askdb.validation;

import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.model.aggregate.AggregateResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares sibling aggregate results group by group. Groups missing from one side count as zero.
 */
@Slf4j
public class ConsistencyValidator {

    public ConsistencyOutcome check(ConsistencyCheck check) {
        String label = check.getMetricLabel();
        Set<String> keys = new TreeSet<>(check.getWhole().getGroups().keySet());
        check.getParts().forEach(part -> keys.addAll(part.getGroups().keySet()));

        List<String> mismatches = new ArrayList<>();
        for (String key : keys) {
            BigDecimal whole = valueOrZero(check.getWhole(), key, label);
            BigDecimal parts = BigDecimal.ZERO;
            for (AggregateResult part : check.getParts()) {
                parts = parts.add(valueOrZero(part, key, label));
            }

            if (!holds(check.getRelation(), whole, parts)) {
                mismatches.add(describe(check.getRelation(), key, whole, parts));
            }
        }

        if (mismatches.isEmpty()) {
            log.debug("{} holds for {} across {} group(s)", check.getRelation(), label, keys.size());
            return ConsistencyOutcome.consistent(check.getRelation(), label);
        }

        String detail = String.join("; ", mismatches);
        log.warn("Consistency check {} on {} violated: {}", check.getRelation(), label, detail);
        return ConsistencyOutcome.violated(check.getRelation(), label, detail);
    }

    private static boolean holds(ConsistencyRelation relation, BigDecimal whole, BigDecimal parts) {
        int comparison = whole.compareTo(parts);
        return relation == ConsistencyRelation.SUM_OF_PARTS ? comparison == 0 : comparison >= 0;
    }

    private static String describe(ConsistencyRelation relation, String key, BigDecimal whole, BigDecimal parts) {
        String operator = relation == ConsistencyRelation.SUM_OF_PARTS ? "!=" : "<";
        String group = AggregateResult.ALL.equals(key) ? "" : "[" + key + "] ";
        return group + whole.toPlainString() + " " + operator + " " + parts.toPlainString();
    }

    private static BigDecimal valueOrZero(AggregateResult result, String key, String label) {
        BigDecimal value = result.getValue(key, label);
        return value == null ? BigDecimal.ZERO : value;
    }
}
