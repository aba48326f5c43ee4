package org.carball.askdb.model.filter;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Storage-agnostic filter unit. {@code field} is always a physical field of the target table;
 * an {@link Operator#OR} operation has no field of its own and carries its disjuncts in {@code operands}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class FilterOperation {
    String field;
    Operator operator;
    Object value;
    List<FilterOperation> operands;

    public static FilterOperation gte(String field, Instant value) {
        return new FilterOperation(field, Operator.GTE, value, List.of());
    }

    public static FilterOperation lt(String field, Instant value) {
        return new FilterOperation(field, Operator.LT, value, List.of());
    }

    public static FilterOperation like(String field, String pattern) {
        return new FilterOperation(field, Operator.LIKE, pattern, List.of());
    }

    public static FilterOperation notLike(String field, String pattern) {
        return new FilterOperation(field, Operator.NOT_LIKE, pattern, List.of());
    }

    public static FilterOperation ilike(String field, String value) {
        return new FilterOperation(field, Operator.ILIKE, value, List.of());
    }

    public static FilterOperation eq(String field, Object value) {
        return new FilterOperation(field, Operator.EQ, value, List.of());
    }

    public static FilterOperation isNull(String field) {
        return new FilterOperation(field, Operator.IS_NULL, null, List.of());
    }

    public static FilterOperation or(List<FilterOperation> operands) {
        if (operands == null || operands.size() < 2) {
            throw new IllegalArgumentException("An OR operation needs at least two operands");
        }
        if (operands.stream().anyMatch(op -> op.getOperator().isCompound())) {
            throw new IllegalArgumentException("Nested OR operations are not supported");
        }
        return new FilterOperation(null, Operator.OR, null, List.copyOf(operands));
    }

    public static FilterOperation or(FilterOperation first, FilterOperation second) {
        return or(List.of(first, second));
    }

    @Override
    public String toString() {
        if (operator == Operator.OR) {
            return operands.stream()
                    .map(FilterOperation::toString)
                    .collect(Collectors.joining(" OR ", "(", ")"));
        }
        if (operator == Operator.IS_NULL) {
            return field + " IS_NULL";
        }
        return field + " " + operator + " " + value;
    }
}
