package org.carball.askdb.client;

import org.carball.askdb.model.filter.FilterOperation;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Evaluates filter operations against exported rows with SQL NULL semantics: every comparison
 * with a NULL or missing value is false, only {@code IS_NULL} matches it.
 */
final class RowFilterEvaluator {

    private static final Pattern SHORT_OFFSET = Pattern.compile("([+-]\\d{2})$");

    private RowFilterEvaluator() {
    }

    static boolean matches(FilterOperation operation, Map<String, Object> row) {
        switch (operation.getOperator()) {
            case OR:
                return operation.getOperands().stream().anyMatch(op -> matches(op, row));
            case IS_NULL:
                return row.get(operation.getField()) == null;
            default:
                break;
        }

        Object actual = row.get(operation.getField());
        if (actual == null) {
            return false;
        }

        switch (operation.getOperator()) {
            case GTE:
                return !toInstant(actual).isBefore((Instant) operation.getValue());
            case LT:
                return toInstant(actual).isBefore((Instant) operation.getValue());
            case LIKE:
                return likePattern((String) operation.getValue(), false).matcher(actual.toString()).matches();
            case NOT_LIKE:
                return !likePattern((String) operation.getValue(), false).matcher(actual.toString()).matches();
            case ILIKE:
                return likePattern((String) operation.getValue(), true).matcher(actual.toString()).matches();
            case EQ:
                return equalsValue(actual, operation.getValue());
            default:
                throw new IllegalArgumentException("Unsupported operator: " + operation.getOperator());
        }
    }

    /**
     * Translates a SQL LIKE pattern: {@code %} is any run of characters, {@code _} exactly one,
     * and a backslash makes the next character literal.
     */
    static Pattern likePattern(String sqlPattern, boolean caseInsensitive) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < sqlPattern.length(); i++) {
            char c = sqlPattern.charAt(i);
            if (c == '\\' && i + 1 < sqlPattern.length()) {
                literal.append(sqlPattern.charAt(++i));
            } else if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }

        int flags = Pattern.DOTALL;
        if (caseInsensitive) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        return Pattern.compile(regex.toString(), flags);
    }

    /**
     * Accepts ISO instants as well as the {@code 2024-03-09 10:15:00+00} form Postgres exports.
     */
    static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        String text = value.toString().trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            String normalized = SHORT_OFFSET.matcher(text.replace(' ', 'T')).replaceFirst("$1:00");
            try {
                return OffsetDateTime.parse(normalized).toInstant();
            } catch (DateTimeParseException nested) {
                throw new IllegalArgumentException("Not a timestamp: " + value, nested);
            }
        }
    }

    private static boolean equalsValue(Object actual, Object expected) {
        if (expected instanceof BigDecimal || expected instanceof Number) {
            try {
                return new BigDecimal(actual.toString()).compareTo(new BigDecimal(expected.toString())) == 0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return actual.toString().equals(String.valueOf(expected));
    }
}
