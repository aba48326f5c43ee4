package org.carball.askdb.parser;

import lombok.extern.slf4j.Slf4j;
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
import org.carball.askdb.model.schema.Column;
import org.carball.askdb.model.schema.TableSchema;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns one atomic condition to a predicate kind by matching it against the closed set of
 * templates the clause generator emits. Shapes are tried in a fixed order, compound shapes
 * first, so a general shape never captures a specific one.
 */
@Slf4j
public class PredicateClassifier {

    /**
     * Bumped whenever a shape is added or changed.
     */
    public static final String PATTERN_SET_VERSION = "2";

    private static final String COLUMN = "(?:\\w+\\.)?(?<%s>\\w+)";
    private static final String LITERAL = "'(?<%s>(?:[^']|'')*)'";
    private static final String DATE_EXPRESSION =
            "\\(?\\s*(?<%s>CURRENT_DATE(?:\\s*-\\s*(?:INTERVAL\\s*'[^']*'(?:\\s*(?:DAYS?|WEEKS?))?|\\d+))?)\\s*\\)?";
    private static final String DATE_COLUMN =
            "(?:DATE\\s*\\(\\s*" + column("dcol") + "\\s*\\)|" + column("ccol") + "\\s*::\\s*DATE)";

    private static final Pattern PATTERN_EXCLUDE = Pattern.compile(
            "^(?:\\(\\s*)?" + column("col") + "\\s+IS\\s+NULL\\s+OR\\s+" + column("col2")
                    + "\\s+NOT\\s+LIKE\\s+" + literal("pattern") + "(?:\\s*\\))?$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern PATTERN_EXCLUDE_REVERSED = Pattern.compile(
            "^(?:\\(\\s*)?" + column("col2") + "\\s+NOT\\s+LIKE\\s+" + literal("pattern")
                    + "\\s+OR\\s+" + column("col") + "\\s+IS\\s+NULL(?:\\s*\\))?$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DATE_EQUALS = Pattern.compile(
            "^" + DATE_COLUMN + "\\s*=\\s*" + dateExpression("expr") + "$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DATE_SINCE = Pattern.compile(
            "^(?:" + DATE_COLUMN + "|" + column("rcol") + ")\\s*>=\\s*" + dateExpression("expr") + "$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DATE_BETWEEN = Pattern.compile(
            "^" + DATE_COLUMN + "\\s+BETWEEN\\s+" + dateExpression("from")
                    + "\\s+AND\\s+" + dateExpression("to") + "$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CASE_INSENSITIVE_EQUALS = Pattern.compile(
            "^(?:UPPER|LOWER)\\s*\\(\\s*" + column("col") + "\\s*\\)\\s*=\\s*(?:UPPER|LOWER)\\s*\\(\\s*"
                    + literal("value") + "\\s*\\)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern PATTERN_INCLUDE = Pattern.compile(
            "^" + column("col") + "\\s+LIKE\\s+" + literal("pattern") + "$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern EXACT_EQUALS = Pattern.compile(
            "^" + column("col") + "\\s*=\\s*(?:" + literal("value") + "|(?<number>-?\\d+(?:\\.\\d+)?))$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern OFFSET = Pattern.compile(
            "^CURRENT_DATE(?:\\s*-\\s*(?:INTERVAL\\s*'\\s*(?<n>\\d+)\\s*(?<unit>[a-z]+)?\\s*'(?:\\s*(?<unit2>DAYS?|WEEKS?))?|(?<days>\\d+)))?$",
            Pattern.CASE_INSENSITIVE);

    public ClassifiedPredicate classify(RawCondition condition, TableSchema table) {
        String raw = condition.getText();
        String text = normalize(raw);

        ClassifiedPredicate predicate = classifyNormalized(raw, text, table);
        log.debug("Classified [{}] as {}", raw, predicate.getClass().getSimpleName());
        return predicate;
    }

    private ClassifiedPredicate classifyNormalized(String raw, String text, TableSchema table) {
        Matcher m;

        // 1. Compound NULL-or-NOT-LIKE exclusion
        m = PATTERN_EXCLUDE.matcher(text);
        if (!m.matches()) {
            m = PATTERN_EXCLUDE_REVERSED.matcher(text);
        }
        if (m.matches()) {
            String column = m.group("col");
            String pattern = unescape(m.group("pattern"));
            if (!column.equalsIgnoreCase(m.group("col2"))) {
                return Unrecognized.unsupported(raw);
            }
            return requireColumn(raw, table, column, false)
                    .orElseGet(() -> new PatternExclude(raw, column, pattern));
        }

        // 2. Single day relative to today
        m = DATE_EQUALS.matcher(text);
        if (m.matches()) {
            String column = dateColumn(m);
            Long offset = parseOffset(m.group("expr"));
            if (offset == null) {
                return Unrecognized.unsupported(raw);
            }
            if (offset > Integer.MAX_VALUE) {
                return outOfRange(raw, offset);
            }
            return requireColumn(raw, table, column, true)
                    .orElseGet(() -> new DateEquals(raw, column, offset.intValue()));
        }

        // 3. Ranges of days
        m = DATE_BETWEEN.matcher(text);
        if (m.matches()) {
            String column = dateColumn(m);
            Long from = parseOffset(m.group("from"));
            Long to = parseOffset(m.group("to"));
            if (from == null || to == null || from < to) {
                return Unrecognized.unsupported(raw);
            }
            if (from > Integer.MAX_VALUE) {
                return outOfRange(raw, from);
            }
            return requireColumn(raw, table, column, true)
                    .orElseGet(() -> new DateRange(raw, column, from.intValue(), to.intValue()));
        }

        m = DATE_SINCE.matcher(text);
        if (m.matches()) {
            String column = m.group("rcol") != null ? m.group("rcol") : dateColumn(m);
            Long from = parseOffset(m.group("expr"));
            if (from == null) {
                return Unrecognized.unsupported(raw);
            }
            if (from > Integer.MAX_VALUE) {
                return outOfRange(raw, from);
            }
            return requireColumn(raw, table, column, true)
                    .orElseGet(() -> new DateRange(raw, column, from.intValue(), 0));
        }

        // 4. UPPER(col) = UPPER('value')
        m = CASE_INSENSITIVE_EQUALS.matcher(text);
        if (m.matches()) {
            String column = m.group("col");
            String value = unescape(m.group("value"));
            return requireColumn(raw, table, column, false)
                    .orElseGet(() -> new CaseInsensitiveEquals(raw, column, value));
        }

        // 5. Plain LIKE
        m = PATTERN_INCLUDE.matcher(text);
        if (m.matches()) {
            String column = m.group("col");
            String pattern = unescape(m.group("pattern"));
            return requireColumn(raw, table, column, false)
                    .orElseGet(() -> new PatternInclude(raw, column, pattern));
        }

        // 6. Bare equality
        m = EXACT_EQUALS.matcher(text);
        if (m.matches()) {
            String column = m.group("col");
            String value = m.group("value") != null ? unescape(m.group("value")) : m.group("number");
            return requireColumn(raw, table, column, false)
                    .orElseGet(() -> new ExactEquals(raw, column, value));
        }

        return Unrecognized.unsupported(raw);
    }

    /**
     * Empty when the column is usable, otherwise the schema-mismatch result to return instead.
     */
    private Optional<ClassifiedPredicate> requireColumn(String raw, TableSchema table, String column, boolean temporal) {
        Optional<String> field = table.resolveField(column);
        if (field.isEmpty()) {
            log.debug("Column {} is not part of {}", column, table.getName());
            return Optional.of(new Unrecognized(raw, UnrecognizedReason.SCHEMA_MISMATCH));
        }
        if (temporal) {
            Optional<Column> resolved = table.findColumn(field.get());
            if (resolved.isPresent() && resolved.get().getDataType() != null && !resolved.get().isTemporal()) {
                log.debug("Column {}.{} is not a date/time column", table.getName(), field.get());
                return Optional.of(new Unrecognized(raw, UnrecognizedReason.SCHEMA_MISMATCH));
            }
        }
        return Optional.empty();
    }

    private static String dateColumn(Matcher m) {
        return m.group("dcol") != null ? m.group("dcol") : m.group("ccol");
    }

    private static ClassifiedPredicate outOfRange(String raw, long offset) {
        log.debug("Day offset {} in [{}] does not fit a date window", offset, raw);
        return new Unrecognized(raw, UnrecognizedReason.OFFSET_OUT_OF_RANGE);
    }

    /**
     * Days before today denoted by a {@code CURRENT_DATE [- INTERVAL ...]} expression, or null
     * when the interval unit is not a whole number of days. Amounts too large for a {@code long}
     * come back as {@link Long#MAX_VALUE}.
     */
    static Long parseOffset(String expression) {
        Matcher m = OFFSET.matcher(expression.trim());
        if (!m.matches()) {
            return null;
        }
        if (m.group("days") != null) {
            return days(m.group("days"), 1);
        }
        if (m.group("n") == null) {
            return 0L;
        }

        String unit = m.group("unit") != null ? m.group("unit") : m.group("unit2");
        if (unit == null || unit.toLowerCase().startsWith("day")) {
            return days(m.group("n"), 1);
        }
        if (unit.toLowerCase().startsWith("week")) {
            return days(m.group("n"), 7);
        }
        return null;
    }

    private static long days(String digits, int multiplier) {
        try {
            return Math.multiplyExact(Long.parseLong(digits), multiplier);
        } catch (NumberFormatException | ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Collapses whitespace and strips identifier quotes outside string literals.
     */
    static String normalize(String condition) {
        StringBuilder sb = new StringBuilder(condition.length());
        boolean inLiteral = false;
        boolean pendingSpace = false;

        for (char c : condition.trim().toCharArray()) {
            if (c == '\'') {
                inLiteral = !inLiteral;
            }
            if (!inLiteral && c == '"') {
                continue;
            }
            if (!inLiteral && Character.isWhitespace(c)) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace && sb.length() > 0) {
                sb.append(' ');
            }
            pendingSpace = false;
            sb.append(c);
        }
        return sb.toString();
    }

    private static String unescape(String literal) {
        return literal.replace("''", "'");
    }

    private static String column(String group) {
        return String.format(COLUMN, group);
    }

    private static String literal(String group) {
        return String.format(LITERAL, group);
    }

    private static String dateExpression(String group) {
        return String.format(DATE_EXPRESSION, group);
    }
}
