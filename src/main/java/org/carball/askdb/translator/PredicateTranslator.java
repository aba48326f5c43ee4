package org.carball.askdb.translator;

import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.model.filter.FilterOperation;
import org.carball.askdb.model.predicate.CaseInsensitiveEquals;
import org.carball.askdb.model.predicate.ClassifiedPredicate;
import org.carball.askdb.model.predicate.DateEquals;
import org.carball.askdb.model.predicate.DateRange;
import org.carball.askdb.model.predicate.ExactEquals;
import org.carball.askdb.model.predicate.PatternExclude;
import org.carball.askdb.model.predicate.PatternInclude;
import org.carball.askdb.model.predicate.Unrecognized;
import org.carball.askdb.model.schema.Column;
import org.carball.askdb.model.schema.TableSchema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Converts classified predicates into filter operations on physical fields.
 * Returns an empty list for unrecognized predicates and for fields the schema cannot map.
 */
@Slf4j
public class PredicateTranslator {

    private final DateWindowResolver dateWindowResolver;
    private final ZoneId zone;

    public PredicateTranslator(DateWindowResolver dateWindowResolver, ZoneId zone) {
        this.dateWindowResolver = dateWindowResolver;
        this.zone = zone;
    }

    /**
     * @throws DateWindowRangeException when a date predicate's offset exceeds the configured bound
     */
    public List<FilterOperation> translate(ClassifiedPredicate predicate, TableSchema schema, LocalDate today) {
        return predicate.accept(new ClassifiedPredicate.Visitor<>() {

            @Override
            public List<FilterOperation> visitDateEquals(DateEquals p) {
                return field(schema, p.getDateField())
                        .map(field -> window(field, dateWindowResolver.resolve(today, p.getRelativeOffsetDays(), zone)))
                        .orElse(List.of());
            }

            @Override
            public List<FilterOperation> visitDateRange(DateRange p) {
                return field(schema, p.getDateField())
                        .map(field -> window(field, dateWindowResolver.resolveRange(
                                today, p.getStartOffsetDays(), p.getEndOffsetDays(), zone)))
                        .orElse(List.of());
            }

            @Override
            public List<FilterOperation> visitPatternExclude(PatternExclude p) {
                // Must stay one disjunction: AND-ing the two halves drops every NULL row
                return field(schema, p.getField())
                        .map(field -> List.of(FilterOperation.or(
                                FilterOperation.isNull(field),
                                FilterOperation.notLike(field, p.getPattern()))))
                        .orElse(List.of());
            }

            @Override
            public List<FilterOperation> visitPatternInclude(PatternInclude p) {
                return field(schema, p.getField())
                        .map(field -> List.of(FilterOperation.like(field, p.getPattern())))
                        .orElse(List.of());
            }

            @Override
            public List<FilterOperation> visitCaseInsensitiveEquals(CaseInsensitiveEquals p) {
                return field(schema, p.getField())
                        .map(field -> List.of(FilterOperation.ilike(field, escapeLike(p.getValue()))))
                        .orElse(List.of());
            }

            @Override
            public List<FilterOperation> visitExactEquals(ExactEquals p) {
                return field(schema, p.getField())
                        .map(field -> List.of(FilterOperation.eq(field, typedValue(schema, field, p.getValue()))))
                        .orElse(List.of());
            }

            @Override
            public List<FilterOperation> visitUnrecognized(Unrecognized p) {
                return List.of();
            }
        });
    }

    private static List<FilterOperation> window(String field, DateWindow window) {
        return List.of(
                FilterOperation.gte(field, window.getStart()),
                FilterOperation.lt(field, window.getEndExclusive()));
    }

    /**
     * Makes {@code %}, {@code _} and the escape character match themselves in a LIKE pattern.
     */
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private static Optional<String> field(TableSchema schema, String logicalName) {
        Optional<String> field = schema.resolveField(logicalName);
        if (field.isEmpty()) {
            log.warn("Field {} is not mapped for table {}, predicate dropped", logicalName, schema.getName());
        }
        return field;
    }

    private static Object typedValue(TableSchema schema, String field, String value) {
        boolean numeric = schema.findColumn(field).map(Column::isNumeric).orElse(false);
        if (!numeric) {
            return value;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            log.debug("Keeping non-numeric literal '{}' for numeric field {}", value, field);
            return value;
        }
    }
}
