package org.carball.askdb.translator;

import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.model.filter.FilterOperation;
import org.carball.askdb.model.filter.FilterPipeline;
import org.carball.askdb.model.predicate.ClassifiedPredicate;
import org.carball.askdb.model.predicate.Unrecognized;
import org.carball.askdb.model.predicate.UnrecognizedReason;
import org.carball.askdb.model.query.RawCondition;
import org.carball.askdb.model.query.TranslationDiagnostics;
import org.carball.askdb.model.query.UnrecognizedCondition;
import org.carball.askdb.model.schema.TableSchema;
import org.carball.askdb.parser.ConditionSplitter;
import org.carball.askdb.parser.PredicateClassifier;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Split, classify and translate a WHERE clause into a fresh pipeline.
 * Every condition is handled on its own; an unusable condition is dropped and recorded in
 * the diagnostics while the rest of the clause still applies.
 */
@Slf4j
public class WhereClauseTranslator {

    private final ConditionSplitter splitter;
    private final PredicateClassifier classifier;
    private final PredicateTranslator translator;
    private final DateWindowResolver dateWindowResolver;
    private final ZoneId zone;

    public WhereClauseTranslator(DateWindowResolver dateWindowResolver, ZoneId zone) {
        this(new ConditionSplitter(), new PredicateClassifier(), dateWindowResolver, zone);
    }

    public WhereClauseTranslator(ConditionSplitter splitter, PredicateClassifier classifier,
                                 DateWindowResolver dateWindowResolver, ZoneId zone) {
        this.splitter = splitter;
        this.classifier = classifier;
        this.translator = new PredicateTranslator(dateWindowResolver, zone);
        this.dateWindowResolver = dateWindowResolver;
        this.zone = zone;
    }

    public TranslationResult translate(String whereClause, TableSchema table) {
        LocalDate today = dateWindowResolver.today(zone);
        FilterPipeline pipeline = new FilterPipeline(table.getName());
        TranslationDiagnostics diagnostics = new TranslationDiagnostics();
        List<ClassifiedPredicate> predicates = new ArrayList<>();

        List<RawCondition> conditions = splitter.split(whereClause);
        for (RawCondition condition : conditions) {
            ClassifiedPredicate predicate = classifier.classify(condition, table);

            List<FilterOperation> operations;
            try {
                operations = translator.translate(predicate, table, today);
            } catch (DateWindowRangeException e) {
                log.warn("Dropping condition [{}]: {}", condition.getText(), e.getMessage());
                predicate = new Unrecognized(condition.getText(), UnrecognizedReason.OFFSET_OUT_OF_RANGE);
                operations = List.of();
            }

            if (predicate.isRecognized() && operations.isEmpty()) {
                predicate = new Unrecognized(condition.getText(), UnrecognizedReason.SCHEMA_MISMATCH);
            }

            if (predicate instanceof Unrecognized unrecognized) {
                log.warn("Unrecognized condition #{} [{}] on {}: {}", condition.getPosition(),
                        condition.getText(), table.getName(), unrecognized.getReason());
                diagnostics.addUnrecognized(new UnrecognizedCondition(condition.getText(), unrecognized.getReason()));
            }

            predicates.add(predicate);
            pipeline.appendAll(operations);
        }

        log.info("Translated {} condition(s) on {} into {} filter operation(s), {} unrecognized",
                conditions.size(), table.getName(), pipeline.size(), diagnostics.getUnrecognizedCount());
        return new TranslationResult(pipeline, predicates, diagnostics, today);
    }

    public ZoneId getZone() {
        return zone;
    }
}
