package org.carball.askdb.translator;

import lombok.Value;
import org.carball.askdb.model.filter.FilterPipeline;
import org.carball.askdb.model.predicate.ClassifiedPredicate;
import org.carball.askdb.model.query.TranslationDiagnostics;

import java.time.LocalDate;
import java.util.List;

@Value
public class TranslationResult {
    FilterPipeline pipeline;
    List<ClassifiedPredicate> predicates;
    TranslationDiagnostics diagnostics;
    LocalDate businessDate;
}
