package org.carball.askdb.model.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import org.carball.askdb.validation.ConsistencyOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Travels with every answer so the caller can decide whether to show a confidence caveat.
 */
@Data
public class TranslationDiagnostics {
    private List<UnrecognizedCondition> unrecognized = new ArrayList<>();
    private ConsistencyOutcome consistency;

    public void addUnrecognized(UnrecognizedCondition condition) {
        unrecognized.add(condition);
    }

    public List<String> getUnrecognizedConditions() {
        return unrecognized.stream()
                .map(UnrecognizedCondition::getText)
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public int getUnrecognizedCount() {
        return unrecognized.size();
    }

    @JsonIgnore
    public boolean isDegraded() {
        return !unrecognized.isEmpty();
    }
}
