package org.carball.askdb.service;

import lombok.Value;
import org.carball.askdb.model.query.AskDatabaseResponse;
import org.carball.askdb.validation.ConsistencyOutcome;

import java.util.List;

@Value
public class ConsistencyReport {
    AskDatabaseResponse whole;
    List<AskDatabaseResponse> parts;
    ConsistencyOutcome outcome;
}
