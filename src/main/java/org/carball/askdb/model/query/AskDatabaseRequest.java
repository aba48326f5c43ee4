package org.carball.askdb.model.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.askdb.model.aggregate.AggregateRequest;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskDatabaseRequest {
    private String whereClause;
    private String targetTable;
    private AggregateRequest aggregateRequest;

    public static AskDatabaseRequest of(String whereClause, String targetTable) {
        return new AskDatabaseRequest(whereClause, targetTable, null);
    }

    public static AskDatabaseRequest of(String whereClause, String targetTable, AggregateRequest aggregateRequest) {
        return new AskDatabaseRequest(whereClause, targetTable, aggregateRequest);
    }
}
