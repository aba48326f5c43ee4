package org.carball.askdb.ai;

import org.carball.askdb.model.schema.TableSchema;

/**
 * Turns a natural-language question into a WHERE clause over one table.
 */
public interface WhereClauseGenerator {

    String generateWhereClause(String question, TableSchema table) throws WhereClauseGenerationException;
}
