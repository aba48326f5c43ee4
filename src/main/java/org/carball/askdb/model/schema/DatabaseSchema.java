package org.carball.askdb.model.schema;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DatabaseSchema {
    private List<TableSchema> tables = new ArrayList<>();

    public void addTable(TableSchema table) {
        tables.add(table);
    }

    public TableSchema findTable(String name) {
        return tables.stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .findFirst()
                .orElse(null);
    }

    /**
     * Like {@link #findTable(String)} but fails for tables the store does not expose.
     */
    public TableSchema requireTable(String name) {
        TableSchema table = findTable(name);
        if (table == null) {
            throw new IllegalArgumentException("Unknown target table: " + name);
        }
        return table;
    }
}
