package org.carball.askdb.model.schema;

import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Known columns of one table plus the logical names the clause generator may use for them.
 */
@Data
@RequiredArgsConstructor
public class TableSchema {
    private final String name;
    private List<Column> columns = new ArrayList<>();
    private Column primaryKey;
    private Map<String, String> aliases = new LinkedHashMap<>();

    public void addColumn(Column column) {
        columns.add(column);
        if (column.isPrimaryKey()) {
            primaryKey = column;
        }
    }

    public void addAlias(String logicalName, String fieldName) {
        aliases.put(logicalName.toLowerCase(Locale.ROOT), fieldName);
    }

    public Optional<Column> findColumn(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(c -> c.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * Maps a column name as written in a WHERE clause to the field the store understands.
     * Empty when the name is neither a column nor an alias of this table.
     */
    public Optional<String> resolveField(String logicalName) {
        if (logicalName == null || logicalName.isBlank()) {
            return Optional.empty();
        }
        Optional<Column> direct = findColumn(logicalName);
        if (direct.isPresent()) {
            return direct.map(Column::getName);
        }
        String aliased = aliases.get(logicalName.toLowerCase(Locale.ROOT));
        return aliased == null ? Optional.empty() : findColumn(aliased).map(Column::getName);
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>();
        columns.forEach(c -> names.add(c.getName()));
        return names;
    }
}
