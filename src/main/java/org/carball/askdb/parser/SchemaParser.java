package org.carball.askdb.parser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import net.sf.jsqlparser.statement.create.table.ColumnDefinition;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.Index;
import org.carball.askdb.model.schema.Column;
import org.carball.askdb.model.schema.DatabaseSchema;
import org.carball.askdb.model.schema.TableSchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Builds the table schema provider from PostgreSQL DDL, optionally overlaid with a YAML
 * file of logical column aliases.
 */
@Slf4j
public class SchemaParser {

    public static final String DEFAULT_SCHEMA_RESOURCE = "schema/warehouse-schema.sql";
    public static final String DEFAULT_ALIASES_RESOURCE = "schema/column-aliases.yaml";

    private SchemaParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Loads the warehouse tables bundled with the application.
     */
    public static DatabaseSchema loadDefault() throws IOException {
        DatabaseSchema schema = parseDDL(readResource(DEFAULT_SCHEMA_RESOURCE));
        try (InputStream aliases = SchemaParser.class.getClassLoader().getResourceAsStream(DEFAULT_ALIASES_RESOURCE)) {
            if (aliases != null) {
                applyAliases(schema, aliases);
            }
        }
        return schema;
    }

    public static DatabaseSchema parseDDL(Path ddlFile) throws IOException {
        String content = Files.readString(ddlFile);
        return parseDDL(content);
    }

    public static DatabaseSchema parseDDL(String ddlContent) {
        DatabaseSchema schema = new DatabaseSchema();

        try {
            Statements statements = CCJSqlParserUtil.parseStatements(preprocessDDL(ddlContent));

            for (Statement statement : statements.getStatements()) {
                if (statement instanceof CreateTable createTable) {
                    TableSchema table = convertTable(createTable);
                    schema.addTable(table);
                    log.debug("Parsed table: {} ({} columns)", table.getName(), table.getColumns().size());
                }
            }
        } catch (JSQLParserException e) {
            log.error("Error parsing DDL: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid SQL DDL: " + e.getMessage(), e);
        }

        return schema;
    }

    /**
     * Reads {@code table -> {logicalName: column}} from YAML and registers each alias.
     * Aliases pointing at unknown tables or columns are skipped with a warning.
     */
    public static void applyAliases(DatabaseSchema schema, InputStream yaml) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        Map<String, Map<String, String>> aliases = yamlMapper.readValue(yaml, new TypeReference<>() {});
        if (aliases == null) {
            return;
        }

        aliases.forEach((tableName, mapping) -> {
            TableSchema table = schema.findTable(tableName);
            if (table == null) {
                log.warn("Ignoring aliases for unknown table: {}", tableName);
                return;
            }
            mapping.forEach((logical, field) -> {
                if (table.findColumn(field).isEmpty()) {
                    log.warn("Ignoring alias {}.{} -> {}: no such column", tableName, logical, field);
                } else {
                    table.addAlias(logical, field);
                }
            });
        });
    }

    private static String preprocessDDL(String ddlContent) {
        // Drop line comments, JSqlParser chokes on some of them between column definitions
        String processed = ddlContent.replaceAll("--[^\\n]*", "");

        // Identity columns are irrelevant for filtering
        processed = processed.replaceAll("(?i)GENERATED\\s+(ALWAYS|BY DEFAULT)\\s+AS\\s+IDENTITY", "");

        return processed.replaceAll("\\s+", " ").trim();
    }

    private static TableSchema convertTable(CreateTable createTable) {
        TableSchema table = new TableSchema(cleanIdentifier(createTable.getTable().getName()));

        if (createTable.getColumnDefinitions() != null) {
            for (ColumnDefinition colDef : createTable.getColumnDefinitions()) {
                table.addColumn(convertColumn(colDef));
            }
        }

        if (createTable.getIndexes() != null) {
            for (Index index : createTable.getIndexes()) {
                if ("PRIMARY KEY".equalsIgnoreCase(index.getType()) && index.getColumnsNames().size() == 1) {
                    String pkColumn = cleanIdentifier(index.getColumnsNames().get(0));
                    table.findColumn(pkColumn).ifPresent(c -> {
                        c.setPrimaryKey(true);
                        table.setPrimaryKey(c);
                    });
                }
            }
        }

        return table;
    }

    private static Column convertColumn(ColumnDefinition colDef) {
        Column.ColumnBuilder builder = Column.builder()
                .name(cleanIdentifier(colDef.getColumnName()))
                .dataType(colDef.getColDataType().getDataType())
                .nullable(true);

        List<String> specs = colDef.getColumnSpecs();
        if (specs != null) {
            for (int i = 0; i < specs.size(); i++) {
                String upperSpec = specs.get(i).toUpperCase();

                if (upperSpec.equals("NOT NULL")) {
                    builder.nullable(false);
                } else if (upperSpec.equals("NOT") && i + 1 < specs.size()
                        && specs.get(i + 1).equalsIgnoreCase("NULL")) {
                    builder.nullable(false);
                } else if (upperSpec.equals("PRIMARY") || upperSpec.contains("PRIMARY KEY")) {
                    builder.primaryKey(true).nullable(false);
                } else if (upperSpec.equals("DEFAULT") && i + 1 < specs.size()) {
                    builder.defaultValue(specs.get(i + 1));
                }
            }
        }

        return builder.build();
    }

    private static String readResource(String name) throws IOException {
        try (InputStream in = SchemaParser.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IOException("Schema resource not found on classpath: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static String cleanIdentifier(String identifier) {
        if (identifier == null) return null;

        return identifier
                .replaceAll("[`\"]", "")
                .replaceAll("^public\\.", "");
    }
}
