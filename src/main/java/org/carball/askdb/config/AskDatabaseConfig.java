package org.carball.askdb.config;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
public class AskDatabaseConfig {
    private String targetTable;
    private String whereClause;
    private String question;
    private boolean count;
    private List<String> sumFields = new ArrayList<>();
    private String groupBy;
    private List<String> partitions = new ArrayList<>();
    private Path dataFile;
    private Path schemaFile;
    private OutputFormat outputFormat = OutputFormat.JSON;
    private String outputFile;
}
