package org.carball.askdb.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.ai.OpenAiWhereClauseGenerator;
import org.carball.askdb.ai.WhereClauseGenerationException;
import org.carball.askdb.client.FileDataAccessClient;
import org.carball.askdb.client.PostgrestDataAccessClient;
import org.carball.askdb.config.AskDatabaseConfig;
import org.carball.askdb.config.ConfigurationLoader;
import org.carball.askdb.config.OutputFormat;
import org.carball.askdb.config.TranslationSettings;
import org.carball.askdb.executor.DataAccessClient;
import org.carball.askdb.executor.QueryExecutionException;
import org.carball.askdb.model.aggregate.AggregateRequest;
import org.carball.askdb.model.aggregate.Metric;
import org.carball.askdb.model.query.AskDatabaseRequest;
import org.carball.askdb.model.query.AskDatabaseResponse;
import org.carball.askdb.model.schema.DatabaseSchema;
import org.carball.askdb.output.AnswerReport;
import org.carball.askdb.parser.SchemaParser;
import org.carball.askdb.service.AskDatabaseService;
import org.carball.askdb.service.ConsistencyReport;
import org.carball.askdb.validation.ConsistencyRelation;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class AskDatabaseCLI {

    private static final String VERSION = "1.0.0";

    public static void main(String[] args) {
        if (args.length < 2 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 2 ? 1 : 0);
        }

        try {
            AskDatabaseConfig config = parseArgs(args);
            // The report itself may go to stdout, keep progress out of its way
            PrintStream console = config.getOutputFile() != null ? System.out : System.err;
            console.printf("Ask Database v%s%n", VERSION);

            TranslationSettings settings = new ConfigurationLoader().loadConfiguration(args);
            DatabaseSchema schema = config.getSchemaFile() != null
                    ? SchemaParser.parseDDL(config.getSchemaFile())
                    : SchemaParser.loadDefault();
            DataAccessClient client = createClient(config, settings);

            OpenAiWhereClauseGenerator clauseGenerator = new OpenAiWhereClauseGenerator(settings.getOpenAiApiKey());
            AskDatabaseService service = new AskDatabaseService(schema, client, settings, Clock.systemUTC(),
                    clauseGenerator);

            console.println("   Table: " + config.getTargetTable());
            console.println("   Source: " + (config.getDataFile() != null ? config.getDataFile() : settings.getStoreUrl()));

            AggregateRequest aggregateRequest = buildAggregateRequest(config);
            AnswerReport report;
            AskDatabaseResponse answer;

            if (config.getPartitions().isEmpty()) {
                answer = config.getQuestion() != null
                        ? service.askQuestion(config.getQuestion(), config.getTargetTable(), aggregateRequest)
                        : service.ask(AskDatabaseRequest.of(config.getWhereClause(), config.getTargetTable(), aggregateRequest));
                report = new AnswerReport(answer);
            } else {
                String whereClause = config.getWhereClause();
                if (config.getQuestion() != null) {
                    whereClause = clauseGenerator.generateWhereClause(
                            config.getQuestion(), schema.requireTable(config.getTargetTable()));
                }
                List<AskDatabaseRequest> parts = config.getPartitions().stream()
                        .map(partition -> AskDatabaseRequest.of(partition, config.getTargetTable(), aggregateRequest))
                        .collect(Collectors.toList());
                ConsistencyReport consistency = service.askWithConsistency(
                        AskDatabaseRequest.of(whereClause, config.getTargetTable(), aggregateRequest),
                        parts, ConsistencyRelation.SUM_OF_PARTS);
                answer = consistency.getWhole();
                report = new AnswerReport(answer, consistency.getParts());
            }

            String rendered = config.getOutputFormat() == OutputFormat.MARKDOWN ? report.toMarkdown() : report.toJson();
            if (config.getOutputFile() != null) {
                Files.writeString(Paths.get(config.getOutputFile()), rendered);
                console.println("   Output file: " + config.getOutputFile());
            } else {
                System.out.println(rendered);
            }

            if (answer.getDiagnostics().isDegraded()) {
                console.println("\n⚠️  " + answer.getDiagnostics().getUnrecognizedCount()
                        + " condition(s) could not be applied: " + answer.getDiagnostics().getUnrecognizedConditions());
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (QueryExecutionException e) {
            System.err.println("\n❌ Query failed: " + e.getMessage());
            log.debug("Query error details", e);
            System.exit(2);
        } catch (WhereClauseGenerationException e) {
            System.err.println("\n❌ Could not generate a WHERE clause: " + e.getMessage());
            log.debug("Generation error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar askdb-filter.jar --table <table> (--where <clause> | --question <text>) [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --table, -t         Target table, e.g. record_palletinfo");
        System.out.println("  --where, -w         WHERE clause to translate and run");
        System.out.println("  --question, -q      Natural-language question (needs OPENAI_API_KEY)");
        System.out.println("  --count             Count matching rows");
        System.out.println("  --sum <field>       Sum a numeric field (repeatable)");
        System.out.println("  --group-by <field>  Group the aggregate by a field");
        System.out.println("  --partition <clause> Disjoint sub-clause whose results must add up to the main one (repeatable)");
        System.out.println("  --data-file <json>  Answer from an exported JSON file instead of the store");
        System.out.println("  --store-url <url>   PostgREST root of the warehouse store");
        System.out.println("  --schema <ddl>      Schema DDL file (default: bundled warehouse schema)");
        System.out.println("  --format, -f        Output format: json|markdown (default: json)");
        System.out.println("  --output, -o        Output file (default: stdout)");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
        System.out.println("Examples:");
        System.out.println("  # Pallets generated today, excluding GRN receipts");
        System.out.println("  java -jar askdb-filter.jar -t record_palletinfo --count --data-file export.json \\");
        System.out.println("    -w \"DATE(generate_time) = CURRENT_DATE AND (plt_remark IS NULL OR plt_remark NOT LIKE '%Material GRN%')\"");
        System.out.println();
        System.out.println("  # Check that today's total equals GRN plus non-GRN pallets");
        System.out.println("  java -jar askdb-filter.jar -t record_palletinfo --count --store-url https://x.supabase.co/rest/v1 \\");
        System.out.println("    -w \"DATE(generate_time) = CURRENT_DATE\" \\");
        System.out.println("    --partition \"DATE(generate_time) = CURRENT_DATE AND plt_remark LIKE '%Material GRN%'\" \\");
        System.out.println("    --partition \"DATE(generate_time) = CURRENT_DATE AND (plt_remark IS NULL OR plt_remark NOT LIKE '%Material GRN%')\"");
    }

    static AskDatabaseConfig parseArgs(String[] args) {
        AskDatabaseConfig config = new AskDatabaseConfig();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--table":
                case "-t":
                    config.setTargetTable(requireValue(args, ++i, "Target table not specified"));
                    break;

                case "--where":
                case "-w":
                    config.setWhereClause(requireValue(args, ++i, "WHERE clause not specified"));
                    break;

                case "--question":
                case "-q":
                    config.setQuestion(requireValue(args, ++i, "Question not specified"));
                    break;

                case "--count":
                    config.setCount(true);
                    break;

                case "--sum":
                    config.getSumFields().add(requireValue(args, ++i, "Sum field not specified"));
                    break;

                case "--group-by":
                    config.setGroupBy(requireValue(args, ++i, "Group-by field not specified"));
                    break;

                case "--partition":
                    config.getPartitions().add(requireValue(args, ++i, "Partition clause not specified"));
                    break;

                case "--data-file":
                    config.setDataFile(Paths.get(requireValue(args, ++i, "Data file not specified")));
                    break;

                case "--schema":
                    config.setSchemaFile(Paths.get(requireValue(args, ++i, "Schema file not specified")));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase()));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json or markdown", e);
                    }
                    break;

                case "--output":
                case "-o":
                    config.setOutputFile(requireValue(args, ++i, "Output file not specified"));
                    break;

                // Handled by ConfigurationLoader
                case "--store-url":
                case "--api-key":
                case "--time-zone":
                case "--max-offset-days":
                case "--timeout-ms":
                case "--row-limit":
                    requireValue(args, ++i, args[i - 1] + " needs a value");
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static void validateConfig(AskDatabaseConfig config) {
        if (config.getTargetTable() == null || config.getTargetTable().isBlank()) {
            throw new IllegalArgumentException("Target table is required (--table)");
        }
        if (config.getWhereClause() != null && config.getQuestion() != null) {
            throw new IllegalArgumentException("Use either --where or --question, not both");
        }
        if (config.getWhereClause() == null && config.getQuestion() == null) {
            throw new IllegalArgumentException("A WHERE clause (--where) or a question (--question) is required");
        }
        if (!config.getPartitions().isEmpty() && !config.isCount() && config.getSumFields().isEmpty()) {
            throw new IllegalArgumentException("--partition needs --count or --sum to compare");
        }
        if (config.getDataFile() != null && !Files.exists(config.getDataFile())) {
            throw new IllegalArgumentException("Data file does not exist: " + config.getDataFile());
        }
        if (config.getSchemaFile() != null && !Files.exists(config.getSchemaFile())) {
            throw new IllegalArgumentException("Schema file does not exist: " + config.getSchemaFile());
        }
    }

    static AggregateRequest buildAggregateRequest(AskDatabaseConfig config) {
        List<Metric> metrics = new ArrayList<>();
        if (config.isCount()) {
            metrics.add(Metric.count());
        }
        config.getSumFields().forEach(field -> metrics.add(Metric.sum(field)));

        if (metrics.isEmpty()) {
            if (config.getGroupBy() != null) {
                metrics.add(Metric.count());
            } else {
                return null;
            }
        }
        return new AggregateRequest(metrics, config.getGroupBy());
    }

    private static DataAccessClient createClient(AskDatabaseConfig config, TranslationSettings settings) throws IOException {
        if (config.getDataFile() != null) {
            return FileDataAccessClient.load(config.getDataFile());
        }
        if (settings.getStoreUrl() != null) {
            return new PostgrestDataAccessClient(settings.getStoreUrl(), settings.getStoreApiKey(),
                    settings.getRequestTimeout(), settings.getRowLimit());
        }
        throw new IllegalArgumentException("No data source: use --data-file or --store-url (or ASKDB_STORE_URL)");
    }
}
