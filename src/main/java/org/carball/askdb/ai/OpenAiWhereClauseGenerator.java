package org.carball.askdb.ai;

import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.completion.chat.ChatMessageRole;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.model.schema.Column;
import org.carball.askdb.model.schema.TableSchema;

import java.time.Duration;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Asks the OpenAI chat API for a WHERE clause restricted to the shapes the classifier understands.
 */
@Slf4j
public class OpenAiWhereClauseGenerator implements WhereClauseGenerator {

    private static final String MODEL = "gpt-4";
    private static final double TEMPERATURE = 0.0;
    private static final int MAX_TOKENS = 300;

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");
    private static final Pattern LEADING_WHERE = Pattern.compile("^\\s*WHERE\\s+", Pattern.CASE_INSENSITIVE);

    private static final String SYSTEM_PROMPT = """
        You translate warehouse questions into a single PostgreSQL WHERE clause.
        Reply with the condition only: no SELECT, no WHERE keyword, no explanation.

        Combine conditions with AND and use only these shapes:

        - DATE(<column>) = CURRENT_DATE
        - DATE(<column>) = CURRENT_DATE - INTERVAL '<n> day'
        - DATE(<column>) >= CURRENT_DATE - INTERVAL '<n> days'
        - DATE(<column>) BETWEEN CURRENT_DATE - INTERVAL '<n> days' AND CURRENT_DATE - INTERVAL '<m> days'
        - (<column> IS NULL OR <column> NOT LIKE '%<text>%')
        - <column> LIKE '%<text>%'
        - UPPER(<column>) = UPPER('<value>')
        - <column> = '<value>'

        "Today" means the current local day. GRN pallets carry 'Material GRN' in plt_remark;
        to exclude them use the IS NULL OR NOT LIKE shape so pallets without a remark still count.
        """;

    private final OpenAiService openAiService;

    public OpenAiWhereClauseGenerator(String apiKey) {
        // Only initialize OpenAI service if we're actually going to use it
        if (!"true".equals(System.getProperty("skip.ai")) && apiKey != null && !apiKey.isBlank()) {
            this.openAiService = new OpenAiService(apiKey, Duration.ofSeconds(30));
        } else {
            this.openAiService = null;
        }
    }

    @Override
    public String generateWhereClause(String question, TableSchema table) throws WhereClauseGenerationException {
        if ("true".equals(System.getProperty("skip.ai"))) {
            throw new WhereClauseGenerationException("AI clause generation is disabled (skip.ai=true)");
        }
        if (openAiService == null) {
            throw new WhereClauseGenerationException("No OpenAI API key configured");
        }

        String prompt = buildPrompt(question, table);
        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(MODEL)
                .messages(Arrays.asList(
                        new ChatMessage(ChatMessageRole.SYSTEM.value(), SYSTEM_PROMPT),
                        new ChatMessage(ChatMessageRole.USER.value(), prompt)
                ))
                .temperature(TEMPERATURE)
                .maxTokens(MAX_TOKENS)
                .build();

        log.trace("User prompt:\n{}", prompt);

        try {
            ChatCompletionResult result = openAiService.createChatCompletion(request);
            if (result.getChoices() == null || result.getChoices().isEmpty()) {
                throw new WhereClauseGenerationException("OpenAI returned no choices");
            }
            String response = result.getChoices().get(0).getMessage().getContent();
            log.trace("OpenAI response:\n{}", response);

            String clause = cleanResponse(response);
            log.info("Generated WHERE clause for {}: {}", table.getName(), clause);
            return clause;
        } catch (RuntimeException e) {
            log.error("Error generating WHERE clause: {}", e.getMessage());
            throw new WhereClauseGenerationException("OpenAI request failed: " + e.getMessage(), e);
        }
    }

    static String buildPrompt(String question, TableSchema table) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("## Table: ").append(table.getName()).append("\n\n");
        prompt.append("| Column | Type |\n");
        prompt.append("|--------|------|\n");
        for (Column column : table.getColumns()) {
            prompt.append("| ").append(column.getName()).append(" | ").append(column.getDataType()).append(" |\n");
        }
        prompt.append("\n## Question\n\n").append(question.trim()).append("\n");
        return prompt.toString();
    }

    /**
     * Strips markdown fences, a leading WHERE and a trailing semicolon.
     */
    static String cleanResponse(String response) {
        if (response == null) {
            return "";
        }
        String clause = CODE_FENCE.matcher(response.trim()).replaceAll("").trim();
        clause = LEADING_WHERE.matcher(clause).replaceFirst("").trim();
        if (clause.endsWith(";")) {
            clause = clause.substring(0, clause.length() - 1).trim();
        }
        return clause;
    }
}
