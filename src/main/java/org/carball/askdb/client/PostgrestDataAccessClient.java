package org.carball.askdb.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.carball.askdb.executor.DataAccessClient;
import org.carball.askdb.executor.FilterQuery;
import org.carball.askdb.executor.QueryExecutionException;
import org.carball.askdb.model.filter.FilterOperation;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Talks to a PostgREST endpoint (the REST layer of a Supabase project). Each filter becomes
 * one horizontal-filtering query parameter, so the store only ever sees chained predicates.
 * The base URL is the REST root, e.g. {@code https://<project>.supabase.co/rest/v1}.
 */
@Slf4j
public class PostgrestDataAccessClient implements DataAccessClient {

    private static final Pattern CONTENT_RANGE_TOTAL = Pattern.compile("^(?:\\d+-\\d+|\\*)/(\\d+)$");
    private static final Pattern NEEDS_QUOTES = Pattern.compile("[,()\":]");

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final int rowLimit;
    private final ObjectMapper objectMapper;

    public PostgrestDataAccessClient(String baseUrl, String apiKey, Duration requestTimeout, int rowLimit) {
        this(new OkHttpClient.Builder()
                        .callTimeout(requestTimeout)
                        .build(),
                baseUrl, apiKey, rowLimit);
    }

    public PostgrestDataAccessClient(OkHttpClient httpClient, String baseUrl, String apiKey, int rowLimit) {
        HttpUrl parsed = baseUrl == null ? null : HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid store URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.baseUrl = parsed;
        this.apiKey = apiKey;
        this.rowLimit = rowLimit;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
    }

    @Override
    public PostgrestQuery from(String table) {
        return new PostgrestQuery(table);
    }

    /**
     * PostgREST operand syntax for one simple operation, without the field name.
     */
    static String operand(FilterOperation operation) {
        return operatorPrefix(operation) + operandValue(operation);
    }

    /**
     * Body of an {@code or=(...)} parameter. Values containing reserved characters are double-quoted.
     */
    static String disjunction(List<FilterOperation> operands) {
        return operands.stream()
                .map(op -> {
                    String value = operandValue(op);
                    if (NEEDS_QUOTES.matcher(value).find()) {
                        value = "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
                    }
                    return op.getField() + "." + operatorPrefix(op) + value;
                })
                .collect(Collectors.joining(",", "(", ")"));
    }

    private static String operatorPrefix(FilterOperation operation) {
        switch (operation.getOperator()) {
            case GTE:
                return "gte.";
            case LT:
                return "lt.";
            case LIKE:
                return "like.";
            case NOT_LIKE:
                return "not.like.";
            case ILIKE:
                return "ilike.";
            case EQ:
                return "eq.";
            case IS_NULL:
                return "is.null";
            default:
                throw new IllegalArgumentException("No PostgREST operand for " + operation.getOperator());
        }
    }

    private static String operandValue(FilterOperation operation) {
        Object value = operation.getValue();
        switch (operation.getOperator()) {
            case LIKE:
            case NOT_LIKE:
            case ILIKE:
                return wildcards((String) value);
            case IS_NULL:
                return "";
            default:
                return literal(value);
        }
    }

    static long parseContentRangeTotal(String contentRange) throws QueryExecutionException {
        if (contentRange == null) {
            throw new QueryExecutionException("Store response has no Content-Range header");
        }
        Matcher m = CONTENT_RANGE_TOTAL.matcher(contentRange.trim());
        if (!m.matches()) {
            throw new QueryExecutionException("Unexpected Content-Range header: " + contentRange);
        }
        return Long.parseLong(m.group(1));
    }

    // SQL wildcards are accepted by PostgREST, but '*' avoids percent-encoding in the URL.
    // Escaped characters are passed through with their backslash.
    static String wildcards(String pattern) {
        StringBuilder sb = new StringBuilder(pattern.length());
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\\' && i + 1 < pattern.length()) {
                sb.append(c).append(pattern.charAt(++i));
            } else {
                sb.append(c == '%' ? '*' : c);
            }
        }
        return sb.toString();
    }

    private static String literal(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return String.valueOf(value);
    }

    public class PostgrestQuery implements FilterQuery {

        private final String table;
        private final List<String[]> parameters = new ArrayList<>();

        PostgrestQuery(String table) {
            this.table = table;
        }

        @Override
        public PostgrestQuery gte(String field, Instant value) {
            return add(field, operand(FilterOperation.gte(field, value)));
        }

        @Override
        public PostgrestQuery lt(String field, Instant value) {
            return add(field, operand(FilterOperation.lt(field, value)));
        }

        @Override
        public PostgrestQuery like(String field, String pattern) {
            return add(field, operand(FilterOperation.like(field, pattern)));
        }

        @Override
        public PostgrestQuery notLike(String field, String pattern) {
            return add(field, operand(FilterOperation.notLike(field, pattern)));
        }

        @Override
        public PostgrestQuery ilike(String field, String value) {
            return add(field, operand(FilterOperation.ilike(field, value)));
        }

        @Override
        public PostgrestQuery eq(String field, Object value) {
            return add(field, operand(FilterOperation.eq(field, value)));
        }

        @Override
        public PostgrestQuery isNull(String field) {
            return add(field, operand(FilterOperation.isNull(field)));
        }

        @Override
        public PostgrestQuery or(List<FilterOperation> operands) {
            return add("or", disjunction(operands));
        }

        @Override
        public List<Map<String, Object>> rows() throws QueryExecutionException {
            HttpUrl url = toUrl(true);
            Request request = authorized(new Request.Builder().url(url).get()).build();

            try (Response response = send(request)) {
                ResponseBody body = response.body();
                String json = body == null ? "[]" : body.string();
                List<Map<String, Object>> rows = objectMapper.readValue(json, new TypeReference<>() {});
                if (rows.size() >= rowLimit) {
                    log.warn("Result for {} hit the row limit of {}, aggregates may be incomplete", table, rowLimit);
                }
                return rows;
            } catch (IOException e) {
                throw failure(e);
            }
        }

        @Override
        public long count() throws QueryExecutionException {
            HttpUrl url = toUrl(false);
            Request request = authorized(new Request.Builder().url(url).head())
                    .header("Prefer", "count=exact")
                    .build();

            try (Response response = send(request)) {
                return parseContentRangeTotal(response.header("Content-Range"));
            } catch (IOException e) {
                throw failure(e);
            }
        }

        HttpUrl toUrl(boolean withLimit) {
            HttpUrl.Builder builder = baseUrl.newBuilder()
                    .addPathSegment(table)
                    .addQueryParameter("select", "*");
            for (String[] parameter : parameters) {
                builder.addQueryParameter(parameter[0], parameter[1]);
            }
            if (withLimit) {
                builder.addQueryParameter("limit", String.valueOf(rowLimit));
            }
            return builder.build();
        }

        private PostgrestQuery add(String name, String value) {
            parameters.add(new String[]{name, value});
            return this;
        }

        private Request.Builder authorized(Request.Builder builder) {
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("apikey", apiKey)
                        .header("Authorization", "Bearer " + apiKey);
            }
            return builder;
        }

        private Response send(Request request) throws IOException, QueryExecutionException {
            log.debug("{} {}", request.method(), request.url());
            Response response = httpClient.newCall(request).execute();
            if (!response.isSuccessful()) {
                ResponseBody body = response.body();
                String detail = body == null ? "" : body.string();
                response.close();
                throw new QueryExecutionException("Store returned HTTP " + response.code()
                        + " for " + table + (detail.isBlank() ? "" : ": " + detail));
            }
            return response;
        }

        private QueryExecutionException failure(IOException e) {
            if (e instanceof InterruptedIOException) {
                return new QueryExecutionException("Store request for " + table + " timed out", e);
            }
            return new QueryExecutionException("Store request for " + table + " failed: " + e.getMessage(), e);
        }
    }
}
