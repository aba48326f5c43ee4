package org.carball.askdb.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.askdb.model.query.RawCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits a WHERE clause into atomic conditions on top-level AND boundaries.
 * Parenthesised groups, quoted literals and quoted identifiers are never split, and the
 * AND of a top-level {@code BETWEEN x AND y} stays with its BETWEEN.
 */
@Slf4j
public class ConditionSplitter {

    private static final Pattern LEADING_WHERE = Pattern.compile("^\\s*WHERE\\s+", Pattern.CASE_INSENSITIVE);

    public List<RawCondition> split(String whereClause) {
        List<RawCondition> conditions = new ArrayList<>();
        if (whereClause == null || whereClause.isBlank()) {
            log.debug("Empty WHERE clause, no conditions");
            return conditions;
        }

        String clause = LEADING_WHERE.matcher(whereClause.trim()).replaceFirst("").trim();
        for (String part : splitGroup(clause)) {
            conditions.add(new RawCondition(part, conditions.size()));
        }

        log.debug("Split WHERE clause into {} condition(s): {}", conditions.size(), conditions);
        return conditions;
    }

    private List<String> splitGroup(String text) {
        List<String> parts = new ArrayList<>();
        String clause = text.trim();
        if (clause.isEmpty()) {
            return parts;
        }

        List<Integer> andPositions = topLevelKeywords(clause, "AND");
        int start = 0;
        for (int position : andPositions) {
            addPart(parts, clause.substring(start, position));
            start = position + 3;
        }
        addPart(parts, clause.substring(start));
        return parts;
    }

    private void addPart(List<String> parts, String candidate) {
        String part = candidate.trim();
        if (part.isEmpty()) {
            return;
        }

        // An AND-only group in parentheses is the same as its members at top level
        String inner = unwrap(part);
        if (inner != null && topLevelKeywords(inner, "OR").isEmpty() && !topLevelKeywords(inner, "AND").isEmpty()) {
            parts.addAll(splitGroup(inner));
        } else if (inner != null && topLevelKeywords(inner, "OR").isEmpty()) {
            parts.add(inner.trim());
        } else {
            parts.add(part);
        }
    }

    /**
     * Returns the content of a condition wrapped entirely in one pair of parentheses, else null.
     */
    static String unwrap(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("(") || !trimmed.endsWith(")")) {
            return null;
        }

        int depth = 0;
        boolean inLiteral = false;
        boolean inIdentifier = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '\'' && !inIdentifier) {
                inLiteral = !inLiteral;
            } else if (c == '"' && !inLiteral) {
                inIdentifier = !inIdentifier;
            } else if (!inLiteral && !inIdentifier) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    if (depth == 0 && i < trimmed.length() - 1) {
                        return null;
                    }
                }
            }
        }
        return depth == 0 ? trimmed.substring(1, trimmed.length() - 1) : null;
    }

    /**
     * Start offsets of a keyword occurring at parenthesis depth zero, outside quotes.
     * For {@code AND} the one closing a top-level BETWEEN is skipped.
     */
    static List<Integer> topLevelKeywords(String text, String keyword) {
        List<Integer> positions = new ArrayList<>();
        int depth = 0;
        boolean inLiteral = false;
        boolean inIdentifier = false;
        boolean pendingBetween = false;

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);

            if (c == '\'' && !inIdentifier) {
                inLiteral = !inLiteral;
                i++;
                continue;
            }
            if (c == '"' && !inLiteral) {
                inIdentifier = !inIdentifier;
                i++;
                continue;
            }
            if (inLiteral || inIdentifier) {
                i++;
                continue;
            }

            if (c == '(') {
                depth++;
                i++;
                continue;
            }
            if (c == ')') {
                depth = Math.max(0, depth - 1);
                i++;
                continue;
            }

            if (isWordStart(text, i)) {
                int end = i;
                while (end < text.length() && isWordChar(text.charAt(end))) {
                    end++;
                }
                String word = text.substring(i, end).toUpperCase(Locale.ROOT);

                if (depth == 0) {
                    if (word.equals("BETWEEN")) {
                        pendingBetween = true;
                    } else if (word.equals("AND") && pendingBetween) {
                        pendingBetween = false;
                        i = end;
                        continue;
                    }
                    if (word.equals(keyword)) {
                        positions.add(i);
                    }
                }
                i = end;
                continue;
            }
            i++;
        }

        return positions;
    }

    private static boolean isWordStart(String text, int index) {
        return Character.isLetter(text.charAt(index))
                && (index == 0 || !isWordChar(text.charAt(index - 1)));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
