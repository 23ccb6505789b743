package io.arazzolens.core.expression;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar: {@code $} prefix, optional dotted segments, optional {@code #/} JSON pointer.
 */
public final class RuntimeExpressionParser {

    // runtime expressions embedded in free text, e.g. simple criterion conditions
    private static final Pattern EMBEDDED_EXPRESSION = Pattern.compile("\\$[A-Za-z][A-Za-z0-9_.\\-]*(#/[^\\s)\\]}]*)?");

    public static RuntimeExpression parse(final String expression) {
        if (Strings.isNullOrEmpty(expression) || !expression.startsWith("$")) {
            throw new ExpressionSyntaxException("Runtime expression must start with '$': '%s'".formatted(expression));
        }
        if (expression.chars().anyMatch(Character::isWhitespace)) {
            throw new ExpressionSyntaxException("Runtime expression must not contain whitespace: '%s'".formatted(expression));
        }

        String path = expression.substring(1);
        String pointer = null;
        int hashIndex = path.indexOf('#');
        if (hashIndex >= 0) {
            pointer = path.substring(hashIndex + 1);
            path = path.substring(0, hashIndex);
            if (!pointer.isEmpty() && !pointer.startsWith("/")) {
                throw new ExpressionSyntaxException("JSON pointer must start with '/': '%s'".formatted(expression));
            }
        }

        String[] parts = path.split("\\.", -1);
        String prefix = parts[0];
        if (prefix.isEmpty()) {
            throw new ExpressionSyntaxException("Runtime expression has no prefix: '%s'".formatted(expression));
        }
        ExpressionKind kind = ExpressionKind.fromPrefix(prefix)
                .orElseThrow(() -> new ExpressionSyntaxException(
                        "Unknown runtime expression prefix '$%s' in '%s'".formatted(prefix, expression)));

        List<String> segments = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            if (parts[i].isEmpty()) {
                throw new ExpressionSyntaxException("Empty segment in runtime expression '%s'".formatted(expression));
            }
            segments.add(parts[i]);
        }
        return new RuntimeExpression(expression, kind, ImmutableList.copyOf(segments), pointer);
    }

    /**
     * @return the contents of every {@code {$...}} template in the text, without braces
     * @throws ExpressionSyntaxException on an unterminated template
     */
    public static List<String> templates(final String text) {
        List<String> templates = new ArrayList<>();
        if (Objects.isNull(text)) return templates;
        int start = 0;
        while (start < text.length()) {
            int openIndex = text.indexOf("{$", start);
            if (openIndex == -1) break;
            int closeIndex = text.indexOf('}', openIndex);
            if (closeIndex == -1) {
                throw new ExpressionSyntaxException("Unmatched '{$' in expression: %s".formatted(text));
            }
            templates.add(text.substring(openIndex + 1, closeIndex));
            start = closeIndex + 1;
        }
        return templates;
    }

    public static List<String> embedded(final String text) {
        List<String> expressions = new ArrayList<>();
        if (Objects.isNull(text)) return expressions;
        Matcher matcher = EMBEDDED_EXPRESSION.matcher(text);
        while (matcher.find()) {
            // a sentence may end right after the expression
            expressions.add(StringUtils.stripEnd(matcher.group(), "."));
        }
        return expressions;
    }

    private RuntimeExpressionParser() {}
}
