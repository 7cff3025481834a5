package com.forecastmind.core.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Materializes prompt templates of the form {@code {{ path | filter(arg) | ... }}}.
 * <p>
 * Paths are dotted lookups into the variable map. Supported filters:
 * <ul>
 *   <li>{@code default(x)}: substitute {@code x} when the value is null or blank</li>
 *   <li>{@code round(n)}: round a number to {@code n} decimals (half-up)</li>
 *   <li>{@code json}: serialize the value as JSON</li>
 *   <li>{@code join(sep)}: join a collection with {@code sep}</li>
 * </ul>
 * Unresolved expressions without a default render as an empty string.
 */
@Component
public class PromptRenderer {

    private static final Logger log = LoggerFactory.getLogger(PromptRenderer.class);

    private static final Pattern EXPRESSION = Pattern.compile("\\{\\{\\s*(.+?)\\s*}}");
    private static final Pattern FILTER = Pattern.compile("(\\w+)(?:\\((.*)\\))?");

    private final ObjectMapper mapper;

    public PromptRenderer() {
        this(new ObjectMapper());
    }

    public PromptRenderer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String render(String template, Map<String, ?> variables) {
        if (template == null) {
            return "";
        }
        Matcher matcher = EXPRESSION.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = evaluate(matcher.group(1), variables);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Checks that every required variable resolves to a non-null value.
     *
     * @throws MissingTemplateVariablesException listing each missing name
     */
    public void requireVariables(Collection<String> required, Map<String, ?> variables) {
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            if (lookup(name, variables) == null) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingTemplateVariablesException(missing);
        }
    }

    /** Top-level variable names referenced by a template. */
    public Set<String> referencedVariables(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = EXPRESSION.matcher(template);
        while (matcher.find()) {
            String path = matcher.group(1).split("\\|")[0].trim();
            names.add(path.split("\\.")[0]);
        }
        return names;
    }

    private String evaluate(String expression, Map<String, ?> variables) {
        String[] parts = expression.split("\\|");
        Object value = lookup(parts[0].trim(), variables);
        for (int i = 1; i < parts.length; i++) {
            value = applyFilter(parts[i].trim(), value);
        }
        return stringify(value);
    }

    private Object applyFilter(String filterExpr, Object value) {
        Matcher m = FILTER.matcher(filterExpr);
        if (!m.matches()) {
            log.warn("Ignoring malformed filter '{}'", filterExpr);
            return value;
        }
        String name = m.group(1);
        String arg = m.group(2) != null ? unquote(m.group(2).trim()) : null;
        return switch (name) {
            case "default" -> (value == null || (value instanceof String s && s.isBlank())) ? arg : value;
            case "round" -> round(value, arg);
            case "json" -> toJson(value);
            case "join" -> value instanceof Collection<?> c
                    ? String.join(arg != null ? arg : ", ", c.stream().map(PromptRenderer::stringify).toList())
                    : value;
            default -> {
                log.warn("Unknown template filter '{}'", name);
                yield value;
            }
        };
    }

    private static Object round(Object value, String decimalsArg) {
        Double number = asDouble(value);
        if (number == null) {
            return value;
        }
        int decimals = decimalsArg != null && !decimalsArg.isEmpty() ? Integer.parseInt(decimalsArg) : 0;
        BigDecimal rounded = BigDecimal.valueOf(number).setScale(decimals, RoundingMode.HALF_UP);
        return decimals == 0 ? (Object) rounded.longValue() : rounded.toPlainString();
    }

    private String toJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize template value as JSON: {}", e.getMessage());
            return String.valueOf(value);
        }
    }

    static Object lookup(String path, Map<String, ?> variables) {
        Object current = variables;
        for (String key : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String unquote(String arg) {
        if (arg.length() >= 2 && ((arg.startsWith("'") && arg.endsWith("'"))
                || (arg.startsWith("\"") && arg.endsWith("\"")))) {
            return arg.substring(1, arg.length() - 1);
        }
        return arg;
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
