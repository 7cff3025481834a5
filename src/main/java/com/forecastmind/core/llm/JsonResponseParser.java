package com.forecastmind.core.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a JSON object from free-form model output.
 * <p>
 * Strategies are tried in order: the whole text, the first fenced code block, then the
 * first balanced {@code {...}} object. Only when all three fail is the text rejected.
 */
public class JsonResponseParser {

    private static final Logger log = LoggerFactory.getLogger(JsonResponseParser.class);

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|JSON)?\\s*\\n?([\\s\\S]*?)```");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public enum Strategy {
        DIRECT,
        FENCED_BLOCK,
        BALANCED_OBJECT
    }

    public record Parsed(Map<String, Object> value, Strategy strategy) {}

    private final ObjectMapper mapper;

    public JsonResponseParser() {
        this(new ObjectMapper());
    }

    public JsonResponseParser(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    /**
     * @throws UnparsableResponseException if every strategy fails
     */
    public Parsed parse(String text) {
        if (text == null || text.isBlank()) {
            throw new UnparsableResponseException("Response is empty");
        }
        String trimmed = text.trim();

        Map<String, Object> direct = tryRead(trimmed);
        if (direct != null) {
            return new Parsed(direct, Strategy.DIRECT);
        }

        Matcher fenced = FENCED_BLOCK.matcher(trimmed);
        while (fenced.find()) {
            Map<String, Object> value = tryRead(fenced.group(1).trim());
            if (value != null) {
                log.debug("Recovered JSON from fenced code block");
                return new Parsed(value, Strategy.FENCED_BLOCK);
            }
        }

        Map<String, Object> balanced = firstBalancedObject(trimmed);
        if (balanced != null) {
            log.debug("Recovered JSON from first balanced object");
            return new Parsed(balanced, Strategy.BALANCED_OBJECT);
        }

        String preview = trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed;
        throw new UnparsableResponseException("No JSON object could be recovered from response: " + preview);
    }

    private Map<String, Object> firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = matchingBrace(text, start);
            if (end < 0) {
                return null;
            }
            Map<String, Object> value = tryRead(text.substring(start, end + 1));
            if (value != null) {
                return value;
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    /** Index of the brace closing the one at {@code open}, honoring strings and escapes; -1 if unbalanced. */
    static int matchingBrace(String text, int open) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Map<String, Object> tryRead(String candidate) {
        if (candidate.isEmpty() || candidate.charAt(0) != '{') {
            return null;
        }
        try {
            return mapper.readValue(candidate, MAP_TYPE);
        } catch (Exception e) {
            log.trace("Candidate rejected: {}", e.getMessage());
            return null;
        }
    }
}
