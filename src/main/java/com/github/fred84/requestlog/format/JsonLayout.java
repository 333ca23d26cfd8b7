package com.github.fred84.requestlog.format;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a record as an indented JSON object.
 *
 * <p>{@code key=value} pairs found in the message are lifted into top level attributes, values are typed where
 * possible ({@code count=3} becomes a number, {@code ok=True} a boolean). What remains of the message is
 * written last, followed by the exception if any.
 */
public class JsonLayout extends StructuredLayout {

    private static final Pattern KEY_VALUE = Pattern.compile(
            "(?<key>\\w+)=(?<value>\\{.*?\\}|\\[.*?\\]|\\(.*?\\)|\\S+)"
    );

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public JsonLayout() {
    }

    public JsonLayout(String template) {
        super(template);
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        ObjectNode node = mapper.createObjectNode();

        for (String field : getFields()) {
            if (MESSAGE.equals(field)) {
                continue;
            }
            Object value = resolve(event, field);
            if (value != null) {
                node.set(field, mapper.valueToTree(stringify(value)));
            }
        }

        String message = message(event);
        Map<String, Object> pairs = keyValuePairs(message);
        if (!pairs.isEmpty()) {
            pairs.forEach((key, value) -> node.set(key, mapper.valueToTree(value)));
            message = KEY_VALUE.matcher(message).replaceAll("");
        }

        node.remove(MESSAGE);
        node.put(MESSAGE, message.trim().replace('\n', ' ').replace('\t', ' ').trim());

        String exception = exceptionText(event);
        if (exception != null) {
            node.remove(EXCEPTION);
            node.put(EXCEPTION, exception);
        }

        try {
            return mapper.writeValueAsString(node) + CoreConstants.LINE_SEPARATOR;
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Map<String, Object> keyValuePairs(String message) {
        Map<String, Object> pairs = new LinkedHashMap<>();
        Matcher matcher = KEY_VALUE.matcher(message);
        while (matcher.find()) {
            pairs.put(matcher.group("key"), typed(matcher.group("value")));
        }
        return pairs;
    }

    static Object typed(String value) {
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        return LiteralParser.parse(value).orElse(value);
    }

    @Override
    public String getContentType() {
        return "application/json";
    }
}
