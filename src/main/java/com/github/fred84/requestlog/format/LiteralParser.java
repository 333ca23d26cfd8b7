package com.github.fred84.requestlog.format;

import com.fasterxml.jackson.databind.node.NullNode;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for literals as they are usually written into log messages: numbers, quoted strings, {@code True},
 * {@code False}, {@code None}, {@code [lists]}, {@code (tuples)} and {@code {'dicts': 1}}.
 *
 * <p>Tuples become lists, dictionary keys become strings and {@code None} becomes {@link NullNode}. Parsing
 * stops at the first unexpected character and yields nothing; it never throws.
 */
final class LiteralParser {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(?:(\\d+)(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final BigInteger MIN_LONG = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);

    private final String text;
    private int pos;
    private boolean failed;

    private LiteralParser(String text) {
        this.text = text;
    }

    static Optional<Object> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        LiteralParser parser = new LiteralParser(text);
        Object value = parser.value();
        parser.skipWhitespace();

        if (parser.failed || parser.pos != text.length()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    private Object value() {
        skipWhitespace();
        if (pos >= text.length()) {
            return fail();
        }

        char c = text.charAt(pos);
        switch (c) {
            case '{':
                return dict();
            case '[':
                pos++;
                return items(new ArrayList<>(), ']');
            case '(':
                return tuple();
            case '\'':
            case '"':
                return string(c);
            default:
                if (c == '+' || c == '-' || c == '.' || Character.isDigit(c)) {
                    return number();
                }
                return keyword();
        }
    }

    private Object dict() {
        pos++;
        Map<String, Object> result = new LinkedHashMap<>();

        skipWhitespace();
        if (consume('}')) {
            return result;
        }

        while (!failed) {
            Object key = value();
            skipWhitespace();
            if (failed || !consume(':')) {
                return fail();
            }
            Object item = value();
            if (failed) {
                return null;
            }
            result.put(String.valueOf(key), item);

            skipWhitespace();
            if (consume(',')) {
                skipWhitespace();
                if (consume('}')) {
                    return result;
                }
            } else if (consume('}')) {
                return result;
            } else {
                return fail();
            }
        }
        return null;
    }

    private Object tuple() {
        pos++;

        skipWhitespace();
        if (consume(')')) {
            return new ArrayList<>();
        }

        Object first = value();
        skipWhitespace();
        if (failed) {
            return null;
        }
        if (consume(')')) {
            // parenthesized value, not a tuple
            return first;
        }
        if (!consume(',')) {
            return fail();
        }

        List<Object> result = new ArrayList<>();
        result.add(first);
        return items(result, ')');
    }

    // the opening bracket has been consumed already
    private Object items(List<Object> result, char close) {
        skipWhitespace();
        if (consume(close)) {
            return result;
        }

        while (!failed) {
            Object item = value();
            if (failed) {
                return null;
            }
            result.add(item);

            skipWhitespace();
            if (consume(',')) {
                skipWhitespace();
                if (consume(close)) {
                    return result;
                }
            } else if (consume(close)) {
                return result;
            } else {
                return fail();
            }
        }
        return null;
    }

    private Object string(char quote) {
        pos++;
        StringBuilder result = new StringBuilder();

        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == quote) {
                return result.toString();
            }
            if (c == '\\' && pos < text.length()) {
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n':
                        result.append('\n');
                        break;
                    case 't':
                        result.append('\t');
                        break;
                    case 'r':
                        result.append('\r');
                        break;
                    case '\\':
                    case '\'':
                    case '"':
                        result.append(escaped);
                        break;
                    default:
                        result.append('\\').append(escaped);
                }
            } else {
                result.append(c);
            }
        }
        return fail();
    }

    private Object number() {
        Matcher matcher = NUMBER.matcher(text).region(pos, text.length());
        if (!matcher.lookingAt()) {
            return fail();
        }

        String literal = matcher.group();
        String integerPart = matcher.group(1);
        pos = matcher.end();

        if (matcher.group(2) != null || matcher.group(3) != null || integerPart == null) {
            return Double.parseDouble(literal);
        }
        if (integerPart.length() > 1 && integerPart.startsWith("0") && !integerPart.matches("0+")) {
            // leading zeros are not a valid integer literal
            return fail();
        }

        BigInteger value = new BigInteger(literal.startsWith("+") ? literal.substring(1) : literal);
        if (value.bitLength() < 32) {
            return value.intValue();
        }
        if (value.compareTo(MIN_LONG) >= 0 && value.compareTo(MAX_LONG) <= 0) {
            return value.longValue();
        }
        return value;
    }

    private Object keyword() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }

        switch (text.substring(start, pos)) {
            case "True":
                return Boolean.TRUE;
            case "False":
                return Boolean.FALSE;
            case "None":
                return NullNode.getInstance();
            default:
                return fail();
        }
    }

    private boolean consume(char expected) {
        if (pos < text.length() && text.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private Object fail() {
        failed = true;
        return null;
    }
}
