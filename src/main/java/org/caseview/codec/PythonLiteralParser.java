package org.caseview.codec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for the small subset of Python literal syntax found in {@code .npy}
 * headers: dicts, lists, tuples, quoted strings, integers, floats,
 * {@code True}, {@code False} and {@code None}.
 * <p>
 * Dicts become {@link LinkedHashMap}s, lists and tuples both become
 * {@link List}s, integers become {@link Long}s and floats {@link Double}s.
 */
public final class PythonLiteralParser {

    private final String text;
    private int pos;

    private PythonLiteralParser(String text) {
        this.text = text;
    }

    /**
     * Parses a complete literal.
     *
     * @param text the literal source.
     * @return the parsed value.
     * @throws IllegalArgumentException if the text is not a well-formed literal.
     */
    public static Object parse(String text) {
        PythonLiteralParser parser = new PythonLiteralParser(text);
        Object value = parser.readValue();
        parser.skipWhitespace();
        if (parser.pos != text.length()) {
            throw parser.error("Trailing characters after literal");
        }
        return value;
    }

    private Object readValue() {
        skipWhitespace();
        if (pos >= text.length()) {
            throw error("Unexpected end of literal");
        }
        char c = text.charAt(pos);
        switch (c) {
            case '{':
                return readDict();
            case '[':
                return readSequence('[', ']');
            case '(':
                return readSequence('(', ')');
            case '\'':
            case '"':
                return readString(c);
            default:
                if (c == '-' || c == '+' || c == '.' || Character.isDigit(c)) {
                    return readNumber();
                }
                if (Character.isLetter(c)) {
                    return readKeyword();
                }
                throw error("Unexpected character '" + c + "'");
        }
    }

    private Map<String, Object> readDict() {
        expect('{');
        Map<String, Object> result = new LinkedHashMap<>();
        while (true) {
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return result;
            }
            Object key = readValue();
            skipWhitespace();
            expect(':');
            Object value = readValue();
            result.put(String.valueOf(key), value);
            skipWhitespace();
            if (peek() == ',') {
                pos++;
            } else if (peek() != '}') {
                throw error("Expected ',' or '}' in dict");
            }
        }
    }

    private List<Object> readSequence(char open, char close) {
        expect(open);
        List<Object> result = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (peek() == close) {
                pos++;
                return result;
            }
            result.add(readValue());
            skipWhitespace();
            if (peek() == ',') {
                pos++;
            } else if (peek() != close) {
                throw error("Expected ',' or '" + close + "' in sequence");
            }
        }
    }

    private String readString(char quote) {
        expect(quote);
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == quote) {
                return sb.toString();
            }
            if (c == '\\' && pos < text.length()) {
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '0' -> sb.append('\0');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        throw error("Unterminated string");
    }

    private Object readNumber() {
        int start = pos;
        boolean floating = false;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isDigit(c) || c == '-' || c == '+') {
                pos++;
            } else if (c == '.' || c == 'e' || c == 'E') {
                floating = true;
                pos++;
            } else {
                break;
            }
        }
        // Python 2 headers may carry long suffixes such as (3L,)
        if (pos < text.length() && (text.charAt(pos) == 'L' || text.charAt(pos) == 'l')) {
            pos++;
            return Long.parseLong(text.substring(start, pos - 1));
        }
        String literal = text.substring(start, pos);
        try {
            return floating ? (Object) Double.parseDouble(literal) : (Object) Long.parseLong(literal);
        } catch (NumberFormatException e) {
            throw error("Malformed number '" + literal + "'");
        }
    }

    private Object readKeyword() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        String word = text.substring(start, pos);
        return switch (word) {
            case "True" -> Boolean.TRUE;
            case "False" -> Boolean.FALSE;
            case "None" -> null;
            default -> throw error("Unsupported identifier '" + word + "'");
        };
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private char peek() {
        if (pos >= text.length()) {
            throw error("Unexpected end of literal");
        }
        return text.charAt(pos);
    }

    private void expect(char c) {
        if (peek() != c) {
            throw error("Expected '" + c + "'");
        }
        pos++;
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at offset " + pos + " in: " + text);
    }
}
