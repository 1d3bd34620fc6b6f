package faxc.io;

import faxc.diag.CodegenException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON reader for serialized syntax trees. Produces {@link Map}
 * (insertion ordered), {@link List}, {@link String}, {@link BigDecimal},
 * {@link Boolean} or {@code null}. Numbers stay {@code BigDecimal} so their
 * spelling survives into the generated code.
 */
public final class JsonParser {
    /** Deepest object/array nesting accepted; deeper input is rejected, not recursed into. */
    public static final int MAX_DEPTH = 512;

    private final String input;
    private int depth = 0;
    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private JsonParser(String input) {
        this.input = input;
    }

    public static Object parse(String json) {
        JsonParser p = new JsonParser(json);
        Object value = p.parseValue();
        p.skipWhitespace();
        if (!p.isAtEnd()) throw p.error("Unexpected trailing content");
        return value;
    }

    private Object parseValue() {
        skipWhitespace();
        if (isAtEnd()) throw error("Unexpected end of input");
        char c = peek();
        return switch (c) {
            case '"' -> parseString();
            case '{' -> nested(true);
            case '[' -> nested(false);
            case 't' -> literal("true", Boolean.TRUE);
            case 'f' -> literal("false", Boolean.FALSE);
            case 'n' -> literal("null", null);
            default -> {
                if (c == '-' || isDigit(c)) yield parseNumber();
                throw error("Unexpected character '" + c + "'");
            }
        };
    }

    private Object nested(boolean object) {
        if (++depth > MAX_DEPTH) throw error("Nesting deeper than " + MAX_DEPTH + " levels");
        try {
            return object ? parseObject() : parseArray();
        } finally {
            depth--;
        }
    }

    private Map<String, Object> parseObject() {
        expect('{');
        Map<String, Object> map = new LinkedHashMap<>();
        skipWhitespace();
        if (match('}')) return map;
        do {
            skipWhitespace();
            if (isAtEnd() || peek() != '"') throw error("Expected object key");
            String key = parseString();
            skipWhitespace();
            expect(':');
            map.put(key, parseValue());
            skipWhitespace();
        } while (match(','));
        expect('}');
        return map;
    }

    private List<Object> parseArray() {
        expect('[');
        List<Object> list = new ArrayList<>();
        skipWhitespace();
        if (match(']')) return list;
        do {
            list.add(parseValue());
            skipWhitespace();
        } while (match(','));
        expect(']');
        return list;
    }

    private String parseString() {
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd()) {
            char c = advance();
            if (c == '"') return sb.toString();
            if (c < 0x20) throw error("Control character in string");
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd()) break;
            char esc = advance();
            switch (esc) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case '/' -> sb.append('/');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> sb.append(parseUnicodeEscape());
                default -> throw error("Invalid escape '\\" + esc + "'");
            }
        }
        throw error("Unterminated string");
    }

    private char parseUnicodeEscape() {
        if (pos + 4 > input.length()) throw error("Invalid unicode escape");
        String hex = input.substring(pos, pos + 4);
        int value = 0;
        for (int i = 0; i < 4; i++) {
            int digit = hexDigit(hex.charAt(i));
            if (digit < 0) throw error("Invalid unicode escape '\\u" + hex + "'");
            value = value * 16 + digit;
        }
        for (int i = 0; i < 4; i++) advance();
        return (char) value;
    }

    private BigDecimal parseNumber() {
        int start = pos;
        match('-');
        // ведущий ноль не может продолжаться цифрами
        if (!match('0')) digits("Invalid number");
        if (match('.')) digits("Expected digit after decimal point");
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            advance();
            if (!match('+')) match('-');
            digits("Expected digit in exponent");
        }
        String text = input.substring(start, pos);
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            // синтаксис верный, но экспонента не помещается в int
            throw error("Number out of range '" + text + "'");
        }
    }

    private void digits(String message) {
        if (isAtEnd() || !isDigit(peek())) throw error(message);
        while (!isAtEnd() && isDigit(peek())) advance();
    }

    private Object literal(String word, Object value) {
        if (!input.startsWith(word, pos)) throw error("Expected '" + word + "'");
        for (int i = 0; i < word.length(); i++) advance();
        return value;
    }

    // ---------- helpers ----------

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c != ' ' && c != '\t' && c != '\r' && c != '\n') break;
            advance();
        }
    }

    private boolean isAtEnd() { return pos >= input.length(); }

    private char peek() { return input.charAt(pos); }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || peek() != expected) return false;
        advance();
        return true;
    }

    private void expect(char expected) {
        if (!match(expected)) throw error("Expected '" + expected + "'");
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private static int hexDigit(char c) {
        if (isDigit(c)) return c - '0';
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        return -1;
    }

    private CodegenException error(String message) {
        return CodegenException.malformed("Invalid JSON: " + message, line + ":" + col);
    }
}
