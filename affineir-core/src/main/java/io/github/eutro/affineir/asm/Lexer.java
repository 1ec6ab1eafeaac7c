package io.github.eutro.affineir.asm;

import io.github.eutro.affineir.ir.Location;
import org.jetbrains.annotations.Nullable;

/**
 * Splits IR text into {@link Token}s on demand, so the parser can rewind and lex context sensitive pieces
 * such as memref shapes.
 */
final class Lexer {
    private final String source;
    private final String fileName;
    private int pos = 0;
    private int line = 1;
    private int lineStart = 0;

    Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    Location locationOf(Token token) {
        return Location.fileLineCol(fileName, token.line, token.column);
    }

    /**
     * Rewind (or advance) to the start of a token previously returned.
     *
     * @param token The token.
     */
    void resetTo(Token token) {
        pos = token.start;
        line = token.line;
        lineStart = token.start - (token.column - 1);
    }

    private void skipTrivia() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                pos++;
                line++;
                lineStart = pos;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '/' && pos + 1 < source.length() && source.charAt(pos + 1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') pos++;
            } else {
                break;
            }
        }
    }

    private Token make(Token.Kind kind, int start) {
        return new Token(kind, source.substring(start, pos), start, line, start - lineStart + 1);
    }

    Token lex() throws ParseException {
        skipTrivia();
        int start = pos;
        if (pos >= source.length()) return make(Token.Kind.EOF, start);
        char c = source.charAt(pos++);
        switch (c) {
            case '(':
                return make(Token.Kind.L_PAREN, start);
            case ')':
                return make(Token.Kind.R_PAREN, start);
            case '[':
                return make(Token.Kind.L_SQUARE, start);
            case ']':
                return make(Token.Kind.R_SQUARE, start);
            case '{':
                return make(Token.Kind.L_BRACE, start);
            case '}':
                return make(Token.Kind.R_BRACE, start);
            case ',':
                return make(Token.Kind.COMMA, start);
            case ':':
                return make(Token.Kind.COLON, start);
            case '+':
                return make(Token.Kind.PLUS, start);
            case '*':
                return make(Token.Kind.STAR, start);
            case '?':
                return make(Token.Kind.QUESTION, start);
            case '<':
                if (peek('=')) return make(Token.Kind.LESS_EQUAL, start);
                return make(Token.Kind.LESS, start);
            case '>':
                if (peek('=')) return make(Token.Kind.GREATER_EQUAL, start);
                return make(Token.Kind.GREATER, start);
            case '=':
                if (peek('=')) return make(Token.Kind.EQUAL_EQUAL, start);
                return make(Token.Kind.EQUAL, start);
            case '-':
                if (peek('>')) return make(Token.Kind.ARROW, start);
                return make(Token.Kind.MINUS, start);
            case '"':
                return lexString(start);
            case '%':
                return lexPrefixed(Token.Kind.PERCENT_IDENT, start);
            case '^':
                return lexPrefixed(Token.Kind.CARET_IDENT, start);
            case '@':
                return lexPrefixed(Token.Kind.AT_IDENT, start);
            default:
                break;
        }
        if (Character.isDigit(c)) return lexNumber(start);
        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length() && isIdentChar(source.charAt(pos))) pos++;
            return make(Token.Kind.BARE_IDENT, start);
        }
        throw error(start, "unexpected character '" + c + "'");
    }

    private boolean peek(char expected) {
        if (pos < source.length() && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private static boolean isIdentChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';
    }

    private Token lexPrefixed(Token.Kind kind, int start) throws ParseException {
        int nameStart = pos;
        while (pos < source.length() && (isIdentChar(source.charAt(pos)) || source.charAt(pos) == '-')) pos++;
        if (pos == nameStart) throw error(start, "invalid identifier after '" + source.charAt(start) + "'");
        return make(kind, start);
    }

    private Token lexNumber(int start) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
        boolean isFloat = false;
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            isFloat = true;
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
        }
        if (isFloat && pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) pos++;
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
            } else {
                pos = save;
            }
        }
        return make(isFloat ? Token.Kind.FLOAT : Token.Kind.INTEGER, start);
    }

    private Token lexString(int start) throws ParseException {
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '"') return make(Token.Kind.STRING, start);
            if (c == '\\') pos++;
            if (c == '\n') break;
        }
        throw error(start, "unterminated string literal");
    }

    /**
     * Lex one extent of a memref shape, {@code 4x} or {@code ?x}, including the {@code x}.
     *
     * @return The extent text without the {@code x}, or null (consuming nothing) if there is none.
     */
    @Nullable String lexShapeDimension() {
        skipTrivia();
        int start = pos;
        int end = pos;
        if (end < source.length() && source.charAt(end) == '?') {
            end++;
        } else {
            while (end < source.length() && Character.isDigit(source.charAt(end))) end++;
        }
        if (end == start || end >= source.length() || source.charAt(end) != 'x') return null;
        pos = end + 1;
        return source.substring(start, end);
    }

    static String unescape(String quoted) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < quoted.length() - 1; i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length() - 1) {
                char next = quoted.charAt(++i);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    default:
                        sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private ParseException error(int at, String message) {
        return new ParseException(Location.fileLineCol(fileName, line, at - lineStart + 1), message);
    }
}
