package io.github.eutro.affineir.asm;

final class Token {
    enum Kind {
        EOF,
        BARE_IDENT,
        PERCENT_IDENT,
        CARET_IDENT,
        AT_IDENT,
        INTEGER,
        FLOAT,
        STRING,
        L_PAREN("("),
        R_PAREN(")"),
        L_SQUARE("["),
        R_SQUARE("]"),
        L_BRACE("{"),
        R_BRACE("}"),
        LESS("<"),
        GREATER(">"),
        GREATER_EQUAL(">="),
        LESS_EQUAL("<="),
        EQUAL_EQUAL("=="),
        EQUAL("="),
        COMMA(","),
        COLON(":"),
        ARROW("->"),
        MINUS("-"),
        PLUS("+"),
        STAR("*"),
        QUESTION("?"),
        ;

        final String spelling;

        Kind() {
            this(null);
        }

        Kind(String spelling) {
            this.spelling = spelling;
        }

        @Override
        public String toString() {
            return spelling == null ? name().toLowerCase(java.util.Locale.ROOT).replace('_', ' ') : "'" + spelling + "'";
        }
    }

    final Kind kind;
    final String text;
    final int start;
    final int line;
    final int column;

    Token(Kind kind, String text, int start, int line, int column) {
        this.kind = kind;
        this.text = text;
        this.start = start;
        this.line = line;
        this.column = column;
    }

    boolean is(Kind kind) {
        return this.kind == kind;
    }

    boolean isKeyword(String keyword) {
        return kind == Kind.BARE_IDENT && text.equals(keyword);
    }

    @Override
    public String toString() {
        return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }
}
