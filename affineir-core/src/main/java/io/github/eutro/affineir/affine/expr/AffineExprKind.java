package io.github.eutro.affineir.affine.expr;

public enum AffineExprKind {
    ADD("+"),
    MUL("*"),
    MOD("mod"),
    FLOOR_DIV("floordiv"),
    CEIL_DIV("ceildiv"),
    CONSTANT(null),
    DIM(null),
    SYMBOL(null),
    ;

    private final String spelling;

    AffineExprKind(String spelling) {
        this.spelling = spelling;
    }

    public boolean isBinary() {
        return spelling != null;
    }

    /**
     * @return The operator as written in the textual form, for binary kinds.
     */
    public String getSpelling() {
        if (spelling == null) throw new IllegalStateException(this + " is not a binary kind");
        return spelling;
    }
}
