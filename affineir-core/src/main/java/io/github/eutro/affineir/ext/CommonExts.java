package io.github.eutro.affineir.ext;

import io.github.eutro.affineir.ops.Dialect;
import io.github.eutro.affineir.ops.OpFolder;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.ops.OpParser;
import io.github.eutro.affineir.ops.OpPrinter;
import io.github.eutro.affineir.ops.OpVerifier;
import io.github.eutro.affineir.rewrite.RewritePattern;

import java.util.List;

/**
 * Exts shared by the whole IR, mostly attached to {@link OpKey op kinds}.
 */
public final class CommonExts {
    private CommonExts() {
    }

    /**
     * Trait: the operation must end its block.
     */
    public static final Ext<Boolean> IS_TERMINATOR = Ext.create(Boolean.class, "IS_TERMINATOR");
    /**
     * Trait: the operation has no side effects, so it can be removed when its results are unused.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");
    /**
     * Trait: the operation produces a constant, which folding it yields.
     */
    public static final Ext<Boolean> CONSTANT_LIKE = Ext.create(Boolean.class, "CONSTANT_LIKE");
    /**
     * Trait: values defined directly in the regions of this operation are top-level,
     * usable as affine symbols anywhere inside it.
     */
    public static final Ext<Boolean> AFFINE_SCOPE = Ext.create(Boolean.class, "AFFINE_SCOPE");
    /**
     * The terminator each block of this operation's regions ends with, which the textual form leaves implicit.
     */
    public static final Ext<OpKey> IMPLICIT_TERMINATOR = Ext.create(OpKey.class, "IMPLICIT_TERMINATOR");

    public static final Ext<Dialect> DIALECT = Ext.create(Dialect.class, "DIALECT");
    public static final Ext<OpVerifier> VERIFIER = Ext.create(OpVerifier.class, "VERIFIER");
    public static final Ext<OpFolder> FOLDER = Ext.create(OpFolder.class, "FOLDER");
    public static final Ext<OpPrinter> PRINTER = Ext.create(OpPrinter.class, "PRINTER");
    public static final Ext<OpParser> PARSER = Ext.create(OpParser.class, "PARSER");
    public static final Ext<List<RewritePattern>> CANONICALIZATION_PATTERNS =
            Ext.create(List.class, "CANONICALIZATION_PATTERNS");

    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }
}
