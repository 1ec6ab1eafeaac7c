/**
 * Exts associate arbitrary typed data with instances of {@link io.github.eutro.affineir.ext.ExtContainer}.
 *
 * <pre>{@code
 * public static final Ext<Integer> LOOP_DEPTH = Ext.create(Integer.class, "LOOP_DEPTH");
 *
 * forOp.getOperation().attachExt(LOOP_DEPTH, 2);
 * forOp.getOperation().getExtOrThrow(LOOP_DEPTH); // => 2
 * }</pre>
 * <p>
 * The IR uses exts for two things. Passes attach scratch data to operations, blocks and values
 * and discard it afterwards. Dialects attach behaviour to their {@link io.github.eutro.affineir.ops.OpKey op kinds}
 * (verifiers, folders, printers, parsers, canonicalization patterns and traits such as
 * {@link io.github.eutro.affineir.ext.CommonExts#IS_TERMINATOR}), which every
 * {@link io.github.eutro.affineir.ir.Operation} of that kind sees through
 * {@link io.github.eutro.affineir.ext.DelegatingExtHolder delegation}.
 * This keeps the graph core closed while letting dialects be added without changing it.
 */
package io.github.eutro.affineir.ext;
