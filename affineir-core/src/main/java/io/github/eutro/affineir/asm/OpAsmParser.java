package io.github.eutro.affineir.asm;

import io.github.eutro.affineir.affine.expr.AffineMap;
import io.github.eutro.affineir.affine.expr.IntegerSet;
import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.ir.Location;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Region;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The view of {@link AsmParser} given to custom operation parsers.
 * <p>
 * Operands are read as {@link UnresolvedOperand names} first, and resolved to values once their types are known,
 * which is usually only after the trailing type list.
 */
public interface OpAsmParser {
    /**
     * A {@code %name} read from the text, not yet looked up.
     */
    final class UnresolvedOperand {
        private final String name;
        private final Location location;

        public UnresolvedOperand(String name, Location location) {
            this.name = name;
            this.location = location;
        }

        public String getName() {
            return name;
        }

        public Location getLocation() {
            return location;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    Location getCurrentLocation();

    /**
     * Create an error at the current token, for the caller to throw.
     *
     * @param message The message.
     * @return The exception.
     */
    ParseException error(String message);

    boolean parseOptionalKeyword(String keyword) throws ParseException;

    void parseKeyword(String keyword) throws ParseException;

    /**
     * Consume a punctuation token if it is next.
     *
     * @param punct The punctuation, such as {@code "("} or {@code "->"}.
     * @return Whether it was there.
     */
    boolean parseOptionalPunct(String punct) throws ParseException;

    void parsePunct(String punct) throws ParseException;

    /**
     * @return A possibly negative integer, or null if none is next.
     */
    @Nullable Long parseOptionalInteger() throws ParseException;

    long parseInteger() throws ParseException;

    @Nullable UnresolvedOperand parseOptionalOperand() throws ParseException;

    UnresolvedOperand parseOperand() throws ParseException;

    /**
     * Read a possibly empty comma separated list of operands.
     *
     * @return The operands.
     */
    List<UnresolvedOperand> parseOperandList() throws ParseException;

    /**
     * Read {@code (%d0, ...)[%s0, ...]}, the brackets being optional.
     *
     * @param operands The list to add the operands to, dimensions first.
     * @return The number of dimension operands.
     */
    int parseDimAndSymbolList(List<UnresolvedOperand> operands) throws ParseException;

    /**
     * Read a bracketed list of affine expressions over operand names, such as {@code [%i + 1, symbol(%n)]}.
     * Each distinct name becomes a dimension, or a symbol if wrapped in {@code symbol(...)}, in order of appearance.
     *
     * @param operands The list to add the operands to, dimensions first.
     * @return The map.
     */
    AffineMap parseAffineMapOfSSAIds(List<UnresolvedOperand> operands) throws ParseException;

    AffineMap parseAffineMap() throws ParseException;

    IntegerSet parseIntegerSet() throws ParseException;

    Type parseType() throws ParseException;

    Type parseColonType() throws ParseException;

    List<Type> parseColonTypeList() throws ParseException;

    /**
     * Read a function result type list: a single type, or a parenthesized, possibly empty, list.
     *
     * @return The types.
     */
    List<Type> parseResultTypeList() throws ParseException;

    Attribute parseAttribute() throws ParseException;

    /**
     * Read an {@code @name}.
     *
     * @return The name without the {@code @}.
     */
    String parseSymbolName() throws ParseException;

    void parseOptionalAttrDict(OperationState state) throws ParseException;

    /**
     * Read a region in braces.
     *
     * @param region    The region to add the blocks to.
     * @param arguments Names for the entry block arguments, if the custom form declares them outside the braces.
     * @param argTypes  The types of those arguments.
     */
    void parseRegion(Region region, List<UnresolvedOperand> arguments, List<Type> argTypes) throws ParseException;

    /**
     * Read a region in braces, if the next token is an opening brace.
     *
     * @return Whether there was a region.
     * @see #parseRegion(Region, List, List)
     */
    boolean parseOptionalRegion(Region region, List<UnresolvedOperand> arguments, List<Type> argTypes)
            throws ParseException;

    Value resolveOperand(UnresolvedOperand operand, Type type) throws ParseException;

    List<Value> resolveOperands(List<UnresolvedOperand> operands, Type type) throws ParseException;

    List<Value> resolveOperands(List<UnresolvedOperand> operands, List<Type> types, Location location)
            throws ParseException;
}
