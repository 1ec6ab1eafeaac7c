package io.github.eutro.affineir.rewrite;

import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.ext.CommonExts;
import io.github.eutro.affineir.ir.Block;
import io.github.eutro.affineir.ir.OpBuilder;
import io.github.eutro.affineir.ir.Operation;
import io.github.eutro.affineir.ir.OperationState;
import io.github.eutro.affineir.ir.Region;
import io.github.eutro.affineir.ir.Value;
import io.github.eutro.affineir.ops.Dialect;
import io.github.eutro.affineir.ops.FoldResult;
import io.github.eutro.affineir.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Folds operations, materializing constant results at the start of the enclosing affine scope
 * and keeping a single constant per dialect, value and type in each scope.
 */
public final class OperationFolder {
    private final Map<Region, Map<ConstantKey, Operation>> foldScopes = new HashMap<>();
    private final Map<Operation, List<ConstantKey>> referencedKeys = new HashMap<>();

    private static final class ConstantKey {
        final Region scope;
        final Dialect dialect;
        final Attribute value;
        final Type type;

        ConstantKey(Region scope, Dialect dialect, Attribute value, Type type) {
            this.scope = scope;
            this.dialect = dialect;
            this.value = value;
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ConstantKey)) return false;
            ConstantKey that = (ConstantKey) o;
            return scope == that.scope
                    && dialect == that.dialect
                    && value.equals(that.value)
                    && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(scope), System.identityHashCode(dialect), value, type);
        }
    }

    /**
     * Find the region constants used by an operation are placed in: the nearest one that belongs to an
     * affine scope, or the outermost one.
     *
     * @param op The operation.
     * @return The region, or null if the operation is not in one.
     */
    private static @Nullable Region getInsertionRegion(Operation op) {
        Region region = op.getContainingRegion();
        while (region != null) {
            Operation parent = region.getParentOp();
            if (parent == null || parent.hasTrait(CommonExts.AFFINE_SCOPE)) return region;
            Region outer = parent.getContainingRegion();
            if (outer == null) return region;
            region = outer;
        }
        return null;
    }

    private static @Nullable Attribute getConstantValue(Operation constant) {
        List<FoldResult> results = new ArrayList<>(1);
        if (!constant.fold(List.of(), results) || results.size() != 1) return null;
        return results.get(0).getAttribute();
    }

    /**
     * Get the constant value of each operand of an operation, as far as known.
     *
     * @param op The operation.
     * @return The constants, null where not known.
     */
    public static List<@Nullable Attribute> getConstantOperands(Operation op) {
        List<@Nullable Attribute> constants = new ArrayList<>(op.getNumOperands());
        for (Value operand : op.getOperands()) {
            Operation def = operand.getDefiningOp();
            constants.add(def != null && def.hasTrait(CommonExts.CONSTANT_LIKE) ? getConstantValue(def) : null);
        }
        return constants;
    }

    /**
     * Try to fold an operation, replacing its uses with the folded results and erasing it.
     * <p>
     * A constant operation is instead deduplicated against the other constants of its scope,
     * and moved to the start of the scope if it is the first of its value.
     *
     * @param op                        The operation.
     * @param processGeneratedConstants Called with each constant created to hold a folded result.
     * @param preReplaceAction          Called with the operation just before it is replaced.
     * @return Whether the operation was folded, including in place.
     */
    public boolean tryToFold(Operation op,
                             @Nullable Consumer<Operation> processGeneratedConstants,
                             @Nullable Consumer<Operation> preReplaceAction) {
        List<Value> replacements = fold(op, processGeneratedConstants);
        if (replacements == null) return false;
        if (replacements.isEmpty()) return true;
        if (preReplaceAction != null) preReplaceAction.accept(op);
        op.replaceAllUsesWith(replacements);
        op.erase();
        return true;
    }

    /**
     * @return The values to replace the results of {@code op} with, empty if it was folded in place,
     * or null if it did not fold.
     */
    private @Nullable List<Value> fold(Operation op, @Nullable Consumer<Operation> processGeneratedConstants) {
        if (op.hasTrait(CommonExts.CONSTANT_LIKE)) {
            Operation existing = uniqueConstant(op);
            return existing == null ? null : new ArrayList<>(existing.getResults());
        }

        List<FoldResult> foldResults = new ArrayList<>();
        if (!op.fold(getConstantOperands(op), foldResults)) return null;
        if (foldResults.isEmpty()) return List.of();

        List<Value> replacements = new ArrayList<>(foldResults.size());
        List<Operation> generated = new ArrayList<>();
        boolean inPlace = true;
        for (int i = 0; i < foldResults.size(); i++) {
            FoldResult result = foldResults.get(i);
            if (result.isValue()) {
                Value value = result.getValue();
                if (value != op.getResult(i)) inPlace = false;
                replacements.add(value);
                continue;
            }
            inPlace = false;
            Operation constant = getOrCreateConstant(op, result.getAttribute(), op.getResult(i).getType(), generated);
            if (constant == null) {
                for (Operation created : generated) {
                    notifyRemoval(created);
                    created.erase();
                }
                return null;
            }
            replacements.add(constant.getResult(0));
        }
        if (processGeneratedConstants != null) generated.forEach(processGeneratedConstants);
        return inPlace ? List.of() : replacements;
    }

    /**
     * Register a constant in its scope.
     *
     * @param op The constant.
     * @return An earlier equal constant to replace it with, or null if it is the first.
     */
    private @Nullable Operation uniqueConstant(Operation op) {
        Region scope = getInsertionRegion(op);
        Dialect dialect = op.getNullable(CommonExts.DIALECT);
        Attribute value = getConstantValue(op);
        if (scope == null || dialect == null || value == null || op.getNumResults() != 1) return null;

        ConstantKey key = new ConstantKey(scope, dialect, value, op.getResult(0).getType());
        Map<ConstantKey, Operation> constants = foldScopes.computeIfAbsent(scope, r -> new HashMap<>());
        Operation existing = constants.get(key);
        if (existing == op) return null;
        if (existing != null) return existing;

        constants.put(key, op);
        referencedKeys.computeIfAbsent(op, o -> new ArrayList<>()).add(key);
        Block entry = scope.front();
        if (op.getBlock() != entry || entry.front() != op) {
            op.moveBefore(entry, 0);
        }
        return null;
    }

    private @Nullable Operation getOrCreateConstant(Operation op, Attribute value, Type type,
                                                    List<Operation> generated) {
        Region scope = getInsertionRegion(op);
        Dialect dialect = op.getNullable(CommonExts.DIALECT);
        if (scope == null || dialect == null) return null;

        Map<ConstantKey, Operation> constants = foldScopes.computeIfAbsent(scope, r -> new HashMap<>());
        ConstantKey key = new ConstantKey(scope, dialect, value, type);
        Operation existing = constants.get(key);
        if (existing != null) return existing;

        OpBuilder builder = OpBuilder.atBlockBegin(scope.front());
        Operation constant = dialect.materializeConstant(builder, value, type, op.getLoc());
        if (constant == null) return null;
        generated.add(constant);
        constants.put(key, constant);
        referencedKeys.computeIfAbsent(constant, o -> new ArrayList<>()).add(key);

        // the constant's own dialect may unique it too
        Dialect constantDialect = constant.getNullable(CommonExts.DIALECT);
        Attribute constantValue = getConstantValue(constant);
        if (constantDialect != null && constantDialect != dialect && constantValue != null) {
            ConstantKey ownKey = new ConstantKey(scope, constantDialect, constantValue, type);
            if (constants.putIfAbsent(ownKey, constant) == null) referencedKeys.get(constant).add(ownKey);
        }
        return constant;
    }

    /**
     * Forget a constant that is about to be erased by something other than this folder.
     *
     * @param op The constant.
     */
    public void notifyRemoval(Operation op) {
        List<ConstantKey> keys = referencedKeys.remove(op);
        if (keys == null) return;
        for (ConstantKey key : keys) {
            Map<ConstantKey, Operation> constants = foldScopes.get(key.scope);
            if (constants != null) constants.remove(key, op);
        }
    }

    /**
     * Create an operation and immediately try to fold it.
     *
     * @param builder Where to create it.
     * @param state   The operation.
     * @return The results, which are the folded values if it folded.
     */
    public List<Value> create(OpBuilder builder, OperationState state) {
        Operation op = builder.create(state);
        List<Value> replacements = fold(op, null);
        if (replacements == null || replacements.isEmpty()) return new ArrayList<>(op.getResults());
        op.erase();
        return replacements;
    }
}
