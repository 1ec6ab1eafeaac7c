package io.github.eutro.affineir.ir;

import io.github.eutro.affineir.attrs.Attribute;
import io.github.eutro.affineir.attrs.NamedAttribute;
import io.github.eutro.affineir.ops.OpKey;
import io.github.eutro.affineir.types.Type;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Everything needed to {@link Operation#create(OperationState) create} an operation, gathered piece by piece.
 */
public final class OperationState {
    private final Location location;
    private final OpKey key;
    private final List<Value> operands = new ArrayList<>();
    private final List<Type> types = new ArrayList<>();
    private final List<NamedAttribute> attributes = new ArrayList<>();
    private final List<Block> successors = new ArrayList<>();
    private final List<List<Value>> successorOperands = new ArrayList<>();
    private final List<Region> regions = new ArrayList<>();

    public OperationState(Location location, OpKey key) {
        this.location = location;
        this.key = key;
    }

    public Location getLocation() {
        return location;
    }

    public OpKey getKey() {
        return key;
    }

    public List<Value> getOperands() {
        return operands;
    }

    public List<Type> getTypes() {
        return types;
    }

    public List<NamedAttribute> getAttributes() {
        return attributes;
    }

    public List<Block> getSuccessors() {
        return successors;
    }

    public List<List<Value>> getSuccessorOperands() {
        return successorOperands;
    }

    public List<Region> getRegions() {
        return regions;
    }

    public OperationState addOperand(Value operand) {
        operands.add(operand);
        return this;
    }

    public OperationState addOperands(Collection<? extends Value> newOperands) {
        operands.addAll(newOperands);
        return this;
    }

    public OperationState addType(Type type) {
        types.add(type);
        return this;
    }

    public OperationState addTypes(Collection<? extends Type> newTypes) {
        types.addAll(newTypes);
        return this;
    }

    public OperationState addAttribute(String name, Attribute value) {
        attributes.removeIf(attr -> attr.getName().equals(name));
        attributes.add(new NamedAttribute(name, value));
        return this;
    }

    public OperationState addSuccessor(Block successor, List<Value> operands) {
        successors.add(successor);
        successorOperands.add(new ArrayList<>(operands));
        return this;
    }

    /**
     * Add a region for the operation to take the blocks of.
     *
     * @return The region.
     */
    public Region addRegion() {
        Region region = new Region();
        regions.add(region);
        return region;
    }
}
