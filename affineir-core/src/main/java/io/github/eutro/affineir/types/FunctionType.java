package io.github.eutro.affineir.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The type of a function, {@code (inputs) -> results}.
 */
public final class FunctionType extends Type {
    private final List<Type> inputs;
    private final List<Type> results;

    private FunctionType(List<Type> inputs, List<Type> results) {
        this.inputs = inputs;
        this.results = results;
    }

    public static FunctionType get(List<Type> inputs, List<Type> results) {
        return new FunctionType(List.copyOf(inputs), List.copyOf(results));
    }

    public List<Type> getInputs() {
        return inputs;
    }

    public List<Type> getResults() {
        return results;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return inputs.equals(that.inputs) && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return inputs.hashCode() * 31 + results.hashCode();
    }

    /**
     * Print a result type list, parenthesized unless it is a single non-function type.
     *
     * @param results The types.
     * @return The text.
     */
    public static String resultsToString(List<Type> results) {
        if (results.size() == 1 && !(results.get(0) instanceof FunctionType)) {
            return results.get(0).toString();
        }
        return results.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return inputs.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"))
                + " -> " + resultsToString(results);
    }
}
