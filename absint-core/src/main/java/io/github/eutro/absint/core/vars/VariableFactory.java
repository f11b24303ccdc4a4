package io.github.eutro.absint.core.vars;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Interns strings into {@link VarName}s with densely ordered indices.
 * <p>
 * A factory is an ordinary object; pass it to whoever builds CFGs for a program
 * rather than sharing one globally.
 */
public class VariableFactory {
    private final Map<String, VarName> names = new HashMap<>();
    private final List<VarName> byIndex = new ArrayList<>();
    private final long startIndex;

    /**
     * Construct a factory whose first name has index 1.
     */
    public VariableFactory() {
        this(1);
    }

    /**
     * Construct a factory whose first name has the given index.
     *
     * @param startIndex The index of the first interned name.
     */
    public VariableFactory(long startIndex) {
        this.startIndex = startIndex;
    }

    /**
     * Intern a string, returning the existing name if it was seen before.
     *
     * @param name The string.
     * @return The interned name.
     */
    public VarName get(String name) {
        VarName existing = names.get(name);
        if (existing != null) return existing;
        VarName fresh = new VarName(name, startIndex + byIndex.size());
        names.put(name, fresh);
        byIndex.add(fresh);
        return fresh;
    }

    /**
     * Look a name up by its index.
     *
     * @param index The index.
     * @return The name with that index.
     * @throws NoSuchElementException If no name with that index was interned by this factory.
     */
    public VarName lookup(long index) {
        long offset = index - startIndex;
        if (offset < 0 || offset >= byIndex.size()) {
            throw new NoSuchElementException("no variable name with index " + index);
        }
        return byIndex.get((int) offset);
    }

    /**
     * Get the number of names interned so far.
     *
     * @return The number of names.
     */
    public int size() {
        return byIndex.size();
    }
}
