package io.github.eutro.absint.core.passes;

/**
 * An {@link IRPass} that modifies (or only inspects) its input, and returns it.
 *
 * @param <T> The type of IR the pass runs on.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass on the IR, modifying it in place.
     *
     * @param t The IR.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
