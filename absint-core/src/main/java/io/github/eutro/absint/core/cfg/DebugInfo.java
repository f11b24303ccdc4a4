package io.github.eutro.absint.core.cfg;

import java.util.Objects;

/**
 * A source location attached to a {@link Statement}.
 */
public final class DebugInfo {
    /**
     * The absence of a source location.
     */
    public static final DebugInfo NONE = new DebugInfo("", -1, -1);

    private final String file;
    private final int line;
    private final int column;

    public DebugInfo(String file, int line, int column) {
        this.file = Objects.requireNonNull(file);
        this.line = line;
        this.column = column;
    }

    public String file() {
        return file;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /**
     * Get whether this carries a usable location: a non-empty file and non-negative line and column.
     *
     * @return Whether there is a location.
     */
    public boolean hasDebug() {
        return !file.isEmpty() && line >= 0 && column >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DebugInfo)) return false;
        DebugInfo that = (DebugInfo) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return hasDebug() ? file + ":" + line + ":" + column : "<no debug info>";
    }
}
