package org.newo.nsl.metadata;

import java.util.List;
import java.util.Objects;

/**
 * The parameters a template declares in its skill metadata.
 * <p>
 * A template without metadata has <em>absent</em> parameters, which turns off the
 * undefined-variable analysis. A template whose metadata lists no parameters has
 * <em>present</em> but empty parameters, so every non-built-in variable is reported.
 */
public final class DeclaredParameters {

    private static final DeclaredParameters ABSENT = new DeclaredParameters(null);

    private final List<String> names;

    private DeclaredParameters(List<String> names) {
        this.names = names;
    }

    /**
     * @return The value for a template without metadata.
     */
    public static DeclaredParameters absent() {
        return ABSENT;
    }

    /**
     * @param names The declared names, in declaration order.
     * @return Present parameters with the given names.
     */
    public static DeclaredParameters of(List<String> names) {
        return new DeclaredParameters(List.copyOf(names));
    }

    public boolean isPresent() {
        return names != null;
    }

    /**
     * @return The declared names.
     * @throws IllegalStateException if the parameters are absent.
     */
    public List<String> names() {
        if (names == null) {
            throw new IllegalStateException("No parameters declared: metadata is absent");
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeclaredParameters)) return false;
        return Objects.equals(names, ((DeclaredParameters) o).names);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(names);
    }

    @Override
    public String toString() {
        return isPresent() ? "DeclaredParameters" + names : "DeclaredParameters[absent]";
    }
}
