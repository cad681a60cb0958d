package io.surfworks.tensordict;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Path to an entry in a container tree: a non-empty sequence of non-empty key atoms.
 */
public record NestedKey(List<String> atoms) {

    public NestedKey {
        Objects.requireNonNull(atoms, "atoms cannot be null");
        if (atoms.isEmpty()) {
            throw new IllegalArgumentException("a key path needs at least one atom");
        }
        for (String atom : atoms) {
            checkAtom(atom);
        }
        atoms = List.copyOf(atoms);
    }

    public static NestedKey of(String... atoms) {
        return new NestedKey(Arrays.asList(atoms));
    }

    /**
     * Split a joined key on {@code separator}.
     */
    public static NestedKey parse(String joined, String separator) {
        return new NestedKey(Arrays.asList(joined.split(Pattern.quote(separator), -1)));
    }

    /**
     * Coerce a {@code String} or {@code NestedKey} map key.
     */
    public static NestedKey from(Object key) {
        if (key instanceof NestedKey nested) {
            return nested;
        }
        if (key instanceof String atom) {
            return of(atom);
        }
        if (key instanceof String[] atoms) {
            return of(atoms);
        }
        throw new TypeMismatchException(
            "Expected a String or NestedKey key, got " + (key == null ? "null" : key.getClass().getSimpleName()));
    }

    static void checkAtom(String atom) {
        if (atom == null || atom.isEmpty()) {
            throw new IllegalArgumentException("key atoms must be non-empty strings, got " + (atom == null ? "null" : "\"\""));
        }
    }

    public int size() {
        return atoms.size();
    }

    public boolean isNested() {
        return atoms.size() > 1;
    }

    public String first() {
        return atoms.get(0);
    }

    public String last() {
        return atoms.get(atoms.size() - 1);
    }

    /**
     * Path without its first atom; requires {@link #isNested()}.
     */
    public NestedKey rest() {
        return new NestedKey(atoms.subList(1, atoms.size()));
    }

    /**
     * Path without its last atom; requires {@link #isNested()}.
     */
    public NestedKey parent() {
        return new NestedKey(atoms.subList(0, atoms.size() - 1));
    }

    public NestedKey append(String atom) {
        List<String> extended = new ArrayList<>(atoms);
        extended.add(atom);
        return new NestedKey(extended);
    }

    public NestedKey prepend(String atom) {
        List<String> extended = new ArrayList<>(atoms.size() + 1);
        extended.add(atom);
        extended.addAll(atoms);
        return new NestedKey(extended);
    }

    public String join(String separator) {
        return String.join(separator, atoms);
    }

    @Override
    public String toString() {
        return atoms.size() == 1 ? atoms.get(0) : "(" + String.join(", ", atoms) + ")";
    }
}
