package com.codeguard.engine.protect;

import com.codeguard.engine.protect.Violation.Category;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Structural identifiers of one snippet: defined functions and classes, call
 * targets (dotted, e.g. {@code os.path.join}) and the calls made directly in
 * the {@code if __name__ == "__main__":} guard.
 *
 * Immutable. A session keeps the first snapshot as its baseline and compares
 * later snapshots against it; snapshots are never merged.
 */
public record ProtectedIdentifiers(
        SortedSet<String> functions,
        SortedSet<String> classes,
        SortedSet<String> calls,
        SortedSet<String> entryPoints) {

    public ProtectedIdentifiers {
        functions   = frozen(functions);
        classes     = frozen(classes);
        calls       = frozen(calls);
        entryPoints = frozen(entryPoints);
    }

    public static ProtectedIdentifiers empty() {
        return new ProtectedIdentifiers(new TreeSet<>(), new TreeSet<>(), new TreeSet<>(), new TreeSet<>());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return functions.isEmpty() && classes.isEmpty() && calls.isEmpty() && entryPoints.isEmpty();
    }

    /**
     * Whether renaming or removing {@code name} would touch a protected identifier.
     *
     * True when the first segment of {@code name} is a protected function,
     * class or entry point, or when {@code name} is a recorded call target or
     * the first segment of one.
     */
    public boolean forbids(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String base = baseOf(name);
        if (functions.contains(base) || classes.contains(base) || entryPoints.contains(base)) {
            return true;
        }
        for (String call : calls) {
            if (call.equals(name) || baseOf(call).equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Every member of {@code baseline} that is absent from {@code current},
     * category by category, sorted by category then name.
     */
    public static List<Violation> diff(ProtectedIdentifiers baseline, ProtectedIdentifiers current) {
        List<Violation> out = new ArrayList<>();
        missing(baseline.functions(),   current.functions(),   Category.FUNCTION,    out);
        missing(baseline.classes(),     current.classes(),     Category.CLASS,       out);
        missing(baseline.calls(),       current.calls(),       Category.CALL,        out);
        missing(baseline.entryPoints(), current.entryPoints(), Category.ENTRY_POINT, out);
        Collections.sort(out);
        return out;
    }

    private static void missing(Collection<String> before, Collection<String> after,
                                Category category, List<Violation> out) {
        for (String name : before) {
            if (!after.contains(name)) {
                out.add(new Violation(category, name));
            }
        }
    }

    private static String baseOf(String dotted) {
        int dot = dotted.indexOf('.');
        return dot < 0 ? dotted : dotted.substring(0, dot);
    }

    private static SortedSet<String> frozen(Collection<String> names) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(names == null ? List.of() : names));
    }
}
