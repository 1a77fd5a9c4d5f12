package org.ember.compiler.frontend.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered metadata attached to an AST node: source position and compiler-internal annotations.
 * <p>
 * Well-known keys have typed accessors; {@link #with(String, Object)} returns a copy with one entry
 * added or replaced, keeping the original insertion order.
 */
public final class Meta {

    public static final String LINE = "line";
    public static final String GENERATED = "generated";
    public static final String COUNTER = "counter";
    public static final String IMPORT_FA = "import_fa";
    public static final String IMPORT = "import";
    public static final String CONTEXT = "context";

    /** Metadata without any entry. */
    public static final Meta EMPTY = new Meta(Collections.emptyMap());

    private final Map<String, Object> entries;

    private Meta(Map<String, Object> entries) {
        this.entries = entries;
    }

    /**
     * @param line The source line.
     * @return Metadata holding only a line number.
     */
    public static Meta line(int line) {
        return EMPTY.with(LINE, line);
    }

    /**
     * @param counter The uniqueness counter of a compiler-generated variable.
     * @return Metadata holding only a counter.
     */
    public static Meta counter(long counter) {
        return EMPTY.with(COUNTER, counter);
    }

    public Meta with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(entries);
        copy.put(key, Objects.requireNonNull(value, key));
        return new Meta(Collections.unmodifiableMap(copy));
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public int line() {
        Object line = entries.get(LINE);
        return line instanceof Integer i ? i : 0;
    }

    public boolean isGenerated() {
        return Boolean.TRUE.equals(entries.get(GENERATED));
    }

    public Optional<Long> counter() {
        Object counter = entries.get(COUNTER);
        return counter instanceof Long l ? Optional.of(l) : Optional.empty();
    }

    public Optional<ImportHint> importFa() {
        Object hint = entries.get(IMPORT_FA);
        return hint instanceof ImportHint h ? Optional.of(h) : Optional.empty();
    }

    public Optional<String> importModule() {
        Object module = entries.get(IMPORT);
        return module instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public Map<String, Object> entries() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((Meta) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    /**
     * Records which module a locally written name was imported from by an earlier expansion step.
     *
     * @param receiver The module the name resolves to.
     * @param context  The context the import was performed in.
     */
    public record ImportHint(String receiver, String context) {}
}
