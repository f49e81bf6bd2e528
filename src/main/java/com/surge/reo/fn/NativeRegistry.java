package com.surge.reo.fn;

import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table from native function name to its implementation.
 *
 * Each entry declares whether the receiver (the parent of the atom carrying
 * the {@code λ} edge) is passed as the first argument, and how many
 * positional {@code αN} arguments follow it. The table is fixed once built;
 * use {@link #builder()} to extend the standard set.
 */
public final class NativeRegistry {

    /** Calling convention and implementation of one native. */
    public record NativeMetadata(String name, boolean receiver, int arity, NativeFunction fn) {
        /** Total number of arguments the function receives. */
        public int width() {
            return arity + (receiver ? 1 : 0);
        }
    }

    private final Map<String, NativeMetadata> natives;

    private NativeRegistry(Map<String, NativeMetadata> natives) {
        this.natives = Collections.unmodifiableMap(new LinkedHashMap<>(natives));
    }

    /** The standard natives, with {@code stdout} writing to {@link System#out}. */
    public static NativeRegistry standard() {
        return standard(System.out);
    }

    public static NativeRegistry standard(PrintStream out) {
        return builder().withStandard(out).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<NativeMetadata> lookup(String name) {
        return Optional.ofNullable(natives.get(name));
    }

    public boolean contains(String name) {
        return natives.containsKey(name);
    }

    /** Registered names, in registration order. */
    public Set<String> names() {
        return natives.keySet();
    }

    public static final class Builder {
        private final Map<String, NativeMetadata> natives = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a native. A later registration of the same name replaces
         * the earlier one.
         */
        public Builder register(String name, boolean receiver, int arity, NativeFunction fn) {
            if (arity < 0)
                throw new IllegalArgumentException("Negative arity for native '" + name + "'");
            natives.put(name, new NativeMetadata(name, receiver, arity, fn));
            return this;
        }

        public Builder withStandard(PrintStream out) {
            StandardNatives.registerAll(this, out);
            return this;
        }

        public NativeRegistry build() {
            return new NativeRegistry(natives);
        }
    }
}
