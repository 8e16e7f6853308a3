package com.testament.core.scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One frame of the package scope chain.
 * <p>
 * Each package owns a frame whose parent is the frame of its enclosing package. Reads walk
 * from this frame to the root and return the first binding found, so a child package sees
 * everything its ancestors set up. Writes always land in this frame; an ancestor binding
 * with the same name is shadowed, never modified.
 * <p>
 * Frames are written by their package's setup fixture and only read afterwards. Nothing
 * enforces that; test code must treat the chain as append-only.
 */
public final class Scope {

    private final String name;
    private final Scope parent;
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    private Scope(String name, Scope parent) {
        this.name = name;
        this.parent = parent;
    }

    public static Scope root() {
        return new Scope("", null);
    }

    /** Creates a frame for a nested package whose lookups fall back to this frame. */
    public Scope child(String name) {
        return new Scope(name, this);
    }

    public String name() {
        return name;
    }

    public Optional<Scope> parent() {
        return Optional.ofNullable(parent);
    }

    public void set(String key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Scope values must not be null: " + key);
        }
        values.put(key, value);
    }

    /**
     * Returns the value bound to {@code key} in the nearest frame that has it.
     *
     * @throws IllegalArgumentException if no frame up to the root binds the key
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        for (Scope frame = this; frame != null; frame = frame.parent) {
            Object value = frame.values.get(key);
            if (value != null) {
                return (T) value;
            }
        }
        throw new IllegalArgumentException("No attribute named " + key + " in scope " + describe());
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> find(String key) {
        for (Scope frame = this; frame != null; frame = frame.parent) {
            Object value = frame.values.get(key);
            if (value != null) {
                return Optional.of((T) value);
            }
        }
        return Optional.empty();
    }

    public boolean has(String key) {
        return find(key).isPresent();
    }

    /** Keys bound anywhere in the chain, nearest frame first. */
    public Set<String> keys() {
        var keys = new LinkedHashSet<String>();
        for (Scope frame = this; frame != null; frame = frame.parent) {
            keys.addAll(frame.values.keySet());
        }
        return Collections.unmodifiableSet(keys);
    }

    /** Bindings owned by this frame only. */
    public Map<String, Object> localValues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    private String describe() {
        List<String> names = new ArrayList<>();
        for (Scope frame = this; frame != null; frame = frame.parent) {
            names.add(frame.name.isEmpty() ? "<root>" : frame.name);
        }
        return String.join(" -> ", names);
    }

    @Override
    public String toString() {
        return "Scope[" + describe() + "]";
    }
}
