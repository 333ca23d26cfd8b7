package com.github.fred84.requestlog.context;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable set of context entries. Every mutation returns a new instance, so a context captured by one
 * thread or subscription is never changed by another.
 */
public final class LogContext {

    private static final LogContext EMPTY = new LogContext(Collections.emptyMap());

    private final Map<String, ContextEntry> entries;

    private LogContext(Map<String, ContextEntry> entries) {
        this.entries = entries;
    }

    @NotNull
    public static LogContext empty() {
        return EMPTY;
    }

    @NotNull
    public LogContext with(@NotNull Map<String, ?> pairs) {
        requireNonNull(pairs, "pairs");

        if (pairs.isEmpty()) {
            return this;
        }

        Map<String, ContextEntry> copy = copy();
        pairs.forEach((key, value) -> copy.put(key, ContextEntry.bound(key, value)));
        return new LogContext(unmodifiableMap(copy));
    }

    @NotNull
    public LogContext with(@NotNull String key, @Nullable Object value) {
        return with(Collections.singletonMap(requireNonNull(key, "key"), value));
    }

    @NotNull
    public LogContext without(@NotNull String key) {
        requireNonNull(key, "key");

        Map<String, ContextEntry> copy = copy();
        copy.put(key, ContextEntry.tombstone(key));
        return new LogContext(unmodifiableMap(copy));
    }

    /**
     * Tombstones every visible entry.
     */
    @NotNull
    public LogContext cleared() {
        Map<String, ContextEntry> copy = copy();
        copy.replaceAll((key, entry) -> entry.isTombstoned() ? entry : ContextEntry.tombstone(key));
        return new LogContext(unmodifiableMap(copy));
    }

    LogContext restore(String key, @Nullable ContextEntry previous) {
        Map<String, ContextEntry> copy = copy();
        if (previous == null) {
            copy.remove(key);
        } else {
            copy.put(key, previous);
        }
        return new LogContext(unmodifiableMap(copy));
    }

    @Nullable
    ContextEntry entry(String key) {
        return entries.get(key);
    }

    public boolean contains(@NotNull String key) {
        ContextEntry entry = entries.get(key);
        return entry != null && !entry.isTombstoned();
    }

    @Nullable
    public Object get(@NotNull String key) {
        ContextEntry entry = entries.get(key);
        return entry == null || entry.isTombstoned() ? null : entry.getValue();
    }

    /**
     * Visible entries in binding order. Tombstoned keys are left out.
     */
    @NotNull
    public Map<String, Object> snapshot() {
        Map<String, Object> result = new LinkedHashMap<>();
        entries.values().forEach(entry -> {
            if (!entry.isTombstoned()) {
                result.put(entry.getKey(), entry.getValue());
            }
        });
        return result;
    }

    private Map<String, ContextEntry> copy() {
        return new LinkedHashMap<>(entries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof LogContext)) {
            return false;
        } else {
            return entries.equals(((LogContext) o).entries);
        }
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "log context " + entries.values();
    }
}
