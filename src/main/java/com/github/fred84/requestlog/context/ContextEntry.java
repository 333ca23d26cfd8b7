package com.github.fred84.requestlog.context;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Single value of a {@link LogContext}. A tombstoned entry reads as absent, but unlike a missing key it
 * records that the key was explicitly unbound.
 */
public final class ContextEntry {

    private final String key;
    private final Object value;
    private final boolean tombstoned;

    private ContextEntry(String key, Object value, boolean tombstoned) {
        this.key = requireNonNull(key, "key");
        this.value = value;
        this.tombstoned = tombstoned;
    }

    @NotNull
    static ContextEntry bound(@NotNull String key, @Nullable Object value) {
        return new ContextEntry(key, value, false);
    }

    @NotNull
    static ContextEntry tombstone(@NotNull String key) {
        return new ContextEntry(key, null, true);
    }

    @NotNull
    public String getKey() {
        return key;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    public boolean isTombstoned() {
        return tombstoned;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof ContextEntry)) {
            return false;
        } else {
            ContextEntry that = (ContextEntry) o;
            return this.tombstoned == that.tombstoned
                    && Objects.equals(this.key, that.key)
                    && Objects.equals(this.value, that.value);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, tombstoned);
    }

    @Override
    public String toString() {
        return tombstoned ? key + "=<unbound>" : key + "=" + value;
    }
}
