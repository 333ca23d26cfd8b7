package com.github.fred84.requestlog.context;

import org.jetbrains.annotations.Nullable;

/**
 * Handle returned by {@link ContextStore#batchBind(java.util.Map)} for one key. Resetting it restores the
 * entry that was visible before the bind, including "never set". A token can be used only once.
 */
public final class RestoreToken {

    private final String key;
    private final ContextEntry previous;
    private boolean used;

    RestoreToken(String key, @Nullable ContextEntry previous) {
        this.key = key;
        this.previous = previous;
    }

    public String getKey() {
        return key;
    }

    /**
     * Entry visible before the bind, {@code null} if the key had never been set.
     */
    @Nullable
    ContextEntry getPrevious() {
        return previous;
    }

    void checkUnused() {
        if (used) {
            throw new IllegalStateException(String.format("restore token for '%s' has already been used", key));
        }
    }

    void markUsed() {
        checkUnused();
        used = true;
    }

    @Override
    public String toString() {
        return String.format("restore token for %s (previous: %s)", key, previous == null ? "<missing>" : previous);
    }
}
