package com.github.fred84.requestlog.http;

import org.jetbrains.annotations.Nullable;

/**
 * Authenticated (or anonymous) caller attached to a request.
 */
public interface Principal {

    boolean isAuthenticated();

    @Nullable
    Object getId();

    /**
     * Value of an identity field such as {@code username} or {@code email}, {@code null} if the principal has none.
     */
    @Nullable
    Object attribute(String field);
}
