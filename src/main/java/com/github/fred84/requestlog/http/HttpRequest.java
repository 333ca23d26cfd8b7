package com.github.fred84.requestlog.http;

import static java.util.Objects.requireNonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Request as seen by middlewares. Headers are looked up case-insensitively; metadata holds transport level
 * values ({@code REMOTE_ADDR}, {@code HTTP_X_FORWARDED_FOR}, ...). Attributes are mutable and live as long
 * as the request.
 */
public final class HttpRequest {

    public static final class Builder {
        private String method = "GET";
        private String path = "/";
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private Principal principal;

        private Builder() {
        }

        @NotNull
        public Builder method(@NotNull String val) {
            method = val;
            return this;
        }

        @NotNull
        public Builder path(@NotNull String val) {
            path = val;
            return this;
        }

        @NotNull
        public Builder queryParam(@NotNull String name, @NotNull String value) {
            queryParams.put(name, value);
            return this;
        }

        @NotNull
        public Builder header(@NotNull String name, @NotNull String value) {
            headers.put(name, value);
            return this;
        }

        @NotNull
        public Builder metadata(@NotNull String name, @NotNull String value) {
            metadata.put(name, value);
            return this;
        }

        @NotNull
        public Builder principal(@Nullable Principal val) {
            principal = val;
            return this;
        }

        @NotNull
        public HttpRequest build() {
            return new HttpRequest(this);
        }
    }

    private final String method;
    private final String path;
    private final Map<String, String> queryParams;
    private final Map<String, String> headers;
    private final Map<String, String> metadata;
    private final Principal principal;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    private HttpRequest(Builder builder) {
        method = requireNonNull(builder.method, "method");
        path = requireNonNull(builder.path, "path");
        queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParams));
        Map<String, String> headerCopy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headerCopy.putAll(builder.headers);
        headers = Collections.unmodifiableMap(headerCopy);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        principal = builder.principal;
    }

    @NotNull
    public static Builder request() {
        return new Builder();
    }

    @NotNull
    public String getMethod() {
        return method;
    }

    @NotNull
    public String getPath() {
        return path;
    }

    @NotNull
    public Map<String, String> getQueryParams() {
        return queryParams;
    }

    @Nullable
    public String getHeader(@NotNull String name) {
        return headers.get(name);
    }

    @NotNull
    public Map<String, String> getMetadata() {
        return metadata;
    }

    @NotNull
    public Optional<Principal> getPrincipal() {
        return Optional.ofNullable(principal);
    }

    @Nullable
    public Object getAttribute(@NotNull String name) {
        return attributes.get(name);
    }

    public void setAttribute(@NotNull String name, @NotNull Object value) {
        attributes.put(name, value);
    }

    @Override
    public String toString() {
        return String.format("%s %s", method, path);
    }
}
