package com.github.fred84.requestlog.http;

import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.TreeMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Flux;

/**
 * Response produced by a handler. A streaming response carries its body either as an {@link Iterable} (blocking
 * handlers) or as a {@link Flux} (reactive handlers); both can be replaced by a middleware.
 */
public final class HttpResponse {

    public static final class Builder {
        private int status = 200;
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private byte[] content = new byte[0];
        private Iterable<byte[]> streamingContent;
        private Flux<byte[]> reactiveContent;

        private Builder() {
        }

        @NotNull
        public Builder status(int val) {
            status = val;
            return this;
        }

        @NotNull
        public Builder header(@NotNull String name, @NotNull String value) {
            headers.put(name, value);
            return this;
        }

        @NotNull
        public Builder content(@NotNull byte[] val) {
            content = val;
            return this;
        }

        @NotNull
        public Builder streamingContent(@NotNull Iterable<byte[]> val) {
            streamingContent = val;
            return this;
        }

        @NotNull
        public Builder reactiveContent(@NotNull Flux<byte[]> val) {
            reactiveContent = val;
            return this;
        }

        @NotNull
        public HttpResponse build() {
            return new HttpResponse(this);
        }
    }

    private final int status;
    private final Map<String, String> headers;
    private final byte[] content;
    private volatile Iterable<byte[]> streamingContent;
    private volatile Flux<byte[]> reactiveContent;

    private HttpResponse(Builder builder) {
        if (builder.status < 100 || builder.status > 599) {
            throw new IllegalArgumentException(String.format("status %s should be inside range [100, 599]", builder.status));
        }
        if (builder.streamingContent != null && builder.reactiveContent != null) {
            throw new IllegalArgumentException("response can't have both blocking and reactive streaming content");
        }
        status = builder.status;
        headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(builder.headers);
        content = requireNonNull(builder.content, "content");
        streamingContent = builder.streamingContent;
        reactiveContent = builder.reactiveContent;
    }

    @NotNull
    public static Builder response() {
        return new Builder();
    }

    public int getStatus() {
        return status;
    }

    @Nullable
    public String getHeader(@NotNull String name) {
        return headers.get(name);
    }

    @NotNull
    public byte[] getContent() {
        return content;
    }

    public boolean isStreaming() {
        return streamingContent != null || reactiveContent != null;
    }

    @Nullable
    public Iterable<byte[]> getStreamingContent() {
        return streamingContent;
    }

    public void setStreamingContent(@NotNull Iterable<byte[]> val) {
        streamingContent = requireNonNull(val, "streaming content");
    }

    @Nullable
    public Flux<byte[]> getReactiveContent() {
        return reactiveContent;
    }

    public void setReactiveContent(@NotNull Flux<byte[]> val) {
        reactiveContent = requireNonNull(val, "reactive content");
    }

    @Override
    public String toString() {
        return String.format("response %s%s", status, isStreaming() ? " (streaming)" : "");
    }
}
