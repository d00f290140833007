package io.renderbuffers.servlet;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework-neutral view of the request being rendered.
 */
public final class RenderRequest {
    private final String method;
    private final String path;
    private final Map<String, List<String>> parameters;
    private final Map<String, List<String>> headers;

    public RenderRequest(String method, String path, Map<String, List<String>> parameters, Map<String, List<String>> headers) {
        this.method = Objects.requireNonNull(method, "method");
        this.path = Objects.requireNonNull(path, "path");
        this.parameters = Map.copyOf(Objects.requireNonNull(parameters, "parameters"));
        this.headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public Map<String, List<String>> parameters() {
        return parameters;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> parameter(String name) {
        List<String> values = parameters.get(name);
        if (values == null || values.isEmpty()) return Optional.empty();
        return Optional.ofNullable(values.get(0));
    }

    /**
     * First value of header {@code name}, compared case-insensitively.
     */
    public Optional<String> header(String name) {
        if (name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (!e.getKey().toLowerCase(Locale.ROOT).equals(target)) continue;
            for (String v : e.getValue()) {
                if (v != null) return Optional.of(v);
            }
            return Optional.empty();
        }
        return Optional.empty();
    }
}
