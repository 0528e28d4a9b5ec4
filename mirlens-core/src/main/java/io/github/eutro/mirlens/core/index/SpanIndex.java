package io.github.eutro.mirlens.core.index;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public final class SpanIndex {
    private final Map<Long, SpanInfo> byId = new HashMap<>();

    public SpanIndex(Iterable<SpanInfo> spans) {
        for (SpanInfo span : spans) {
            byId.put(span.id, span);
        }
    }

    public @Nullable SpanInfo getNullable(long id) {
        return byId.get(id);
    }

    public Optional<SpanInfo> get(long id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Describe a span, falling back to its label if it is unknown.
     *
     * @param id The span id.
     * @return {@code file:line:col}, or {@code span<N>}.
     */
    public String describe(long id) {
        SpanInfo info = byId.get(id);
        return info == null ? "span" + id : info.shortForm();
    }

    public int size() {
        return byId.size();
    }
}
