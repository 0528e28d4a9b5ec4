package io.github.eutro.mirlens.core.analysis;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The lexical lifetimes of every declared local of a function, indexed by local.
 */
public final class LifetimeIndex {
    private final List<LocalLifetime> locals;

    public LifetimeIndex(List<LocalLifetime> locals) {
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
    }

    public @Nullable LocalLifetime get(int local) {
        return local >= 0 && local < locals.size() ? locals.get(local) : null;
    }

    public List<LocalLifetime> all() {
        return locals;
    }

    /**
     * Get the lifetimes that resolved to a source range, by local.
     *
     * @return The lifetimes.
     */
    public List<LocalLifetime> withSourceRanges() {
        List<LocalLifetime> result = new ArrayList<>();
        for (LocalLifetime lifetime : locals) {
            if (lifetime.hasSourceInfo()) result.add(lifetime);
        }
        return result;
    }
}
