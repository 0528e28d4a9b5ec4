package io.github.eutro.mirlens.core.index;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves function types to function names.
 */
public final class FunctionIndex {
    private static final Logger logger = LogManager.getLogger(FunctionIndex.class);
    private static final Pattern HASH_SUFFIX = Pattern.compile("::h[0-9a-f]+$");

    private final Map<FunctionKey, String> byKey = new HashMap<>();
    private final Map<Long, String> byType = new HashMap<>();
    private final Map<FunctionKey, String> sources;
    private final Map<Long, String> sourcesByType = new HashMap<>();

    /**
     * Build the index.
     *
     * @param symbols The function symbol table.
     * @param sources Debug information: where each function was referenced from. May be empty.
     */
    public FunctionIndex(Iterable<FunctionSymbol> symbols, Map<FunctionKey, String> sources) {
        for (FunctionSymbol symbol : symbols) {
            String name = symbol.displayName();
            byKey.put(symbol.key, name);
            byType.put(symbol.key.typeId, name);
        }
        this.sources = new HashMap<>(sources);
        for (Map.Entry<FunctionKey, String> entry : sources.entrySet()) {
            // an uninstantiated key wins as the type's fallback
            if (entry.getKey().instanceDesc == null || !sourcesByType.containsKey(entry.getKey().typeId)) {
                sourcesByType.put(entry.getKey().typeId, entry.getValue());
            }
        }
    }

    public FunctionIndex(Iterable<FunctionSymbol> symbols) {
        this(symbols, Collections.emptyMap());
    }

    /**
     * Shorten a function path for display.
     * <p>
     * A trailing {@code ::h<hash>} is dropped, then everything up to the last {@code ::}.
     *
     * @param name The full name.
     * @return The short name.
     */
    public static String shortName(String name) {
        String trimmed = HASH_SUFFIX.matcher(name).replaceFirst("");
        int idx = trimmed.lastIndexOf("::");
        return idx == -1 ? trimmed : trimmed.substring(idx + 2);
    }

    /**
     * Look up a function, by instance if possible, falling back to its type alone.
     *
     * @param key The key.
     * @return The display name, if any.
     */
    public Optional<String> lookup(FunctionKey key) {
        String name = byKey.get(key);
        if (name == null) name = byType.get(key.typeId);
        if (name == null) logger.trace("unknown function {}", key);
        return Optional.ofNullable(name);
    }

    /**
     * Look up a function by its type alone.
     *
     * @param typeId The function type.
     * @return The display name, if any.
     */
    public Optional<String> lookupByType(long typeId) {
        return Optional.ofNullable(byType.get(typeId));
    }

    /**
     * Get where a function was referenced from, if the debug information has it,
     * by instance if possible, falling back to its type alone.
     *
     * @param key The key.
     * @return The source description, or null.
     */
    public @Nullable String sourceOf(FunctionKey key) {
        String source = sources.get(key);
        if (source == null) source = sourcesByType.get(key.typeId);
        if (source == null) logger.trace("no debug source for {}", key);
        return source;
    }

    /**
     * Get where a function was referenced from by its type alone.
     *
     * @param typeId The function type.
     * @return The source description, or null.
     */
    public @Nullable String sourceOf(long typeId) {
        return sourceOf(new FunctionKey(typeId, null));
    }

    public int size() {
        return byKey.size();
    }
}
