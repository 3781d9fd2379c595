package com.warehousesentinel.core.expression;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memoizes {@link ExpressionCompiler#compile(String, Map)} results.
 *
 * <p>
 * Entries are keyed by the expression text together with a copy of the alias
 * map, so the same predicate compiled for two different reports never shares
 * an entry. Instances are thread-safe and owned by whoever creates them;
 * there is no process-wide cache.
 * </p>
 *
 * @since 1.0.0
 */
public final class CompiledExpressionCache {

    private final ConcurrentHashMap<Key, String> entries = new ConcurrentHashMap<>();

    /**
     * Compile through the cache.
     *
     * @param expression predicate-language text; must not be {@code null}
     * @param aliasMap   identifier to replacement; must not be {@code null}
     * @return SQL fragment
     * @throws CompileException if compilation fails (failures are not cached)
     */
    public String compile(String expression, Map<String, String> aliasMap) {
        Objects.requireNonNull(expression, "Expression must not be null");
        Objects.requireNonNull(aliasMap, "Alias map must not be null");
        Key key = new Key(expression, Map.copyOf(aliasMap));
        return entries.computeIfAbsent(key, k -> ExpressionCompiler.compile(k.expression(), k.aliasMap()));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private record Key(String expression, Map<String, String> aliasMap) {
    }
}
