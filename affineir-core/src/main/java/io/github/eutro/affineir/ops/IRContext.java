package io.github.eutro.affineir.ops;

import io.github.eutro.affineir.affine.AffineDialect;
import io.github.eutro.affineir.std.BuiltinDialect;
import io.github.eutro.affineir.std.StdDialect;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The set of dialects known when reading IR, mapping operation names to their kinds.
 * <p>
 * Dialects are loaded up front. Unknown operation names get an {@link OpKey#unregistered(String) unregistered}
 * kind, created once per name, unless unregistered operations are disallowed.
 */
public final class IRContext {
    private final Map<String, Dialect> dialects = new LinkedHashMap<>();
    private final Map<String, OpKey> unregistered = new ConcurrentHashMap<>();
    private boolean allowUnregisteredOps = true;

    /**
     * @return A context with the builtin, standard and affine dialects loaded.
     */
    public static IRContext withDefaultDialects() {
        IRContext ctx = new IRContext();
        ctx.loadDialect(BuiltinDialect.INSTANCE);
        ctx.loadDialect(StdDialect.INSTANCE);
        ctx.loadDialect(AffineDialect.INSTANCE);
        return ctx;
    }

    public IRContext loadDialect(Dialect dialect) {
        Dialect existing = dialects.putIfAbsent(dialect.getNamespace(), dialect);
        if (existing != null && existing != dialect) {
            throw new IllegalStateException("a different dialect is already loaded for '" + dialect.getNamespace() + "'");
        }
        return this;
    }

    public @Nullable Dialect getDialect(String namespace) {
        return dialects.get(namespace);
    }

    public Collection<Dialect> getDialects() {
        return Collections.unmodifiableCollection(dialects.values());
    }

    public boolean allowsUnregisteredOps() {
        return allowUnregisteredOps;
    }

    public IRContext setAllowUnregisteredOps(boolean allow) {
        allowUnregisteredOps = allow;
        return this;
    }

    public @Nullable OpKey lookupRegistered(String name) {
        int dot = name.indexOf('.');
        Dialect dialect = dialects.get(dot < 0 ? "" : name.substring(0, dot));
        return dialect == null ? null : dialect.lookup(name);
    }

    /**
     * Get the kind of an operation by name.
     *
     * @param name The full name.
     * @return The registered kind, or an unregistered one if allowed, otherwise null.
     */
    public @Nullable OpKey getOpKey(String name) {
        OpKey key = lookupRegistered(name);
        if (key != null) return key;
        if (!allowUnregisteredOps) return null;
        return unregistered.computeIfAbsent(name, OpKey::unregistered);
    }
}
