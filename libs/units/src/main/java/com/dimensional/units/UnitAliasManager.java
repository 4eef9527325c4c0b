package com.dimensional.units;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry of unit aliases: short names standing for a fully resolved {@link PrefixedUnit}
 * (e.g. "N" for kg·m/s²).
 *
 * <p>Registration is idempotent for an equal definition and rejects a different one with
 * {@link AliasConflictException}. Aliases may not reuse a fundamental unit symbol.
 *
 * <p>This is the only mutable state of the library. It is an ordinary object rather than a
 * singleton: parsers take it as a dependency and tests create their own. All access goes through
 * a single lock; registrations are rare and lookups short.
 */
public final class UnitAliasManager {

    private static final Logger log = LoggerFactory.getLogger(UnitAliasManager.class);

    private final Object lock = new Object();
    private final Map<String, PrefixedUnit> aliases = new LinkedHashMap<>();

    /** Creates an empty registry. */
    public UnitAliasManager() {
    }

    /** Creates a registry seeded with {@link StandardUnits}. */
    public static UnitAliasManager withStandardUnits() {
        UnitAliasManager registry = new UnitAliasManager();
        StandardUnits.registerAll(registry);
        return registry;
    }

    /**
     * Binds {@code name} to {@code unit}.
     *
     * @param name the alias, a single identifier (e.g. "N")
     * @param unit the unit it stands for
     * @throws IllegalArgumentException if the name is not a valid identifier
     * @throws AliasConflictException if the name is a fundamental symbol or already bound to a
     *     different unit
     */
    public void register(String name, PrefixedUnit unit) {
        if (!UnitLexer.isIdentifier(name)) {
            throw new IllegalArgumentException("alias must be a non-empty identifier, was '" + name + "'");
        }
        Objects.requireNonNull(unit, "unit must not be null");
        Optional<FundamentalUnit> fundamental = FundamentalUnit.fromSymbol(name);
        if (fundamental.isPresent()) {
            throw new AliasConflictException(name, "fundamental unit " + fundamental.get(), unit.render());
        }
        synchronized (lock) {
            PrefixedUnit existing = aliases.get(name);
            if (existing == null) {
                aliases.put(name, unit);
                log.debug("Registered unit alias {} = {}", name, unit);
            } else if (existing.equals(unit)) {
                log.debug("Unit alias {} already registered with the same definition", name);
            } else {
                throw new AliasConflictException(name, existing.render(), unit.render());
            }
        }
    }

    /**
     * Parses {@code formula} against this registry and binds the result to {@code name}. The
     * formula must be a plain expression; {@code "X = m"} is rejected without registering
     * {@code X}.
     *
     * @throws UnexpectedTokenException if the formula is itself an alias definition
     * @see #register(String, PrefixedUnit)
     */
    public void register(String name, String formula) {
        register(name, new UnitParser(this).parseExpression(formula));
    }

    /**
     * Returns the unit bound to {@code name}.
     *
     * @throws UnknownAliasException if the alias is not registered
     */
    public PrefixedUnit resolve(String name) {
        return find(name).orElseThrow(() -> new UnknownAliasException(name));
    }

    /** Returns the unit bound to {@code name}, or empty. */
    public Optional<PrefixedUnit> find(String name) {
        synchronized (lock) {
            return Optional.ofNullable(aliases.get(name));
        }
    }

    /** Returns the first registered alias whose unit equals {@code unit}, or empty. */
    public Optional<String> findAlias(PrefixedUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        synchronized (lock) {
            for (Map.Entry<String, PrefixedUnit> entry : aliases.entrySet()) {
                if (entry.getValue().equals(unit)) {
                    return Optional.of(entry.getKey());
                }
            }
            return Optional.empty();
        }
    }

    public boolean isRegistered(String name) {
        synchronized (lock) {
            return aliases.containsKey(name);
        }
    }

    /**
     * Removes an alias. Unknown names are ignored.
     *
     * @return true if an alias was removed
     */
    public boolean unregister(String name) {
        synchronized (lock) {
            boolean removed = aliases.remove(name) != null;
            if (removed) {
                log.debug("Unregistered unit alias {}", name);
            }
            return removed;
        }
    }

    /** Registered names in registration order. */
    public List<String> names() {
        synchronized (lock) {
            return List.copyOf(aliases.keySet());
        }
    }

    public int size() {
        synchronized (lock) {
            return aliases.size();
        }
    }

    /** Removes every alias. */
    public void clear() {
        synchronized (lock) {
            log.debug("Clearing {} unit aliases", aliases.size());
            aliases.clear();
        }
    }
}
