package com.product.resolution.alias;

import com.product.resolution.rules.ManufacturerNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable mapping from manufacturer aliases to canonical manufacturer names.
 * All names are stored in normalized form; every canonical name is also an alias of itself.
 *
 * <pre>
 * AliasTable table = AliasTable.builder()
 *         .addAlias("3M", "Minnesota Mining and Manufacturing", "3M Company")
 *         .build();
 * table.canonicalOf("3M Co.");   // Optional["3M"]
 * </pre>
 */
public final class AliasTable {
    private static final Logger log = LoggerFactory.getLogger(AliasTable.class);

    private static final AliasTable EMPTY = new AliasTable(new Builder());

    private final ManufacturerNormalizer normalizer;
    private final Map<String, String> aliasToCanonical;
    private final Map<String, Set<String>> canonicalToAliases;
    private final Map<String, String> displayNames;

    private AliasTable(Builder builder) {
        this.normalizer = builder.normalizer;
        this.aliasToCanonical = Collections.unmodifiableMap(new TreeMap<>(builder.aliasToCanonical));
        Map<String, Set<String>> aliases = new TreeMap<>();
        builder.canonicalToAliases.forEach((canonical, names) ->
                aliases.put(canonical, Collections.unmodifiableSet(new TreeSet<>(names))));
        this.canonicalToAliases = Collections.unmodifiableMap(aliases);
        this.displayNames = Map.copyOf(builder.displayNames);
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up an already normalized name.
     */
    public Optional<String> lookupNormalized(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliasToCanonical.get(normalized));
    }

    /**
     * Normalizes a manufacturer name and returns its canonical name, if known.
     */
    public Optional<String> canonicalOf(String name) {
        return lookupNormalized(normalizer.normalize(name));
    }

    /**
     * Returns all aliases of a canonical manufacturer (canonical or alias spelling accepted),
     * the canonical name included, or an empty set when it is unknown.
     */
    public Set<String> aliasesOf(String name) {
        return canonicalOf(name)
                .map(canonicalToAliases::get)
                .orElse(Set.of());
    }

    /**
     * Checks whether two names resolve to the same known canonical manufacturer.
     */
    public boolean isAliasOf(String name1, String name2) {
        Optional<String> canonical1 = canonicalOf(name1);
        return canonical1.isPresent() && canonical1.equals(canonicalOf(name2));
    }

    /**
     * Finds canonical manufacturers whose canonical name or one of whose aliases contains the query.
     * Results are in canonical name order.
     */
    public List<AliasEntry> search(String query, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        String needle = normalizer.normalize(query);
        List<AliasEntry> results = new ArrayList<>();
        if (needle.isEmpty()) {
            return results;
        }
        for (Map.Entry<String, Set<String>> entry : canonicalToAliases.entrySet()) {
            boolean hit = entry.getValue().stream().anyMatch(alias -> alias.contains(needle));
            if (hit) {
                results.add(new AliasEntry(displayNameOf(entry.getKey()), entry.getKey(), entry.getValue()));
                if (results.size() >= limit) {
                    break;
                }
            }
        }
        return results;
    }

    /**
     * The canonical name as originally supplied, or the normalized name when not known.
     */
    public String displayNameOf(String canonical) {
        return displayNames.getOrDefault(canonical, canonical);
    }

    /**
     * Every known name (canonical names and aliases) mapped to its canonical name, in name order.
     */
    public Map<String, String> knownNames() {
        return aliasToCanonical;
    }

    public Set<String> canonicalNames() {
        return canonicalToAliases.keySet();
    }

    public boolean isEmpty() {
        return canonicalToAliases.isEmpty();
    }

    public AliasTableStats stats() {
        return new AliasTableStats(canonicalToAliases.size(), aliasToCanonical.size());
    }

    public static class Builder {
        private final ManufacturerNormalizer normalizer = new ManufacturerNormalizer();
        private final Map<String, String> aliasToCanonical = new TreeMap<>();
        private final Map<String, Set<String>> canonicalToAliases = new TreeMap<>();
        private final Map<String, String> displayNames = new TreeMap<>();

        public Builder addAlias(String canonicalName, String... aliases) {
            return addAliases(canonicalName, List.of(aliases));
        }

        /**
         * Registers a canonical manufacturer and its aliases. An alias already mapped to
         * another canonical manufacturer keeps its first mapping.
         */
        public Builder addAliases(String canonicalName, Collection<String> aliases) {
            String canonical = normalizer.normalize(canonicalName);
            if (canonical.isEmpty()) {
                return this;
            }
            displayNames.putIfAbsent(canonical, canonicalName.trim());
            Set<String> names = canonicalToAliases.computeIfAbsent(canonical, c -> new TreeSet<>());
            register(canonical, canonical, names);
            for (String alias : aliases) {
                String normalizedAlias = normalizer.normalize(alias);
                if (!normalizedAlias.isEmpty()) {
                    register(normalizedAlias, canonical, names);
                }
            }
            return this;
        }

        private void register(String alias, String canonical, Set<String> names) {
            String existing = aliasToCanonical.putIfAbsent(alias, canonical);
            if (existing == null || existing.equals(canonical)) {
                names.add(alias);
            } else {
                log.warn("alias.conflict alias='{}' canonical='{}' ignored='{}'", alias, existing, canonical);
            }
        }

        public AliasTable build() {
            return new AliasTable(this);
        }
    }
}
