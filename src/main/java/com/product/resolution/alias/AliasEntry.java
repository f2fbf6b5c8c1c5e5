package com.product.resolution.alias;

import java.util.Set;

/**
 * One canonical manufacturer of an alias table with its known aliases.
 *
 * @param displayName the canonical name as first supplied, before normalization
 * @param canonical   the normalized canonical name
 * @param aliases     normalized aliases, the canonical name included
 */
public record AliasEntry(String displayName, String canonical, Set<String> aliases) {

    public AliasEntry {
        aliases = Set.copyOf(aliases);
    }
}
