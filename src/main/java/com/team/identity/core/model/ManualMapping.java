package com.team.identity.core.model;

import java.util.Objects;

/**
 * A curated provider name to canonical name association.
 *
 * @param competition   the competition the entry was curated under, or null for override entries
 * @param sourceName    exact provider spelling, used as the lookup key
 * @param canonicalName the canonical team name
 */
public record ManualMapping(String competition, String sourceName, String canonicalName) {

    public ManualMapping {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(canonicalName, "canonicalName is required");
    }
}
