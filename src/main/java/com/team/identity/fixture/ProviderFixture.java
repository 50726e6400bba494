package com.team.identity.fixture;

import java.time.Instant;
import java.util.Objects;

/**
 * A fixture as listed by the odds provider, named in that provider's spelling.
 *
 * @param commenceTime kick-off time, may be null when the provider omits it
 */
public record ProviderFixture(String fixtureId, String homeTeam, String awayTeam, Instant commenceTime) {

    public ProviderFixture {
        Objects.requireNonNull(fixtureId, "fixtureId is required");
        Objects.requireNonNull(homeTeam, "homeTeam is required");
        Objects.requireNonNull(awayTeam, "awayTeam is required");
    }
}
