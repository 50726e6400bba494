package com.team.identity.fixture;

import com.team.identity.core.model.MatchResult;

import java.util.Optional;

/**
 * Outcome of linking one home/away pair to the provider's fixture list.
 *
 * @param home    resolution of the home team
 * @param away    resolution of the away team
 * @param fixture the linked provider fixture, or null when none matched
 */
public record FixtureLink(MatchResult home, MatchResult away, ProviderFixture fixture) {

    public Optional<ProviderFixture> linkedFixture() {
        return Optional.ofNullable(fixture);
    }

    public boolean isLinked() {
        return fixture != null;
    }
}
