package com.team.identity.fixture;

import com.team.identity.api.TeamResolver;
import com.team.identity.core.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the provider fixture for a home/away pair named in the stats provider's spelling.
 * Both teams are resolved against every team name appearing in the provider's list,
 * with the competition as context.
 */
public class FixtureLinker {
    private static final Logger log = LoggerFactory.getLogger(FixtureLinker.class);

    private final TeamResolver resolver;

    public FixtureLinker(TeamResolver resolver) {
        this.resolver = resolver;
    }

    public FixtureLink link(String homeTeam, String awayTeam, List<ProviderFixture> providerFixtures,
                            String competition) {
        List<ProviderFixture> fixtures = providerFixtures != null ? providerFixtures : List.of();
        List<String> candidates = candidateNames(fixtures);

        MatchResult home = resolver.resolve(homeTeam, candidates, competition);
        MatchResult away = resolver.resolve(awayTeam, candidates, competition);

        if (!home.matchFound() || !away.matchFound()) {
            log.info("fixture.unlinked home='{}' found={} away='{}' found={}",
                    homeTeam, home.matchFound(), awayTeam, away.matchFound());
            return new FixtureLink(home, away, null);
        }

        for (ProviderFixture fixture : fixtures) {
            if (fixture.homeTeam().equals(home.matchedName()) && fixture.awayTeam().equals(away.matchedName())) {
                log.debug("Linked '{}' v '{}' to fixture {}", homeTeam, awayTeam, fixture.fixtureId());
                return new FixtureLink(home, away, fixture);
            }
        }
        log.info("fixture.unlinked home='{}' -> '{}' away='{}' -> '{}': no fixture pairs them",
                homeTeam, home.matchedName(), awayTeam, away.matchedName());
        return new FixtureLink(home, away, null);
    }

    private static List<String> candidateNames(List<ProviderFixture> fixtures) {
        Set<String> names = new LinkedHashSet<>();
        for (ProviderFixture fixture : fixtures) {
            names.add(fixture.homeTeam());
            names.add(fixture.awayTeam());
        }
        return new ArrayList<>(names);
    }
}
