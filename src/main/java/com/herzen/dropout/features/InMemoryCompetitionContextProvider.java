package com.herzen.dropout.features;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Keeps the last two ranks pushed for each student. */
@Component
public class InMemoryCompetitionContextProvider implements CompetitionContextProvider {
    private final Map<String, RankSnapshot> ranks = new ConcurrentHashMap<>();

    public RankSnapshot recordRank(String studentId, int rank) {
        return ranks.merge(studentId, new RankSnapshot(rank, null),
                (current, next) -> new RankSnapshot(next.latestRank(), current.latestRank()));
    }

    @Override
    public Optional<RankSnapshot> ranksFor(String studentId) {
        return Optional.ofNullable(ranks.get(studentId));
    }
}
