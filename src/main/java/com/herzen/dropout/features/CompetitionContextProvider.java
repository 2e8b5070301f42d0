package com.herzen.dropout.features;

import java.util.Optional;

/** Supplies the latest and previous mock-test rank of a student. */
public interface CompetitionContextProvider {
    Optional<RankSnapshot> ranksFor(String studentId);

    record RankSnapshot(Integer latestRank, Integer previousRank) {}
}
