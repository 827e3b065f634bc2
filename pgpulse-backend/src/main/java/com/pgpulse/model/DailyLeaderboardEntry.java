package com.pgpulse.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A leaderboard row, keyed by (day, queryId).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DailyLeaderboardEntry {
    private LocalDate day;
    private String queryId;
    private String queryText;
    private double meanTimeMs;
    private double maxTimeMs;
    private double totalTimeMs;
    private long calls;
    private long rows;
    private long sharedBlocksRead;
    private long sharedBlocksHit;
    private long lastSeen;

    /**
     * Builds the entry that admits {@code candidate} to the leaderboard of {@code day}.
     *
     * @param day leaderboard day
     * @param candidate admitted candidate
     * @param now epoch millis of the admission
     * @return new entry with max time equal to the candidate mean time
     */
    public static DailyLeaderboardEntry admit(LocalDate day, QueryStatCandidate candidate, long now) {
        return DailyLeaderboardEntry.builder()
                .day(day)
                .queryId(candidate.getQueryId())
                .queryText(candidate.getQueryText())
                .meanTimeMs(candidate.getMeanTimeMs())
                .maxTimeMs(candidate.getMeanTimeMs())
                .totalTimeMs(candidate.getTotalTimeMs())
                .calls(candidate.getCalls())
                .rows(candidate.getRows())
                .sharedBlocksRead(candidate.getSharedBlocksRead())
                .sharedBlocksHit(candidate.getSharedBlocksHit())
                .lastSeen(now)
                .build();
    }
}
