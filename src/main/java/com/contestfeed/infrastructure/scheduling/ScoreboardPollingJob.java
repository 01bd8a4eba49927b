package com.contestfeed.infrastructure.scheduling;

import com.contestfeed.application.usecase.SyncScoreboardUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives ticks. Fixed delay on Spring's single scheduler thread, so a tick never
 * starts before the previous one has finished appending.
 */
@Component
@ConditionalOnProperty(name = "feed.polling-enabled", havingValue = "true", matchIfMissing = true)
public class ScoreboardPollingJob {

    private static final Logger logger = LoggerFactory.getLogger(ScoreboardPollingJob.class);

    private final SyncScoreboardUseCase syncScoreboardUseCase;

    public ScoreboardPollingJob(SyncScoreboardUseCase syncScoreboardUseCase) {
        this.syncScoreboardUseCase = syncScoreboardUseCase;
    }

    @Scheduled(fixedDelayString = "${feed.polling-interval-ms:30000}",
               initialDelayString = "${feed.initial-delay-ms:1000}")
    public void pollScoreboard() {
        SyncScoreboardUseCase.TickSummary summary = syncScoreboardUseCase.poll();
        if (summary.status() != SyncScoreboardUseCase.TickStatus.COMPLETED) {
            logger.warn("Tick {}: {}", summary.status(), summary.error());
        }
        if (!summary.rejectedJudgements().isEmpty()) {
            logger.warn("Upstream reported changed verdicts for judged submissions {}, check the scoreboard",
                summary.rejectedJudgements());
        }
    }
}
