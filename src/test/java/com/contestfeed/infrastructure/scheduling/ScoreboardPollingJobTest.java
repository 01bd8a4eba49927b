package com.contestfeed.infrastructure.scheduling;

import com.contestfeed.application.usecase.SyncScoreboardUseCase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ScoreboardPollingJobTest {

    @Test
    void testEachRunPollsOnce() {
        SyncScoreboardUseCase useCase = mock(SyncScoreboardUseCase.class);
        when(useCase.poll()).thenReturn(new SyncScoreboardUseCase.TickSummary(
            SyncScoreboardUseCase.TickStatus.ABORTED_STORE_UNAVAILABLE, 1, 4, 0, List.of("T1-P1-1"), "write failed"));
        ScoreboardPollingJob job = new ScoreboardPollingJob(useCase);

        assertDoesNotThrow(job::pollScoreboard);
        job.pollScoreboard();

        verify(useCase, times(2)).poll();
    }
}
