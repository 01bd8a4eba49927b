package com.contestfeed.application.usecase;

import com.contestfeed.domain.exception.InvalidTokenException;
import com.contestfeed.domain.model.EventOp;
import com.contestfeed.domain.model.EventType;
import com.contestfeed.domain.model.FeedEvent;
import com.contestfeed.domain.model.Submission;
import com.contestfeed.support.InMemoryStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EventFeedUseCase.
 */
class EventFeedUseCaseTest {

    private InMemoryStateStore stateStore;
    private EventFeedUseCase useCase;

    @BeforeEach
    void setUp() {
        stateStore = new InMemoryStateStore();
        // Small pages so paging is exercised
        useCase = new EventFeedUseCase(stateStore, 2);
    }

    @Test
    void testParseResumeToken() {
        appendSubmissions(3);

        assertEquals(0, useCase.parseResumeToken(null));
        assertEquals(0, useCase.parseResumeToken("0"));
        assertEquals(3, useCase.parseResumeToken("3"));
        assertEquals(2, useCase.parseResumeToken(" 2 "));
    }

    @Test
    void testParseResumeTokenRejectsBadInput() {
        appendSubmissions(3);

        InvalidTokenException format = assertThrows(InvalidTokenException.class, () -> useCase.parseResumeToken("abc"));
        assertEquals("Invalid token format: abc", format.getMessage());
        assertThrows(InvalidTokenException.class, () -> useCase.parseResumeToken("-1"));
        InvalidTokenException unknown = assertThrows(InvalidTokenException.class, () -> useCase.parseResumeToken("4"));
        assertEquals("Unknown token: 4", unknown.getMessage());
    }

    @Test
    void testReadFromPagesThroughWholeLog() {
        appendSubmissions(5);

        List<FeedEvent> all = useCase.readFrom(1);
        assertEquals(5, all.size());
        assertEquals(1, all.get(0).token());
        assertEquals(5, all.get(4).token());

        List<FeedEvent> resumed = useCase.readFrom(4);
        assertEquals(List.of(4L, 5L), resumed.stream().map(FeedEvent::token).toList());

        assertTrue(useCase.readFrom(6).isEmpty());
    }

    @Test
    void testProjectionsServedFromStore() {
        appendSubmissions(2);

        assertEquals(2, useCase.listSubmissions().size());
        assertTrue(useCase.findSubmission("S1").isPresent());
        assertTrue(useCase.findSubmission("S9").isEmpty());
        assertTrue(useCase.listJudgements().isEmpty());
        assertEquals(2, useCase.lastToken());
    }

    @Test
    void testCursorDeliversHistoryThenCatchesUp() throws Exception {
        appendSubmissions(3);
        EventFeedUseCase.FeedCursor cursor = useCase.openCursor(1);

        List<FeedEvent> page = cursor.next(Duration.ofMillis(10));
        assertEquals(List.of(2L, 3L), page.stream().map(FeedEvent::token).toList());
        assertEquals(3, cursor.lastDelivered());

        assertTrue(cursor.next(Duration.ofMillis(50)).isEmpty());
        assertEquals(3, cursor.lastDelivered());
    }

    @Test
    void testCursorWakesUpOnAppend() throws Exception {
        appendSubmissions(1);
        EventFeedUseCase.FeedCursor cursor = useCase.openCursor(1);

        CompletableFuture<List<FeedEvent>> waiting = CompletableFuture.supplyAsync(() -> {
            try {
                return cursor.next(Duration.ofSeconds(10));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);
        appendSubmissions(1);

        List<FeedEvent> page = waiting.get(5, TimeUnit.SECONDS);
        assertEquals(1, page.size());
        assertEquals(2, page.get(0).token());
    }

    private void appendSubmissions(int count) {
        for (int i = 0; i < count; i++) {
            long token = stateStore.lastToken() + 1;
            Submission submission = new Submission("S" + token, "T1", "P1", "cpp", null, "0:00:0" + (token % 10) + ".000");
            stateStore.append(new FeedEvent(token, submission.id(), EventType.SUBMISSIONS, EventOp.CREATE, submission));
        }
    }
}
