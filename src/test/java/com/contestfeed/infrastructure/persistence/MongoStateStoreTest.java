package com.contestfeed.infrastructure.persistence;

import com.contestfeed.domain.exception.StoreCorruptException;
import com.contestfeed.domain.exception.StoreUnavailableException;
import com.contestfeed.domain.model.EventOp;
import com.contestfeed.domain.model.EventType;
import com.contestfeed.domain.model.FeedEvent;
import com.contestfeed.domain.model.NormalizedSnapshot;
import com.contestfeed.domain.model.Submission;
import com.contestfeed.domain.model.Transition;
import com.contestfeed.domain.service.DiffEngine;
import com.contestfeed.domain.service.EventEmitter;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.UpdateOptions;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for MongoStateStore.
 */
class MongoStateStoreTest {

    private final FeedDocumentMapper mapper = new FeedDocumentMapper();

    private FakeMongoCollection events;
    private FakeMongoCollection submissions;
    private FakeMongoCollection judgements;
    private FakeMongoCollection counters;
    private MongoClient mongoClient;

    @BeforeEach
    void setUp() {
        events = new FakeMongoCollection();
        submissions = new FakeMongoCollection();
        judgements = new FakeMongoCollection();
        counters = new FakeMongoCollection();

        mongoClient = mock(MongoClient.class);
        MongoDatabase database = mock(MongoDatabase.class);
        when(mongoClient.getDatabase("contest_feed")).thenReturn(database);
        when(database.getCollection("events")).thenReturn(events.collection());
        when(database.getCollection("submissions")).thenReturn(submissions.collection());
        when(database.getCollection("judgements")).thenReturn(judgements.collection());
        when(database.getCollection("counters")).thenReturn(counters.collection());
    }

    private MongoStateStore openStore() {
        return new MongoStateStore(mongoClient, "contest_feed", "", false);
    }

    @Test
    void testAppendWritesLogThenProjectionThenCounter() {
        MongoStateStore store = openStore();

        store.append(submissionEvent(1, "S1"));

        InOrder order = inOrder(events.collection(), submissions.collection(), counters.collection());
        order.verify(events.collection()).insertOne(any(Document.class));
        order.verify(submissions.collection()).replaceOne(any(Bson.class), any(Document.class), any(ReplaceOptions.class));
        order.verify(counters.collection()).updateOne(any(Bson.class), any(Bson.class), any(UpdateOptions.class));

        assertEquals(1, store.lastToken());
        assertEquals(1L, counters.documents().get(0).get("value"));
        assertTrue(store.lastKnownSubmission("S1").isPresent());
        assertEquals(List.of(submissionEvent(1, "S1")), store.readFrom(1, 10));
    }

    @Test
    void testOutOfSequenceTokenIsRejected() {
        MongoStateStore store = openStore();

        assertThrows(StoreUnavailableException.class, () -> store.append(submissionEvent(2, "S1")));

        assertTrue(events.documents().isEmpty());
        assertEquals(0, store.lastToken());
    }

    @Test
    void testRestartRollsLaggingCounterForward() {
        events.documents().add(mapper.toEventDocument(submissionEvent(1, "S1")));
        events.documents().add(mapper.toEventDocument(submissionEvent(2, "S2")));
        submissions.documents().add(mapper.toProjectionDocument("S1", submission("S1")));
        counters.documents().add(new Document("_id", "token").append("value", 1L));

        MongoStateStore store = openStore();

        assertEquals(2, store.lastToken());
        assertTrue(store.lastKnownSubmission("S2").isPresent());
        assertEquals(2, submissions.documents().size());
        assertEquals(2L, counters.documents().get(0).get("value"));
    }

    @Test
    void testGapInLogFailsStartup() {
        events.documents().add(mapper.toEventDocument(submissionEvent(1, "S1")));
        events.documents().add(mapper.toEventDocument(submissionEvent(3, "S3")));
        counters.documents().add(new Document("_id", "token").append("value", 3L));

        assertThrows(StoreCorruptException.class, this::openStore);
    }

    @Test
    void testCounterAheadOfLogFailsStartup() {
        events.documents().add(mapper.toEventDocument(submissionEvent(1, "S1")));
        counters.documents().add(new Document("_id", "token").append("value", 2L));

        assertThrows(StoreCorruptException.class, this::openStore);
    }

    @Test
    void testFailedProjectionWriteIsRecoveredAndWakesReaders() throws Exception {
        MongoStateStore store = openStore();
        submissions.failOn("replaceOne");

        assertThrows(StoreUnavailableException.class, () -> store.append(submissionEvent(1, "S1")));

        // The event document exists, but was never published
        assertEquals(1, events.documents().size());
        assertEquals(0, store.lastToken());
        assertTrue(store.readFrom(1, 10).isEmpty());

        CompletableFuture<Boolean> reader = CompletableFuture.supplyAsync(() -> {
            try {
                return store.awaitAppend(0, Duration.ofSeconds(20));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);

        submissions.heal();
        store.recoverIfNeeded();

        assertTrue(reader.get(5, TimeUnit.SECONDS));
        assertEquals(1, store.lastToken());
        assertEquals(1, store.readFrom(1, 10).size());
        assertTrue(store.lastKnownSubmission("S1").isPresent());
        assertEquals(1L, counters.documents().get(0).get("value"));
    }

    @Test
    void testFailedReloadKeepsLastKnownState() {
        MongoStateStore store = openStore();
        store.append(submissionEvent(1, "S1"));

        events.failOn("insertOne");
        assertThrows(StoreUnavailableException.class, () -> store.append(submissionEvent(2, "S2")));
        events.heal();

        submissions.failOn("find");
        assertThrows(StoreUnavailableException.class, store::recoverIfNeeded);
        assertTrue(store.lastKnownSubmission("S1").isPresent());
        submissions.heal();

        DiffEngine.DiffResult diff = new DiffEngine(store).diff(
            new NormalizedSnapshot(List.of(submission("S1"), submission("S2")), List.of(), 0));
        assertEquals(List.of("S2"), diff.transitions().stream().map(Transition::submissionId).toList());

        new EventEmitter(store).emit(diff.transitions());

        assertEquals(List.of("S1", "S2"), events.documents().stream().map(d -> d.getString("id")).toList());
        assertEquals(2, store.lastToken());
    }

    @Test
    void testNoUnusedIndexesAreCreated() {
        openStore();

        verify(events.collection(), never()).createIndex(any(Bson.class));
        verify(events.collection(), never()).createIndex(any(Bson.class), any(IndexOptions.class));
        verify(judgements.collection(), never()).createIndex(any(Bson.class), any(IndexOptions.class));
    }

    @Test
    void testClearDataOnStartup() {
        events.documents().add(mapper.toEventDocument(submissionEvent(1, "S1")));
        counters.documents().add(new Document("_id", "token").append("value", 1L));

        MongoStateStore store = new MongoStateStore(mongoClient, "contest_feed", "", true);

        assertEquals(0, store.lastToken());
        assertTrue(events.documents().isEmpty());
        assertTrue(store.listSubmissions().isEmpty());
    }

    private static Submission submission(String id) {
        return new Submission(id, "T1", "P1", "cpp", "2025-01-01T10:01:00.000Z", "0:01:00.000");
    }

    private static FeedEvent submissionEvent(long token, String id) {
        return new FeedEvent(token, id, EventType.SUBMISSIONS, EventOp.CREATE, submission(id));
    }
}
