package com.contestfeed.infrastructure.persistence;

import com.contestfeed.domain.exception.StoreUnavailableException;
import com.contestfeed.domain.model.EventType;
import com.contestfeed.domain.model.FeedEvent;
import com.contestfeed.domain.model.Judgement;
import com.contestfeed.domain.model.Submission;
import com.contestfeed.domain.ports.StateStore;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MongoDB implementation of {@link StateStore}.
 *
 * <p>Four collections: {@code events} (keyed by token), {@code submissions} and
 * {@code judgements} (last-known projections keyed by entity id) and {@code counters}
 * (the token counter). An append writes them in that order; the event insert is the
 * commit point, everything after it can be rebuilt from the log by {@link #recover()}.
 *
 * <p>The projections are also cached in memory for diffing and listing.
 */
@Repository
public class MongoStateStore implements StateStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoStateStore.class);
    private static final String TOKEN_COUNTER = "token";

    private static final Comparator<Submission> SUBMISSION_ORDER =
        Comparator.comparingLong(Submission::contestTimeMillis).thenComparing(Submission::id);

    private final MongoCollection<Document> events;
    private final MongoCollection<Document> submissions;
    private final MongoCollection<Document> judgements;
    private final MongoCollection<Document> counters;
    private final FeedDocumentMapper mapper = new FeedDocumentMapper();
    private final AppendSignal signal = new AppendSignal();

    // Replaced as a whole by recover(), never cleared in place
    private volatile Map<String, Submission> submissionCache = new ConcurrentHashMap<>();
    private volatile Map<String, Judgement> judgementCache = new ConcurrentHashMap<>();

    private volatile boolean recoveryPending;

    public MongoStateStore(
            MongoClient mongoClient,
            @Value("${mongodb.database:contest_feed}") String databaseName,
            @Value("${mongodb.collection-prefix:}") String collectionPrefix,
            @Value("${feed.clear-data-on-startup:false}") boolean clearDataOnStartup) {
        MongoDatabase database = mongoClient.getDatabase(databaseName);
        this.events = database.getCollection(collectionPrefix + "events");
        this.submissions = database.getCollection(collectionPrefix + "submissions");
        this.judgements = database.getCollection(collectionPrefix + "judgements");
        this.counters = database.getCollection(collectionPrefix + "counters");

        if (clearDataOnStartup) {
            clearData();
        }
        recover();
    }

    private void clearData() {
        events.drop();
        submissions.drop();
        judgements.drop();
        counters.drop();
        logger.info("Cleared persisted feed state");
    }

    /**
     * Checks the log against the token counter, rolls forward what a crash left behind and
     * reloads the in-memory projections.
     *
     * @throws com.contestfeed.domain.exception.StoreCorruptException if tokens are missing
     *         or the counter is ahead of the log
     */
    synchronized void recover() {
        long count = events.countDocuments();
        long lowest = tokenOf(events.find().sort(Sorts.ascending("_id")).first());
        long highest = tokenOf(events.find().sort(Sorts.descending("_id")).first());
        Document counterDocument = counters.find(Filters.eq("_id", TOKEN_COUNTER)).first();
        long counter = counterDocument == null ? 0 : ((Number) counterDocument.get("value")).longValue();

        EventLogRecovery.LogState state = new EventLogRecovery.LogState(count, lowest, highest, counter);
        if (EventLogRecovery.check(state) == EventLogRecovery.Action.ROLL_FORWARD) {
            logger.warn("Token counter {} lags event log head {}, rebuilding projections from the log",
                counter, highest);
            rollForward(counter, highest);
        }

        Map<String, Submission> loadedSubmissions = new ConcurrentHashMap<>();
        for (Document document : submissions.find()) {
            Submission submission = mapper.fromProjectionDocument(document, Submission.class);
            loadedSubmissions.put(submission.id(), submission);
        }
        Map<String, Judgement> loadedJudgements = new ConcurrentHashMap<>();
        for (Document document : judgements.find()) {
            Judgement judgement = mapper.fromProjectionDocument(document, Judgement.class);
            loadedJudgements.put(judgement.id(), judgement);
        }

        submissionCache = loadedSubmissions;
        judgementCache = loadedJudgements;
        if (highest > signal.head()) {
            // Events committed by a write that failed later on become visible to waiting readers
            signal.publish(highest);
        } else {
            signal.reset(highest);
        }
        recoveryPending = false;
        logger.info("Loaded event log: {} events, {} submissions, {} judgements",
            highest, loadedSubmissions.size(), loadedJudgements.size());
    }

    @Override
    public synchronized void recoverIfNeeded() {
        if (!recoveryPending) {
            return;
        }
        try {
            recover();
        } catch (MongoException e) {
            throw new StoreUnavailableException("Store still unavailable, recovery failed", e);
        }
    }

    private void rollForward(long fromCounter, long toToken) {
        for (Document document : events.find(Filters.gt("_id", fromCounter)).sort(Sorts.ascending("_id"))) {
            FeedEvent event = mapper.fromEventDocument(document);
            writeProjection(event);
        }
        writeCounter(toToken);
    }

    @Override
    public synchronized long append(FeedEvent event) {
        recoverIfNeeded();

        long expected = signal.head() + 1;
        if (event.token() != expected) {
            // Recovery may have committed an event the emitter did not know about
            throw new StoreUnavailableException(
                "Token " + event.token() + " out of sequence, expected " + expected, null);
        }

        try {
            events.insertOne(mapper.toEventDocument(event));
            writeProjection(event);
            writeCounter(event.token());
        } catch (MongoException e) {
            recoveryPending = true;
            throw new StoreUnavailableException("Failed to persist event " + event.token(), e);
        }

        cache(event);
        signal.publish(event.token());
        return event.token();
    }

    private void writeProjection(FeedEvent event) {
        MongoCollection<Document> collection = event.type() == EventType.SUBMISSIONS ? submissions : judgements;
        collection.replaceOne(
            Filters.eq("_id", event.id()),
            mapper.toProjectionDocument(event.id(), event.data()),
            new ReplaceOptions().upsert(true)
        );
    }

    private void writeCounter(long token) {
        counters.updateOne(
            Filters.eq("_id", TOKEN_COUNTER),
            Updates.set("value", token),
            new UpdateOptions().upsert(true)
        );
    }

    private void cache(FeedEvent event) {
        if (event.data() instanceof Submission submission) {
            submissionCache.put(submission.id(), submission);
        } else if (event.data() instanceof Judgement judgement) {
            judgementCache.put(judgement.id(), judgement);
        }
    }

    @Override
    public List<FeedEvent> readFrom(long fromToken, int limit) {
        long head = signal.head();
        if (fromToken > head || limit <= 0) {
            return List.of();
        }

        try {
            List<FeedEvent> result = new ArrayList<>();
            for (Document document : events.find(Filters.and(Filters.gte("_id", fromToken), Filters.lte("_id", head)))
                    .sort(Sorts.ascending("_id"))
                    .limit(limit)) {
                result.add(mapper.fromEventDocument(document));
            }
            return result;
        } catch (MongoException e) {
            throw new StoreUnavailableException("Failed to read events from token " + fromToken, e);
        }
    }

    @Override
    public long lastToken() {
        return signal.head();
    }

    @Override
    public Optional<Submission> lastKnownSubmission(String submissionId) {
        return Optional.ofNullable(submissionCache.get(submissionId));
    }

    @Override
    public Optional<Judgement> lastKnownJudgement(String judgementId) {
        return Optional.ofNullable(judgementCache.get(judgementId));
    }

    @Override
    public List<Submission> listSubmissions() {
        return submissionCache.values().stream().sorted(SUBMISSION_ORDER).toList();
    }

    @Override
    public List<Judgement> listJudgements() {
        return judgementCache.values().stream()
            .sorted(Comparator.comparing(Judgement::id))
            .toList();
    }

    @Override
    public boolean awaitAppend(long afterToken, Duration timeout) throws InterruptedException {
        return signal.await(afterToken, timeout);
    }

    private static long tokenOf(Document document) {
        return document == null ? 0 : ((Number) document.get("_id")).longValue();
    }
}
