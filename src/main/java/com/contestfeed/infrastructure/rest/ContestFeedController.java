package com.contestfeed.infrastructure.rest;

import com.contestfeed.application.usecase.EventFeedUseCase;
import com.contestfeed.domain.exception.InvalidTokenException;
import com.contestfeed.domain.model.FeedEvent;
import com.contestfeed.domain.model.Judgement;
import com.contestfeed.domain.model.Submission;
import com.contestfeed.domain.model.Verdict;
import com.contestfeed.infrastructure.json.FeedJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CCS Contest API endpoints backed by the event log.
 */
@RestController
public class ContestFeedController {

    private static final Logger logger = LoggerFactory.getLogger(ContestFeedController.class);

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private static final List<Map<String, String>> LANGUAGES = List.of(
        language("c", "C"),
        language("cpp", "C++"),
        language("java", "Java"),
        language("kotlin", "Kotlin"),
        language("python3", "Python 3")
    );

    private final EventFeedUseCase eventFeedUseCase;
    private final String contestId;
    private final Duration waitTimeout;
    private final Duration keepAliveInterval;

    public ContestFeedController(
            EventFeedUseCase eventFeedUseCase,
            @Value("${contest.id:contest}") String contestId,
            @Value("${feed.wait-seconds:30}") long waitSeconds,
            @Value("${feed.keepalive-seconds:120}") long keepAliveSeconds) {
        this.eventFeedUseCase = eventFeedUseCase;
        this.contestId = contestId;
        this.waitTimeout = Duration.ofSeconds(waitSeconds);
        this.keepAliveInterval = Duration.ofSeconds(keepAliveSeconds);
    }

    @GetMapping("/")
    public Map<String, Object> apiInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("version", "draft");
        info.put("version_url", "https://ccs-specs.icpc.io/draft/contest_api");
        info.put("provider", Map.of("name", "Scoreboard Event Feed"));
        return info;
    }

    @GetMapping("/contests/{contestId}/judgement-types")
    public List<Map<String, Object>> judgementTypes(@PathVariable String contestId) {
        requireContest(contestId);
        return Arrays.stream(Verdict.values())
            .filter(Verdict::isTerminal)
            .map(verdict -> {
                Map<String, Object> type = new LinkedHashMap<>();
                type.put("id", verdict.getCode());
                type.put("name", verdict.getDisplayName());
                type.put("penalty", verdict.isPenalty());
                type.put("solved", verdict.isSolved());
                return type;
            })
            .toList();
    }

    @GetMapping("/contests/{contestId}/languages")
    public List<Map<String, String>> languages(@PathVariable String contestId) {
        requireContest(contestId);
        return LANGUAGES;
    }

    @GetMapping("/contests/{contestId}/submissions")
    public List<Submission> submissions(@PathVariable String contestId) {
        requireContest(contestId);
        return eventFeedUseCase.listSubmissions();
    }

    @GetMapping("/contests/{contestId}/submissions/{submissionId}")
    public Submission submission(@PathVariable String contestId, @PathVariable String submissionId) {
        requireContest(contestId);
        return eventFeedUseCase.findSubmission(submissionId)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Submission not found"));
    }

    @GetMapping("/contests/{contestId}/judgements")
    public List<Judgement> judgements(@PathVariable String contestId) {
        requireContest(contestId);
        return eventFeedUseCase.listJudgements();
    }

    @GetMapping("/contests/{contestId}/judgements/{judgementId}")
    public Judgement judgement(@PathVariable String contestId, @PathVariable String judgementId) {
        requireContest(contestId);
        return eventFeedUseCase.findJudgement(judgementId)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Judgement not found"));
    }

    /**
     * Streams every event after {@code since_token} as NDJSON, then keeps the connection open
     * and streams new events as they are committed. The stream only ends when the client leaves.
     */
    @GetMapping("/contests/{contestId}/event-feed")
    public ResponseEntity<StreamingResponseBody> eventFeed(
            @PathVariable String contestId,
            @RequestParam(name = "since_token", required = false) String sinceToken) {
        requireContest(contestId);

        long since;
        try {
            since = eventFeedUseCase.parseResumeToken(sinceToken);
        } catch (InvalidTokenException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        StreamingResponseBody body = out -> streamEvents(out, since);
        return ResponseEntity.ok().contentType(NDJSON).body(body);
    }

    private void streamEvents(OutputStream out, long since) throws IOException {
        EventFeedUseCase.FeedCursor cursor = eventFeedUseCase.openCursor(since);
        logger.info("Event feed client connected (since_token={})", since);

        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        long lastSend = System.nanoTime();
        try {
            while (!Thread.currentThread().isInterrupted()) {
                List<FeedEvent> events = cursor.next(waitTimeout);
                if (!events.isEmpty()) {
                    for (FeedEvent event : events) {
                        writer.write(FeedJson.toJsonLine(event));
                    }
                    writer.flush();
                    lastSend = System.nanoTime();
                } else if (System.nanoTime() - lastSend >= keepAliveInterval.toNanos()) {
                    // Keep-alive newline per the CCS event feed format
                    writer.write("\n");
                    writer.flush();
                    lastSend = System.nanoTime();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            logger.info("Event feed client disconnected (last token {})", cursor.lastDelivered());
        }
    }

    private static Map<String, String> language(String id, String name) {
        Map<String, String> language = new LinkedHashMap<>();
        language.put("id", id);
        language.put("name", name);
        return language;
    }

    private void requireContest(String requested) {
        if (!contestId.equals(requested)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Contest not found");
        }
    }
}
