package com.contestfeed.infrastructure.scraper.algotester;

import com.contestfeed.domain.model.ScoreboardRow;
import com.contestfeed.domain.model.ScoreboardSnapshot;
import com.contestfeed.domain.ports.ScoreboardGateway;
import com.contestfeed.infrastructure.scraper.HttpClientUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scoreboard gateway for Algotester contests.
 */
@Component
public class AlgotesterScraper implements ScoreboardGateway {

    private static final Logger logger = LoggerFactory.getLogger(AlgotesterScraper.class);

    private static final String PROVIDER_NAME = "algotester";
    private static final String BASE_URL = "https://%s.algotester.com/en/Contest/ListScoreboardWithAPI/%d";
    // Safety stop in case the provider keeps returning full pages
    private static final int MAX_PAGES = 1000;

    private final String scoreboardUrl;
    private final Map<String, String> headers;
    private final int pageSize;
    private final boolean showUnofficial;
    private final Duration timeout;

    public AlgotesterScraper(
            @Value("${algotester.api-key:}") String apiKey,
            @Value("${algotester.subdomain:algotester}") String subdomain,
            @Value("${algotester.contest-id:0}") long contestId,
            @Value("${algotester.page-size:100}") int pageSize,
            @Value("${algotester.show-unofficial:false}") boolean showUnofficial,
            @Value("${algotester.timeout-seconds:30}") long timeoutSeconds) {
        this.scoreboardUrl = String.format(BASE_URL, subdomain, contestId);
        this.headers = Map.of(
            "X-Requested-With", "XMLHttpRequest",
            "X-API-Key", apiKey,
            "accept", "application/json"
        );
        this.pageSize = pageSize;
        this.showUnofficial = showUnofficial;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public ScoreboardSnapshot fetchSnapshot() throws IOException {
        List<ScoreboardRow> rows = new ArrayList<>();
        int offset = 0;

        for (int page = 0; page < MAX_PAGES; page++) {
            Map<String, String> params = Map.of(
                "showUnofficial", String.valueOf(showUnofficial),
                "offset", String.valueOf(offset),
                "limit", String.valueOf(pageSize)
            );
            JsonNode response = HttpClientUtil.getJson(scoreboardUrl, params, headers, timeout);
            JsonNode pageRows = response.path("rows");
            if (!pageRows.isArray()) {
                throw new IOException("Scoreboard response has no rows array");
            }

            // A row that cannot be parsed makes the snapshot incomplete, so the whole tick fails
            for (JsonNode row : pageRows) {
                rows.add(AlgotesterRowParser.parseRow(row));
            }

            if (pageRows.size() < pageSize) {
                logger.debug("Fetched {} scoreboard rows in {} pages", rows.size(), page + 1);
                return new ScoreboardSnapshot(rows);
            }
            offset += pageSize;
        }

        throw new IOException("Scoreboard pagination did not terminate after " + MAX_PAGES + " pages");
    }
}
