package com.contestfeed.domain.ports;

import com.contestfeed.domain.model.ScoreboardSnapshot;

/**
 * Port for polling the external scoreboard provider.
 */
public interface ScoreboardGateway {

    /**
     * Gets the name of the provider this gateway polls.
     *
     * @return Provider name (e.g., "algotester")
     */
    String getProviderName();

    /**
     * Fetches the complete current scoreboard.
     *
     * @return the scoreboard as observed now
     * @throws Exception if the provider cannot be reached or answers with garbage
     */
    ScoreboardSnapshot fetchSnapshot() throws Exception;
}
