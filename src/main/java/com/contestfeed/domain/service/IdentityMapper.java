package com.contestfeed.domain.service;

import com.contestfeed.domain.exception.UnmappedIdentifierException;

import java.util.Map;

/**
 * Translates scoreboard identifiers into contest-package identifiers.
 * Loaded once at startup; the tables never change while the process runs.
 */
public class IdentityMapper {

    private final Map<String, String> teams;
    private final Map<String, String> problems;

    public IdentityMapper(Map<String, String> teams, Map<String, String> problems) {
        this.teams = Map.copyOf(teams);
        this.problems = Map.copyOf(problems);
    }

    public String mapTeam(String externalId) {
        return lookup(teams, "team", externalId);
    }

    public String mapProblem(String externalId) {
        return lookup(problems, "problem", externalId);
    }

    public int teamCount() {
        return teams.size();
    }

    public int problemCount() {
        return problems.size();
    }

    private static String lookup(Map<String, String> table, String kind, String externalId) {
        String mapped = externalId == null ? null : table.get(externalId);
        if (mapped == null) {
            throw new UnmappedIdentifierException(kind, externalId);
        }
        return mapped;
    }
}
