package com.contestfeed.infrastructure.config;

import com.contestfeed.domain.ports.StateStore;
import com.contestfeed.domain.service.DiffEngine;
import com.contestfeed.domain.service.EventEmitter;
import com.contestfeed.domain.service.IdentityMapper;
import com.contestfeed.domain.service.SnapshotNormalizer;
import com.contestfeed.infrastructure.mapping.MappingFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Wires the synchronization engine.
 */
@Configuration
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public IdentityMapper identityMapper(
            @Value("${mapping.team-file:./team_mapping.yaml}") String teamFile,
            @Value("${mapping.problem-file:./problem_mapping.yaml}") String problemFile) throws IOException {
        IdentityMapper mapper = new IdentityMapper(
            MappingFileLoader.load(Path.of(teamFile)),
            MappingFileLoader.load(Path.of(problemFile))
        );
        logger.info("Identity mapper ready: {} teams, {} problems", mapper.teamCount(), mapper.problemCount());
        return mapper;
    }

    @Bean
    public SnapshotNormalizer snapshotNormalizer(
            IdentityMapper identityMapper,
            @Value("${contest.start-time:}") String startTime,
            @Value("${contest.default-language:cpp}") String languageId) {
        return new SnapshotNormalizer(identityMapper, parseStartTime(startTime), languageId);
    }

    @Bean
    public DiffEngine diffEngine(StateStore stateStore) {
        return new DiffEngine(stateStore);
    }

    @Bean
    public EventEmitter eventEmitter(StateStore stateStore) {
        return new EventEmitter(stateStore);
    }

    static OffsetDateTime parseStartTime(String startTime) {
        if (startTime == null || startTime.isBlank()) {
            OffsetDateTime now = OffsetDateTime.now();
            logger.warn("contest.start-time not set, using {} as contest start", now);
            return now;
        }
        try {
            return OffsetDateTime.parse(startTime.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("contest.start-time must be an ISO-8601 offset date-time: "
                + startTime, e);
        }
    }
}
