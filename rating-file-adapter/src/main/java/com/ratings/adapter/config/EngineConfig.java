package com.ratings.adapter.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.ratings.adapter.exception.ConfigException;
import com.ratings.engine.config.RatingConfig;
import com.ratings.engine.engine.RatingEngine;
import com.ratings.engine.validation.TournamentValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine and CSV mapper beans.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    private final RatingEngineProperties properties;

    public EngineConfig(RatingEngineProperties properties) {
        this.properties = properties;
    }

    @Bean
    public TournamentValidator tournamentValidator() {
        return new TournamentValidator();
    }

    @Bean
    public RatingEngine ratingEngine(TournamentValidator tournamentValidator) {
        RatingConfig config;
        try {
            config = properties.toRatingConfig();
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid rating.engine settings: " + e.getMessage(), e);
        }
        RatingEngine engine = new RatingEngine(config, tournamentValidator);
        log.info("Rating engine configured: {}", engine.getConfig());
        return engine;
    }

    @Bean
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
    }
}
