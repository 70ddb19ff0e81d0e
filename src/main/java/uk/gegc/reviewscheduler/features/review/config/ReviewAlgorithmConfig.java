package uk.gegc.reviewscheduler.features.review.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.reviewscheduler.features.review.application.SrsAlgorithm;
import uk.gegc.reviewscheduler.features.review.application.impl.Sm2Algorithm;

@Configuration
public class ReviewAlgorithmConfig {

    @Bean
    public SrsAlgorithm srsAlgorithm(ReviewProperties properties) {
        return new Sm2Algorithm(properties.getSm2());
    }
}
