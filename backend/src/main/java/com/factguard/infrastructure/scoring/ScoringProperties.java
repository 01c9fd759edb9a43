package com.factguard.infrastructure.scoring;

import com.factguard.domain.validation.model.Severity;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Scoring weights, defaults and decision thresholds. Binds to {@code factguard.scoring.*}.
 * Defaults reproduce the production weighting; override per deployment in application.yml.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "factguard.scoring")
public class ScoringProperties {

    private Weights weights = new Weights();
    private Fact fact = new Fact();
    private Compliance compliance = new Compliance();
    private Thresholds thresholds = new Thresholds();

    /** Fixed clarity score used until a dedicated clarity model exists. */
    private double clarity = 0.8;

    @Getter
    @Setter
    public static class Weights {
        private double fact = 0.25;
        private double consistency = 0.10;
        private double citation = 0.15;
        private double compliance = 0.25;
        private double clarity = 0.20;
    }

    @Getter
    @Setter
    public static class Fact {
        /** Fact score when no checkable claims were extracted. */
        private double noClaims = 0.7;
        /** Contribution of an unverified claim. */
        private double unverified = 0.6;
        /** Contribution of a false claim, before clipping the average to [0, 1]. */
        private double falseClaim = -1.0;
    }

    @Getter
    @Setter
    public static class Compliance {
        private double low = 0.9;
        private double medium = 0.7;
        private double high = 0.4;
        private double critical = 0.0;

        public double scoreFor(Severity severity) {
            return switch (severity) {
                case LOW -> low;
                case MEDIUM -> medium;
                case HIGH -> high;
                case CRITICAL -> critical;
            };
        }
    }

    @Getter
    @Setter
    public static class Thresholds {
        /** Scores below this are flagged. */
        private double flag = 0.6;
        /** High-severity violations block below this score. */
        private double block = 0.3;
        /** Minimum confidence of a false claim for the low-score blocking path. */
        private double blockingFalseConfidence = 0.85;
    }
}
