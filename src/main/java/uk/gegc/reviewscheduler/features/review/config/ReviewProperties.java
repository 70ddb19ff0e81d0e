package uk.gegc.reviewscheduler.features.review.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.review")
public class ReviewProperties {

    /**
     * A completion with the same quality arriving within this window of the last one is treated as a replay.
     */
    @NotNull
    private Duration replayWindow = Duration.ofSeconds(30);

    @Min(1)
    private int defaultDueLimit = 50;

    @Min(1)
    private int maxDueLimit = 200;

    @Min(1)
    private int maxBatchSize = 500;

    @Valid
    @NotNull
    private Sm2 sm2 = new Sm2();

    @Valid
    @NotNull
    private Calendar calendar = new Calendar();

    @Valid
    @NotNull
    private Reminders reminders = new Reminders();

    @Data
    public static class Sm2 {
        @DecimalMin("1.0")
        private double minEaseFactor = 1.3;

        @DecimalMin("1.0")
        private double initialEaseFactor = 2.5;

        @Min(1)
        private int lapseIntervalDays = 1;

        @Min(1)
        private int firstIntervalDays = 1;

        @Min(1)
        private int secondIntervalDays = 6;
    }

    @Data
    public static class Calendar {
        /**
         * Zone used to cut review days when a request does not name one.
         */
        @NotBlank
        private String zone = "UTC";

        /**
         * Minutes past local midnight at which a review day starts.
         */
        @Min(0)
        @Max(1439)
        private int dayCutoffMinutes = 0;
    }

    @Data
    public static class Reminders {
        @NotNull
        private Duration dueSoonWindow = Duration.ofHours(2);
    }
}
