package com.swisspair.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Tournament defaults and session ownership settings.
 */
@Getter
@Setter
@Component
@Validated
@ConfigurationProperties(prefix = "swiss")
public class SwissTournamentProperties {

    @Valid
    private Tournament tournament = new Tournament();

    @Valid
    private Session session = new Session();

    @Getter
    @Setter
    public static class Tournament {
        /**
         * Rounds to play when a session does not request a count. Zero derives it from the
         * player count (log2 of the even player count, rounded up).
         */
        @Min(0)
        private int defaultRoundCount = 0;
    }

    @Getter
    @Setter
    public static class Session {
        /**
         * How long a caller waits to become the owner of a busy session.
         */
        @Min(0)
        private long lockTimeoutMs = 5_000;

        /**
         * Sessions that never paired a round are dropped after this long without use. Zero keeps them.
         */
        @Min(0)
        private long idleTimeoutMs = 1_800_000;
    }
}
