package org.shygy.blackjack.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "blackjack")
public class BlackjackProperties {
    @Min(1)
    private int decks = 6;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double reshuffleThreshold = 0.2;

    @Min(2)
    private int dealerStandValue = 17;

    @Min(1)
    private long startingBalance = 100;

    @Min(1)
    private long refillAmount = 50;

    /** Graine du mélange ; absente = SecureRandom. */
    private Long seed;

    @Valid
    private Console console = new Console();

    @Data
    public static class Console {
        private boolean enabled = true;
    }
}
