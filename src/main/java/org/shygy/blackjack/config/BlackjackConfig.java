package org.shygy.blackjack.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class BlackjackConfig {

    @Bean
    public Random shuffleRandom(BlackjackProperties props) {
        return props.getSeed() != null ? new Random(props.getSeed()) : new SecureRandom();
    }
}
