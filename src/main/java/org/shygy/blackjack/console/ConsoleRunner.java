package org.shygy.blackjack.console;

import lombok.RequiredArgsConstructor;
import org.shygy.blackjack.config.BlackjackProperties;
import org.shygy.blackjack.service.GameSessionService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "blackjack.console", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleRunner implements CommandLineRunner {
    private final GameSessionService sessions;
    private final BlackjackProperties props;

    @Override
    public void run(String... args) {
        System.out.println("Welcome to Blackjack! You start with " + props.getStartingBalance() + " Rocks.");
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        sessions.run(new ConsoleInputProvider(in, System.out));
    }
}
