package org.shygy.blackjack;

import org.junit.jupiter.api.Test;
import org.shygy.blackjack.config.BlackjackProperties;
import org.shygy.blackjack.console.ConsoleRunner;
import org.shygy.blackjack.service.GameSessionService;
import org.shygy.blackjack.service.engine.RoundEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
class BlackjackApplicationTest {

    @Autowired ApplicationContext ctx;
    @Autowired BlackjackProperties props;
    @Autowired GameSessionService sessions;
    @Autowired RoundEngine engine;

    @Test
    void contexte_chargeSansConsole() {
        assertThat(ctx.getBeansOfType(ConsoleRunner.class)).isEmpty();
        assertThat(sessions).isNotNull();
        assertThat(engine).isNotNull();
    }

    @Test
    void proprietes_valeursParDefautEtGraine() {
        assertThat(props.getDecks()).isEqualTo(6);
        assertThat(props.getDealerStandValue()).isEqualTo(17);
        assertThat(props.getStartingBalance()).isEqualTo(100);
        assertThat(props.getRefillAmount()).isEqualTo(50);
        assertThat(props.getSeed()).isEqualTo(42L);
        assertThat(sessions.newShoe().size()).isEqualTo(312);
    }
}
