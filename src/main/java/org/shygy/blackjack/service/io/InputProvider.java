package org.shygy.blackjack.service.io;

import org.shygy.blackjack.dto.Decision;
import org.shygy.blackjack.dto.Prompt;

/** Source des décisions du joueur. Appel bloquant, une décision à la fois. */
public interface InputProvider {
    Decision request(Prompt prompt);
}
