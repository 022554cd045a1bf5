package org.shygy.blackjack.service.io;

import org.shygy.blackjack.dto.RoundEvent;

public interface OutputSink {
    void emit(RoundEvent event);
}
