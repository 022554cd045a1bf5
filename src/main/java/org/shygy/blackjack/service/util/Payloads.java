package org.shygy.blackjack.service.util;

import org.shygy.blackjack.model.*;
import org.shygy.blackjack.model.rules.HandRules;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class Payloads {

    public Map<String, Object> hand(Hand h) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("cards", List.copyOf(h.getCards()));
        m.put("total", h.value());
        m.put("soft", HandRules.isSoft(h.getCards()));
        m.put("busted", h.isBust());
        m.put("blackjack", h.isBlackjack());
        if (h instanceof PlayerHand p) {
            m.put("bet", p.getBet());
            m.put("doubled", p.isDoubled());
            m.put("standing", p.isStanding());
            m.put("split", p.isSplit());
        }
        return m;
    }

    public List<Map<String, Object>> hands(RoundState r) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (int i = 0; i < r.getHands().size(); i++) {
            Map<String, Object> m = hand(r.getHands().get(i));
            m.put("index", i);
            out.add(m);
        }
        return out;
    }

    /** Main du croupier avec la carte cachée : seule la première carte est exposée. */
    public Map<String, Object> dealerUp(RoundState r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("upCard", r.dealerUpCard());
        m.put("hidden", Math.max(0, r.getDealer().size() - 1));
        return m;
    }

    public Map<String, Object> result(HandResult res) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("hand", res.handIndex());
        m.put("outcome", res.outcome().name());
        m.put("stake", res.stake());
        m.put("credit", res.credit());
        m.put("net", res.net());
        return m;
    }
}
