package org.shygy.blackjack.model;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;
import static org.shygy.blackjack.model.Card.Rank.*;

class ShoeTest {

    @Test
    void create_sixPaquets_312Cartes() {
        Shoe shoe = Shoe.create(6);

        assertThat(shoe.size()).isEqualTo(312);
        assertThat(shoe.getCapacity()).isEqualTo(312);
        assertThat(shoe.getReshuffleThreshold()).isEqualTo(0.2);
    }

    @Test
    void create_unPaquet_chaqueCarteUneFois() {
        Shoe shoe = new Shoe(1, 0.2, new Random(3));
        Set<Card> seen = new HashSet<>();
        for (int i = 0; i < 52; i++) seen.add(shoe.draw());

        assertThat(seen).hasSize(52);
    }

    @Test
    void draw_sabotVide_unSeulRemelangeEt311Restantes() {
        Shoe shoe = new Shoe(6, 0.2, new Random(1));
        for (int i = 0; i < 312; i++) shoe.draw();
        assertThat(shoe.size()).isZero();
        assertThat(shoe.getReshuffleCount()).isZero();

        Card c = shoe.draw();

        assertThat(c).isNotNull();
        assertThat(shoe.getReshuffleCount()).isEqualTo(1);
        assertThat(shoe.size()).isEqualTo(311);
        assertThat(shoe.getCapacity()).isEqualTo(312);
    }

    @Test
    void needsReshuffle_sousLeSeuilDe20Pourcent() {
        Shoe shoe = new Shoe(1, 0.2, new Random(5));
        for (int i = 0; i < 41; i++) shoe.draw();
        // 11 cartes restantes, seuil 52 * 0.2 = 10.4
        assertThat(shoe.needsReshuffle()).isFalse();

        shoe.draw();

        assertThat(shoe.needsReshuffle()).isTrue();
    }

    @Test
    void reshuffle_recomposeUnSabotComplet() {
        Shoe shoe = new Shoe(2, 0.5, new Random(9));
        for (int i = 0; i < 80; i++) shoe.draw();
        assertThat(shoe.needsReshuffle()).isTrue();

        shoe.reshuffle();

        assertThat(shoe.size()).isEqualTo(104);
        assertThat(shoe.needsReshuffle()).isFalse();
        assertThat(shoe.getReshuffleCount()).isEqualTo(1);
    }

    @Test
    void memeGraine_memeOrdre() {
        Shoe a = new Shoe(6, 0.2, new Random(77));
        Shoe b = new Shoe(6, 0.2, new Random(77));

        for (int i = 0; i < 50; i++) assertThat(a.draw()).isEqualTo(b.draw());
    }

    @Test
    void stacked_tireDansLOrdreImpose_puisSeRecompose() {
        Shoe shoe = Cards.stacked(ACE, KING, TWO);

        assertThat(shoe.draw().getRank()).isEqualTo(ACE);
        assertThat(shoe.draw().getRank()).isEqualTo(KING);
        assertThat(shoe.draw().getRank()).isEqualTo(TWO);
        assertThat(shoe.draw()).isNotNull();
        assertThat(shoe.size()).isEqualTo(311);
    }

    @Test
    void constructeur_refuseUneConfigurationInvalide() {
        assertThatThrownBy(() -> new Shoe(0, 0.2, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Shoe(6, 1.5, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
