package com.tcg.pocket.effect;

import com.tcg.pocket.card.Card;
import com.tcg.pocket.card.CardCategory;

/**
 * Card predicate used by zone movement.
 */
public enum CardFilter {
    ANY,
    POKEMON,
    BASIC,
    EVOLUTION,
    TRAINER,
    ITEM,
    SUPPORTER,
    TOOL;

    public boolean matches(Card card) {
        CardCategory category = card.getCategory();
        return switch (this) {
            case ANY -> true;
            case POKEMON -> category.isPokemon();
            case BASIC -> category == CardCategory.BASIC;
            case EVOLUTION -> category == CardCategory.EVOLUTION;
            case TRAINER -> category.isTrainer();
            case ITEM -> category == CardCategory.ITEM;
            case SUPPORTER -> category == CardCategory.SUPPORTER;
            case TOOL -> category == CardCategory.TOOL;
        };
    }
}
