package com.tcg.pocket.card;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Unified card definition - a sealed interface over the four card types.
 * Uses Jackson polymorphic deserialization based on the "card_type" field.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "card_type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Card.Pokemon.class, name = "pokemon"),
    @JsonSubTypes.Type(value = Card.Item.class, name = "item"),
    @JsonSubTypes.Type(value = Card.Supporter.class, name = "supporter"),
    @JsonSubTypes.Type(value = Card.Tool.class, name = "tool")
})
public sealed interface Card permits Card.Pokemon, Card.Item, Card.Supporter, Card.Tool {

    String getId();
    String getName();
    CardCategory getCategory();

    default boolean isPokemon() {
        return getCategory().isPokemon();
    }

    default boolean isBasicPokemon() {
        return getCategory() == CardCategory.BASIC;
    }

    /**
     * Pokémon card wrapper. Category follows the printed stage.
     */
    final class Pokemon extends PokemonCard implements Card {
        @Override
        public CardCategory getCategory() {
            return getStage() == Stage.BASIC ? CardCategory.BASIC : CardCategory.EVOLUTION;
        }
    }

    /**
     * Item wrapper
     */
    final class Item extends TrainerCard implements Card {
        @Override
        public CardCategory getCategory() {
            return CardCategory.ITEM;
        }
    }

    /**
     * Supporter wrapper
     */
    final class Supporter extends TrainerCard implements Card {
        @Override
        public CardCategory getCategory() {
            return CardCategory.SUPPORTER;
        }
    }

    /**
     * Tool wrapper
     */
    final class Tool extends TrainerCard implements Card {
        @Override
        public CardCategory getCategory() {
            return CardCategory.TOOL;
        }
    }
}
