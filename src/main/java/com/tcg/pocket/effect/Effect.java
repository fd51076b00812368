package com.tcg.pocket.effect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.tcg.pocket.card.EnergyType;
import com.tcg.pocket.game.StatusCondition;

import java.util.List;

/**
 * Effect descriptor: a closed set of composable primitives, deserialized from
 * card data by the "kind" field. Descriptors are immutable and shared by every
 * match; all runtime state lives in the match that resolves them.
 * Optional fields fall back to defaults in the compact constructors.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "kind"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Effect.Damage.class, name = "damage"),
    @JsonSubTypes.Type(value = Effect.BonusDamage.class, name = "bonus_damage"),
    @JsonSubTypes.Type(value = Effect.SetDamage.class, name = "set_damage"),
    @JsonSubTypes.Type(value = Effect.Heal.class, name = "heal"),
    @JsonSubTypes.Type(value = Effect.ApplyStatus.class, name = "apply_status"),
    @JsonSubTypes.Type(value = Effect.CureStatus.class, name = "cure_status"),
    @JsonSubTypes.Type(value = Effect.AttachEnergy.class, name = "attach_energy"),
    @JsonSubTypes.Type(value = Effect.MoveEnergy.class, name = "move_energy"),
    @JsonSubTypes.Type(value = Effect.DiscardEnergy.class, name = "discard_energy"),
    @JsonSubTypes.Type(value = Effect.MoveCards.class, name = "move_cards"),
    @JsonSubTypes.Type(value = Effect.Draw.class, name = "draw"),
    @JsonSubTypes.Type(value = Effect.ShuffleDeck.class, name = "shuffle_deck"),
    @JsonSubTypes.Type(value = Effect.CoinFlip.class, name = "coin_flip"),
    @JsonSubTypes.Type(value = Effect.Scaled.class, name = "scaled"),
    @JsonSubTypes.Type(value = Effect.Conditional.class, name = "conditional"),
    @JsonSubTypes.Type(value = Effect.Sequence.class, name = "sequence"),
    @JsonSubTypes.Type(value = Effect.SwitchActive.class, name = "switch_active"),
    @JsonSubTypes.Type(value = Effect.Modifier.class, name = "modifier"),
    @JsonSubTypes.Type(value = Effect.EndTurn.class, name = "end_turn"),
    @JsonSubTypes.Type(value = Effect.Unique.class, name = "unique")
})
public sealed interface Effect permits Effect.Damage, Effect.BonusDamage, Effect.SetDamage, Effect.Heal,
        Effect.ApplyStatus, Effect.CureStatus, Effect.AttachEnergy, Effect.MoveEnergy, Effect.DiscardEnergy,
        Effect.MoveCards, Effect.Draw, Effect.ShuffleDeck, Effect.CoinFlip, Effect.Scaled, Effect.Conditional,
        Effect.Sequence, Effect.SwitchActive, Effect.Modifier, Effect.EndTurn, Effect.Unique {

    /**
     * Put damage on a target directly. Ignores weakness and modifiers.
     */
    record Damage(
        @JsonProperty("amount") int amount,
        @JsonProperty("target") Target target
    ) implements Effect {
        public Damage {
            requirePositive(amount, "damage");
            if (target == null) {
                target = Target.OPPONENT_ACTIVE;
            }
        }
    }

    /**
     * Add to the damage of the attack being resolved.
     */
    record BonusDamage(@JsonProperty("amount") int amount) implements Effect {
    }

    /**
     * Replace the damage of the attack being resolved.
     */
    record SetDamage(@JsonProperty("amount") int amount) implements Effect {
        public SetDamage {
            if (amount < 0) {
                throw new IllegalArgumentException("set_damage amount cannot be negative");
            }
        }
    }

    record Heal(
        @JsonProperty("amount") int amount,
        @JsonProperty("target") Target target
    ) implements Effect {
        public Heal {
            requirePositive(amount, "heal");
            if (target == null) {
                target = Target.SELF;
            }
        }
    }

    record ApplyStatus(
        @JsonProperty("status") StatusCondition status,
        @JsonProperty("target") Target target
    ) implements Effect {
        public ApplyStatus {
            if (status == null) {
                throw new IllegalArgumentException("apply_status needs 'status'");
            }
            if (target == null) {
                target = Target.OPPONENT_ACTIVE;
            }
        }
    }

    /**
     * Remove every status condition from a target.
     */
    record CureStatus(@JsonProperty("target") Target target) implements Effect {
        public CureStatus {
            if (target == null) {
                target = Target.OWN_ACTIVE;
            }
        }
    }

    /**
     * Attach energy of the given type, created from nothing (energy zone style).
     */
    record AttachEnergy(
        @JsonProperty("energy") EnergyType energy,
        @JsonProperty("count") int count,
        @JsonProperty("target") Target target
    ) implements Effect {
        public AttachEnergy {
            if (energy == null) {
                throw new IllegalArgumentException("attach_energy needs 'energy'");
            }
            count = count <= 0 ? 1 : count;
            if (target == null) {
                target = Target.SELF;
            }
        }
    }

    /**
     * Move energy between two Pokémon of the same player. A null energy type
     * moves any type.
     */
    record MoveEnergy(
        @JsonProperty("energy") EnergyType energy,
        @JsonProperty("count") int count,
        @JsonProperty("all") boolean all,
        @JsonProperty("from") Target from,
        @JsonProperty("to") Target to
    ) implements Effect {
        public MoveEnergy {
            count = count <= 0 ? 1 : count;
            if (from == null || to == null) {
                throw new IllegalArgumentException("move_energy needs 'from' and 'to'");
            }
            if (!from.isSingle() || !to.isSingle()) {
                throw new IllegalArgumentException("move_energy endpoints must name one Pokémon");
            }
            if (from.getSide() != to.getSide()) {
                throw new IllegalArgumentException("move_energy endpoints must be on the same side");
            }
            if (from.isChosen() && to.isChosen()) {
                throw new IllegalArgumentException("move_energy can choose only one endpoint");
            }
        }
    }

    record DiscardEnergy(
        @JsonProperty("energy") EnergyType energy,
        @JsonProperty("count") int count,
        @JsonProperty("all") boolean all,
        @JsonProperty("target") Target target
    ) implements Effect {
        public DiscardEnergy {
            count = count <= 0 ? 1 : count;
            if (target == null) {
                target = Target.SELF;
            }
        }
    }

    /**
     * Move cards between zones of one player. Moving into the deck places
     * cards at the bottom; combine with {@link ShuffleDeck} to shuffle.
     */
    record MoveCards(
        @JsonProperty("side") Side side,
        @JsonProperty("from") Zone from,
        @JsonProperty("to") Zone to,
        @JsonProperty("count") int count,
        @JsonProperty("all") boolean all,
        @JsonProperty("filter") CardFilter filter,
        @JsonProperty("select") Selection selection
    ) implements Effect {
        public MoveCards {
            if (from == null || to == null || from == to) {
                throw new IllegalArgumentException("move_cards needs distinct 'from' and 'to' zones");
            }
            if (from == Zone.BENCH) {
                throw new IllegalArgumentException("move_cards cannot take cards from the bench");
            }
            if (side == null) {
                side = Side.OWN;
            }
            count = count <= 0 ? 1 : count;
            if (filter == null) {
                filter = to == Zone.BENCH ? CardFilter.BASIC : CardFilter.ANY;
            }
            if (to == Zone.BENCH && filter != CardFilter.BASIC) {
                throw new IllegalArgumentException("only basic Pokémon can be moved to the bench");
            }
            if (selection == null) {
                selection = Selection.FIRST;
            }
            if (selection == Selection.CHOSEN && (from != Zone.HAND || side != Side.OWN)) {
                throw new IllegalArgumentException("chosen selection is only available for your own hand");
            }
        }
    }

    /**
     * Draw cards. Drawing for the opponent is a forced draw.
     */
    record Draw(
        @JsonProperty("side") Side side,
        @JsonProperty("count") int count
    ) implements Effect {
        public Draw {
            if (side == null) {
                side = Side.OWN;
            }
            count = count <= 0 ? 1 : count;
        }
    }

    record ShuffleDeck(@JsonProperty("side") Side side) implements Effect {
        public ShuffleDeck {
            if (side == null) {
                side = Side.OWN;
            }
        }
    }

    /**
     * Flip coins; {@code onHeads} runs when every flip is heads, otherwise
     * {@code onTails}. Either branch may be absent.
     */
    record CoinFlip(
        @JsonProperty("flips") int flips,
        @JsonProperty("on_heads") Effect onHeads,
        @JsonProperty("on_tails") Effect onTails
    ) implements Effect {
        public CoinFlip {
            flips = flips <= 0 ? 1 : flips;
            if (onHeads == null && onTails == null) {
                throw new IllegalArgumentException("coin_flip needs 'on_heads' or 'on_tails'");
            }
        }
    }

    /**
     * Run the child effect once per counted unit.
     */
    record Scaled(
        @JsonProperty("counter") Counter counter,
        @JsonProperty("effect") Effect effect
    ) implements Effect {
        public Scaled {
            if (counter == null || effect == null) {
                throw new IllegalArgumentException("scaled needs 'counter' and 'effect'");
            }
        }
    }

    record Conditional(
        @JsonProperty("condition") Condition condition,
        @JsonProperty("then") Effect then,
        @JsonProperty("else") Effect otherwise
    ) implements Effect {
        public Conditional {
            if (condition == null || then == null) {
                throw new IllegalArgumentException("conditional needs 'condition' and 'then'");
            }
        }
    }

    record Sequence(@JsonProperty("effects") List<Effect> effects) implements Effect {
        public Sequence {
            if (effects == null || effects.isEmpty()) {
                throw new IllegalArgumentException("sequence needs at least one effect");
            }
            effects = List.copyOf(effects);
        }
    }

    /**
     * Switch the active Pokémon of a side with one of its benched Pokémon.
     * The new active is chosen by the controller unless {@code ownerChooses}
     * hands the choice to the bench's owner.
     */
    record SwitchActive(
        @JsonProperty("side") Side side,
        @JsonProperty("owner_chooses") boolean ownerChooses
    ) implements Effect {
        public SwitchActive {
            if (side == null) {
                side = Side.OWN;
            }
        }
    }

    record Modifier(
        @JsonProperty("modifier") ModifierKind modifier,
        @JsonProperty("amount") int amount,
        @JsonProperty("target") Target target,
        @JsonProperty("expiry") Expiry expiry
    ) implements Effect {
        public Modifier {
            if (modifier == null) {
                throw new IllegalArgumentException("modifier needs 'modifier'");
            }
            if (target == null) {
                target = Target.SELF;
            }
            if (expiry == null) {
                expiry = Expiry.THIS_TURN;
            }
        }
    }

    /**
     * End the controller's turn once the current resolution finishes.
     */
    record EndTurn() implements Effect {
    }

    /**
     * A named one-off behaviour for cards no primitive composition captures.
     */
    record Unique(@JsonProperty("name") String name) implements Effect {
        public static final String COPYCAT = "copycat";
        public static final String POKEMON_COMMUNICATION = "pokemon_communication";

        public Unique {
            if (!COPYCAT.equals(name) && !POKEMON_COMMUNICATION.equals(name)) {
                throw new IllegalArgumentException("Unknown unique effect: " + name);
            }
        }
    }

    private static void requirePositive(int amount, String kind) {
        if (amount <= 0) {
            throw new IllegalArgumentException(kind + " amount must be positive: " + amount);
        }
    }
}
