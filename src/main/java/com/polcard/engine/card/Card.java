package com.polcard.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Unified card type, a sealed interface over the four card categories.
 * Uses Jackson polymorphic deserialization based on the "cardType" field.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "cardType"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Card.Character.class, name = "character"),
    @JsonSubTypes.Type(value = Card.Help.class, name = "help"),
    @JsonSubTypes.Type(value = Card.Sp.class, name = "sp"),
    @JsonSubTypes.Type(value = Card.Leader.class, name = "leader")
})
public sealed interface Card permits Card.Character, Card.Help, Card.Sp, Card.Leader {

    String getId();
    String getName();
    String getGameType();
    int getPower();
    List<String> getTraits();
    CardEffects getEffects();
    boolean hasTrait(String trait);
    boolean hasEffectRules();

    @JsonIgnore
    CardCategory getCardType();

    /**
     * Character card, placed in top/left/right and counted in battle.
     */
    final class Character extends BaseCard implements Card {
        @Override
        @JsonIgnore
        public CardCategory getCardType() {
            return CardCategory.CHARACTER;
        }
    }

    /**
     * Help card, placed face-up in the help zone during the main phase.
     */
    final class Help extends BaseCard implements Card {
        @Override
        @JsonIgnore
        public CardCategory getCardType() {
            return CardCategory.HELP;
        }
    }

    /**
     * SP card, placed face-down in the sp zone and revealed before battle.
     */
    final class Sp extends BaseCard implements Card {
        @Override
        @JsonIgnore
        public CardCategory getCardType() {
            return CardCategory.SP;
        }
    }

    /**
     * Leader card
     */
    final class Leader extends LeaderCard implements Card {
        @Override
        @JsonIgnore
        public CardCategory getCardType() {
            return CardCategory.LEADER;
        }
    }
}
