package com.kotsin.turnengine.resolution;

import com.kotsin.turnengine.config.GameConstants;
import com.kotsin.turnengine.ladder.Position;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.PlayerCharacter;
import com.kotsin.turnengine.model.Trait;
import com.kotsin.turnengine.model.TraitCategory;
import com.kotsin.turnengine.model.turn.PlayerTurnState;
import com.kotsin.turnengine.model.turn.TraitTransaction;
import com.kotsin.turnengine.validation.ReasonCode;
import com.kotsin.turnengine.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Resolves trait use as part of a turn.
 *
 * EXISTING leaves the character untouched, NEW adds a flashback trait, CONSOLIDATE replaces
 * three traits with one grouped trait. The position bonus is only ever derived, see
 * {@link #effectivePosition(PlayerTurnState)}.
 */
@Slf4j
@Component
public class TraitTransactionResolver {

    public ValidationResult validate(PlayerCharacter character, TraitTransaction transaction) {
        if (transaction == null || transaction.getMode() == null) {
            return ValidationResult.fail(ReasonCode.NO_TRAIT_SELECTED);
        }

        return switch (transaction.getMode()) {
            case EXISTING -> validateExisting(character, transaction);
            case NEW -> isBlank(transaction.getNewTraitName())
                ? ValidationResult.fail(ReasonCode.MISSING_TRAIT_NAME)
                : ValidationResult.ok();
            case CONSOLIDATE -> validateConsolidate(character, transaction);
        };
    }

    private ValidationResult validateExisting(PlayerCharacter character, TraitTransaction transaction) {
        if (transaction.getTraitId() == null) {
            return ValidationResult.fail(ReasonCode.NO_TRAIT_SELECTED);
        }
        Optional<Trait> trait = character.findTrait(transaction.getTraitId());
        if (trait.isEmpty()) {
            return ValidationResult.fail(ReasonCode.TRAIT_NOT_FOUND);
        }
        if (trait.get().isDisabled()) {
            return ValidationResult.fail(ReasonCode.TRAIT_DISABLED);
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateConsolidate(PlayerCharacter character, TraitTransaction transaction) {
        List<String> ids = transaction.getConsolidatedTraitIds();
        if (ids == null || ids.size() != GameConstants.CONSOLIDATE_TRAIT_COUNT
            || new HashSet<>(ids).size() != GameConstants.CONSOLIDATE_TRAIT_COUNT) {
            return ValidationResult.fail(ReasonCode.CONSOLIDATE_NEEDS_THREE);
        }
        if (ids.stream().anyMatch(id -> character.findTrait(id).isEmpty())) {
            return ValidationResult.fail(ReasonCode.TRAIT_NOT_FOUND);
        }
        if (isBlank(transaction.getNewTraitName())) {
            return ValidationResult.fail(ReasonCode.MISSING_TRAIT_NAME);
        }
        return ValidationResult.ok();
    }

    /**
     * Apply the character-side mutation of a transaction.
     *
     * @param newTraitId id for the trait created by NEW or CONSOLIDATE
     * @return the created trait, empty for EXISTING
     */
    public Optional<Trait> apply(GameState state, String characterId, TraitTransaction transaction,
                                 String newTraitId, long timestamp) {
        PlayerCharacter character = state.requireCharacter(characterId);
        validate(character, transaction).orThrow("Trait transaction for " + characterId);

        Trait created = switch (transaction.getMode()) {
            case EXISTING -> null;
            case NEW -> newTrait(newTraitId, transaction, TraitCategory.FLASHBACK, timestamp);
            case CONSOLIDATE -> {
                character.getTraits().removeIf(t -> transaction.getConsolidatedTraitIds().contains(t.getId()));
                yield newTrait(newTraitId, transaction, TraitCategory.GROUPED, timestamp);
            }
        };

        if (created != null) {
            character.getTraits().add(created);
            character.setUpdatedAt(timestamp);
            log.info("Character {} gained {} trait '{}'", characterId, created.getCategory(), created.getName());
        }
        return Optional.ofNullable(created);
    }

    private Trait newTrait(String id, TraitTransaction transaction, TraitCategory category, long timestamp) {
        return Trait.builder()
            .id(id)
            .name(transaction.getNewTraitName())
            .description(transaction.getNewTraitDescription())
            .category(category)
            .disabled(false)
            .acquiredAt(timestamp)
            .build();
    }

    /**
     * Base position raised one rung while a transaction with a position bonus is attached.
     */
    public Position effectivePosition(PlayerTurnState turn) {
        TraitTransaction transaction = turn.getTraitTransaction();
        if (transaction != null && transaction.isPositionImprovement()) {
            return turn.getPosition().improve();
        }
        return turn.getPosition();
    }

    public int momentumCost(TraitTransaction transaction) {
        if (transaction == null || !transaction.isPositionImprovement()) {
            return 0;
        }
        return GameConstants.TRAIT_TRANSACTION_COST;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
