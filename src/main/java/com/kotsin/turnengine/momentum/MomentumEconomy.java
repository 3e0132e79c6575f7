package com.kotsin.turnengine.momentum;

import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.exception.InsufficientMomentumException;
import com.kotsin.turnengine.exception.RallyUnavailableException;
import com.kotsin.turnengine.exception.RuleViolationException;
import com.kotsin.turnengine.ladder.Position;
import com.kotsin.turnengine.model.Crew;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.PlayerCharacter;
import com.kotsin.turnengine.model.Trait;
import com.kotsin.turnengine.validation.ReasonCode;
import com.kotsin.turnengine.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * MomentumEconomy - the crew's shared pool and the ways it moves.
 *
 * Rules:
 * - the pool always stays within [0, max]; gains above the cap are lost
 * - spending more than is available fails
 * - rally needs momentum at or below the threshold and an unused rally flag
 * - leaning into a trait always pays out, independent of rally
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MomentumEconomy {

    private final GameRulesConfig rules;

    public int momentumGain(Position position) {
        return position.getMomentumGain();
    }

    // ========== POOL ==========

    public int addMomentum(GameState state, String crewId, int amount, long timestamp) {
        Crew crew = state.requireCrew(crewId);
        int before = crew.getCurrentMomentum();
        int after = clamp((long) before + amount);
        crew.setCurrentMomentum(after);
        crew.setUpdatedAt(timestamp);
        if ((long) before + amount > after) {
            log.debug("Crew {} momentum capped at {}, {} lost", crewId, after, before + amount - after);
        }
        return after;
    }

    public int spendMomentum(GameState state, String crewId, int amount, long timestamp) {
        if (amount < 0) {
            throw new IllegalArgumentException("Momentum to spend must not be negative: " + amount);
        }
        Crew crew = state.requireCrew(crewId);
        if (amount > crew.getCurrentMomentum()) {
            throw new InsufficientMomentumException(crewId, amount, crew.getCurrentMomentum());
        }
        crew.setCurrentMomentum(crew.getCurrentMomentum() - amount);
        crew.setUpdatedAt(timestamp);
        return crew.getCurrentMomentum();
    }

    /**
     * Direct GM override, clamped.
     */
    public int setMomentum(GameState state, String crewId, int amount, long timestamp) {
        Crew crew = state.requireCrew(crewId);
        crew.setCurrentMomentum(clamp(amount));
        crew.setUpdatedAt(timestamp);
        return crew.getCurrentMomentum();
    }

    public ValidationResult validateSpend(GameState state, String crewId, int amount) {
        if (crewId == null || !state.getCrews().containsKey(crewId)) {
            return ValidationResult.fail(ReasonCode.NO_CREW);
        }
        if (amount > state.getCrews().get(crewId).getCurrentMomentum()) {
            return ValidationResult.fail(ReasonCode.INSUFFICIENT_MOMENTUM);
        }
        return ValidationResult.ok();
    }

    /**
     * Momentum back to the starting value and every member's rally restored. Clocks and traits are untouched.
     */
    public void resetCrew(GameState state, String crewId, long timestamp) {
        Crew crew = state.requireCrew(crewId);
        crew.setCurrentMomentum(rules.getMomentum().getStart());
        crew.setUpdatedAt(timestamp);
        for (String memberId : crew.getMemberIds()) {
            PlayerCharacter member = state.getCharacters().get(memberId);
            if (member != null) {
                member.setRallyAvailable(true);
                member.setUpdatedAt(timestamp);
            }
        }
        log.info("Crew {} reset: momentum {}, rally restored for {} members",
            crewId, crew.getCurrentMomentum(), crew.getMemberIds().size());
    }

    // ========== RALLY ==========

    public ValidationResult validateRally(GameState state, String characterId) {
        PlayerCharacter character = state.requireCharacter(characterId);
        Optional<Crew> crew = state.findCrewOf(characterId);
        if (crew.isEmpty()) {
            return ValidationResult.fail(ReasonCode.NO_CREW);
        }
        if (!character.isRallyAvailable()) {
            return ValidationResult.fail(ReasonCode.RALLY_USED);
        }
        int momentum = crew.get().getCurrentMomentum();
        if (momentum < 0 || momentum > rules.getMomentum().getRallyThreshold()) {
            return ValidationResult.fail(ReasonCode.MOMENTUM_TOO_HIGH);
        }
        return ValidationResult.ok();
    }

    /**
     * Spend {@code amount} momentum, optionally re-enable one disabled trait, and use up the rally.
     *
     * @param traitIdToReEnable may be {@code null}
     */
    public void rally(GameState state, String characterId, int amount, String traitIdToReEnable, long timestamp) {
        ValidationResult check = validateRally(state, characterId);
        if (!check.isValid()) {
            throw new RallyUnavailableException("Rally unavailable for " + characterId + ": " + check.getReason());
        }

        PlayerCharacter character = state.requireCharacter(characterId);
        Crew crew = state.findCrewOf(characterId).orElseThrow();

        Trait trait = null;
        if (traitIdToReEnable != null) {
            trait = character.findTrait(traitIdToReEnable)
                .orElseThrow(() -> new RuleViolationException(ReasonCode.TRAIT_NOT_FOUND,
                    "Trait " + traitIdToReEnable + " not found on " + characterId));
            if (!trait.isDisabled()) {
                throw new RuleViolationException(ReasonCode.TRAIT_NOT_DISABLED,
                    "Trait " + traitIdToReEnable + " is not disabled");
            }
        }

        spendMomentum(state, crew.getId(), amount, timestamp);
        if (trait != null) {
            trait.setDisabled(false);
        }
        character.setRallyAvailable(false);
        character.setUpdatedAt(timestamp);

        log.info("Character {} rallied: spent {}, crew momentum now {}", characterId, amount, crew.getCurrentMomentum());
    }

    // ========== LEAN INTO TRAIT ==========

    public ValidationResult validateLeanIntoTrait(GameState state, String characterId) {
        PlayerCharacter character = state.requireCharacter(characterId);
        if (state.findCrewOf(characterId).isEmpty()) {
            return ValidationResult.fail(ReasonCode.NO_CREW);
        }
        if (!character.hasEnabledTrait()) {
            return ValidationResult.fail(ReasonCode.NO_AVAILABLE_TRAITS);
        }
        return ValidationResult.ok();
    }

    public int leanIntoTrait(GameState state, String characterId, String traitId, long timestamp) {
        validateLeanIntoTrait(state, characterId).orThrow("Lean into trait");

        PlayerCharacter character = state.requireCharacter(characterId);
        Trait trait = character.findTrait(traitId)
            .orElseThrow(() -> new RuleViolationException(ReasonCode.TRAIT_NOT_FOUND,
                "Trait " + traitId + " not found on " + characterId));
        if (trait.isDisabled()) {
            throw new RuleViolationException(ReasonCode.TRAIT_DISABLED, "Trait " + traitId + " is already disabled");
        }

        trait.setDisabled(true);
        character.setUpdatedAt(timestamp);
        Crew crew = state.findCrewOf(characterId).orElseThrow();
        return addMomentum(state, crew.getId(), rules.getMomentum().getLeanIntoTraitGain(), timestamp);
    }

    private int clamp(long value) {
        return (int) Math.max(0, Math.min(rules.getMomentum().getMax(), value));
    }
}
