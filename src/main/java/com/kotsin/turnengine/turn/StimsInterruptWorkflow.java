package com.kotsin.turnengine.turn;

import com.kotsin.turnengine.clock.ClockService;
import com.kotsin.turnengine.command.Commands;
import com.kotsin.turnengine.config.GameConstants;
import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.dice.DiceResolutionEngine;
import com.kotsin.turnengine.dice.DiceRoller;
import com.kotsin.turnengine.dice.RollResult;
import com.kotsin.turnengine.exception.RuleViolationException;
import com.kotsin.turnengine.exception.TurnStateException;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.Crew;
import com.kotsin.turnengine.model.GameClock;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.TraitCategory;
import com.kotsin.turnengine.model.turn.PlayerTurnState;
import com.kotsin.turnengine.model.turn.TurnState;
import com.kotsin.turnengine.notification.NotificationCode;
import com.kotsin.turnengine.notification.NotificationPublisher;
import com.kotsin.turnengine.notification.TurnNotification;
import com.kotsin.turnengine.store.GameStateStore;
import com.kotsin.turnengine.store.IdGenerator;
import com.kotsin.turnengine.validation.ReasonCode;
import com.kotsin.turnengine.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * StimsInterruptWorkflow - reroll a partial or failure at the price of addiction.
 *
 * Steps, each committed before the next starts:
 * 1. find or create the character's addiction clock
 * 2. roll one die for addiction
 * 3. advance the addiction clock and mark stims used
 * 4. full clock: grant Addict and lock the turn, no reroll
 * 5. otherwise reroll the same pool, replacing the previous outcome
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StimsInterruptWorkflow {

    private final GameStateStore store;
    private final ClockService clockService;
    private final DiceResolutionEngine diceEngine;
    private final DiceRoller diceRoller;
    private final GameRulesConfig rules;
    private final IdGenerator idGenerator;
    private final NotificationPublisher notificationPublisher;

    public ValidationResult validate(String characterId) {
        return validate(store.getState(), characterId);
    }

    private ValidationResult validate(GameState state, String characterId) {
        PlayerTurnState turn = state.getTurns().get(characterId);
        if (turn == null) {
            return ValidationResult.fail(ReasonCode.NO_ACTIVE_TURN);
        }
        if (turn.getState() != TurnState.GM_RESOLVING_CONSEQUENCE) {
            return ValidationResult.fail(ReasonCode.INVALID_STATE);
        }
        Optional<Crew> crew = state.findCrewOf(characterId);
        if (crew.isEmpty()) {
            return ValidationResult.fail(ReasonCode.NO_CREW);
        }
        if (turn.isStimsUsed()) {
            return ValidationResult.fail(ReasonCode.STIMS_ALREADY_USED);
        }
        if (clockService.isStimsLockedForCrew(state, crew.get())) {
            return ValidationResult.fail(ReasonCode.TEAM_ADDICTION_LOCKED);
        }
        return ValidationResult.ok();
    }

    public StimsResult useStims(String characterId, String userId) {
        GameState state = store.getState();
        ValidationResult check = validate(state, characterId);
        if (!check.isValid()) {
            if (ReasonCode.NO_ACTIVE_TURN.equals(check.getReason()) || ReasonCode.INVALID_STATE.equals(check.getReason())) {
                throw new TurnStateException("Cannot use stims for " + characterId + ": " + check.getReason());
            }
            throw new RuleViolationException(check.getReason(), "Cannot use stims for " + characterId + ": " + check.getReason());
        }

        // 1. addiction clock
        String clockId = clockService.findAddictionClock(state, characterId)
            .map(GameClock::getId)
            .orElseGet(() -> createAddictionClock(characterId, userId));

        // 2. addiction roll
        int addictionRoll = clampAddictionRoll(diceRoller.rollDie());

        // 3. advance and mark used
        state = store.dispatch(List.of(
            Commands.addSegments(clockId, addictionRoll),
            Commands.markStimsUsed(characterId)), userId);
        GameClock addiction = state.requireClock(clockId);
        log.info("{} used stims: addiction +{} -> {}/{}", characterId, addictionRoll,
            addiction.getSegments(), addiction.getMaxSegments());
        notificationPublisher.publish(TurnNotification.of(NotificationCode.STIMS_USED, characterId, Map.of(
            "addictionRoll", addictionRoll,
            "segments", addiction.getSegments(),
            "maxSegments", addiction.getMaxSegments())));

        StimsResult.StimsResultBuilder result = StimsResult.builder()
            .addictionClockId(clockId)
            .addictionRoll(addictionRoll)
            .addictionSegments(addiction.getSegments())
            .addictionMaxSegments(addiction.getMaxSegments());

        // 4. addiction capped
        if (clockService.isFull(addiction)) {
            lockOut(state, characterId, userId);
            return result.locked(true).build();
        }

        // 5. reroll
        store.dispatch(Commands.transition(characterId, TurnState.STIMS_ROLLING, "stims reroll"), userId);
        int pool = state.requireTurn(characterId).getDicePool();
        RollResult reroll = diceEngine.roll(pool, diceRoller);
        store.dispatch(List.of(
            Commands.transition(characterId, TurnState.ROLLING, "rerolling"),
            Commands.recordRoll(characterId, reroll)), userId);

        log.info("{} rerolled {} dice on stims: {} -> {}", characterId, pool, reroll.getDice(), reroll.getOutcome());
        notificationPublisher.publish(TurnNotification.of(NotificationCode.ROLL_RESOLVED, characterId, Map.of(
            "dicePool", pool,
            "dice", reroll.getDice(),
            "outcome", reroll.getOutcome().name(),
            "stims", true)));
        return result.locked(false).reroll(reroll).build();
    }

    /**
     * Faces outside 1..6 are clamped; anything below 1 counts as 1.
     */
    int clampAddictionRoll(int raw) {
        if (raw < 1) {
            return 1;
        }
        return Math.min(raw, GameConstants.DIE_FACES);
    }

    private String createAddictionClock(String characterId, String userId) {
        String clockId = idGenerator.nextId();
        store.dispatch(Commands.createClock(clockId, characterId, ClockType.ADDICTION,
            GameConstants.ADDICTION_CLOCK_SUBTYPE, rules.getClocks().getAddictionSegments(), null, null), userId);
        log.debug("Created addiction clock {} for {}", clockId, characterId);
        return clockId;
    }

    private void lockOut(GameState state, String characterId, String userId) {
        boolean alreadyAddict = state.requireCharacter(characterId).getTraits().stream()
            .anyMatch(trait -> GameConstants.ADDICT_TRAIT_NAME.equals(trait.getName())
                && trait.getCategory() == TraitCategory.SCAR);

        if (alreadyAddict) {
            store.dispatch(Commands.transition(characterId, TurnState.STIMS_LOCKED, "addiction full"), userId);
        } else {
            store.dispatch(List.of(
                Commands.addTrait(characterId, idGenerator.nextId(), GameConstants.ADDICT_TRAIT_NAME,
                    TraitCategory.SCAR, GameConstants.ADDICT_TRAIT_DESCRIPTION),
                Commands.transition(characterId, TurnState.STIMS_LOCKED, "addiction full")), userId);
        }

        String crewId = state.findCrewOf(characterId).map(Crew::getId).orElse(null);
        log.warn("{} is addicted; stims locked for crew {}", characterId, crewId);
        notificationPublisher.publish(TurnNotification.of(NotificationCode.STIMS_LOCKED, characterId,
            Map.of("crewId", String.valueOf(crewId))));
    }
}
