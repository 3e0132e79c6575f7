package com.kotsin.turnengine.turn;

import com.kotsin.turnengine.clock.ClockService;
import com.kotsin.turnengine.command.Command;
import com.kotsin.turnengine.command.Commands;
import com.kotsin.turnengine.config.GameConstants;
import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.dice.DiceResolutionEngine;
import com.kotsin.turnengine.dice.DiceRoller;
import com.kotsin.turnengine.dice.RollResult;
import com.kotsin.turnengine.exception.EngineConfigurationException;
import com.kotsin.turnengine.exception.InsufficientMomentumException;
import com.kotsin.turnengine.exception.RuleViolationException;
import com.kotsin.turnengine.exception.TurnStateException;
import com.kotsin.turnengine.ladder.Effect;
import com.kotsin.turnengine.ladder.Position;
import com.kotsin.turnengine.model.Approach;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.Crew;
import com.kotsin.turnengine.model.Equipment;
import com.kotsin.turnengine.model.GameClock;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.PlayerCharacter;
import com.kotsin.turnengine.model.turn.ConsequenceTransaction;
import com.kotsin.turnengine.model.turn.ConsequenceType;
import com.kotsin.turnengine.model.turn.PlayerTurnState;
import com.kotsin.turnengine.model.turn.PushType;
import com.kotsin.turnengine.model.turn.RollMode;
import com.kotsin.turnengine.model.turn.TraitTransaction;
import com.kotsin.turnengine.model.turn.TurnState;
import com.kotsin.turnengine.notification.NotificationCode;
import com.kotsin.turnengine.notification.NotificationPublisher;
import com.kotsin.turnengine.notification.TurnNotification;
import com.kotsin.turnengine.resolution.ConsequencePlan;
import com.kotsin.turnengine.resolution.ConsequenceResolver;
import com.kotsin.turnengine.resolution.DefensiveSuccessValues;
import com.kotsin.turnengine.resolution.TraitTransactionResolver;
import com.kotsin.turnengine.store.GameStateStore;
import com.kotsin.turnengine.store.IdGenerator;
import com.kotsin.turnengine.validation.ReasonCode;
import com.kotsin.turnengine.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * PlayerTurnStateMachine - drives one character's turn from decision to completion.
 *
 * Every operation reads the current state, checks it, and commits its effect as one batch.
 * Checks that a player can correct come back as {@link ValidationResult}; operations invoked
 * from the wrong state throw {@link TurnStateException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerTurnStateMachine {

    private final GameStateStore store;
    private final DiceResolutionEngine diceEngine;
    private final DiceRoller diceRoller;
    private final ConsequenceResolver consequenceResolver;
    private final TraitTransactionResolver traitTransactionResolver;
    private final ClockService clockService;
    private final GameRulesConfig rules;
    private final IdGenerator idGenerator;
    private final NotificationPublisher notificationPublisher;

    // ========== LIFECYCLE ==========

    public PlayerTurnState beginTurn(String characterId, String userId) {
        return beginTurn(characterId, Position.RISKY, Effect.STANDARD, userId);
    }

    public PlayerTurnState beginTurn(String characterId, Position position, Effect effect, String userId) {
        GameState state = store.dispatch(Commands.beginTurn(characterId, position, effect), userId);
        log.info("Turn started for {} at {}/{}", characterId, position, effect);
        return state.requireTurn(characterId);
    }

    public Optional<PlayerTurnState> getTurn(String characterId) {
        return Optional.ofNullable(store.getState().getTurns().get(characterId));
    }

    /**
     * Abandon the turn. Only possible before effects are applied; nothing else is undone.
     */
    public void cancelTurn(String characterId, String userId) {
        PlayerTurnState turn = store.getState().requireTurn(characterId);
        if (!turn.getState().isCancellable()) {
            throw new TurnStateException(characterId, turn.getState(), TurnState.IDLE_WAITING);
        }
        store.dispatch(Commands.transition(characterId, TurnState.IDLE_WAITING, "cancelled"), userId);
        notificationPublisher.publish(TurnNotification.of(NotificationCode.TURN_CANCELLED, characterId,
            Map.of("fromState", turn.getState().name())));
        log.info("Turn of {} cancelled from {}", characterId, turn.getState());
    }

    /**
     * TURN_COMPLETE → IDLE_WAITING; the turn state is discarded.
     */
    public void endTurn(String characterId, String userId) {
        store.getState().requireTurn(characterId).requireState("end turn", TurnState.TURN_COMPLETE);
        store.dispatch(Commands.transition(characterId, TurnState.IDLE_WAITING, "turn ended"), userId);
        log.info("Turn of {} ended", characterId);
    }

    /**
     * Close a successful roll without advancing a clock.
     */
    public void completeSuccess(String characterId, String userId) {
        store.getState().requireTurn(characterId).requireState("complete success", TurnState.SUCCESS_COMPLETE);
        store.dispatch(Commands.transition(characterId, TurnState.TURN_COMPLETE, "success accepted"), userId);
    }

    // ========== DECISION PHASE ==========

    public void selectApproach(String characterId, Approach approach, String userId) {
        store.dispatch(Commands.selectApproach(characterId, RollMode.STANDARD, approach, null), userId);
    }

    public void selectSynergy(String characterId, Approach primary, Approach secondary, String userId) {
        store.dispatch(Commands.selectApproach(characterId, RollMode.SYNERGY, primary, secondary), userId);
    }

    public void setPosition(String characterId, Position position, String userId) {
        store.dispatch(Commands.setPosition(characterId, position), userId);
    }

    public void setEffect(String characterId, Effect effect, String userId) {
        store.dispatch(Commands.setEffect(characterId, effect), userId);
    }

    /**
     * @param pushType {@code null} removes the push
     */
    public void setPush(String characterId, PushType pushType, String userId) {
        store.dispatch(Commands.setPush(characterId, pushType), userId);
    }

    public void setFlashback(String characterId, boolean applied, String userId) {
        store.dispatch(Commands.setFlashback(characterId, applied), userId);
    }

    public ValidationResult validateTraitTransaction(String characterId, TraitTransaction transaction) {
        return traitTransactionResolver.validate(store.getState().requireCharacter(characterId), transaction);
    }

    public void setTraitTransaction(String characterId, TraitTransaction transaction, String userId) {
        validateTraitTransaction(characterId, transaction).orThrow("Trait transaction for " + characterId);
        store.dispatch(Commands.setTraitTransaction(characterId, transaction), userId);
    }

    public void clearTraitTransaction(String characterId, String userId) {
        store.dispatch(Commands.setTraitTransaction(characterId, null), userId);
    }

    public void selectEquipment(String characterId, List<String> equipmentIds, String userId) {
        store.dispatch(Commands.setEquipment(characterId, equipmentIds), userId);
    }

    public void setGmApproved(String characterId, boolean approved, String userId) {
        store.dispatch(Commands.setGmApproved(characterId, approved), userId);
    }

    // ========== ROLL ==========

    /**
     * Momentum the current improvements cost: push, flashback, trait transaction, and the
     * first lock of each rare or epic item.
     */
    public int calculateMomentumCost(GameState state, PlayerTurnState turn) {
        int cost = 0;
        if (turn.isPushed()) {
            cost += GameConstants.PUSH_COST;
        }
        if (turn.isFlashbackApplied()) {
            cost += GameConstants.FLASHBACK_COST;
        }
        cost += traitTransactionResolver.momentumCost(turn.getTraitTransaction());

        PlayerCharacter character = state.requireCharacter(turn.getCharacterId());
        for (String equipmentId : new LinkedHashSet<>(turn.getEquipmentIds())) {
            if (character.findEquipment(equipmentId).map(Equipment::requiresFirstLockPayment).orElse(false)) {
                cost += GameConstants.EQUIPMENT_FIRST_LOCK_COST;
            }
        }
        return cost;
    }

    public int calculateDicePool(String characterId) {
        GameState state = store.getState();
        return diceEngine.calculateDicePool(state.requireCharacter(characterId), state.requireTurn(characterId));
    }

    public Position effectivePosition(String characterId) {
        return traitTransactionResolver.effectivePosition(store.getState().requireTurn(characterId));
    }

    public Effect effectiveEffect(String characterId) {
        return consequenceResolver.effectiveEffect(store.getState().requireTurn(characterId));
    }

    public ValidationResult validateRoll(String characterId) {
        return validateRoll(store.getState(), characterId);
    }

    private ValidationResult validateRoll(GameState state, String characterId) {
        PlayerTurnState turn = state.getTurns().get(characterId);
        if (turn == null) {
            return ValidationResult.fail(ReasonCode.NO_ACTIVE_TURN);
        }
        if (turn.getState() != TurnState.DECISION_PHASE) {
            return ValidationResult.fail(ReasonCode.INVALID_STATE);
        }
        if (turn.getPrimaryApproach() == null) {
            return ValidationResult.fail(ReasonCode.NO_ACTION_SELECTED);
        }
        if (turn.getRollMode() == RollMode.SYNERGY
            && (turn.getSecondaryApproach() == null || turn.getSecondaryApproach() == turn.getPrimaryApproach())) {
            return ValidationResult.fail(ReasonCode.SYNERGY_NEEDS_TWO_APPROACHES);
        }

        PlayerCharacter character = state.requireCharacter(characterId);
        for (String equipmentId : turn.getEquipmentIds()) {
            Optional<Equipment> item = character.findEquipment(equipmentId);
            if (item.isEmpty()) {
                return ValidationResult.fail(ReasonCode.UNKNOWN_EQUIPMENT);
            }
            if (item.get().isConsumed()) {
                return ValidationResult.fail(ReasonCode.EQUIPMENT_CONSUMED);
            }
        }
        if (turn.getTraitTransaction() != null) {
            ValidationResult traitCheck = traitTransactionResolver.validate(character, turn.getTraitTransaction());
            if (!traitCheck.isValid()) {
                return traitCheck;
            }
        }
        if (rules.getTurn().isRequireGmApproval() && !turn.isGmApproved()) {
            return ValidationResult.fail(ReasonCode.GM_APPROVAL_REQUIRED);
        }

        int cost = calculateMomentumCost(state, turn);
        int available = state.findCrewOf(characterId).map(Crew::getCurrentMomentum).orElse(0);
        if (cost > available) {
            return ValidationResult.fail(ReasonCode.INSUFFICIENT_MOMENTUM);
        }
        return ValidationResult.ok();
    }

    /**
     * DECISION_PHASE → ROLLING → SUCCESS_COMPLETE | GM_RESOLVING_CONSEQUENCE in one batch,
     * together with the momentum spend, the trait transaction and the equipment locks.
     */
    public RollResult commitRoll(String characterId, String userId) {
        GameState state = store.getState();
        PlayerTurnState turn = state.requireTurn(characterId);
        turn.requireState("roll", TurnState.DECISION_PHASE);

        ValidationResult check = validateRoll(state, characterId);
        int cost = calculateMomentumCost(state, turn);
        Optional<Crew> crew = state.findCrewOf(characterId);
        if (!check.isValid()) {
            if (ReasonCode.INSUFFICIENT_MOMENTUM.equals(check.getReason())) {
                throw new InsufficientMomentumException(crew.map(Crew::getId).orElse(null), cost,
                    crew.map(Crew::getCurrentMomentum).orElse(0));
            }
            throw new RuleViolationException(check.getReason(), "Cannot roll for " + characterId + ": " + check.getReason());
        }

        PlayerCharacter character = state.requireCharacter(characterId);
        int pool = diceEngine.calculateDicePool(character, turn);
        RollResult result = diceEngine.roll(pool, diceRoller);

        List<Command> batch = new ArrayList<>();
        if (cost > 0) {
            batch.add(Commands.spendMomentum(crew.orElseThrow().getId(), cost));
        }
        if (turn.getTraitTransaction() != null) {
            batch.add(Commands.applyTraitTransaction(characterId, turn.getTraitTransaction(), idGenerator.nextId()));
        }
        Set<String> equipment = new LinkedHashSet<>(turn.getEquipmentIds());
        if (!equipment.isEmpty()) {
            batch.add(Commands.lockEquipment(characterId, equipment));
        }
        batch.add(Commands.transition(characterId, TurnState.ROLLING, "roll committed"));
        batch.add(Commands.recordRoll(characterId, result));
        store.dispatch(batch, userId);

        log.info("{} rolled {} dice: {} -> {} (spent {} momentum)",
            characterId, pool, result.getDice(), result.getOutcome(), cost);
        notificationPublisher.publish(TurnNotification.of(NotificationCode.ROLL_RESOLVED, characterId, Map.of(
            "dicePool", pool,
            "dice", result.getDice(),
            "outcome", result.getOutcome().name(),
            "momentumSpent", cost)));
        return result;
    }

    // ========== CONSEQUENCE ==========

    /**
     * Start a fresh consequence of the given type. Harm targets the acting character by default.
     */
    public ConsequenceTransaction selectConsequenceType(String characterId, ConsequenceType type, String userId) {
        ConsequenceTransaction transaction = ConsequenceTransaction.builder()
            .type(type)
            .harmTargetCharacterId(type == ConsequenceType.HARM ? characterId : null)
            .build();
        store.dispatch(Commands.setConsequence(characterId, transaction), userId);
        return transaction;
    }

    /**
     * Changing the harm target drops the previously chosen clock, which belonged to the old target.
     */
    public ConsequenceTransaction selectHarmTarget(String characterId, String targetCharacterId, String userId) {
        store.getState().requireCharacter(targetCharacterId);
        return updateConsequence(characterId, tx -> tx.toBuilder()
            .harmTargetCharacterId(targetCharacterId)
            .harmClockId(Objects.equals(targetCharacterId, tx.getHarmTargetCharacterId()) ? tx.getHarmClockId() : null)
            .build(), userId);
    }

    /**
     * Point the pending consequence at an existing clock, in the slot its type uses.
     */
    public ConsequenceTransaction selectClock(String characterId, String clockId, String userId) {
        store.getState().requireClock(clockId);
        return updateConsequence(characterId, tx -> switch (tx.getType()) {
            case HARM -> tx.toBuilder().harmClockId(clockId).build();
            case CREW_CLOCK -> tx.toBuilder().crewClockId(clockId).build();
            case SUCCESS_CLOCK -> tx.toBuilder().successClockId(clockId).build();
        }, userId);
    }

    public ConsequenceTransaction setDefensiveSuccess(String characterId, boolean useDefensiveSuccess, String userId) {
        return updateConsequence(characterId,
            tx -> tx.toBuilder().useDefensiveSuccess(useDefensiveSuccess).build(), userId);
    }

    /**
     * Create a harm clock for the current harm target and select it. At the harm clock cap the
     * emptiest existing clock is re-labelled and selected instead.
     */
    public String createHarmClock(String characterId, String subtype, String userId) {
        GameState state = store.getState();
        ConsequenceTransaction transaction = requireConsequence(state.requireTurn(characterId));
        if (transaction.getType() != ConsequenceType.HARM || transaction.getHarmTargetCharacterId() == null) {
            throw new RuleViolationException(ReasonCode.MISSING_HARM_TARGET, "No harm target selected for " + characterId);
        }
        String targetId = transaction.getHarmTargetCharacterId();
        String clockId = clockService.harmClockToReplace(state, targetId)
            .map(GameClock::getId)
            .orElseGet(idGenerator::nextId);

        ConsequenceTransaction updated = transaction.toBuilder().harmClockId(clockId).build();
        store.dispatch(List.of(
            Commands.createClock(clockId, targetId, ClockType.HARM, subtype,
                rules.getClocks().getHarmSegments(), null, null),
            Commands.setConsequence(characterId, updated)), userId);
        return clockId;
    }

    public String createCrewClock(String characterId, String subtype, int maxSegments, String userId) {
        GameState state = store.getState();
        ConsequenceTransaction transaction = requireConsequence(state.requireTurn(characterId));
        Crew crew = state.findCrewOf(characterId)
            .orElseThrow(() -> new EngineConfigurationException("Cannot create crew clock: no crew assigned"));

        String clockId = idGenerator.nextId();
        ConsequenceTransaction updated = transaction.toBuilder().crewClockId(clockId).build();
        store.dispatch(List.of(
            Commands.createClock(clockId, crew.getId(), ClockType.PROGRESS, subtype, maxSegments, "threat", null),
            Commands.setConsequence(characterId, updated)), userId);
        return clockId;
    }

    public ValidationResult validateConsequence(String characterId) {
        GameState state = store.getState();
        PlayerTurnState turn = state.getTurns().get(characterId);
        if (turn == null) {
            return ValidationResult.fail(ReasonCode.NO_ACTIVE_TURN);
        }
        return consequenceResolver.validate(state, turn);
    }

    public DefensiveSuccessValues getDefensiveSuccessValues(String characterId) {
        return consequenceResolver.defensiveSuccess(store.getState().requireTurn(characterId));
    }

    /**
     * Commit the pending consequence: clock, momentum, clear, and on to TURN_COMPLETE in one batch.
     */
    public ConsequencePlan acceptConsequence(String characterId, String userId) {
        GameState state = store.getState();
        PlayerTurnState turn = state.requireTurn(characterId);
        if (!turn.getState().awaitsConsequence()) {
            throw new TurnStateException("Cannot accept consequence for " + characterId + " in state " + turn.getState());
        }

        ConsequencePlan plan = consequenceResolver.plan(state, turn);
        GameState after = store.dispatch(plan.getCommands(), userId);

        notificationPublisher.publish(TurnNotification.of(NotificationCode.CONSEQUENCE_APPLIED, characterId, Map.of(
            "type", turn.getConsequence().getType().name(),
            "segments", plan.getSegments(),
            "momentumGain", plan.getMomentumGain(),
            "forfeitedMomentum", plan.getForfeitedMomentum(),
            "defensive", plan.isDefensive())));

        String harmTarget = turn.getConsequence().getHarmTargetCharacterId();
        if (turn.getConsequence().getType() == ConsequenceType.HARM && clockService.isDying(after, harmTarget)) {
            log.warn("Character {} is dying", harmTarget);
            notificationPublisher.publish(TurnNotification.of(NotificationCode.CHARACTER_DYING, harmTarget,
                Map.of("clockId", plan.getClockId())));
        }
        return plan;
    }

    /**
     * On a success, advance a progress clock by position and effect and close the roll.
     */
    public ConsequencePlan applySuccessClock(String characterId, String clockId, String userId) {
        GameState state = store.getState();
        PlayerTurnState turn = state.requireTurn(characterId);
        turn.requireState("apply success clock", TurnState.SUCCESS_COMPLETE);

        ConsequenceTransaction transaction = ConsequenceTransaction.builder()
            .type(ConsequenceType.SUCCESS_CLOCK)
            .successClockId(clockId)
            .build();
        turn.setConsequence(transaction);
        ConsequencePlan plan = consequenceResolver.plan(state, turn);

        List<Command> batch = new ArrayList<>();
        batch.add(Commands.setConsequence(characterId, transaction));
        batch.addAll(plan.getCommands());
        store.dispatch(batch, userId);

        notificationPublisher.publish(TurnNotification.of(NotificationCode.SUCCESS_CLOCK_ADVANCED, characterId,
            Map.of("clockId", clockId, "segments", plan.getSegments())));
        return plan;
    }

    // ========== helpers ==========

    private ConsequenceTransaction updateConsequence(String characterId, UnaryOperator<ConsequenceTransaction> change,
                                                     String userId) {
        ConsequenceTransaction updated = change.apply(requireConsequence(store.getState().requireTurn(characterId)));
        store.dispatch(Commands.setConsequence(characterId, updated), userId);
        return updated;
    }

    private ConsequenceTransaction requireConsequence(PlayerTurnState turn) {
        if (turn.getConsequence() == null) {
            throw new RuleViolationException(ReasonCode.NO_CONSEQUENCE,
                "No consequence selected for " + turn.getCharacterId());
        }
        return turn.getConsequence();
    }
}
