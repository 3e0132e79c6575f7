package com.kotsin.turnengine.resolution;

import com.kotsin.turnengine.command.Command;
import com.kotsin.turnengine.command.Commands;
import com.kotsin.turnengine.dice.RollOutcome;
import com.kotsin.turnengine.exception.RuleViolationException;
import com.kotsin.turnengine.ladder.Effect;
import com.kotsin.turnengine.ladder.Position;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.Crew;
import com.kotsin.turnengine.model.GameClock;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.turn.ConsequenceTransaction;
import com.kotsin.turnengine.model.turn.ConsequenceType;
import com.kotsin.turnengine.model.turn.PlayerTurnState;
import com.kotsin.turnengine.model.turn.PushType;
import com.kotsin.turnengine.model.turn.TurnState;
import com.kotsin.turnengine.validation.ReasonCode;
import com.kotsin.turnengine.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ConsequenceResolver - turns an outcome into clock segments and momentum.
 *
 * Severity depends on position only; effect matters for success clocks alone.
 * Both severity and momentum gain read the same per-position value.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsequenceResolver {

    private final TraitTransactionResolver traitTransactionResolver;

    public int severity(Position position) {
        return position.getConsequenceSegments();
    }

    /**
     * Progress earned on a success clock: position base plus effect modifier, never below zero.
     */
    public int successClockSegments(Position position, Effect effect) {
        return Math.max(0, position.getProgressBase() + effect.getProgressModifier());
    }

    public Position effectivePosition(PlayerTurnState turn) {
        return traitTransactionResolver.effectivePosition(turn);
    }

    public Effect effectiveEffect(PlayerTurnState turn) {
        if (turn.isPushed() && turn.getPushType() == PushType.IMPROVED_EFFECT) {
            return turn.getEffect().improve();
        }
        return turn.getEffect();
    }

    // ========== DEFENSIVE SUCCESS ==========

    public DefensiveSuccessValues defensiveSuccess(RollOutcome outcome, Position position, Effect effect) {
        if (outcome != RollOutcome.PARTIAL || effect.isWorst()) {
            return DefensiveSuccessValues.unavailable(position);
        }

        Position defensivePosition = position.isBest() ? null : position.improve();
        return DefensiveSuccessValues.builder()
            .available(true)
            .defensivePosition(defensivePosition)
            .defensiveEffect(effect.worsen())
            .defensiveSegments(defensivePosition == null ? 0 : severity(defensivePosition))
            .originalSegments(severity(position))
            // Banked from the original position even though the consequence is softened
            .momentumGain(position.getMomentumGain())
            .build();
    }

    public DefensiveSuccessValues defensiveSuccess(PlayerTurnState turn) {
        return defensiveSuccess(turn.getOutcome(), effectivePosition(turn), effectiveEffect(turn));
    }

    // ========== VALIDATION ==========

    public ValidationResult validate(ConsequenceTransaction transaction) {
        if (transaction == null || transaction.getType() == null) {
            return ValidationResult.fail(ReasonCode.NO_CONSEQUENCE);
        }
        return switch (transaction.getType()) {
            case HARM -> {
                if (transaction.getHarmTargetCharacterId() == null) {
                    yield ValidationResult.fail(ReasonCode.MISSING_HARM_TARGET);
                }
                yield transaction.getHarmClockId() == null
                    ? ValidationResult.fail(ReasonCode.MISSING_HARM_CLOCK)
                    : ValidationResult.ok();
            }
            case CREW_CLOCK -> transaction.getCrewClockId() == null
                ? ValidationResult.fail(ReasonCode.MISSING_CREW_CLOCK)
                : ValidationResult.ok();
            case SUCCESS_CLOCK -> transaction.getSuccessClockId() == null
                ? ValidationResult.fail(ReasonCode.MISSING_SUCCESS_CLOCK)
                : ValidationResult.ok();
        };
    }

    /**
     * Full check before commit: the transaction is complete, its clock exists, and a requested
     * defensive success is actually on offer.
     */
    public ValidationResult validate(GameState state, PlayerTurnState turn) {
        ConsequenceTransaction transaction = turn.getConsequence();
        ValidationResult shape = validate(transaction);
        if (!shape.isValid()) {
            return shape;
        }
        GameClock clock = state.getClocks().get(targetClockId(transaction));
        if (clock == null) {
            return ValidationResult.fail(switch (transaction.getType()) {
                case HARM -> ReasonCode.MISSING_HARM_CLOCK;
                case CREW_CLOCK -> ReasonCode.MISSING_CREW_CLOCK;
                case SUCCESS_CLOCK -> ReasonCode.MISSING_SUCCESS_CLOCK;
            });
        }
        if (!fitsSlot(state, turn, clock)) {
            log.debug("Clock {} ({} owned by {}) cannot take a {} consequence",
                clock.getId(), clock.getType(), clock.getOwnerId(), transaction.getType());
            return ValidationResult.fail(ReasonCode.INVALID_CONSEQUENCE_CLOCK);
        }
        if (transaction.isUseDefensiveSuccess()
            && transaction.getType() != ConsequenceType.SUCCESS_CLOCK
            && !defensiveSuccess(turn).isAvailable()) {
            return ValidationResult.fail(ReasonCode.DEFENSIVE_SUCCESS_UNAVAILABLE);
        }
        return ValidationResult.ok();
    }

    // ========== APPLICATION ==========

    /**
     * Build the single batch that commits the pending transaction: advance the clock, grant momentum,
     * clear the transaction, and move the turn through APPLYING_EFFECTS to TURN_COMPLETE.
     */
    public ConsequencePlan plan(GameState state, PlayerTurnState turn) {
        ValidationResult check = validate(state, turn);
        if (!check.isValid()) {
            throw new RuleViolationException(check.getReason(),
                "Consequence for " + turn.getCharacterId() + " is not ready: " + check.getReason());
        }

        ConsequenceTransaction transaction = turn.getConsequence();
        Position position = effectivePosition(turn);
        Effect effect = effectiveEffect(turn);

        int segments;
        int momentumGain;
        boolean defensive = false;
        if (transaction.getType() == ConsequenceType.SUCCESS_CLOCK) {
            segments = successClockSegments(position, effect);
            momentumGain = 0;
        } else if (transaction.isUseDefensiveSuccess()) {
            DefensiveSuccessValues values = defensiveSuccess(turn);
            segments = values.getDefensiveSegments();
            momentumGain = values.getMomentumGain();
            defensive = true;
        } else {
            segments = severity(position);
            momentumGain = position.getMomentumGain();
        }

        String clockId = targetClockId(transaction);
        String crewId = state.findCrewOf(turn.getCharacterId()).map(Crew::getId).orElse(null);

        int forfeited = 0;
        if (crewId == null && momentumGain > 0) {
            forfeited = momentumGain;
            log.warn("Character {} has no crew, {} momentum from this consequence is forfeited",
                turn.getCharacterId(), momentumGain);
        }

        List<Command> commands = new ArrayList<>();
        if (segments > 0) {
            commands.add(Commands.addSegments(clockId, segments));
        }
        if (crewId != null && momentumGain > 0) {
            commands.add(Commands.addMomentum(crewId, momentumGain));
        }
        commands.add(Commands.setConsequence(turn.getCharacterId(), null));
        commands.add(Commands.transition(turn.getCharacterId(), TurnState.APPLYING_EFFECTS,
            transaction.getType().name().toLowerCase() + " applied"));
        commands.add(Commands.transition(turn.getCharacterId(), TurnState.TURN_COMPLETE, "effects applied"));

        log.debug("Consequence plan for {}: {} segments on {}, +{} momentum (defensive={})",
            turn.getCharacterId(), segments, clockId, momentumGain, defensive);

        return ConsequencePlan.builder()
            .clockId(clockId)
            .segments(segments)
            .crewId(crewId)
            .momentumGain(crewId == null ? 0 : momentumGain)
            .forfeitedMomentum(forfeited)
            .defensive(defensive)
            .commands(commands)
            .build();
    }

    /**
     * Harm lands on one of the target's harm clocks, crew clocks belong to the actor's crew,
     * and success only advances progress clocks.
     */
    private boolean fitsSlot(GameState state, PlayerTurnState turn, GameClock clock) {
        ConsequenceTransaction transaction = turn.getConsequence();
        return switch (transaction.getType()) {
            case HARM -> clock.getType() == ClockType.HARM
                && Objects.equals(clock.getOwnerId(), transaction.getHarmTargetCharacterId());
            case CREW_CLOCK -> state.findCrewOf(turn.getCharacterId())
                .map(crew -> crew.getId().equals(clock.getOwnerId()))
                .orElse(false);
            case SUCCESS_CLOCK -> clock.getType() == ClockType.PROGRESS;
        };
    }

    private String targetClockId(ConsequenceTransaction transaction) {
        return switch (transaction.getType()) {
            case HARM -> transaction.getHarmClockId();
            case CREW_CLOCK -> transaction.getCrewClockId();
            case SUCCESS_CLOCK -> transaction.getSuccessClockId();
        };
    }
}
