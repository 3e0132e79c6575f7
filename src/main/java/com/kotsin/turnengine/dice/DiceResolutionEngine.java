package com.kotsin.turnengine.dice;

import com.kotsin.turnengine.config.GameConstants;
import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.model.PlayerCharacter;
import com.kotsin.turnengine.model.Equipment;
import com.kotsin.turnengine.model.turn.PlayerTurnState;
import com.kotsin.turnengine.model.turn.PushType;
import com.kotsin.turnengine.model.turn.RollMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * DiceResolutionEngine - pool sizing, outcome classification and outcome probabilities.
 *
 * Classification of the kept faces:
 * - two or more sixes: CRITICAL
 * - one six: SUCCESS
 * - highest 4 or 5: PARTIAL
 * - highest 1 to 3 (or no dice): FAILURE
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiceResolutionEngine {

    private final GameRulesConfig rules;

    /**
     * Dice for the turn as currently configured. Never negative.
     */
    public int calculateDicePool(PlayerCharacter character, PlayerTurnState turn) {
        int pool = character.rating(turn.getPrimaryApproach());
        if (turn.getRollMode() == RollMode.SYNERGY) {
            pool += character.rating(turn.getSecondaryApproach());
        }

        // An item selected twice still only counts once
        Set<String> distinctItems = new LinkedHashSet<>(turn.getEquipmentIds());
        for (String equipmentId : distinctItems) {
            pool += character.findEquipment(equipmentId)
                .filter(item -> !item.isConsumed())
                .map(Equipment::getDiceModifier)
                .orElse(0);
        }

        if (turn.isPushed() && turn.getPushType() == PushType.EXTRA_DIE) {
            pool += GameConstants.PUSH_DICE_BONUS;
        }
        if (turn.isFlashbackApplied()) {
            pool += GameConstants.FLASHBACK_DICE_BONUS;
        }

        int clamped = Math.max(0, pool);
        log.debug("Dice pool for {}: {} ({} mode)", character.getId(), clamped, turn.getRollMode());
        return clamped;
    }

    public RollOutcome classify(List<Integer> dice) {
        if (dice == null || dice.isEmpty()) {
            return RollOutcome.FAILURE;
        }
        long sixes = dice.stream().filter(face -> face == GameConstants.DIE_FACES).count();
        if (sixes >= GameConstants.CRITICAL_SIX_COUNT) {
            return RollOutcome.CRITICAL;
        }
        if (sixes == 1) {
            return RollOutcome.SUCCESS;
        }
        int highest = dice.stream().mapToInt(Integer::intValue).max().orElse(0);
        return highest >= GameConstants.PARTIAL_MIN_FACE ? RollOutcome.PARTIAL : RollOutcome.FAILURE;
    }

    /**
     * Roll a pool with the given randomness source. An empty pool rolls 2d6 and keeps the lowest.
     */
    public RollResult roll(int dicePool, DiceRoller roller) {
        if (dicePool < 0) {
            throw new IllegalArgumentException("Dice pool must not be negative: " + dicePool);
        }
        List<Integer> dice = dicePool == 0
            ? List.of(roller.rollKeepLowest())
            : roller.roll(dicePool);
        RollOutcome outcome = classify(dice);

        log.debug("Rolled {} dice -> {} ({})", dicePool, dice, outcome);
        return RollResult.builder()
            .dicePool(dicePool)
            .dice(dice)
            .outcome(outcome)
            .desperate(dicePool == 0)
            .build();
    }

    public OutcomeProbabilities probabilities(int dicePool) {
        if (dicePool < 0) {
            throw new IllegalArgumentException("Dice pool must not be negative: " + dicePool);
        }
        if (dicePool == 0) {
            return desperateProbabilities();
        }

        double noSix = Math.pow(5.0 / 6.0, dicePool);
        double allLow = Math.pow(0.5, dicePool);
        double exactlyOneSix = dicePool * (1.0 / 6.0) * Math.pow(5.0 / 6.0, dicePool - 1);

        return OutcomeProbabilities.builder()
            .dicePool(dicePool)
            .failure(allLow)
            .partial(noSix - allLow)
            .success(exactlyOneSix)
            .critical(1.0 - noSix - exactlyOneSix)
            .build();
    }

    private OutcomeProbabilities desperateProbabilities() {
        if (!rules.getDice().isExactDesperateProbabilities()) {
            return OutcomeProbabilities.builder()
                .dicePool(0)
                .critical(0.0)
                .success(GameConstants.LEGACY_DESPERATE_SUCCESS)
                .partial(GameConstants.LEGACY_DESPERATE_PARTIAL)
                .failure(GameConstants.LEGACY_DESPERATE_FAILURE)
                .build();
        }

        // Lower of two dice: P(min >= k) = ((7 - k) / 6)^2
        double atLeastSix = 1.0 / 36.0;
        double atLeastFour = 9.0 / 36.0;
        return OutcomeProbabilities.builder()
            .dicePool(0)
            .critical(0.0)
            .success(atLeastSix)
            .partial(atLeastFour - atLeastSix)
            .failure(1.0 - atLeastFour)
            .build();
    }
}
