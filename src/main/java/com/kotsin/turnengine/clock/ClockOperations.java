package com.kotsin.turnengine.clock;

import com.kotsin.turnengine.command.Commands;
import com.kotsin.turnengine.exception.RuleViolationException;
import com.kotsin.turnengine.ladder.Effect;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.GameClock;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.TraitCategory;
import com.kotsin.turnengine.store.GameStateStore;
import com.kotsin.turnengine.store.IdGenerator;
import com.kotsin.turnengine.validation.ReasonCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * GM-facing clock actions, each committed as its own command.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClockOperations {

    private final GameStateStore store;
    private final ClockService clockService;
    private final IdGenerator idGenerator;

    /**
     * Returns the id of the clock that now carries the subtype. At the harm clock cap that is the
     * existing clock which was re-labelled.
     */
    public String createClock(String ownerId, ClockType type, String subtype, int maxSegments,
                              String category, String description, String userId) {
        String clockId = type == ClockType.HARM
            ? clockService.harmClockToReplace(store.getState(), ownerId)
                .map(GameClock::getId)
                .orElseGet(idGenerator::nextId)
            : idGenerator.nextId();
        store.dispatch(Commands.createClock(clockId, ownerId, type, subtype, maxSegments, category, description), userId);
        return clockId;
    }

    public GameClock addSegments(String clockId, int amount, String userId) {
        return store.dispatch(Commands.addSegments(clockId, amount), userId).requireClock(clockId);
    }

    public GameClock setSegments(String clockId, int segments, String userId) {
        return store.dispatch(Commands.setSegments(clockId, segments), userId).requireClock(clockId);
    }

    public GameClock clearSegments(String clockId, int amount, String userId) {
        return store.dispatch(Commands.clearSegments(clockId, amount), userId).requireClock(clockId);
    }

    /**
     * Clear harm or threat by the amount an effect level buys.
     */
    public GameClock reduceWithEffect(String clockId, Effect effect, String userId) {
        log.debug("Reducing clock {} by {} ({})", clockId, effect.getReductionSegments(), effect);
        return clearSegments(clockId, effect.getReductionSegments(), userId);
    }

    /**
     * Clear segments from a harm or threat clock and report how much actually came off.
     */
    public ClockRecovery recover(String clockId, int segments, String userId) {
        int before = store.getState().requireClock(clockId).getSegments();
        GameClock after = clearSegments(clockId, segments, userId);
        return ClockRecovery.builder()
            .clockId(clockId)
            .segmentsCleared(before - after.getSegments())
            .newSegments(after.getSegments())
            .clockCleared(after.getSegments() == 0)
            .build();
    }

    /**
     * Turn a settled harm clock into a scar trait. The clock must be empty or full; the trait is
     * added and the clock deleted in one batch.
     */
    public String convertToScar(String characterId, String clockId, String name, String userId) {
        GameState state = store.getState();
        state.requireCharacter(characterId);
        GameClock clock = state.requireClock(clockId);
        if (clock.getType() != ClockType.HARM || !characterId.equals(clock.getOwnerId())) {
            throw new RuleViolationException(ReasonCode.NOT_A_HARM_CLOCK,
                "Clock " + clockId + " is not a harm clock of " + characterId);
        }
        if (clock.getSegments() != 0 && !clockService.isFull(clock)) {
            throw new RuleViolationException(ReasonCode.HARM_CLOCK_IN_PROGRESS,
                "Harm clock " + clockId + " must be empty or full to become a scar, has "
                    + clock.getSegments() + "/" + clock.getMaxSegments());
        }
        String scarName = name == null || name.isBlank() ? clock.getSubtype() : name;
        if (scarName == null || scarName.isBlank()) {
            throw new RuleViolationException(ReasonCode.MISSING_TRAIT_NAME, "Scar needs a name");
        }

        String traitId = idGenerator.nextId();
        store.dispatch(List.of(
            Commands.addTrait(characterId, traitId, scarName, TraitCategory.SCAR, clock.getDescription()),
            Commands.deleteClock(clockId)), userId);
        log.info("Harm clock {} of {} became scar '{}'", clockId, characterId, scarName);
        return traitId;
    }

    public void deleteClock(String clockId, String userId) {
        store.dispatch(Commands.deleteClock(clockId), userId);
    }

    public boolean isFull(String clockId) {
        return clockService.isFull(store.getState().requireClock(clockId));
    }
}
