package com.kotsin.turnengine.clock;

import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.Crew;
import com.kotsin.turnengine.model.GameClock;
import com.kotsin.turnengine.model.GameState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * ClockService - segmented counters and the queries built on them.
 *
 * Mutations clamp to [0, maxSegments] and never trigger follow-up effects.
 * Callers check {@link #isFull(GameClock)} and act on it themselves.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClockService {

    private final GameRulesConfig rules;

    // ========== MUTATIONS ==========

    /**
     * Create a zero-filled clock. A character already carrying the maximum number of harm clocks
     * has the emptiest one re-labelled instead; its segments are kept and it is returned.
     */
    public GameClock createClock(GameState state, String clockId, String ownerId, ClockType type,
                                 String subtype, int maxSegments, String category, String description,
                                 long timestamp) {
        if (type == ClockType.ADDICTION && findAddictionClock(state, ownerId).isPresent()) {
            throw new IllegalStateException("Owner " + ownerId + " already has an addiction clock");
        }

        if (type == ClockType.HARM) {
            Optional<GameClock> replaced = harmClockToReplace(state, ownerId);
            if (replaced.isPresent()) {
                GameClock clock = replaced.get();
                log.info("Harm clock limit reached for {}: re-labelling {} from '{}' to '{}'",
                    ownerId, clock.getId(), clock.getSubtype(), subtype);
                clock.setSubtype(subtype);
                clock.setUpdatedAt(timestamp);
                return clock;
            }
        }

        if (state.getClocks().containsKey(clockId)) {
            throw new IllegalStateException("Clock id already in use: " + clockId);
        }

        GameClock clock = GameClock.builder()
            .id(clockId)
            .ownerId(ownerId)
            .type(type)
            .subtype(subtype)
            .segments(0)
            .maxSegments(resolveMaxSegments(type, maxSegments))
            .category(category)
            .description(description)
            .createdAt(timestamp)
            .updatedAt(timestamp)
            .build();
        state.getClocks().put(clockId, clock);
        log.debug("Created {} clock {} for {} ({} segments)", type, clockId, ownerId, clock.getMaxSegments());
        return clock;
    }

    /**
     * Advance a clock. Segments beyond capacity are discarded.
     */
    public GameClock addSegments(GameState state, String clockId, int amount, long timestamp) {
        if (amount < 0) {
            throw new IllegalArgumentException("Segments to add must not be negative: " + amount);
        }
        GameClock clock = state.requireClock(clockId);
        return setSegments(clock, (long) clock.getSegments() + amount, timestamp);
    }

    public GameClock setSegments(GameState state, String clockId, int segments, long timestamp) {
        return setSegments(state.requireClock(clockId), segments, timestamp);
    }

    public GameClock clearSegments(GameState state, String clockId, int amount, long timestamp) {
        if (amount < 0) {
            throw new IllegalArgumentException("Segments to clear must not be negative: " + amount);
        }
        GameClock clock = state.requireClock(clockId);
        return setSegments(clock, (long) clock.getSegments() - amount, timestamp);
    }

    private GameClock setSegments(GameClock clock, long requested, long timestamp) {
        int clamped = (int) Math.max(0, Math.min(clock.getMaxSegments(), requested));
        if (clamped != requested) {
            log.debug("Clock {} clamped from {} to {}", clock.getId(), requested, clamped);
        }
        clock.setSegments(clamped);
        clock.setUpdatedAt(timestamp);
        return clock;
    }

    // ========== QUERIES ==========

    public boolean isFull(GameClock clock) {
        return clock.getSegments() >= clock.getMaxSegments();
    }

    /**
     * The harm clock that a new harm clock for {@code ownerId} would overwrite, if the owner is at the cap.
     */
    public Optional<GameClock> harmClockToReplace(GameState state, String ownerId) {
        List<GameClock> harmClocks = state.clocksOwnedBy(ownerId, ClockType.HARM);
        if (harmClocks.size() < rules.getClocks().getMaxHarmClocks()) {
            return Optional.empty();
        }
        return harmClocks.stream().min(Comparator.comparingInt(GameClock::getSegments));
    }

    public Optional<GameClock> findAddictionClock(GameState state, String characterId) {
        return state.clocksOwnedBy(characterId, ClockType.ADDICTION).stream().findFirst();
    }

    public boolean isAddictionClockFull(GameState state, String characterId) {
        return findAddictionClock(state, characterId).map(this::isFull).orElse(false);
    }

    /**
     * Derived on every call from the character's harm clocks; there is no stored flag.
     */
    public boolean isDying(GameState state, String characterId) {
        return state.clocksOwnedBy(characterId, ClockType.HARM).stream().anyMatch(this::isFull);
    }

    /**
     * Stims are locked for a whole crew as soon as any member's addiction clock is full.
     */
    public boolean isStimsLockedForCrew(GameState state, Crew crew) {
        return crew.getMemberIds().stream().anyMatch(memberId -> isAddictionClockFull(state, memberId));
    }

    public int defaultMaxSegments(ClockType type) {
        return switch (type) {
            case HARM -> rules.getClocks().getHarmSegments();
            case ADDICTION -> rules.getClocks().getAddictionSegments();
            case PROGRESS -> rules.getClocks().getProgressSizes().get(0);
        };
    }

    private int resolveMaxSegments(ClockType type, int requested) {
        if (requested <= 0) {
            return defaultMaxSegments(type);
        }
        if (type == ClockType.PROGRESS && !rules.getClocks().getProgressSizes().contains(requested)) {
            throw new IllegalArgumentException("Progress clocks must have one of "
                + rules.getClocks().getProgressSizes() + " segments, got " + requested);
        }
        return requested;
    }
}
