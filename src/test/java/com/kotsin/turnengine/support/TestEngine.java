package com.kotsin.turnengine.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.turnengine.audit.AuditLogger;
import com.kotsin.turnengine.clock.ClockOperations;
import com.kotsin.turnengine.clock.ClockService;
import com.kotsin.turnengine.command.CommandApplier;
import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.dice.DiceResolutionEngine;
import com.kotsin.turnengine.dice.DiceRoller;
import com.kotsin.turnengine.model.Approach;
import com.kotsin.turnengine.momentum.MomentumEconomy;
import com.kotsin.turnengine.notification.NotificationPublisher;
import com.kotsin.turnengine.resolution.ConsequenceResolver;
import com.kotsin.turnengine.resolution.TraitTransactionResolver;
import com.kotsin.turnengine.roster.RosterService;
import com.kotsin.turnengine.store.GameStateStore;
import com.kotsin.turnengine.store.IdGenerator;
import com.kotsin.turnengine.store.SnapshotService;
import com.kotsin.turnengine.turn.PlayerTurnStateMachine;
import com.kotsin.turnengine.turn.StimsInterruptWorkflow;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hand-wired engine for tests: deterministic ids, a manual clock, and the caller's dice.
 */
public class TestEngine {

    public static final String GM = "gm";

    public final GameRulesConfig rules = new GameRulesConfig();
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final MutableClock clock = new MutableClock(1_000L);
    public final IdGenerator ids;

    public final ClockService clockService;
    public final MomentumEconomy momentumEconomy;
    public final TraitTransactionResolver traitResolver;
    public final ConsequenceResolver consequenceResolver;
    public final DiceResolutionEngine diceEngine;
    public final CommandApplier applier;
    public final GameStateStore store;
    public final SnapshotService snapshots;
    public final RosterService roster;
    public final ClockOperations clocks;
    public final PlayerTurnStateMachine turns;
    public final StimsInterruptWorkflow stims;

    public TestEngine(DiceRoller diceRoller, NotificationPublisher publisher) {
        AtomicInteger sequence = new AtomicInteger();
        this.ids = () -> "id-" + sequence.incrementAndGet();

        this.clockService = new ClockService(rules);
        this.momentumEconomy = new MomentumEconomy(rules);
        this.traitResolver = new TraitTransactionResolver();
        this.consequenceResolver = new ConsequenceResolver(traitResolver);
        this.diceEngine = new DiceResolutionEngine(rules);
        this.applier = new CommandApplier(clockService, momentumEconomy, traitResolver, objectMapper);
        this.store = new GameStateStore(applier, objectMapper, clock, ids, new AuditLogger());
        this.snapshots = new SnapshotService(store, objectMapper);
        this.roster = new RosterService(store, momentumEconomy, rules, ids, publisher);
        this.clocks = new ClockOperations(store, clockService, ids);
        this.turns = new PlayerTurnStateMachine(store, diceEngine, diceRoller, consequenceResolver,
            traitResolver, clockService, rules, ids, publisher);
        this.stims = new StimsInterruptWorkflow(store, clockService, diceEngine, diceRoller, rules, ids, publisher);
    }

    public static Map<Approach, Integer> approaches(int force, int guile, int focus, int spirit) {
        Map<Approach, Integer> ratings = new EnumMap<>(Approach.class);
        ratings.put(Approach.FORCE, force);
        ratings.put(Approach.GUILE, guile);
        ratings.put(Approach.FOCUS, focus);
        ratings.put(Approach.SPIRIT, spirit);
        return ratings;
    }

    /**
     * A crew at starting momentum with one member.
     *
     * @return {crewId, characterId}
     */
    public String[] crewWithMember(String characterName, Map<Approach, Integer> ratings) {
        String crewId = roster.createCrew("Crew", GM);
        String characterId = roster.createCharacter(characterName, ratings, GM);
        roster.addMember(crewId, characterId, GM);
        return new String[]{crewId, characterId};
    }
}
