package com.kotsin.turnengine.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.turnengine.clock.ClockService;
import com.kotsin.turnengine.config.GameConstants;
import com.kotsin.turnengine.dice.RollOutcome;
import com.kotsin.turnengine.exception.TurnStateException;
import com.kotsin.turnengine.ladder.Effect;
import com.kotsin.turnengine.ladder.Position;
import com.kotsin.turnengine.model.Approach;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.Crew;
import com.kotsin.turnengine.model.Equipment;
import com.kotsin.turnengine.model.EquipmentCategory;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.PlayerCharacter;
import com.kotsin.turnengine.model.Trait;
import com.kotsin.turnengine.model.TraitCategory;
import com.kotsin.turnengine.model.turn.ConsequenceTransaction;
import com.kotsin.turnengine.model.turn.PlayerTurnState;
import com.kotsin.turnengine.model.turn.PushType;
import com.kotsin.turnengine.model.turn.RollMode;
import com.kotsin.turnengine.model.turn.TraitTransaction;
import com.kotsin.turnengine.model.turn.TurnState;
import com.kotsin.turnengine.momentum.MomentumEconomy;
import com.kotsin.turnengine.resolution.TraitTransactionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CommandApplier - applies one command to a state.
 *
 * Reads nothing but the payload and the entry timestamp, so replaying a history
 * always reproduces the state it produced live.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandApplier {

    private final ClockService clockService;
    private final MomentumEconomy momentumEconomy;
    private final TraitTransactionResolver traitTransactionResolver;
    private final ObjectMapper objectMapper;

    public void apply(GameState state, CommandHistoryEntry entry) {
        JsonNode p = entry.getPayload();
        long ts = entry.getTimestamp();

        switch (entry.getType()) {
            // Crews
            case CommandTypes.CREW_CREATE -> createCrew(state, p, ts);
            case CommandTypes.CREW_DELETE -> deleteCrew(state, text(p, "crewId"));
            case CommandTypes.CREW_ADD_MEMBER -> addMember(state, text(p, "crewId"), text(p, "characterId"), ts);
            case CommandTypes.CREW_REMOVE_MEMBER -> {
                Crew crew = state.requireCrew(text(p, "crewId"));
                crew.getMemberIds().remove(text(p, "characterId"));
                crew.setUpdatedAt(ts);
            }
            case CommandTypes.CREW_ADD_MOMENTUM ->
                momentumEconomy.addMomentum(state, text(p, "crewId"), p.path("amount").asInt(), ts);
            case CommandTypes.CREW_SPEND_MOMENTUM ->
                momentumEconomy.spendMomentum(state, text(p, "crewId"), p.path("amount").asInt(), ts);
            case CommandTypes.CREW_SET_MOMENTUM ->
                momentumEconomy.setMomentum(state, text(p, "crewId"), p.path("amount").asInt(), ts);
            case CommandTypes.CREW_RESET -> momentumEconomy.resetCrew(state, text(p, "crewId"), ts);

            // Characters
            case CommandTypes.CHARACTER_CREATE -> createCharacter(state, p, ts);
            case CommandTypes.CHARACTER_DELETE -> deleteCharacter(state, text(p, "characterId"));
            case CommandTypes.CHARACTER_ADD_TRAIT -> addTrait(state, p, ts);
            case CommandTypes.CHARACTER_SET_TRAIT_DISABLED -> {
                PlayerCharacter character = state.requireCharacter(text(p, "characterId"));
                character.findTrait(text(p, "traitId"))
                    .orElseThrow(() -> new IllegalArgumentException("Unknown trait " + text(p, "traitId")))
                    .setDisabled(p.path("disabled").asBoolean());
                character.setUpdatedAt(ts);
            }
            case CommandTypes.CHARACTER_ADD_EQUIPMENT -> {
                PlayerCharacter character = state.requireCharacter(text(p, "characterId"));
                character.getEquipment().add(read(p.path("equipment"), Equipment.class));
                character.setUpdatedAt(ts);
            }
            case CommandTypes.CHARACTER_LOCK_EQUIPMENT -> lockEquipment(state, text(p, "characterId"),
                strings(p.path("equipmentIds")), ts);
            case CommandTypes.CHARACTER_APPLY_TRAIT_TRANSACTION -> traitTransactionResolver.apply(state,
                text(p, "characterId"), read(p.path("transaction"), TraitTransaction.class),
                optText(p, "newTraitId"), ts);
            case CommandTypes.CHARACTER_RALLY -> momentumEconomy.rally(state, text(p, "characterId"),
                p.path("amount").asInt(), optText(p, "traitId"), ts);
            case CommandTypes.CHARACTER_LEAN_INTO_TRAIT ->
                momentumEconomy.leanIntoTrait(state, text(p, "characterId"), text(p, "traitId"), ts);

            // Clocks
            case CommandTypes.CLOCK_CREATE -> clockService.createClock(state, text(p, "clockId"),
                text(p, "ownerId"), ClockType.valueOf(text(p, "type")), optText(p, "subtype"),
                p.path("maxSegments").asInt(), optText(p, "category"), optText(p, "description"), ts);
            case CommandTypes.CLOCK_DELETE -> state.getClocks().remove(text(p, "clockId"));
            case CommandTypes.CLOCK_ADD_SEGMENTS ->
                clockService.addSegments(state, text(p, "clockId"), p.path("amount").asInt(), ts);
            case CommandTypes.CLOCK_SET_SEGMENTS ->
                clockService.setSegments(state, text(p, "clockId"), p.path("segments").asInt(), ts);
            case CommandTypes.CLOCK_CLEAR_SEGMENTS ->
                clockService.clearSegments(state, text(p, "clockId"), p.path("amount").asInt(), ts);

            // Turns
            case CommandTypes.TURN_BEGIN -> beginTurn(state, p, ts);
            case CommandTypes.TURN_SELECT_APPROACH -> {
                PlayerTurnState turn = decisionTurn(state, p, "select approach");
                turn.setRollMode(RollMode.valueOf(text(p, "rollMode")));
                turn.setPrimaryApproach(optEnum(p, "primaryApproach", Approach.class));
                turn.setSecondaryApproach(optEnum(p, "secondaryApproach", Approach.class));
            }
            case CommandTypes.TURN_SET_POSITION ->
                decisionTurn(state, p, "set position").setPosition(Position.valueOf(text(p, "position")));
            case CommandTypes.TURN_SET_EFFECT ->
                decisionTurn(state, p, "set effect").setEffect(Effect.valueOf(text(p, "effect")));
            case CommandTypes.TURN_SET_PUSH -> {
                PlayerTurnState turn = decisionTurn(state, p, "push");
                PushType pushType = optEnum(p, "pushType", PushType.class);
                turn.setPushed(pushType != null);
                turn.setPushType(pushType);
            }
            case CommandTypes.TURN_SET_FLASHBACK ->
                decisionTurn(state, p, "apply flashback").setFlashbackApplied(p.path("applied").asBoolean());
            case CommandTypes.TURN_SET_TRAIT_TRANSACTION -> decisionTurn(state, p, "set trait transaction")
                .setTraitTransaction(read(p.path("transaction"), TraitTransaction.class));
            case CommandTypes.TURN_SET_EQUIPMENT ->
                decisionTurn(state, p, "select equipment").setEquipmentIds(strings(p.path("equipmentIds")));
            case CommandTypes.TURN_SET_GM_APPROVED ->
                decisionTurn(state, p, "approve roll").setGmApproved(p.path("approved").asBoolean());
            case CommandTypes.TURN_SET_CONSEQUENCE -> setConsequence(state, p);
            case CommandTypes.TURN_TRANSITION -> transition(state, text(p, "characterId"),
                TurnState.valueOf(text(p, "toState")), optText(p, "reason"), ts);
            case CommandTypes.TURN_RECORD_ROLL -> recordRoll(state, p, ts);
            case CommandTypes.TURN_MARK_STIMS_USED -> {
                PlayerTurnState turn = state.requireTurn(text(p, "characterId"));
                turn.requireState("use stims", TurnState.GM_RESOLVING_CONSEQUENCE);
                turn.setStimsUsed(true);
                // The pending consequence is void once the result is being rerolled
                turn.setConsequence(null);
            }

            default -> throw new IllegalArgumentException("Unknown command type: " + entry.getType());
        }
    }

    // ========== CREWS ==========

    private void createCrew(GameState state, JsonNode p, long ts) {
        String crewId = text(p, "crewId");
        if (state.getCrews().containsKey(crewId)) {
            throw new IllegalStateException("Crew already exists: " + crewId);
        }
        Crew crew = Crew.builder()
            .id(crewId)
            .name(optText(p, "name"))
            .currentMomentum(p.path("momentum").asInt())
            .createdAt(ts)
            .updatedAt(ts)
            .build();
        state.getCrews().put(crewId, crew);
        momentumEconomy.setMomentum(state, crewId, crew.getCurrentMomentum(), ts);
    }

    // Deletions tolerate a missing entity: pruned histories keep them after dropping the create
    private void deleteCrew(GameState state, String crewId) {
        if (state.getCrews().remove(crewId) == null) {
            return;
        }
        state.getClocks().values().removeIf(clock -> crewId.equals(clock.getOwnerId()));
    }

    private void addMember(GameState state, String crewId, String characterId, long ts) {
        Crew crew = state.requireCrew(crewId);
        state.requireCharacter(characterId);
        state.findCrewOf(characterId).ifPresent(current -> {
            if (!current.getId().equals(crewId)) {
                throw new IllegalStateException("Character " + characterId + " already belongs to crew " + current.getId());
            }
        });
        if (!crew.getMemberIds().contains(characterId)) {
            crew.getMemberIds().add(characterId);
            crew.setUpdatedAt(ts);
        }
    }

    // ========== CHARACTERS ==========

    private void createCharacter(GameState state, JsonNode p, long ts) {
        String characterId = text(p, "characterId");
        if (state.getCharacters().containsKey(characterId)) {
            throw new IllegalStateException("Character already exists: " + characterId);
        }
        Map<Approach, Integer> approaches = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = p.path("approaches").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            int rating = field.getValue().asInt();
            if (rating < GameConstants.MIN_APPROACH_RATING || rating > GameConstants.MAX_APPROACH_RATING) {
                throw new IllegalArgumentException("Approach rating out of range for " + field.getKey() + ": " + rating);
            }
            approaches.put(Approach.valueOf(field.getKey()), rating);
        }
        PlayerCharacter character = PlayerCharacter.builder()
            .id(characterId)
            .name(optText(p, "name"))
            .approaches(approaches)
            .rallyAvailable(true)
            .createdAt(ts)
            .updatedAt(ts)
            .build();
        state.getCharacters().put(characterId, character);
    }

    private void deleteCharacter(GameState state, String characterId) {
        if (state.getCharacters().remove(characterId) == null) {
            return;
        }
        state.getTurns().remove(characterId);
        state.getCrews().values().forEach(crew -> crew.getMemberIds().remove(characterId));
        state.getClocks().values().removeIf(clock -> characterId.equals(clock.getOwnerId()));
    }

    private void addTrait(GameState state, JsonNode p, long ts) {
        PlayerCharacter character = state.requireCharacter(text(p, "characterId"));
        Trait trait = Trait.builder()
            .id(text(p, "traitId"))
            .name(text(p, "name"))
            .category(TraitCategory.valueOf(text(p, "category")))
            .description(optText(p, "description"))
            .acquiredAt(ts)
            .build();
        character.getTraits().add(trait);
        character.setUpdatedAt(ts);
    }

    private void lockEquipment(GameState state, String characterId, List<String> equipmentIds, long ts) {
        PlayerCharacter character = state.requireCharacter(characterId);
        for (String equipmentId : equipmentIds) {
            Equipment item = character.findEquipment(equipmentId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown equipment " + equipmentId + " on " + characterId));
            item.setLocked(true);
            if (item.getCategory() == EquipmentCategory.CONSUMABLE) {
                item.setConsumed(true);
            }
        }
        character.setUpdatedAt(ts);
    }

    // ========== TURNS ==========

    private void beginTurn(GameState state, JsonNode p, long ts) {
        String characterId = text(p, "characterId");
        state.requireCharacter(characterId);
        PlayerTurnState existing = state.getTurns().get(characterId);
        if (existing != null) {
            throw new TurnStateException(characterId, existing.getState(), TurnState.DECISION_PHASE);
        }
        PlayerTurnState turn = PlayerTurnState.builder()
            .characterId(characterId)
            .state(TurnState.IDLE_WAITING)
            .position(Position.valueOf(text(p, "position")))
            .effect(Effect.valueOf(text(p, "effect")))
            .stateEnteredAt(ts)
            .build();
        turn.transitionTo(TurnState.DECISION_PHASE, ts, "turn started");
        state.getTurns().put(characterId, turn);
    }

    private PlayerTurnState decisionTurn(GameState state, JsonNode p, String operation) {
        PlayerTurnState turn = state.requireTurn(text(p, "characterId"));
        turn.requireState(operation, TurnState.DECISION_PHASE);
        return turn;
    }

    private void setConsequence(GameState state, JsonNode p) {
        PlayerTurnState turn = state.requireTurn(text(p, "characterId"));
        ConsequenceTransaction transaction = read(p.path("transaction"), ConsequenceTransaction.class);
        if (transaction != null) {
            turn.requireState("set consequence", TurnState.GM_RESOLVING_CONSEQUENCE,
                TurnState.STIMS_LOCKED, TurnState.SUCCESS_COMPLETE);
        }
        turn.setConsequence(transaction);
    }

    private void transition(GameState state, String characterId, TurnState toState, String reason, long ts) {
        PlayerTurnState turn = state.requireTurn(characterId);
        turn.transitionTo(toState, ts, reason);
        if (toState == TurnState.IDLE_WAITING) {
            state.getTurns().remove(characterId);
            log.debug("Turn of {} reset ({})", characterId, reason);
        }
    }

    private void recordRoll(GameState state, JsonNode p, long ts) {
        PlayerTurnState turn = state.requireTurn(text(p, "characterId"));
        turn.requireState("record roll", TurnState.ROLLING);
        RollOutcome outcome = RollOutcome.valueOf(text(p, "outcome"));
        List<Integer> dice = new ArrayList<>();
        p.path("dice").forEach(face -> dice.add(face.asInt()));

        turn.setDicePool(p.path("dicePool").asInt());
        turn.setLastRoll(dice);
        turn.setOutcome(outcome);
        turn.setGmApproved(false);
        turn.transitionTo(outcome.isSuccessful() ? TurnState.SUCCESS_COMPLETE : TurnState.GM_RESOLVING_CONSEQUENCE,
            ts, "rolled " + outcome.name().toLowerCase());
    }

    // ========== payload helpers ==========

    private static String text(JsonNode payload, String field) {
        JsonNode node = payload.path(field);
        if (node.isMissingNode() || node.isNull()) {
            throw new IllegalArgumentException("Command payload is missing '" + field + "'");
        }
        return node.asText();
    }

    private static String optText(JsonNode payload, String field) {
        JsonNode node = payload.path(field);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static <E extends Enum<E>> E optEnum(JsonNode payload, String field, Class<E> type) {
        String value = optText(payload, field);
        return value == null ? null : Enum.valueOf(type, value);
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(node -> values.add(node.asText()));
        return values;
    }

    private <T> T read(JsonNode node, Class<T> type) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " payload", e);
        }
    }
}
