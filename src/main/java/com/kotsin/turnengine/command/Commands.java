package com.kotsin.turnengine.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kotsin.turnengine.dice.RollResult;
import com.kotsin.turnengine.ladder.Effect;
import com.kotsin.turnengine.ladder.Position;
import com.kotsin.turnengine.model.Approach;
import com.kotsin.turnengine.model.ClockType;
import com.kotsin.turnengine.model.Equipment;
import com.kotsin.turnengine.model.TraitCategory;
import com.kotsin.turnengine.model.turn.ConsequenceTransaction;
import com.kotsin.turnengine.model.turn.PushType;
import com.kotsin.turnengine.model.turn.RollMode;
import com.kotsin.turnengine.model.turn.TraitTransaction;
import com.kotsin.turnengine.model.turn.TurnState;

import java.util.Collection;
import java.util.Map;

/**
 * Typed builders for every command the engine issues.
 */
public final class Commands {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Commands() {
        throw new UnsupportedOperationException("Factory class");
    }

    // ========== CREWS ==========

    public static Command createCrew(String crewId, String name, int startingMomentum) {
        ObjectNode payload = payload().put("crewId", crewId).put("name", name)
            .put("momentum", startingMomentum);
        return command(CommandTypes.CREW_CREATE, payload);
    }

    public static Command deleteCrew(String crewId) {
        return command(CommandTypes.CREW_DELETE, payload().put("crewId", crewId));
    }

    public static Command addCrewMember(String crewId, String characterId) {
        return command(CommandTypes.CREW_ADD_MEMBER,
            payload().put("crewId", crewId).put("characterId", characterId));
    }

    public static Command removeCrewMember(String crewId, String characterId) {
        return command(CommandTypes.CREW_REMOVE_MEMBER,
            payload().put("crewId", crewId).put("characterId", characterId));
    }

    public static Command addMomentum(String crewId, int amount) {
        return command(CommandTypes.CREW_ADD_MOMENTUM, payload().put("crewId", crewId).put("amount", amount));
    }

    public static Command spendMomentum(String crewId, int amount) {
        return command(CommandTypes.CREW_SPEND_MOMENTUM, payload().put("crewId", crewId).put("amount", amount));
    }

    public static Command setMomentum(String crewId, int amount) {
        return command(CommandTypes.CREW_SET_MOMENTUM, payload().put("crewId", crewId).put("amount", amount));
    }

    public static Command resetCrew(String crewId) {
        return command(CommandTypes.CREW_RESET, payload().put("crewId", crewId));
    }

    // ========== CHARACTERS ==========

    public static Command createCharacter(String characterId, String name, Map<Approach, Integer> approaches) {
        ObjectNode payload = payload().put("characterId", characterId).put("name", name);
        payload.set("approaches", MAPPER.valueToTree(approaches));
        return command(CommandTypes.CHARACTER_CREATE, payload);
    }

    public static Command deleteCharacter(String characterId) {
        return command(CommandTypes.CHARACTER_DELETE, payload().put("characterId", characterId));
    }

    public static Command addTrait(String characterId, String traitId, String name,
                                   TraitCategory category, String description) {
        ObjectNode payload = payload()
            .put("characterId", characterId)
            .put("traitId", traitId)
            .put("name", name)
            .put("category", category.name())
            .put("description", description);
        return command(CommandTypes.CHARACTER_ADD_TRAIT, payload);
    }

    public static Command setTraitDisabled(String characterId, String traitId, boolean disabled) {
        return command(CommandTypes.CHARACTER_SET_TRAIT_DISABLED, payload()
            .put("characterId", characterId).put("traitId", traitId).put("disabled", disabled));
    }

    public static Command addEquipment(String characterId, Equipment equipment) {
        ObjectNode payload = payload().put("characterId", characterId);
        payload.set("equipment", MAPPER.valueToTree(equipment));
        return command(CommandTypes.CHARACTER_ADD_EQUIPMENT, payload);
    }

    public static Command lockEquipment(String characterId, Collection<String> equipmentIds) {
        ObjectNode payload = payload().put("characterId", characterId);
        payload.set("equipmentIds", stringArray(equipmentIds));
        return command(CommandTypes.CHARACTER_LOCK_EQUIPMENT, payload);
    }

    public static Command applyTraitTransaction(String characterId, TraitTransaction transaction, String newTraitId) {
        ObjectNode payload = payload().put("characterId", characterId).put("newTraitId", newTraitId);
        payload.set("transaction", MAPPER.valueToTree(transaction));
        return command(CommandTypes.CHARACTER_APPLY_TRAIT_TRANSACTION, payload);
    }

    public static Command rally(String characterId, int momentumToSpend, String traitIdToReEnable) {
        ObjectNode payload = payload()
            .put("characterId", characterId)
            .put("amount", momentumToSpend)
            .put("traitId", traitIdToReEnable);
        return command(CommandTypes.CHARACTER_RALLY, payload);
    }

    public static Command leanIntoTrait(String characterId, String traitId) {
        return command(CommandTypes.CHARACTER_LEAN_INTO_TRAIT,
            payload().put("characterId", characterId).put("traitId", traitId));
    }

    // ========== CLOCKS ==========

    public static Command createClock(String clockId, String ownerId, ClockType type, String subtype,
                                      int maxSegments, String category, String description) {
        ObjectNode payload = payload()
            .put("clockId", clockId)
            .put("ownerId", ownerId)
            .put("type", type.name())
            .put("subtype", subtype)
            .put("maxSegments", maxSegments)
            .put("category", category)
            .put("description", description);
        return command(CommandTypes.CLOCK_CREATE, payload);
    }

    public static Command deleteClock(String clockId) {
        return command(CommandTypes.CLOCK_DELETE, payload().put("clockId", clockId));
    }

    public static Command addSegments(String clockId, int amount) {
        return command(CommandTypes.CLOCK_ADD_SEGMENTS, payload().put("clockId", clockId).put("amount", amount));
    }

    public static Command setSegments(String clockId, int segments) {
        return command(CommandTypes.CLOCK_SET_SEGMENTS, payload().put("clockId", clockId).put("segments", segments));
    }

    public static Command clearSegments(String clockId, int amount) {
        return command(CommandTypes.CLOCK_CLEAR_SEGMENTS, payload().put("clockId", clockId).put("amount", amount));
    }

    // ========== TURNS ==========

    public static Command beginTurn(String characterId, Position position, Effect effect) {
        ObjectNode payload = payload()
            .put("characterId", characterId)
            .put("position", position.name())
            .put("effect", effect.name());
        return command(CommandTypes.TURN_BEGIN, payload);
    }

    public static Command selectApproach(String characterId, RollMode mode, Approach primary, Approach secondary) {
        ObjectNode payload = payload()
            .put("characterId", characterId)
            .put("rollMode", mode.name())
            .put("primaryApproach", nameOf(primary))
            .put("secondaryApproach", nameOf(secondary));
        return command(CommandTypes.TURN_SELECT_APPROACH, payload);
    }

    public static Command setPosition(String characterId, Position position) {
        return command(CommandTypes.TURN_SET_POSITION,
            payload().put("characterId", characterId).put("position", position.name()));
    }

    public static Command setEffect(String characterId, Effect effect) {
        return command(CommandTypes.TURN_SET_EFFECT,
            payload().put("characterId", characterId).put("effect", effect.name()));
    }

    /**
     * @param pushType {@code null} clears the push
     */
    public static Command setPush(String characterId, PushType pushType) {
        return command(CommandTypes.TURN_SET_PUSH,
            payload().put("characterId", characterId).put("pushType", nameOf(pushType)));
    }

    public static Command setFlashback(String characterId, boolean applied) {
        return command(CommandTypes.TURN_SET_FLASHBACK,
            payload().put("characterId", characterId).put("applied", applied));
    }

    /**
     * @param transaction {@code null} clears the pending transaction
     */
    public static Command setTraitTransaction(String characterId, TraitTransaction transaction) {
        ObjectNode payload = payload().put("characterId", characterId);
        payload.set("transaction", MAPPER.valueToTree(transaction));
        return command(CommandTypes.TURN_SET_TRAIT_TRANSACTION, payload);
    }

    public static Command setEquipment(String characterId, Collection<String> equipmentIds) {
        ObjectNode payload = payload().put("characterId", characterId);
        payload.set("equipmentIds", stringArray(equipmentIds));
        return command(CommandTypes.TURN_SET_EQUIPMENT, payload);
    }

    public static Command setGmApproved(String characterId, boolean approved) {
        return command(CommandTypes.TURN_SET_GM_APPROVED,
            payload().put("characterId", characterId).put("approved", approved));
    }

    /**
     * @param transaction {@code null} clears the pending consequence
     */
    public static Command setConsequence(String characterId, ConsequenceTransaction transaction) {
        ObjectNode payload = payload().put("characterId", characterId);
        payload.set("transaction", MAPPER.valueToTree(transaction));
        return command(CommandTypes.TURN_SET_CONSEQUENCE, payload);
    }

    public static Command transition(String characterId, TurnState toState, String reason) {
        ObjectNode payload = payload()
            .put("characterId", characterId)
            .put("toState", toState.name())
            .put("reason", reason);
        return command(CommandTypes.TURN_TRANSITION, payload);
    }

    /**
     * Records the faces and moves the turn out of ROLLING according to the outcome.
     */
    public static Command recordRoll(String characterId, RollResult result) {
        ObjectNode payload = payload()
            .put("characterId", characterId)
            .put("dicePool", result.getDicePool())
            .put("outcome", result.getOutcome().name());
        ArrayNode dice = payload.putArray("dice");
        result.getDice().forEach(dice::add);
        return command(CommandTypes.TURN_RECORD_ROLL, payload);
    }

    public static Command markStimsUsed(String characterId) {
        return command(CommandTypes.TURN_MARK_STIMS_USED, payload().put("characterId", characterId));
    }

    // ========== helpers ==========

    private static Command command(String type, ObjectNode payload) {
        return Command.builder().type(type).payload(payload).build();
    }

    private static ObjectNode payload() {
        return MAPPER.createObjectNode();
    }

    private static ArrayNode stringArray(Collection<String> values) {
        ArrayNode array = MAPPER.createArrayNode();
        values.forEach(array::add);
        return array;
    }

    private static String nameOf(Enum<?> value) {
        return value == null ? null : value.name();
    }
}
