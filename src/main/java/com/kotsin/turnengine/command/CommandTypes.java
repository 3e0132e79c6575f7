package com.kotsin.turnengine.command;

/**
 * Command type identifiers. The prefix names the entity the payload refers to.
 */
public final class CommandTypes {

    private CommandTypes() {
        throw new UnsupportedOperationException("Constants class");
    }

    public static final String CREWS_PREFIX = "crews/";
    public static final String CHARACTERS_PREFIX = "characters/";
    public static final String CLOCKS_PREFIX = "clocks/";
    public static final String TURNS_PREFIX = "turns/";
    public static final String DELETE_SUFFIX = "/delete";

    // ========== CREWS ==========

    public static final String CREW_CREATE = "crews/create";
    public static final String CREW_DELETE = "crews/delete";
    public static final String CREW_ADD_MEMBER = "crews/addMember";
    public static final String CREW_REMOVE_MEMBER = "crews/removeMember";
    public static final String CREW_ADD_MOMENTUM = "crews/addMomentum";
    public static final String CREW_SPEND_MOMENTUM = "crews/spendMomentum";
    public static final String CREW_SET_MOMENTUM = "crews/setMomentum";
    public static final String CREW_RESET = "crews/reset";

    // ========== CHARACTERS ==========

    public static final String CHARACTER_CREATE = "characters/create";
    public static final String CHARACTER_DELETE = "characters/delete";
    public static final String CHARACTER_ADD_TRAIT = "characters/addTrait";
    public static final String CHARACTER_SET_TRAIT_DISABLED = "characters/setTraitDisabled";
    public static final String CHARACTER_ADD_EQUIPMENT = "characters/addEquipment";
    public static final String CHARACTER_LOCK_EQUIPMENT = "characters/lockEquipment";
    public static final String CHARACTER_APPLY_TRAIT_TRANSACTION = "characters/applyTraitTransaction";
    public static final String CHARACTER_RALLY = "characters/rally";
    public static final String CHARACTER_LEAN_INTO_TRAIT = "characters/leanIntoTrait";

    // ========== CLOCKS ==========

    public static final String CLOCK_CREATE = "clocks/create";
    public static final String CLOCK_DELETE = "clocks/delete";
    public static final String CLOCK_ADD_SEGMENTS = "clocks/addSegments";
    public static final String CLOCK_SET_SEGMENTS = "clocks/setSegments";
    public static final String CLOCK_CLEAR_SEGMENTS = "clocks/clearSegments";

    // ========== TURNS ==========

    public static final String TURN_BEGIN = "turns/begin";
    public static final String TURN_SELECT_APPROACH = "turns/selectApproach";
    public static final String TURN_SET_POSITION = "turns/setPosition";
    public static final String TURN_SET_EFFECT = "turns/setEffect";
    public static final String TURN_SET_PUSH = "turns/setPush";
    public static final String TURN_SET_FLASHBACK = "turns/setFlashback";
    public static final String TURN_SET_TRAIT_TRANSACTION = "turns/setTraitTransaction";
    public static final String TURN_SET_EQUIPMENT = "turns/setEquipment";
    public static final String TURN_SET_GM_APPROVED = "turns/setGmApproved";
    public static final String TURN_SET_CONSEQUENCE = "turns/setConsequence";
    public static final String TURN_TRANSITION = "turns/transition";
    public static final String TURN_RECORD_ROLL = "turns/recordRoll";
    public static final String TURN_MARK_STIMS_USED = "turns/markStimsUsed";
}
