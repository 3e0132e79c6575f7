package com.kotsin.turnengine.roster;

import com.kotsin.turnengine.command.Commands;
import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.exception.RallyUnavailableException;
import com.kotsin.turnengine.model.Approach;
import com.kotsin.turnengine.model.Crew;
import com.kotsin.turnengine.model.Equipment;
import com.kotsin.turnengine.model.GameState;
import com.kotsin.turnengine.model.TraitCategory;
import com.kotsin.turnengine.momentum.MomentumEconomy;
import com.kotsin.turnengine.notification.NotificationCode;
import com.kotsin.turnengine.notification.NotificationPublisher;
import com.kotsin.turnengine.notification.TurnNotification;
import com.kotsin.turnengine.store.GameStateStore;
import com.kotsin.turnengine.store.IdGenerator;
import com.kotsin.turnengine.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Crew and character bookkeeping the turn engine depends on, plus the crew-level
 * momentum actions (rally, lean into trait, reset, GM override).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RosterService {

    private final GameStateStore store;
    private final MomentumEconomy momentumEconomy;
    private final GameRulesConfig rules;
    private final IdGenerator idGenerator;
    private final NotificationPublisher notificationPublisher;

    // ========== CREWS ==========

    public String createCrew(String name, String userId) {
        String crewId = idGenerator.nextId();
        store.dispatch(Commands.createCrew(crewId, name, rules.getMomentum().getStart()), userId);
        log.info("Created crew {} ({})", crewId, name);
        return crewId;
    }

    public void deleteCrew(String crewId, String userId) {
        store.dispatch(Commands.deleteCrew(crewId), userId);
    }

    public void addMember(String crewId, String characterId, String userId) {
        store.dispatch(Commands.addCrewMember(crewId, characterId), userId);
    }

    public void removeMember(String crewId, String characterId, String userId) {
        store.dispatch(Commands.removeCrewMember(crewId, characterId), userId);
    }

    // ========== CHARACTERS ==========

    public String createCharacter(String name, Map<Approach, Integer> approaches, String userId) {
        String characterId = idGenerator.nextId();
        store.dispatch(Commands.createCharacter(characterId, name, approaches), userId);
        log.info("Created character {} ({})", characterId, name);
        return characterId;
    }

    public void deleteCharacter(String characterId, String userId) {
        store.dispatch(Commands.deleteCharacter(characterId), userId);
    }

    public String addTrait(String characterId, String name, TraitCategory category, String userId) {
        String traitId = idGenerator.nextId();
        store.dispatch(Commands.addTrait(characterId, traitId, name, category, null), userId);
        return traitId;
    }

    public String addEquipment(String characterId, Equipment equipment, String userId) {
        Equipment item = equipment.getId() == null
            ? Equipment.builder()
                .id(idGenerator.nextId())
                .name(equipment.getName())
                .tier(equipment.getTier())
                .category(equipment.getCategory())
                .diceBonus(equipment.getDiceBonus())
                .dicePenalty(equipment.getDicePenalty())
                .locked(equipment.isLocked())
                .consumed(equipment.isConsumed())
                .build()
            : equipment;
        store.dispatch(Commands.addEquipment(characterId, item), userId);
        return item.getId();
    }

    // ========== MOMENTUM ==========

    public void addMomentum(String crewId, int amount, String userId) {
        store.dispatch(Commands.addMomentum(crewId, amount), userId);
    }

    public void spendMomentum(String crewId, int amount, String userId) {
        store.dispatch(Commands.spendMomentum(crewId, amount), userId);
    }

    public void setMomentum(String crewId, int amount, String userId) {
        store.dispatch(Commands.setMomentum(crewId, amount), userId);
    }

    public int getMomentum(String crewId) {
        return store.getState().requireCrew(crewId).getCurrentMomentum();
    }

    public void resetCrew(String crewId, String userId) {
        GameState state = store.dispatch(Commands.resetCrew(crewId), userId);
        Crew crew = state.requireCrew(crewId);
        notificationPublisher.publish(TurnNotification.of(NotificationCode.CREW_RESET, null,
            Map.of("crewId", crewId, "momentum", crew.getCurrentMomentum())));
    }

    public ValidationResult validateRally(String characterId) {
        return momentumEconomy.validateRally(store.getState(), characterId);
    }

    /**
     * @param traitIdToReEnable optional disabled trait to restore
     * @throws RallyUnavailableException when momentum is too high or the rally is spent
     */
    public int rally(String characterId, int momentumToSpend, String traitIdToReEnable, String userId) {
        ValidationResult check = validateRally(characterId);
        if (!check.isValid()) {
            throw new RallyUnavailableException("Rally unavailable for " + characterId + ": " + check.getReason());
        }
        GameState state = store.dispatch(Commands.rally(characterId, momentumToSpend, traitIdToReEnable), userId);
        int momentum = state.findCrewOf(characterId).map(Crew::getCurrentMomentum).orElse(0);
        notificationPublisher.publish(TurnNotification.of(NotificationCode.RALLY_USED, characterId,
            Map.of("spent", momentumToSpend, "momentum", momentum)));
        return momentum;
    }

    public ValidationResult validateLeanIntoTrait(String characterId) {
        return momentumEconomy.validateLeanIntoTrait(store.getState(), characterId);
    }

    public int leanIntoTrait(String characterId, String traitId, String userId) {
        validateLeanIntoTrait(characterId).orThrow("Lean into trait for " + characterId);
        GameState state = store.dispatch(Commands.leanIntoTrait(characterId, traitId), userId);
        int momentum = state.findCrewOf(characterId).map(Crew::getCurrentMomentum).orElse(0);
        notificationPublisher.publish(TurnNotification.of(NotificationCode.LEANED_INTO_TRAIT, characterId,
            Map.of("traitId", traitId, "momentum", momentum)));
        return momentum;
    }

    public List<String> crewMembers(String crewId) {
        return List.copyOf(store.getState().requireCrew(crewId).getMemberIds());
    }
}
