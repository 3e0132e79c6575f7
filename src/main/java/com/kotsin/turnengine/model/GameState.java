package com.kotsin.turnengine.model;

import com.kotsin.turnengine.exception.UnknownEntityException;
import com.kotsin.turnengine.model.turn.PlayerTurnState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Everything the engine knows, keyed by id. Owned by the store; components receive it explicitly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameState {

    @Builder.Default
    private Map<String, PlayerCharacter> characters = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Crew> crews = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, GameClock> clocks = new LinkedHashMap<>();

    /** Active turns keyed by character id; at most one per character */
    @Builder.Default
    private Map<String, PlayerTurnState> turns = new LinkedHashMap<>();

    public PlayerCharacter requireCharacter(String characterId) {
        PlayerCharacter character = characterId == null ? null : characters.get(characterId);
        if (character == null) {
            throw new UnknownEntityException("Character", characterId);
        }
        return character;
    }

    public Crew requireCrew(String crewId) {
        Crew crew = crewId == null ? null : crews.get(crewId);
        if (crew == null) {
            throw new UnknownEntityException("Crew", crewId);
        }
        return crew;
    }

    public GameClock requireClock(String clockId) {
        GameClock clock = clockId == null ? null : clocks.get(clockId);
        if (clock == null) {
            throw new UnknownEntityException("Clock", clockId);
        }
        return clock;
    }

    public PlayerTurnState requireTurn(String characterId) {
        PlayerTurnState turn = characterId == null ? null : turns.get(characterId);
        if (turn == null) {
            throw new UnknownEntityException("Turn for character", characterId);
        }
        return turn;
    }

    public Optional<Crew> findCrewOf(String characterId) {
        return crews.values().stream()
            .filter(crew -> crew.getMemberIds().contains(characterId))
            .findFirst();
    }

    public List<GameClock> clocksOwnedBy(String ownerId, ClockType type) {
        return clocks.values().stream()
            .filter(clock -> ownerId.equals(clock.getOwnerId()) && clock.getType() == type)
            .collect(Collectors.toList());
    }
}
