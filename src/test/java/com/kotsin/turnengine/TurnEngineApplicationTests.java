package com.kotsin.turnengine;

import com.kotsin.turnengine.config.GameRulesConfig;
import com.kotsin.turnengine.model.turn.PlayerTurnState;
import com.kotsin.turnengine.model.turn.TurnState;
import com.kotsin.turnengine.roster.RosterService;
import com.kotsin.turnengine.support.TestEngine;
import com.kotsin.turnengine.turn.PlayerTurnStateMachine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class TurnEngineApplicationTests {

    @Autowired
    private GameRulesConfig rules;

    @Autowired
    private RosterService roster;

    @Autowired
    private PlayerTurnStateMachine turns;

    @Test
    void contextLoads() {
        assertEquals(5, rules.getMomentum().getStart());
        assertEquals(8, rules.getClocks().getAddictionSegments());
    }

    @Test
    void beginsTurnThroughWiredServices() {
        String crewId = roster.createCrew("Crew", "gm");
        String characterId = roster.createCharacter("Nova", TestEngine.approaches(1, 1, 1, 1), "gm");
        roster.addMember(crewId, characterId, "gm");

        PlayerTurnState turn = turns.beginTurn(characterId, "gm");

        assertEquals(TurnState.DECISION_PHASE, turn.getState());
        assertEquals(5, roster.getMomentum(crewId));
    }
}
