package com.kotsin.turnengine.model.turn;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the GM has decided the roll costs (or, for a success clock, earns).
 * Which target fields must be filled depends on {@link #type}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConsequenceTransaction {

    private ConsequenceType type;

    private String harmTargetCharacterId;
    private String harmClockId;

    private String crewClockId;

    private String successClockId;

    private boolean useDefensiveSuccess;
}
