package com.kotsin.turnengine.model.turn;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateTransition {
    private TurnState fromState;
    private TurnState toState;
    private long timestamp;
    private String reason;
}
