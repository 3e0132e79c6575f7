package com.kotsin.turnengine.resolution;

import com.kotsin.turnengine.command.Command;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The computed effect of committing a consequence, plus the batch that performs it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsequencePlan {

    private String clockId;
    private int segments;
    private String crewId;
    private int momentumGain;
    // Gain that had no crew to go to
    private int forfeitedMomentum;
    private boolean defensive;

    @Builder.Default
    private List<Command> commands = new ArrayList<>();
}
