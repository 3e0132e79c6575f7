package com.kotsin.turnengine.resolution;

import com.kotsin.turnengine.ladder.Effect;
import com.kotsin.turnengine.ladder.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trade-off offered on a partial: one rung of effect for one rung of position.
 * A {@code null} defensive position means no consequence lands at all.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DefensiveSuccessValues {

    private boolean available;
    private Position defensivePosition;
    private Effect defensiveEffect;
    private int defensiveSegments;
    private int originalSegments;
    private int momentumGain;

    public static DefensiveSuccessValues unavailable(Position original) {
        return DefensiveSuccessValues.builder()
            .available(false)
            .originalSegments(original.getConsequenceSegments())
            .momentumGain(original.getMomentumGain())
            .build();
    }
}
