package com.kotsin.turnengine.model.turn;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A pending trait use attached to a turn. Applied when the roll is committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraitTransaction {

    private TraitTransactionMode mode;

    // EXISTING
    private String traitId;

    // NEW and CONSOLIDATE
    private String newTraitName;
    private String newTraitDescription;

    // CONSOLIDATE
    @Builder.Default
    private List<String> consolidatedTraitIds = new ArrayList<>();

    @Builder.Default
    private boolean positionImprovement = true;
}
