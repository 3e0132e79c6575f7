package com.kotsin.turnengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Gear as far as the turn engine sees it: dice modifiers and lock state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Equipment {

    private String id;
    private String name;
    private EquipmentTier tier;
    private EquipmentCategory category;
    private int diceBonus;
    private int dicePenalty;
    private boolean locked;
    private boolean consumed;

    @JsonIgnore
    public int getDiceModifier() {
        return diceBonus - dicePenalty;
    }

    public boolean requiresFirstLockPayment() {
        return !locked && tier != null && tier.hasFirstLockCost();
    }
}
