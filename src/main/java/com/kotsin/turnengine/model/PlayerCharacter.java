package com.kotsin.turnengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerCharacter {

    private String id;
    private String name;

    @Builder.Default
    private Map<Approach, Integer> approaches = new LinkedHashMap<>();

    @Builder.Default
    private List<Trait> traits = new ArrayList<>();

    @Builder.Default
    private List<Equipment> equipment = new ArrayList<>();

    @Builder.Default
    private boolean rallyAvailable = true;

    private long createdAt;
    private long updatedAt;

    public int rating(Approach approach) {
        if (approach == null) {
            return 0;
        }
        return approaches.getOrDefault(approach, 0);
    }

    public Optional<Trait> findTrait(String traitId) {
        return traits.stream().filter(t -> t.getId().equals(traitId)).findFirst();
    }

    public Optional<Equipment> findEquipment(String equipmentId) {
        return equipment.stream().filter(e -> e.getId().equals(equipmentId)).findFirst();
    }

    public boolean hasEnabledTrait() {
        return traits.stream().anyMatch(t -> !t.isDisabled());
    }
}
