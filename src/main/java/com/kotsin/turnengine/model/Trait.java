package com.kotsin.turnengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trait {

    private String id;
    private String name;
    private TraitCategory category;
    private boolean disabled;
    private String description;
    private long acquiredAt;
}
