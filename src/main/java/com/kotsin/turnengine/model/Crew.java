package com.kotsin.turnengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Crew {

    private String id;
    private String name;

    @Builder.Default
    private List<String> memberIds = new ArrayList<>();

    private int currentMomentum;
    private long createdAt;
    private long updatedAt;
}
