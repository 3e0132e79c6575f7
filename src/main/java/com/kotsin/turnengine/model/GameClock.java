package com.kotsin.turnengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Segmented counter owned by a character or a crew. 0 <= segments <= maxSegments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameClock {

    private String id;
    private String ownerId;
    private ClockType type;
    private String subtype;
    private int segments;
    private int maxSegments;

    // Optional metadata
    private String category;
    private String description;

    private long createdAt;
    private long updatedAt;

    @JsonIgnore
    public boolean isFull() {
        return segments >= maxSegments;
    }
}
