package com.kotsin.turnengine.store;

import com.kotsin.turnengine.model.GameState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fully serialized state as of {@link #timestamp}, the timestamp of the last batch it includes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Snapshot {
    private long timestamp;
    private int version;
    private GameState state;
}
