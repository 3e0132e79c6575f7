package com.kotsin.turnengine.command;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandHistoryEntry {

    private String commandId;
    private String type;
    private JsonNode payload;
    private long timestamp;
    private String userId;
    private int version;

    public Command toCommand() {
        return new Command(type, payload);
    }
}
