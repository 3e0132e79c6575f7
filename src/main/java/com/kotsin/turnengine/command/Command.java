package com.kotsin.turnengine.command;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single state mutation. Payloads carry every value the mutation needs, including
 * generated ids and dice faces, so applying a command never consults randomness.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Command {
    private String type;
    private JsonNode payload;
}
