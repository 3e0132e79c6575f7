package com.kotsin.turnengine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.kotsin.turnengine.command.CommandHistoryEntry;
import com.kotsin.turnengine.command.CommandTypes;
import com.kotsin.turnengine.model.GameState;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drops history entries that refer to entities no longer present. Deletions are always kept.
 */
public final class HistoryPruner {

    private HistoryPruner() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static List<CommandHistoryEntry> pruneOrphaned(List<CommandHistoryEntry> history, GameState state) {
        return history.stream()
            .filter(entry -> isDeletion(entry) || !isOrphaned(entry, state))
            .collect(Collectors.toList());
    }

    static boolean isDeletion(CommandHistoryEntry entry) {
        return entry.getType().endsWith(CommandTypes.DELETE_SUFFIX);
    }

    /**
     * An entry is orphaned when any entity id in its payload is gone, or when the
     * entity its type prefix names cannot be identified from the payload at all.
     */
    static boolean isOrphaned(CommandHistoryEntry entry, GameState state) {
        JsonNode payload = entry.getPayload();
        if (payload == null) {
            return false;
        }
        if (missing(payload, "crewId", state.getCrews())
            || missing(payload, "characterId", state.getCharacters())
            || missing(payload, "clockId", state.getClocks())) {
            return true;
        }
        String primaryField = primaryIdField(entry.getType());
        return primaryField != null && payload.path(primaryField).isMissingNode();
    }

    private static String primaryIdField(String type) {
        if (type.startsWith(CommandTypes.CREWS_PREFIX)) {
            return "crewId";
        }
        if (type.startsWith(CommandTypes.CHARACTERS_PREFIX) || type.startsWith(CommandTypes.TURNS_PREFIX)) {
            return "characterId";
        }
        if (type.startsWith(CommandTypes.CLOCKS_PREFIX)) {
            return "clockId";
        }
        return null;
    }

    private static boolean missing(JsonNode payload, String field, Map<String, ?> entities) {
        JsonNode id = payload.path(field);
        return !id.isMissingNode() && !id.isNull() && !entities.containsKey(id.asText());
    }
}
