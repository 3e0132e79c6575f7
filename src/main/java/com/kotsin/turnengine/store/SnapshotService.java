package com.kotsin.turnengine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.turnengine.command.CommandHistoryEntry;
import com.kotsin.turnengine.config.GameConstants;
import com.kotsin.turnengine.exception.EngineConfigurationException;
import com.kotsin.turnengine.model.GameState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Cold-start support: capture the store as a snapshot, and load a snapshot followed by
 * the history entries committed after it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotService {

    private final GameStateStore store;
    private final ObjectMapper objectMapper;

    public Snapshot takeSnapshot() {
        Snapshot snapshot = store.snapshot();
        log.info("Snapshot taken at {}", snapshot.getTimestamp());
        return snapshot;
    }

    /**
     * Restore the snapshot, then replay every entry newer than it.
     *
     * @param history the full command history, oldest first
     * @return the loaded state
     */
    public GameState load(Snapshot snapshot, List<CommandHistoryEntry> history) {
        if (snapshot.getVersion() != GameConstants.SNAPSHOT_VERSION) {
            throw new EngineConfigurationException("Unsupported snapshot version " + snapshot.getVersion());
        }
        List<CommandHistoryEntry> newer = history.stream()
            .filter(entry -> entry.getTimestamp() > snapshot.getTimestamp())
            .collect(Collectors.toList());

        GameState loaded = store.replayOnto(snapshot.getState(), newer);
        store.restore(loaded, history, snapshot.getTimestamp());
        log.info("Loaded snapshot from {} and replayed {} newer commands", snapshot.getTimestamp(), newer.size());
        return store.getState();
    }

    public String toJson(Snapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot", e);
        }
    }

    public Snapshot fromJson(String json) {
        try {
            return objectMapper.readValue(json, Snapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed snapshot", e);
        }
    }
}
