package com.kotsin.turnengine.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.turnengine.audit.AuditLogger;
import com.kotsin.turnengine.command.Command;
import com.kotsin.turnengine.command.CommandApplier;
import com.kotsin.turnengine.command.CommandHistoryEntry;
import com.kotsin.turnengine.config.GameConstants;
import com.kotsin.turnengine.model.GameState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * GameStateStore - single writer for game state and its command history.
 *
 * A batch is applied to a private copy and swapped in only if every command succeeds.
 * Entries of one batch share a timestamp; timestamps strictly increase between batches.
 */
@Slf4j
@Component
public class GameStateStore {

    private final CommandApplier applier;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final IdGenerator idGenerator;
    private final AuditLogger auditLogger;

    private GameState state = new GameState();
    private final List<CommandHistoryEntry> history = new ArrayList<>();
    private long lastTimestamp;

    public GameStateStore(CommandApplier applier, ObjectMapper objectMapper, Clock clock,
                          IdGenerator idGenerator, AuditLogger auditLogger) {
        this.applier = applier;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.idGenerator = idGenerator;
        this.auditLogger = auditLogger;
    }

    /**
     * Detached copy of the current state.
     */
    public synchronized GameState getState() {
        return copy(state);
    }

    public synchronized List<CommandHistoryEntry> getHistory() {
        return List.copyOf(history);
    }

    public GameState dispatch(Command command, String userId) {
        return dispatch(List.of(command), userId);
    }

    /**
     * Apply a batch atomically and append it to history.
     *
     * @return a copy of the resulting state
     */
    public synchronized GameState dispatch(List<Command> batch, String userId) {
        if (batch.isEmpty()) {
            return copy(state);
        }
        long timestamp = nextTimestamp();

        List<CommandHistoryEntry> entries = new ArrayList<>(batch.size());
        for (Command command : batch) {
            entries.add(CommandHistoryEntry.builder()
                .commandId(idGenerator.nextId())
                .type(command.getType())
                .payload(command.getPayload())
                .timestamp(timestamp)
                .userId(userId)
                .version(GameConstants.COMMAND_VERSION)
                .build());
        }

        GameState working = copy(state);
        try {
            for (CommandHistoryEntry entry : entries) {
                applier.apply(working, entry);
            }
        } catch (RuntimeException e) {
            log.warn("Rejected batch of {} commands from {}: {}", batch.size(), userId, e.getMessage());
            auditLogger.logRejectedBatch(userId, batch, timestamp, e);
            throw e;
        }

        state = working;
        lastTimestamp = timestamp;
        history.addAll(entries);
        auditLogger.logCommittedBatch(userId, entries);
        log.debug("Committed batch of {} commands from {}", entries.size(), userId);
        return copy(state);
    }

    /**
     * Rebuild state by applying {@code entries} in order to an empty state.
     */
    public GameState replay(List<CommandHistoryEntry> entries) {
        return replayOnto(new GameState(), entries);
    }

    public GameState replayOnto(GameState base, List<CommandHistoryEntry> entries) {
        GameState rebuilt = copy(base);
        for (CommandHistoryEntry entry : entries) {
            applier.apply(rebuilt, entry);
        }
        return rebuilt;
    }

    /**
     * Replace the live state and history, e.g. after loading a snapshot.
     *
     * @param baseTimestamp timestamp the restored state is known to include; new batches are stamped after it
     */
    public synchronized void restore(GameState restored, List<CommandHistoryEntry> fullHistory, long baseTimestamp) {
        this.state = copy(restored);
        this.history.clear();
        this.history.addAll(fullHistory);
        long lastEntry = fullHistory.isEmpty() ? 0L : fullHistory.get(fullHistory.size() - 1).getTimestamp();
        this.lastTimestamp = Math.max(baseTimestamp, lastEntry);
        log.info("Store restored with {} history entries up to {}", fullHistory.size(), lastTimestamp);
    }

    public synchronized Snapshot snapshot() {
        return Snapshot.builder()
            .timestamp(lastTimestamp)
            .version(GameConstants.SNAPSHOT_VERSION)
            .state(copy(state))
            .build();
    }

    /**
     * Timestamp of the most recently committed batch, 0 when nothing has been committed.
     */
    public synchronized long getLastTimestamp() {
        return lastTimestamp;
    }

    // ========== HISTORY MAINTENANCE ==========

    /**
     * Drop the whole history. The current state is kept.
     *
     * @return entries removed
     */
    public synchronized int pruneHistory() {
        int removed = history.size();
        history.clear();
        auditLogger.logHistoryPruned("all", removed, 0);
        return removed;
    }

    /**
     * Drop entries for entities that no longer exist.
     *
     * @return entries removed
     */
    public synchronized int pruneOrphanedHistory() {
        int before = history.size();
        List<CommandHistoryEntry> kept = HistoryPruner.pruneOrphaned(history, state);
        history.clear();
        history.addAll(kept);
        auditLogger.logHistoryPruned("orphaned", before, kept.size());
        return before - kept.size();
    }

    private long nextTimestamp() {
        return Math.max(clock.millis(), lastTimestamp + 1);
    }

    private GameState copy(GameState source) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(source), GameState.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy game state", e);
        }
    }
}
