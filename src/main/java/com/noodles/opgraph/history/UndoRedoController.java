package com.noodles.opgraph.history;

import com.noodles.opgraph.io.GraphDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

/**
 * Linear undo/redo over declarative graph snapshots.
 *
 * <p>
 * History is a list of {@link HistoryEntry}s plus a cursor pointing at the
 * entry that matches the current graph ({@code -1} while empty). Undo and redo
 * move the cursor and hand the target snapshot to the restore callback,
 * normally the reconciler, which diffs the live store back into that shape.
 *
 * <p>
 * Entries are recorded after the change they describe: the entry at the
 * cursor holds the current graph and the description of the edit that
 * produced it. Undo therefore reverts the edit named by the entry at the
 * cursor, and redo re-applies the edit named by the entry after it. The first
 * entry is the baseline and can never be undone.
 *
 * <p>
 * Recording while a restore is in progress is suppressed, so a host that
 * records on every graph change does not push the restored state back onto
 * the stack. Recording a state identical to the one at the cursor is a no-op.
 * The oldest entries are dropped once the history exceeds its size limit.
 *
 * <p>
 * Thread Safety: none. Drive it from the thread that owns the store.
 */
@Log4j2
public final class UndoRedoController {
    public static final int DEFAULT_MAX_HISTORY_SIZE = 50;

    private final List<HistoryEntry> history = new ArrayList<>();
    private final Consumer<GraphDefinition> restore;
    private final Supplier<GraphDefinition> currentState;
    private final int maxHistorySize;
    private UndoRedoListener[] listeners = new UndoRedoListener[0];
    private int currentIndex = -1;
    private boolean restoring;

    public UndoRedoController(Consumer<GraphDefinition> restore) {
        this(restore, null, DEFAULT_MAX_HISTORY_SIZE);
    }

    /**
     * @param restore        applies a snapshot to the live graph.
     * @param currentState   captures the live graph for {@link #takeSnapshot};
     *                       may be null if snapshots are always passed in.
     * @param maxHistorySize maximum number of retained entries.
     */
    public UndoRedoController(Consumer<GraphDefinition> restore, Supplier<GraphDefinition> currentState,
            int maxHistorySize) {
        if (maxHistorySize < 1)
            throw new IllegalArgumentException("maxHistorySize must be positive: " + maxHistorySize);
        this.restore = restore;
        this.currentState = currentState;
        this.maxHistorySize = maxHistorySize;
    }

    /**
     * Appends a snapshot after the cursor, discarding any redo history.
     *
     * @return false if recording was suppressed (restore in progress) or the
     *         state equals the current entry.
     */
    public boolean record(GraphDefinition state, String description) {
        if (restoring) {
            log.debug("Ignoring snapshot '{}' during restore", description);
            return false;
        }
        if (currentIndex >= 0 && history.get(currentIndex).state().equals(state))
            return false;

        while (history.size() > currentIndex + 1)
            history.remove(history.size() - 1);
        history.add(HistoryEntry.capture(state, description));
        while (history.size() > maxHistorySize)
            history.remove(0);
        currentIndex = history.size() - 1;
        notifyListeners();
        return true;
    }

    /**
     * Records the live graph obtained from the current-state supplier.
     *
     * @throws IllegalStateException if the controller was built without one.
     */
    public boolean takeSnapshot(String description) {
        if (currentState == null)
            throw new IllegalStateException("No current-state supplier configured");
        return record(currentState.get(), description);
    }

    /** @return false if there was nothing to undo. */
    public boolean undo() {
        if (!canUndo())
            return false;
        restoreTo(currentIndex - 1);
        return true;
    }

    /** @return false if there was nothing to redo. */
    public boolean redo() {
        if (!canRedo())
            return false;
        restoreTo(currentIndex + 1);
        return true;
    }

    private void restoreTo(int index) {
        HistoryEntry entry = history.get(index);
        restoring = true;
        try {
            restore.accept(entry.state().copy());
        } finally {
            restoring = false;
        }
        // Only move once the restore went through; a failed restore leaves the cursor alone
        currentIndex = index;
        log.debug("Restored history entry {} of {} ({})", index, history.size(), entry.description());
        notifyListeners();
    }

    public boolean canUndo() {
        return currentIndex > 0;
    }

    public boolean canRedo() {
        return currentIndex < history.size() - 1;
    }

    public boolean isRestoring() {
        return restoring;
    }

    /**
     * The undo description names the edit {@link #undo()} would revert (the
     * entry at the cursor); the redo description names the edit {@link #redo()}
     * would re-apply (the entry after it).
     */
    public UndoRedoState getState() {
        boolean canUndo = canUndo();
        boolean canRedo = canRedo();
        return new UndoRedoState(canUndo, canRedo, currentIndex, history.size(),
                canUndo ? history.get(currentIndex).description() : null,
                canRedo ? history.get(currentIndex + 1).description() : null);
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public int maxHistorySize() {
        return maxHistorySize;
    }

    public void clear() {
        history.clear();
        currentIndex = -1;
        notifyListeners();
    }

    public void addListener(UndoRedoListener listener) {
        UndoRedoListener[] old = listeners;
        UndoRedoListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public void removeListener(UndoRedoListener listener) {
        UndoRedoListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                UndoRedoListener[] next = new UndoRedoListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return;
            }
        }
    }

    private void notifyListeners() {
        if (listeners.length == 0)
            return;
        UndoRedoState state = getState();
        for (UndoRedoListener l : listeners)
            l.onStateChanged(state);
    }
}
