package com.noodles.opgraph.history;

/**
 * Read-only view of the undo stack, for enabling buttons and menu labels.
 *
 * @param undoDescription description of the change {@code undo()} would
 *                        revert, or {@code null}.
 * @param redoDescription description of the change {@code redo()} would
 *                        reapply, or {@code null}.
 */
public record UndoRedoState(boolean canUndo, boolean canRedo, int currentIndex, int historySize,
        String undoDescription, String redoDescription) {
}
