package com.noodles.opgraph.history;

/** Notified after every change to the undo stack. */
@FunctionalInterface
public interface UndoRedoListener {
    void onStateChanged(UndoRedoState state);
}
