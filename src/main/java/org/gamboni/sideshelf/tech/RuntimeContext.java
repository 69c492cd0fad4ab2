package org.gamboni.sideshelf.tech;

/**
 * The execution context a runtime is constructed for. The foreground UI and the headless background service
 * each run their own event bus and coordinator; they share no memory.
 */
public enum RuntimeContext {
    /** Foreground context, where the UI's player store is available. */
    UI,
    /** Background playback service, with no UI and no player store. */
    HEADLESS;

    public boolean hasPlayerStore() {
        return this == UI;
    }
}
