package org.gamboni.sideshelf.data;

/** Where a resume position came from, in increasing order of authority. */
public enum ResumeSource {
    /** In-memory position held by the player store. */
    STORE,
    /** Position persisted locally on the device. */
    ASYNC_STORAGE,
    /** Saved media progress of the current user. */
    SAVED_PROGRESS,
    /** Active listening session of the current user. */
    ACTIVE_SESSION
}
