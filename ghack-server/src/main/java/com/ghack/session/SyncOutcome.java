package com.ghack.session;

/**
 * What applying an entity message did to an {@link EntityTable}.
 */
public enum SyncOutcome {
    ADDED,
    /** AddEntity for an id that was already known. Informational. */
    REANNOUNCED,
    REMOVED,
    UPDATED,
    /** RemoveEntity or UpdateState for an id that is not known. A minor error. */
    UNKNOWN_ENTITY,
    /** The message does not touch entities. */
    NOT_APPLICABLE;

    public boolean isMinorError() {
        return this == UNKNOWN_ENTITY;
    }
}
