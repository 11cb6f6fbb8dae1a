package io.xmin.replication.status;

public enum TableState {
    IDLE,
    SYNCING,
    CATCHING_UP,
    /**
     * The last cycles failed and the table is being retried.
     */
    RETRYING,
    /**
     * Cycles complete but a row keeps failing, so the mark cannot pass it.
     */
    STALLED,
    EXCLUDED
}
