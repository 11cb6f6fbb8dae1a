package io.xmin.replication.daemon;

public enum SyncPhase {
    IDLE,
    FETCH,
    APPLY,
    UPDATE_STATE,
    RECONCILE
}
