package io.walletledger.core.storage;

/** Open/close state shared by every component that owns a resource. */
public enum LifecycleState {
    CLOSED,
    OPENING,
    OPEN,
    CLOSING
}
