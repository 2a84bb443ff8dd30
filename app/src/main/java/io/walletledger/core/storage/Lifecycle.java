package io.walletledger.core.storage;

/**
 * Explicit open/close contract. Opening an already open component, or using a
 * closed one, is an {@link IllegalStateException}.
 */
public interface Lifecycle extends AutoCloseable {

    /** Transition CLOSED -> OPENING -> OPEN. */
    void open();

    /** Transition OPEN -> CLOSING -> CLOSED. Closing a closed component is a no-op. */
    @Override
    void close();

    LifecycleState state();

    default boolean isOpen() {
        return state() == LifecycleState.OPEN;
    }

    default void ensureOpen() {
        if (!isOpen()) {
            throw new IllegalStateException(getClass().getSimpleName() + " is not open (state=" + state() + ")");
        }
    }
}
