package com.swaprouter.registry;

/**
 * What {@link PoolRegistry#applyUpdate(String, byte[])} did with a pool update.
 */
public enum UpdateOutcome {

    /** The pool was upserted into an existing registry. */
    APPLIED,

    /** The chain had no registry yet; the update was discarded and a full fetch was made instead. */
    BOOTSTRAPPED
}
