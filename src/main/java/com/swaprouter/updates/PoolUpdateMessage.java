package com.swaprouter.updates;

/**
 * Envelope published on the pool update channel.
 *
 * <pre>
 * {"chain": "wax", "buffer": "a86269..."}
 * </pre>
 *
 * @param chain  Chain the pool belongs to
 * @param buffer Hex encoding of the binary pool payload
 */
public record PoolUpdateMessage(String chain, String buffer) {

    public PoolUpdateMessage {
        if (chain == null || chain.isBlank()) throw new IllegalArgumentException("Chain must not be blank");
        if (buffer == null || buffer.isBlank()) throw new IllegalArgumentException("Buffer must not be blank");
    }
}
