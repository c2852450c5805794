package com.swaprouter.updates;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swaprouter.codec.PoolDecodeException;
import com.swaprouter.registry.PoolRegistry;
import com.swaprouter.registry.PoolSourceException;
import com.swaprouter.registry.UpdateOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Applies pool update messages to the {@link PoolRegistry}.
 *
 * <p>Transport-agnostic: whatever subscribes to the channel hands each raw message to
 * {@link #onMessage(String)}, one at a time and in arrival order. Bad messages are logged and
 * counted, never applied, and never thrown back at the transport.
 */
@Component
public class PoolUpdateListener {

    private static final Logger log = LoggerFactory.getLogger(PoolUpdateListener.class);

    private final PoolRegistry poolRegistry;
    private final ObjectMapper objectMapper;

    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong bootstraps = new AtomicLong();

    public PoolUpdateListener(PoolRegistry poolRegistry, ObjectMapper objectMapper) {
        this.poolRegistry = poolRegistry;
        this.objectMapper = objectMapper;
    }

    public void onMessage(String message) {
        PoolUpdateMessage update;
        byte[] payload;
        try {
            update = objectMapper.readValue(message, PoolUpdateMessage.class);
            payload = HexFormat.of().parseHex(update.buffer());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            rejected.incrementAndGet();
            log.error("Rejected malformed pool update message: {}", e.getMessage());
            return;
        }

        try {
            UpdateOutcome outcome = poolRegistry.applyUpdate(update.chain(), payload);
            if (outcome == UpdateOutcome.APPLIED) {
                applied.incrementAndGet();
            } else {
                bootstraps.incrementAndGet();
            }
        } catch (PoolDecodeException e) {
            rejected.incrementAndGet();
            log.error("Rejected undecodable pool update for chain={}", update.chain(), e);
        } catch (PoolSourceException e) {
            log.error("Bootstrap triggered by pool update failed for chain={}", update.chain(), e);
        }
    }

    /** Updates upserted into a registry. */
    public long appliedCount() {
        return applied.get();
    }

    /** Messages dropped because they could not be parsed or decoded. */
    public long rejectedCount() {
        return rejected.get();
    }

    /** Updates discarded in favour of a bootstrap of their chain. */
    public long bootstrapCount() {
        return bootstraps.get();
    }
}
