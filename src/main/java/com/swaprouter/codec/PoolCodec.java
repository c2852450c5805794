package com.swaprouter.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.swaprouter.model.Pool;
import com.swaprouter.model.Route;
import com.swaprouter.model.Token;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Binary codec for the objects that cross process and thread boundaries: pools arriving
 * on the update channel, and tokens, pools and routes exchanged with route computation workers.
 *
 * <p>Payloads are CBOR documents mirroring the record components. The codec is stateless
 * and safe to share between threads.
 */
@Component
public class PoolCodec {

    private final ObjectMapper mapper;

    public PoolCodec() {
        this.mapper = CBORMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public byte[] encodePool(Pool pool) {
        return write(pool, "pool");
    }

    /**
     * Decode a pool payload.
     *
     * @throws PoolDecodeException if the payload is empty, malformed, or describes an invalid pool
     */
    public Pool decodePool(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new PoolDecodeException("Empty pool payload");
        }
        try {
            Pool pool = mapper.readValue(payload, Pool.class);
            if (pool == null) {
                throw new PoolDecodeException("Pool payload decoded to null");
            }
            return pool;
        } catch (IOException e) {
            throw new PoolDecodeException("Malformed pool payload: " + e.getMessage(), e);
        }
    }

    public byte[] encodeToken(Token token) {
        return write(token, "token");
    }

    public Token decodeToken(byte[] payload) {
        return read(payload, Token.class, "token");
    }

    public byte[] encodeRoute(Route route) {
        return write(route, "route");
    }

    public Route decodeRoute(byte[] payload) {
        return read(payload, Route.class, "route");
    }

    private byte[] write(Object value, String kind) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new CodecException("Failed to encode " + kind, e);
        }
    }

    private <T> T read(byte[] payload, Class<T> type, String kind) {
        if (payload == null || payload.length == 0) {
            throw new CodecException("Empty " + kind + " payload");
        }
        try {
            T value = mapper.readValue(payload, type);
            if (value == null) {
                throw new CodecException(kind + " payload decoded to null");
            }
            return value;
        } catch (IOException e) {
            throw new CodecException("Malformed " + kind + " payload", e);
        }
    }
}
