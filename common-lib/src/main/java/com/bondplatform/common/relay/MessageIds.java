package com.bondplatform.common.relay;

import com.bondplatform.common.model.Bytes32;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives relay message ids as SHA-256 over (source domain, destination domain, nonce).
 */
public final class MessageIds {

    private MessageIds() {}

    public static Bytes32 derive(Bytes32 sourceDomain, Bytes32 destinationDomain, long nonce) {
        ByteBuffer buffer = ByteBuffer.allocate(32 + 32 + Long.BYTES);
        buffer.put(sourceDomain.toBytes());
        buffer.put(destinationDomain.toBytes());
        buffer.putLong(nonce);
        try {
            return Bytes32.wrap(MessageDigest.getInstance("SHA-256").digest(buffer.array()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
