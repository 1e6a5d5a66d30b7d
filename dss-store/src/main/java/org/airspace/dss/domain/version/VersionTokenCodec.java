package org.airspace.dss.domain.version;

import org.airspace.dss.domain.model.Ovn;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.UUID;

/**
 * Derives OVNs from (updated_at, id) and checks caller-presented tokens.
 *
 * Token = unpadded base64url(SHA-256(id + "@" + updated_at in epoch microseconds)).
 * updated_at is truncated to microseconds, the precision the database keeps.
 */
public final class VersionTokenCodec {

    private static final int DIGEST_BYTES = 32;

    public Ovn encode(Instant updatedAt, UUID id) {
        if (updatedAt == null || id == null) {
            throw new IllegalArgumentException("OVN requires both updatedAt and id");
        }
        return new Ovn(Base64.getUrlEncoder().withoutPadding().encodeToString(digest(updatedAt, id)));
    }

    /**
     * @return true iff the token was derived from exactly this (updatedAt, id).
     *         Tokens that do not decode are reported as a mismatch, not raised.
     */
    public boolean validate(Ovn token, Instant currentUpdatedAt, UUID id) {
        if (token == null || currentUpdatedAt == null || id == null) {
            return false;
        }
        byte[] presented;
        try {
            presented = Base64.getUrlDecoder().decode(token.value());
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (presented.length != DIGEST_BYTES) {
            return false;
        }
        return MessageDigest.isEqual(presented, digest(currentUpdatedAt, id));
    }

    private static byte[] digest(Instant updatedAt, UUID id) {
        Instant micros = updatedAt.truncatedTo(ChronoUnit.MICROS);
        long epochMicros = ChronoUnit.MICROS.between(Instant.EPOCH, micros);
        String material = id + "@" + epochMicros;
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return sha.digest(material.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
