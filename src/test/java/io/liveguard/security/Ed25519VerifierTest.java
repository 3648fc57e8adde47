package io.liveguard.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

final class Ed25519VerifierTest {
    private static final byte[] MESSAGE = "{\"heartbeat_id\":\"hb-1\"}".getBytes(StandardCharsets.UTF_8);

    @Test
    void acceptsSignatureFromMatchingKey() {
        HeartbeatSigner.GeneratedKey key = HeartbeatSigner.generate();
        String signature = HeartbeatSigner.fromPkcs8Base64(key.privateKey()).sign(MESSAGE);

        Assertions.assertTrue(Ed25519Verifier.verify(key.publicKey(), MESSAGE, signature));
    }

    @Test
    void acceptsX509EncodedPublicKey() {
        HeartbeatSigner.GeneratedKey key = HeartbeatSigner.generate();
        String signature = HeartbeatSigner.fromPkcs8Base64(key.privateKey()).sign(MESSAGE);
        byte[] raw = Base64.getDecoder().decode(key.publicKey());
        byte[] spki = new byte[Ed25519Verifier.X509_PREFIX.length + raw.length];
        System.arraycopy(Ed25519Verifier.X509_PREFIX, 0, spki, 0, Ed25519Verifier.X509_PREFIX.length);
        System.arraycopy(raw, 0, spki, Ed25519Verifier.X509_PREFIX.length, raw.length);

        Assertions.assertTrue(Ed25519Verifier.verify(Base64.getEncoder().encodeToString(spki), MESSAGE, signature));
    }

    @Test
    void rejectsTamperedMessageAndForeignKey() {
        HeartbeatSigner.GeneratedKey key = HeartbeatSigner.generate();
        HeartbeatSigner.GeneratedKey other = HeartbeatSigner.generate();
        String signature = HeartbeatSigner.fromPkcs8Base64(key.privateKey()).sign(MESSAGE);
        byte[] tampered = "{\"heartbeat_id\":\"hb-2\"}".getBytes(StandardCharsets.UTF_8);

        Assertions.assertFalse(Ed25519Verifier.verify(key.publicKey(), tampered, signature));
        Assertions.assertFalse(Ed25519Verifier.verify(other.publicKey(), MESSAGE, signature));
    }

    @Test
    void malformedInputsFailClosed() {
        HeartbeatSigner.GeneratedKey key = HeartbeatSigner.generate();
        String signature = HeartbeatSigner.fromPkcs8Base64(key.privateKey()).sign(MESSAGE);
        String shortSignature = Base64.getEncoder().encodeToString(new byte[32]);
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        Assertions.assertFalse(Ed25519Verifier.verify("not base64!!", MESSAGE, signature));
        Assertions.assertFalse(Ed25519Verifier.verify(shortKey, MESSAGE, signature));
        Assertions.assertFalse(Ed25519Verifier.verify(key.publicKey(), MESSAGE, "%%%"));
        Assertions.assertFalse(Ed25519Verifier.verify(key.publicKey(), MESSAGE, shortSignature));
        Assertions.assertFalse(Ed25519Verifier.verify(null, MESSAGE, signature));
        Assertions.assertFalse(Ed25519Verifier.verify(key.publicKey(), null, signature));
        Assertions.assertFalse(Ed25519Verifier.verify(key.publicKey(), MESSAGE, null));
    }
}
