package io.liveguard.security;

import io.liveguard.model.HeartbeatSubmission;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Agent side of the protocol, used by the CLI and by tests to produce signed heartbeats.
 * Private keys travel as base64 PKCS#8; public keys are emitted as base64 raw 32 bytes.
 */
public final class HeartbeatSigner {
    private final PrivateKey privateKey;

    public HeartbeatSigner(PrivateKey privateKey) {
        this.privateKey = privateKey;
    }

    public static HeartbeatSigner fromPkcs8Base64(String privateKeyB64) {
        try {
            byte[] der = Base64.getDecoder().decode(privateKeyB64.trim());
            PrivateKey key = KeyFactory.getInstance("Ed25519").generatePrivate(new PKCS8EncodedKeySpec(der));
            return new HeartbeatSigner(key);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid Ed25519 private key", e);
        }
    }

    public static GeneratedKey generate() {
        try {
            KeyPair pair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
            byte[] spki = pair.getPublic().getEncoded();
            byte[] raw = Arrays.copyOfRange(spki, spki.length - Ed25519Verifier.RAW_KEY_LENGTH, spki.length);
            return new GeneratedKey(
                    Base64.getEncoder().encodeToString(raw),
                    Base64.getEncoder().encodeToString(pair.getPrivate().getEncoded())
            );
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 not available", e);
        }
    }

    public String sign(byte[] message) {
        try {
            Signature signer = Signature.getInstance("Ed25519");
            signer.initSign(privateKey);
            signer.update(message);
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign heartbeat", e);
        }
    }

    public HeartbeatSubmission sign(HeartbeatSubmission submission) {
        return submission.withSignature(sign(HeartbeatCanonicalizer.canonicalBytes(submission)));
    }

    public record GeneratedKey(String publicKey, String privateKey) {
    }
}
