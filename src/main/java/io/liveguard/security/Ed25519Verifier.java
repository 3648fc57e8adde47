package io.liveguard.security;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Ed25519 verification over canonical heartbeat bytes. Every failure mode (bad base64,
 * wrong key length, malformed key, mismatch) is reported as {@code false}.
 */
public final class Ed25519Verifier {
    static final byte[] X509_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");
    static final int RAW_KEY_LENGTH = 32;
    static final int SIGNATURE_LENGTH = 64;

    private Ed25519Verifier() {
    }

    public static boolean verify(String publicKeyB64, byte[] message, String signatureB64) {
        if (publicKeyB64 == null || message == null || signatureB64 == null) {
            return false;
        }
        try {
            PublicKey key = decodePublicKey(publicKeyB64);
            byte[] signature = Base64.getDecoder().decode(signatureB64.trim());
            if (signature.length != SIGNATURE_LENGTH) {
                return false;
            }
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(key);
            verifier.update(message);
            return verifier.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Accepts a base64 raw 32-byte key or a base64 X.509 SubjectPublicKeyInfo.
     */
    public static PublicKey decodePublicKey(String publicKeyB64) throws GeneralSecurityException {
        byte[] decoded = Base64.getDecoder().decode(publicKeyB64.trim());
        byte[] spki;
        if (decoded.length == RAW_KEY_LENGTH) {
            spki = new byte[X509_PREFIX.length + RAW_KEY_LENGTH];
            System.arraycopy(X509_PREFIX, 0, spki, 0, X509_PREFIX.length);
            System.arraycopy(decoded, 0, spki, X509_PREFIX.length, RAW_KEY_LENGTH);
        } else if (decoded.length == X509_PREFIX.length + RAW_KEY_LENGTH) {
            spki = decoded;
        } else {
            throw new IllegalArgumentException("Ed25519 public key must be 32 raw bytes or 44 bytes of X.509");
        }
        return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(spki));
    }
}
