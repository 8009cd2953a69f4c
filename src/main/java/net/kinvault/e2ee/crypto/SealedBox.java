package net.kinvault.e2ee.crypto;

import net.kinvault.e2ee.AuthenticationFailedException;
import net.kinvault.e2ee.KeyGenerationException;

import java.security.InvalidKeyException;
import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Anonymous encryption to an identity key: {@code ephemeralPublic(32) || AES-GCM ciphertext}.
 * <p>
 * Used for data addressed to a device identity rather than to a session, so that it stays readable
 * with a rotated-out identity for as long as that identity is retained.
 */
public final class SealedBox {
    private static final byte[] INFO = "KinVault Sealed Box".getBytes(UTF_8);

    private SealedBox() {}

    public static byte[] seal(IdentityKey recipient, byte[] plaintext) throws KeyGenerationException {
        byte[] recipientKey = recipient.getAgreementKey();
        try (DhKeyPair ephemeral = Crypto.generateDh()) {
            byte[] ephemeralPublic = ephemeral.getPublicKey();
            byte[] shared;
            try {
                shared = Crypto.dh(ephemeral, recipientKey);
            } catch (InvalidKeyException e) {
                throw new IllegalArgumentException("Recipient identity key is not usable", e);
            }
            byte[] keyMaterial = Crypto.hkdf(shared, Crypto.concat(ephemeralPublic, recipientKey), INFO,
                Crypto.KEY_SIZE_BYTES + Crypto.IV_SIZE_BYTES);
            try (SecretBytes key = SecretBytes.copyOfRange(keyMaterial, 0, Crypto.KEY_SIZE_BYTES)) {
                byte[] iv = Arrays.copyOfRange(keyMaterial, Crypto.KEY_SIZE_BYTES, keyMaterial.length);
                return Crypto.concat(ephemeralPublic, Crypto.encrypt(key, iv, plaintext, ephemeralPublic));
            } finally {
                Crypto.wipe(shared, keyMaterial);
            }
        }
    }

    /**
     * @throws AuthenticationFailedException if {@code sealed} was not addressed to {@code recipient} or was altered
     */
    public static byte[] open(IdentityKeyPair recipient, byte[] sealed) throws AuthenticationFailedException {
        if (sealed == null || sealed.length < Crypto.KEY_SIZE_BYTES + 16) {
            throw new AuthenticationFailedException("Sealed box too short");
        }
        byte[] ephemeralPublic = Arrays.copyOfRange(sealed, 0, Crypto.KEY_SIZE_BYTES);
        byte[] ciphertext = Arrays.copyOfRange(sealed, Crypto.KEY_SIZE_BYTES, sealed.length);
        DhKeyPair agreement = recipient.getAgreementKeyPair();
        byte[] shared;
        try {
            shared = Crypto.dh(agreement, ephemeralPublic);
        } catch (InvalidKeyException e) {
            throw new AuthenticationFailedException("Bad ephemeral key in sealed box", e);
        }
        byte[] keyMaterial = Crypto.hkdf(shared, Crypto.concat(ephemeralPublic, agreement.getPublicKey()), INFO,
            Crypto.KEY_SIZE_BYTES + Crypto.IV_SIZE_BYTES);
        try (SecretBytes key = SecretBytes.copyOfRange(keyMaterial, 0, Crypto.KEY_SIZE_BYTES)) {
            byte[] iv = Arrays.copyOfRange(keyMaterial, Crypto.KEY_SIZE_BYTES, keyMaterial.length);
            return Crypto.decrypt(key, iv, ciphertext, ephemeralPublic);
        } finally {
            Crypto.wipe(shared, keyMaterial);
        }
    }
}
