package net.kinvault.e2ee.crypto;

import net.kinvault.e2ee.AuthenticationFailedException;
import net.kinvault.e2ee.KeyGenerationException;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Primitive operations of the protocol: X25519 agreement, Ed25519 signatures, the root/chain KDFs,
 * message key expansion and authenticated encryption.
 */
public final class Crypto {
    public static final int KEY_SIZE_BYTES = 32;
    public static final int MAC_SIZE_BYTES = 32;
    static final int IV_SIZE_BYTES = 12;
    static final int AUTH_KEY_SIZE_BYTES = 32;
    private static final int GCM_TAG_BITS = 128;

    private static final byte[] ROOT_INFO = "KinVault Root Key".getBytes(UTF_8);
    private static final byte[] MESSAGE_INFO = "KinVault Message Keys".getBytes(UTF_8);
    private static final byte[] X3DH_INFO = "KinVault X3DH".getBytes(UTF_8);
    private static final byte[] MESSAGE_KEY_SEED = {0x01};
    private static final byte[] CHAIN_KEY_SEED = {0x02};

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private Crypto() {}

    public static DhKeyPair generateDh() throws KeyGenerationException {
        try {
            X25519PrivateKeyParameters privateKey = new X25519PrivateKeyParameters(SECURE_RANDOM);
            return new DhKeyPair(privateKey.generatePublicKey().getEncoded(), SecretBytes.wrap(privateKey.getEncoded()));
        } catch (RuntimeException e) {
            throw new KeyGenerationException("X25519 key generation failed", e);
        }
    }

    static IdentityKeyPair generateSigningKeyPair(DhKeyPair agreement) throws KeyGenerationException {
        try {
            Ed25519PrivateKeyParameters privateKey = new Ed25519PrivateKeyParameters(SECURE_RANDOM);
            return new IdentityKeyPair(agreement, privateKey.generatePublicKey().getEncoded(),
                SecretBytes.wrap(privateKey.getEncoded()));
        } catch (RuntimeException e) {
            agreement.destroy();
            throw new KeyGenerationException("Ed25519 key generation failed", e);
        }
    }

    /**
     * X25519 agreement between a local pair and a raw peer public key.
     *
     * @throws InvalidKeyException if the peer key is malformed or yields a degenerate shared secret
     */
    public static byte[] dh(DhKeyPair dhPair, byte[] dhPublic) throws InvalidKeyException {
        if (dhPublic == null || dhPublic.length != KEY_SIZE_BYTES) {
            throw new InvalidKeyException("Bad X25519 public key length");
        }
        try {
            X25519Agreement agreement = new X25519Agreement();
            agreement.init(new X25519PrivateKeyParameters(dhPair.getPrivateKey().bytes(), 0));
            byte[] secret = new byte[agreement.getAgreementSize()];
            agreement.calculateAgreement(new X25519PublicKeyParameters(dhPublic, 0), secret, 0);
            return secret;
        } catch (IllegalStateException e) {
            throw new InvalidKeyException("X25519 agreement failed", e);
        }
    }

    /**
     * Root KDF: HKDF(salt = root key, ikm = DH output). Returns new root key followed by a chain key.
     */
    public static byte[] kdfRk(byte[] rk, byte[] dhOut) {
        return hkdf(dhOut, rk, ROOT_INFO, 2 * KEY_SIZE_BYTES);
    }

    /**
     * Chain KDF: returns the next chain key followed by the message key for the current index.
     */
    public static byte[] kdfCk(byte[] ck) {
        byte[] nextChainKey = hmacSha256(ck, CHAIN_KEY_SEED);
        byte[] messageKey = hmacSha256(ck, MESSAGE_KEY_SEED);
        try {
            return concat(nextChainKey, messageKey);
        } finally {
            Arrays.fill(nextChainKey, (byte) 0);
            Arrays.fill(messageKey, (byte) 0);
        }
    }

    /**
     * Handshake KDF over the concatenated DH outputs, prefixed with 32 0xFF bytes.
     */
    public static byte[] kdf(byte[] keyMaterial) {
        byte[] f = new byte[KEY_SIZE_BYTES];
        Arrays.fill(f, (byte) 0xFF);
        byte[] inputKeyMaterial = concat(f, keyMaterial);
        try {
            return hkdf(inputKeyMaterial, new byte[KEY_SIZE_BYTES], X3DH_INFO, KEY_SIZE_BYTES);
        } finally {
            Arrays.fill(inputKeyMaterial, (byte) 0);
        }
    }

    /**
     * Expands a message key into independent encryption key, MAC key and nonce.
     */
    public static MessageKeys deriveMessageKeys(byte[] mk) {
        byte[] hkdfOutput = hkdf(mk, new byte[KEY_SIZE_BYTES], MESSAGE_INFO, KEY_SIZE_BYTES + AUTH_KEY_SIZE_BYTES + IV_SIZE_BYTES);
        try {
            return new MessageKeys(
                SecretBytes.copyOfRange(hkdfOutput, 0, KEY_SIZE_BYTES),
                SecretBytes.copyOfRange(hkdfOutput, KEY_SIZE_BYTES, KEY_SIZE_BYTES + AUTH_KEY_SIZE_BYTES),
                Arrays.copyOfRange(hkdfOutput, KEY_SIZE_BYTES + AUTH_KEY_SIZE_BYTES, hkdfOutput.length));
        } finally {
            Arrays.fill(hkdfOutput, (byte) 0);
        }
    }

    public static byte[] hkdf(byte[] inputKeyMaterial, byte[] salt, byte[] info, int length) {
        Digest digest = new SHA256Digest();
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(digest);
        hkdf.init(new HKDFParameters(inputKeyMaterial, salt, info));
        byte[] output = new byte[length];
        hkdf.generateBytes(output, 0, output.length);
        return output;
    }

    public static byte[] encrypt(SecretBytes key, byte[] iv, byte[] plaintext, byte[] associatedData) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key.bytes(), "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(associatedData);
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new AssertionError(e);
        }
    }

    public static byte[] decrypt(SecretBytes key, byte[] iv, byte[] ciphertext, byte[] associatedData)
        throws AuthenticationFailedException {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key.bytes(), "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(associatedData);
            return cipher.doFinal(ciphertext);
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailedException("AEAD tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new AssertionError(e);
        }
    }

    public static byte[] encrypt(MessageKeys keys, byte[] plaintext, byte[] associatedData) {
        return encrypt(keys.getEncryptionKey(), keys.getIv(), plaintext, associatedData);
    }

    public static byte[] decrypt(MessageKeys keys, byte[] ciphertext, byte[] associatedData)
        throws AuthenticationFailedException {
        return decrypt(keys.getEncryptionKey(), keys.getIv(), ciphertext, associatedData);
    }

    public static byte[] hmacSha256(byte[] key, byte[]... inputs) {
        try {
            Mac hmacSha256 = Mac.getInstance("HmacSHA256");
            hmacSha256.init(new SecretKeySpec(key, "HmacSHA256"));
            for (byte[] input : inputs) {
                hmacSha256.update(input);
            }
            return hmacSha256.doFinal();
        } catch (GeneralSecurityException e) {
            throw new AssertionError(e);
        }
    }

    /**
     * Constant-time comparison of a received MAC against the expected one.
     */
    public static boolean verifyMac(byte[] key, byte[] mac, byte[]... inputs) {
        return mac != null && MessageDigest.isEqual(hmacSha256(key, inputs), mac);
    }

    public static byte[] sign(SecretBytes signingKey, byte[] data) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, new Ed25519PrivateKeyParameters(signingKey.bytes(), 0));
        signer.update(data, 0, data.length);
        return signer.generateSignature();
    }

    public static boolean verify(byte[] signingPublicKey, byte[] data, byte[] signature) {
        if (signature == null || signingPublicKey == null || signingPublicKey.length != KEY_SIZE_BYTES) {
            return false;
        }
        Ed25519PublicKeyParameters publicKey;
        try {
            publicKey = new Ed25519PublicKeyParameters(signingPublicKey, 0);
        } catch (IllegalArgumentException e) {
            // not a point on the curve
            return false;
        }
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, publicKey);
        verifier.update(data, 0, data.length);
        return verifier.verifySignature(signature);
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError(e);
        }
    }

    public static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        SECURE_RANDOM.nextBytes(bytes);
        return bytes;
    }

    public static int randomInt(int bound) {
        return SECURE_RANDOM.nextInt(bound);
    }

    public static byte[] concat(byte[]... parts) {
        int length = 0;
        for (byte[] part : parts) {
            length += part.length;
        }
        byte[] concat = new byte[length];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, concat, offset, part.length);
            offset += part.length;
        }
        return concat;
    }

    public static void wipe(byte[]... buffers) {
        for (byte[] buffer : buffers) {
            if (buffer != null) {
                Arrays.fill(buffer, (byte) 0);
            }
        }
    }
}
