package net.kinvault.e2ee.crypto;

import net.kinvault.e2ee.AuthenticationFailedException;
import org.junit.Test;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CryptoTest {

    @Test
    public void testAgreementIsSymmetric() throws Exception {
        DhKeyPair alice = Crypto.generateDh();
        DhKeyPair bob = Crypto.generateDh();

        assertArrayEquals(Crypto.dh(alice, bob.getPublicKey()), Crypto.dh(bob, alice.getPublicKey()));
    }

    @Test
    public void testChainKdfSplitsIntoDistinctKeys() {
        byte[] chainKey = Crypto.randomBytes(Crypto.KEY_SIZE_BYTES);
        byte[] derived = Crypto.kdfCk(chainKey);

        assertEquals(2 * Crypto.KEY_SIZE_BYTES, derived.length);
        assertArrayEquals(derived, Crypto.kdfCk(chainKey));
        assertFalse(Arrays.equals(Arrays.copyOfRange(derived, 0, 32), Arrays.copyOfRange(derived, 32, 64)));
    }

    @Test
    public void testSignatureVerifies() throws Exception {
        IdentityKeyPair identity = IdentityKeyPair.generate();
        byte[] data = "signed pre-key".getBytes(UTF_8);
        byte[] signature = identity.sign(data);

        assertTrue(Crypto.verify(identity.getSigningPublicKey(), data, signature));

        signature[3] ^= 0x01;
        assertFalse(Crypto.verify(identity.getSigningPublicKey(), data, signature));
        assertFalse(Crypto.verify(IdentityKeyPair.generate().getSigningPublicKey(), data, identity.sign(data)));

        byte[] offCurve = new byte[Crypto.KEY_SIZE_BYTES];
        Arrays.fill(offCurve, (byte) 0xFF);
        assertFalse(Crypto.verify(offCurve, data, identity.sign(data)));
    }

    @Test
    public void testAeadRejectsTamperedCiphertext() throws Exception {
        MessageKeys keys = Crypto.deriveMessageKeys(Crypto.randomBytes(32));
        byte[] aad = "header".getBytes(UTF_8);
        byte[] ciphertext = Crypto.encrypt(keys, "hello".getBytes(UTF_8), aad);

        assertArrayEquals("hello".getBytes(UTF_8), Crypto.decrypt(keys, ciphertext, aad));

        ciphertext[0] ^= 0x01;
        try {
            Crypto.decrypt(keys, ciphertext, aad);
            fail("tampered ciphertext decrypted");
        } catch (AuthenticationFailedException e) {
            // expected
        }
    }

    @Test
    public void testMacComparison() {
        byte[] key = Crypto.randomBytes(32);
        byte[] mac = Crypto.hmacSha256(key, "a".getBytes(UTF_8), "b".getBytes(UTF_8));

        assertTrue(Crypto.verifyMac(key, mac, "ab".getBytes(UTF_8)));
        assertFalse(Crypto.verifyMac(key, mac, "ba".getBytes(UTF_8)));
        assertFalse(Crypto.verifyMac(key, null, "ab".getBytes(UTF_8)));
    }

    @Test
    public void testDestroyedSecretIsUnusable() {
        SecretBytes secret = SecretBytes.copyOf(new byte[] {1, 2, 3});
        secret.destroy();

        assertTrue(secret.isDestroyed());
        try {
            secret.bytes();
            fail("destroyed secret readable");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void testIdentityKeyRoundTrip() throws Exception {
        IdentityKey identityKey = IdentityKeyPair.generate().getPublicKey();

        assertEquals(identityKey, IdentityKey.deserialize(identityKey.serialize()));
        assertEquals(IdentityKey.SERIALIZED_LENGTH, identityKey.serialize().length);
    }
}
