package net.kinvault.e2ee.state;

import net.kinvault.e2ee.crypto.Crypto;
import net.kinvault.e2ee.crypto.IdentityKeyPair;
import net.kinvault.e2ee.state.impl.InMemorySecureKeyStorage;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class KeyMaterialStoreTest {

    private final InMemorySecureKeyStorage storage = new InMemorySecureKeyStorage();
    private final KeyMaterialStore store = new KeyMaterialStore(storage);

    @Test
    public void testIdentityRoundTrip() throws Exception {
        assertNull(store.loadIdentity());

        IdentityKeyPair identity = IdentityKeyPair.generate();
        store.storeIdentity(identity);
        IdentityKeyPair loaded = store.loadIdentity();

        assertEquals(identity.getPublicKey(), loaded.getPublicKey());
        assertArrayEquals(identity.getSigningPrivateKey().bytes(), loaded.getSigningPrivateKey().bytes());
        assertArrayEquals(identity.getAgreementKeyPair().getPrivateKey().bytes(),
            loaded.getAgreementKeyPair().getPrivateKey().bytes());
    }

    @Test
    public void testPreKeyIdsAreSorted() throws Exception {
        for (int id : new int[] {12, 3, 7}) {
            store.storePreKey(new PreKeyRecord(id, Crypto.generateDh()));
        }
        store.removePreKey(7);

        assertEquals(Arrays.asList(3, 12), store.loadPreKeyIds());
        assertNull(store.loadPreKey(7));
    }

    @Test
    public void testRotatingKeysNewestFirst() throws Exception {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        for (int version = 1; version <= 3; version++) {
            store.storeRotatingKey(new RotatingKey(RotatingKey.idForVersion(version), IdentityKeyPair.generate(), now,
                now, version, version == 3));
        }
        store.storeActiveRotatingKeyId("key-v3");

        List<RotatingKey> keys = store.loadRotatingKeys();

        assertEquals(3, keys.size());
        assertEquals("key-v3", keys.get(0).getId());
        assertTrue(keys.get(0).isActive());
        assertFalse(keys.get(2).isActive());
        assertEquals("key-v3", store.loadActiveRotatingKeyId());
    }

    @Test
    public void testSessionBlobsListed() throws Exception {
        store.storeSessionBlob("bob:phone", new byte[] {1});
        store.storeSessionBlob("bob:laptop", new byte[] {2});
        store.removeSessionBlob("bob:phone");

        assertEquals(Arrays.asList("bob:laptop"), store.loadSessionIds());
        assertArrayEquals(new byte[] {2}, store.loadSessionBlob("bob:laptop"));
    }
}
