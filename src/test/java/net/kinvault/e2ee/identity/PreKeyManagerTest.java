package net.kinvault.e2ee.identity;

import net.kinvault.e2ee.DirectoryUnavailableException;
import net.kinvault.e2ee.MutableClock;
import net.kinvault.e2ee.TestParty;
import net.kinvault.e2ee.crypto.Crypto;
import net.kinvault.e2ee.device.DeviceRecord;
import net.kinvault.e2ee.device.InMemoryDirectory;
import net.kinvault.e2ee.device.PreKey;
import net.kinvault.e2ee.state.SignedPreKeyRecord;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PreKeyManagerTest {

    private InMemoryDirectory directory;
    private TestParty party;

    @Before
    public void setUp() {
        directory = new InMemoryDirectory();
        party = new TestParty("alice", "laptop", directory, new MutableClock());
    }

    @Test
    public void testRegisterPublishesSignedBundle() throws Exception {
        DeviceRecord record = party.register();

        assertSame(record, directory.get("alice", "laptop"));
        assertEquals(party.identityManager.getIdentity().getPublicKey(), record.getIdentityKey());
        assertTrue(Crypto.verify(record.getIdentityKey().getSigningKey(), record.getSignedPreKey().getPublicKey(),
            record.getSignedPreKey().getSignature()));
        assertEquals(Arrays.asList(1, 2, 3, 4, 5), ids(record.getOneTimePreKeys()));
        assertEquals(party.identityManager.getRegistrationId(), record.getRegistrationId());
        assertEquals(1, directory.getPublishCount());
    }

    @Test
    public void testRegisterTwiceKeepsKeys() throws Exception {
        DeviceRecord first = party.register();
        DeviceRecord second = party.register();

        assertEquals(first.getIdentityKey(), second.getIdentityKey());
        assertEquals(first.getSignedPreKey().getId(), second.getSignedPreKey().getId());
        assertEquals(ids(first.getOneTimePreKeys()), ids(second.getOneTimePreKeys()));
    }

    @Test
    public void testReplenishBelowMinimum() throws Exception {
        party.register();
        for (int id = 1; id <= 4; id++) {
            party.keyMaterialStore.removePreKey(id);
        }

        assertEquals(4, party.preKeyManager.replenishIfNeeded());
        assertEquals(Arrays.asList(5, 6, 7, 8, 9), party.keyMaterialStore.loadPreKeyIds());
        assertEquals(0, party.preKeyManager.replenishIfNeeded());
    }

    @Test
    public void testSignedPreKeyOnlyAdvertisedAfterCommit() throws Exception {
        party.register();
        SignedPreKeyRecord current = party.preKeyManager.getCurrentSignedPreKey();

        SignedPreKeyRecord next = party.preKeyManager.createSignedPreKey(party.identityManager.requireIdentity());
        assertEquals(current.getId() + 1, next.getId());
        assertEquals(current.getId(), party.preKeyManager.getCurrentSignedPreKey().getId());
        assertNull(party.keyMaterialStore.loadSignedPreKey(next.getId()));

        party.preKeyManager.commitSignedPreKey(next);
        assertEquals(next.getId(), party.preKeyManager.getCurrentSignedPreKey().getId());
        assertEquals(current.getId(), party.keyMaterialStore.loadSignedPreKey(current.getId()).getId());
    }

    @Test
    public void testPublishFailure() throws Exception {
        directory.setFailPublish(true);

        try {
            party.register();
            fail("registered while the directory was down");
        } catch (DirectoryUnavailableException e) {
            // expected
        }
        assertEquals(5, party.preKeyManager.getOneTimePreKeyCount());
        assertNull(directory.get("alice", "laptop"));
    }

    private static List<Integer> ids(List<PreKey> preKeys) {
        List<Integer> ids = new ArrayList<>();
        for (PreKey preKey : preKeys) {
            ids.add(preKey.getId());
        }
        return ids;
    }
}
