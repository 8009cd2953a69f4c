package net.kinvault.e2ee.state;

import net.kinvault.e2ee.AuthenticationFailedException;
import net.kinvault.e2ee.MutableClock;
import net.kinvault.e2ee.TestParty;
import net.kinvault.e2ee.device.InMemoryDirectory;
import net.kinvault.e2ee.message.EncryptedEnvelope;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SessionStoreTest {

    private MutableClock clock;
    private TestParty alice;
    private TestParty bob;

    @Before
    public void setUp() throws Exception {
        clock = new MutableClock();
        InMemoryDirectory directory = new InMemoryDirectory();
        alice = new TestParty("alice", "laptop", directory, clock);
        bob = new TestParty("bob", "phone", directory, clock);
        alice.register();
        bob.register();
    }

    @Test
    public void testSkippedKeysSurviveReload() throws Exception {
        EncryptedEnvelope m0 = alice.deviceDirectory.encryptForDevice("bob", "phone", "m0".getBytes(UTF_8));
        EncryptedEnvelope m1 = alice.deviceDirectory.encryptForDevice("bob", "phone", "m1".getBytes(UTF_8));
        EncryptedEnvelope m2 = alice.deviceDirectory.encryptForDevice("bob", "phone", "m2".getBytes(UTF_8));

        assertArrayEquals("m2".getBytes(UTF_8), bob.deviceDirectory.decryptFromDevice("alice", "laptop", m2));
        assertEquals(2, bob.ratchetEngine.getSessionInfo("alice:laptop").getSkippedKeyCount());

        bob.sessionStore.invalidateCache();
        assertEquals(0, bob.sessionStore.getCachedCount());

        assertArrayEquals("m0".getBytes(UTF_8), bob.deviceDirectory.decryptFromDevice("alice", "laptop", m0));
        assertEquals(1, bob.ratchetEngine.getSessionInfo("alice:laptop").getSkippedKeyCount());

        clock.advance(Duration.ofDays(8));
        assertEquals(1, bob.ratchetEngine.tick());
        assertEquals(0, bob.ratchetEngine.getSessionInfo("alice:laptop").getSkippedKeyCount());

        try {
            bob.deviceDirectory.decryptFromDevice("alice", "laptop", m1);
            fail("expired skipped key still usable");
        } catch (AuthenticationFailedException e) {
            // expected
        }
    }

    @Test
    public void testSaveDestroysReplacedInstance() throws Exception {
        alice.deviceDirectory.establishSession("bob", "phone");
        SessionState stored = alice.sessionStore.load("bob:phone");
        SessionState replacement = stored.copy();

        alice.sessionStore.save(replacement);

        assertTrue(stored.isDestroyed());
        assertFalse(replacement.isDestroyed());
        assertNotSame(stored, alice.sessionStore.load("bob:phone"));
    }

    @Test
    public void testReloadFromStorage() throws Exception {
        alice.deviceDirectory.establishSession("bob", "phone");
        SessionInfo before = alice.ratchetEngine.getSessionInfo("bob:phone");

        alice.sessionStore.invalidateCache();
        SessionState reloaded = alice.sessionStore.load("bob:phone");

        assertEquals(before.getRemoteIdentityFingerprint(), reloaded.toInfo().getRemoteIdentityFingerprint());
        assertTrue(reloaded.toInfo().isHandshakePending());
        assertEquals(before.getCreatedAt(), reloaded.getCreatedAt());
    }

    @Test
    public void testInvalidateCacheDestroysDecodedSessions() throws Exception {
        EncryptedEnvelope m0 = alice.deviceDirectory.encryptForDevice("bob", "phone", "m0".getBytes(UTF_8));
        SessionState cached = alice.sessionStore.load("bob:phone");

        alice.sessionStore.invalidateCache();

        assertTrue(cached.isDestroyed());
        assertEquals(0, alice.sessionStore.getCachedCount());
        SessionState reloaded = alice.sessionStore.load("bob:phone");
        assertNotSame(cached, reloaded);
        assertFalse(reloaded.isDestroyed());
        assertArrayEquals("m0".getBytes(UTF_8), bob.deviceDirectory.decryptFromDevice("alice", "laptop", m0));
        EncryptedEnvelope m1 = alice.deviceDirectory.encryptForDevice("bob", "phone", "m1".getBytes(UTF_8));
        assertArrayEquals("m1".getBytes(UTF_8), bob.deviceDirectory.decryptFromDevice("alice", "laptop", m1));
    }

    @Test
    public void testDeleteRemovesStoredBlob() throws Exception {
        alice.deviceDirectory.establishSession("bob", "phone");
        SessionState cached = alice.sessionStore.load("bob:phone");

        alice.sessionStore.delete("bob:phone");

        assertTrue(cached.isDestroyed());
        assertFalse(alice.sessionStore.contains("bob:phone"));
        assertNull(alice.keyMaterialStore.loadSessionBlob("bob:phone"));
    }
}
