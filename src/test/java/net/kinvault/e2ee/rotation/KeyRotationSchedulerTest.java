package net.kinvault.e2ee.rotation;

import net.kinvault.e2ee.EngineConfig;
import net.kinvault.e2ee.MutableClock;
import net.kinvault.e2ee.RotationFailureException;
import net.kinvault.e2ee.TestParty;
import net.kinvault.e2ee.audit.AuditSink;
import net.kinvault.e2ee.crypto.IdentityKey;
import net.kinvault.e2ee.device.InMemoryDirectory;
import net.kinvault.e2ee.message.EncryptedEnvelope;
import net.kinvault.e2ee.state.FailingKeyStorage;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class KeyRotationSchedulerTest {

    private static final EngineConfig CONFIG = EngineConfig.builder()
        .rotationInterval(Duration.ofDays(30))
        .preRotationWarning(Duration.ofDays(7))
        .maxActiveKeys(2)
        .oneTimePreKeyBatchSize(5)
        .minOneTimePreKeys(2)
        .build();

    private MutableClock clock;
    private InMemoryDirectory directory;
    private TestParty party;
    private KeyRotationScheduler scheduler;
    private final List<KeyRotationEvent> events = new ArrayList<>();

    @Before
    public void setUp() throws Exception {
        clock = new MutableClock();
        directory = new InMemoryDirectory();
        party = new TestParty("alice", "laptop", directory, CONFIG, clock, AuditSink.NONE);
        party.register();
        scheduler = party.rotationScheduler;
        scheduler.addListener(events::add);
    }

    @Test
    public void testInitializeAdoptsCurrentIdentity() throws Exception {
        assertEquals("key-v1", scheduler.initialize());
        assertEquals("key-v1", scheduler.initialize());

        RotationStatus status = scheduler.getRotationStatus();
        assertEquals(RotationState.ACTIVE, status.getState());
        assertEquals(1, status.getActiveVersion());
        assertEquals(Duration.ofDays(30), status.getTimeUntilRotation());
        assertEquals(1, status.getRetainedKeyCount());
    }

    @Test
    public void testRotatePublishesNewIdentity() throws Exception {
        scheduler.initialize();
        IdentityKey before = party.identityManager.requireIdentity().getPublicKey();

        assertEquals("key-v2", scheduler.rotate());

        IdentityKey after = party.identityManager.requireIdentity().getPublicKey();
        assertFalse(before.equals(after));
        assertEquals(after, directory.get("alice", "laptop").getIdentityKey());
        assertEquals(Arrays.asList("key-v2", "key-v1"), scheduler.getRetainedKeyIds());
        assertEquals(Arrays.asList(KeyRotationEvent.Type.STARTED, KeyRotationEvent.Type.COMPLETED), types());
        assertEquals(RotationState.ACTIVE, scheduler.getState());
    }

    @Test
    public void testSessionsWorkAfterRotation() throws Exception {
        TestParty bob = new TestParty("bob", "phone", directory, clock);
        bob.register();
        scheduler.initialize();
        scheduler.rotate();

        EncryptedEnvelope envelope = party.deviceDirectory.encryptForDevice("bob", "phone", "hi".getBytes(UTF_8));
        assertArrayEquals("hi".getBytes(UTF_8), bob.deviceDirectory.decryptFromDevice("alice", "laptop", envelope));

        EncryptedEnvelope reply = bob.deviceDirectory.encryptForDevice("alice", "laptop", "hey".getBytes(UTF_8));
        assertArrayEquals("hey".getBytes(UTF_8), party.deviceDirectory.decryptFromDevice("bob", "phone", reply));
    }

    @Test
    public void testOldGenerationsPruned() throws Exception {
        scheduler.initialize();
        byte[] toV1 = scheduler.encryptToIdentity(party.identityManager.requireIdentity().getPublicKey(),
            "v1".getBytes(UTF_8));
        scheduler.rotate();
        byte[] toV2 = scheduler.encryptToIdentity(party.identityManager.requireIdentity().getPublicKey(),
            "v2".getBytes(UTF_8));

        assertArrayEquals("v1".getBytes(UTF_8), scheduler.decryptWithAnyKey(toV1));

        clock.advance(Duration.ofDays(61));
        scheduler.rotate();

        assertEquals(Arrays.asList("key-v3", "key-v2"), scheduler.getRetainedKeyIds());
        assertNull(scheduler.decryptWithAnyKey(toV1));
        assertArrayEquals("v2".getBytes(UTF_8), scheduler.decryptWithAnyKey(toV2));
    }

    @Test
    public void testYoungGenerationsKept() throws Exception {
        scheduler.initialize();
        scheduler.rotate();
        scheduler.rotate();
        scheduler.rotate();

        assertEquals(Arrays.asList("key-v4", "key-v3", "key-v2", "key-v1"), scheduler.getRetainedKeyIds());
    }

    @Test
    public void testWarningThenScheduledRotation() throws Exception {
        scheduler.initialize();

        clock.advance(Duration.ofDays(24));
        assertEquals(RotationState.WARNING, scheduler.tick());
        assertEquals(RotationState.WARNING, scheduler.tick());
        assertEquals(Arrays.asList(KeyRotationEvent.Type.WARNING), types());

        clock.advance(Duration.ofDays(6));
        assertEquals(RotationState.ACTIVE, scheduler.tick());
        assertEquals(Arrays.asList(KeyRotationEvent.Type.WARNING, KeyRotationEvent.Type.STARTED,
            KeyRotationEvent.Type.COMPLETED), types());
        assertEquals("key-v2", scheduler.getRotationStatus().getActiveKeyId());
    }

    @Test
    public void testPublishFailureKeepsPreviousKey() throws Exception {
        scheduler.initialize();
        IdentityKey before = party.identityManager.requireIdentity().getPublicKey();
        directory.setFailPublish(true);

        try {
            scheduler.rotate();
            fail("rotation succeeded without publishing");
        } catch (RotationFailureException e) {
            // expected
        }

        assertEquals("key-v1", scheduler.getRotationStatus().getActiveKeyId());
        assertTrue(scheduler.isRotationPending());
        assertEquals(RotationState.ACTIVE, scheduler.getState());
        assertEquals(before, party.identityManager.requireIdentity().getPublicKey());
        assertEquals(Arrays.asList(KeyRotationEvent.Type.STARTED, KeyRotationEvent.Type.FAILED), types());

        scheduler.tick();
        assertEquals("key-v1", scheduler.getRotationStatus().getActiveKeyId());

        directory.setFailPublish(false);
        scheduler.tick();
        assertEquals("key-v2", scheduler.getRotationStatus().getActiveKeyId());
        assertFalse(scheduler.isRotationPending());
    }

    @Test
    public void testStorageFailureKeepsPreviousKeyAdvertised() throws Exception {
        FailingKeyStorage storage = new FailingKeyStorage();
        TestParty carol = new TestParty("carol", "tablet", directory, CONFIG, clock, AuditSink.NONE, storage);
        carol.register();
        KeyRotationScheduler carolScheduler = carol.rotationScheduler;
        carolScheduler.initialize();
        IdentityKey before = carol.identityManager.requireIdentity().getPublicKey();
        storage.failWritesTo("rotating-key/key-v2");

        try {
            carolScheduler.rotate();
            fail("rotation succeeded without storing the new key");
        } catch (RotationFailureException e) {
            // expected
        }

        assertEquals("key-v1", carolScheduler.getRotationStatus().getActiveKeyId());
        assertEquals(Collections.singletonList("key-v1"), carolScheduler.getRetainedKeyIds());
        assertTrue(carolScheduler.isRotationPending());
        assertEquals(before, carol.identityManager.requireIdentity().getPublicKey());
        assertEquals(before, directory.get("carol", "tablet").getIdentityKey());

        TestParty bob = new TestParty("bob", "phone", directory, clock);
        bob.register();
        EncryptedEnvelope envelope = bob.deviceDirectory.encryptForDevice("carol", "tablet", "hi".getBytes(UTF_8));
        assertArrayEquals("hi".getBytes(UTF_8), carol.deviceDirectory.decryptFromDevice("bob", "phone", envelope));

        storage.clearFailures();
        carolScheduler.tick();
        assertEquals("key-v2", carolScheduler.getRotationStatus().getActiveKeyId());
        assertFalse(carolScheduler.isRotationPending());
    }

    @Test
    public void testLateStorageFailureRollsBackIdentity() throws Exception {
        FailingKeyStorage storage = new FailingKeyStorage();
        TestParty carol = new TestParty("carol", "tablet", directory, CONFIG, clock, AuditSink.NONE, storage);
        carol.register();
        KeyRotationScheduler carolScheduler = carol.rotationScheduler;
        carolScheduler.initialize();
        IdentityKey before = carol.identityManager.requireIdentity().getPublicKey();
        storage.failWritesTo("rotating-key-active");

        try {
            carolScheduler.rotate();
            fail("rotation succeeded without switching the active key");
        } catch (RotationFailureException e) {
            // expected
        }

        RotationStatus status = carolScheduler.getRotationStatus();
        assertEquals("key-v1", status.getActiveKeyId());
        assertEquals(1, status.getRetainedKeyCount());
        assertEquals(before, carol.identityManager.requireIdentity().getPublicKey());
        assertEquals(before, directory.get("carol", "tablet").getIdentityKey());
        assertEquals(RotationState.ACTIVE, carolScheduler.getState());
    }

    @Test
    public void testListenerFailureDoesNotAbortRotation() throws Exception {
        scheduler.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        scheduler.initialize();

        assertEquals("key-v2", scheduler.rotate());
    }

    private List<KeyRotationEvent.Type> types() {
        List<KeyRotationEvent.Type> types = new ArrayList<>();
        for (KeyRotationEvent event : events) {
            types.add(event.getType());
        }
        return types;
    }
}
