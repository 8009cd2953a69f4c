package net.kinvault.e2ee.session;

import net.kinvault.e2ee.AuthenticationFailedException;
import net.kinvault.e2ee.KeyExhaustedException;
import net.kinvault.e2ee.MutableClock;
import net.kinvault.e2ee.PeerBundleInvalidException;
import net.kinvault.e2ee.TestParty;
import net.kinvault.e2ee.audit.AuditEventType;
import net.kinvault.e2ee.audit.AuditSink;
import net.kinvault.e2ee.crypto.IdentityKeyPair;
import net.kinvault.e2ee.device.DeviceRecord;
import net.kinvault.e2ee.device.InMemoryDirectory;
import net.kinvault.e2ee.device.SignedPreKey;
import net.kinvault.e2ee.message.EncryptedEnvelope;
import net.kinvault.e2ee.message.RatchetMessage;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SessionEstablisherTest {

    private static final SessionAddress BOB = new SessionAddress("bob", "phone");

    private final List<AuditEventType> aliceAudit = Collections.synchronizedList(new ArrayList<>());
    private InMemoryDirectory directory;
    private TestParty alice;
    private TestParty bob;

    @Before
    public void setUp() throws Exception {
        MutableClock clock = new MutableClock();
        directory = new InMemoryDirectory();
        AuditSink sink = (type, description, metadata) -> aliceAudit.add(type);
        alice = new TestParty("alice", "laptop", directory, TestParty.TEST_CONFIG, clock, sink);
        bob = new TestParty("bob", "phone", directory, clock);
        alice.register();
        bob.register();
    }

    @Test
    public void testOneTimePreKeyConsumedOnFirstMessage() throws Exception {
        alice.deviceDirectory.establishSession("bob", "phone");

        assertEquals(Collections.singletonList("bob:phone:1"), directory.getConsumed());
        assertEquals(4, directory.get("bob", "phone").getOneTimePreKeys().size());
        assertNotNull(bob.keyMaterialStore.loadPreKey(1));

        EncryptedEnvelope first = alice.ratchetEngine.encryptEnvelope("bob:phone", "hi".getBytes(UTF_8));
        assertEquals(Integer.valueOf(1), first.getHandshake().getOneTimePreKeyId());
        assertArrayEquals("hi".getBytes(UTF_8), bob.deviceDirectory.decryptFromDevice("alice", "laptop", first));

        assertNull(bob.keyMaterialStore.loadPreKey(1));
        assertEquals(4, bob.preKeyManager.getOneTimePreKeyCount());
    }

    @Test
    public void testInitiateWithoutOneTimePreKeys() throws Exception {
        DeviceRecord published = directory.get("bob", "phone");
        DeviceRecord bare = new DeviceRecord(published.getDeviceId(), published.getDeviceName(),
            published.getIdentityKey(), published.getSignedPreKey(), Collections.emptyList(),
            published.getRegistrationId(), published.getRegisteredAt(), published.getLastSeenAt());

        alice.sessionStore.save(alice.establisher.initiate(BOB, bare));
        EncryptedEnvelope first = alice.ratchetEngine.encryptEnvelope("bob:phone", "no prekey".getBytes(UTF_8));

        assertNull(first.getHandshake().getOneTimePreKeyId());
        assertTrue(directory.getConsumed().isEmpty());
        assertArrayEquals("no prekey".getBytes(UTF_8), bob.deviceDirectory.decryptFromDevice("alice", "laptop", first));
        assertEquals(5, bob.preKeyManager.getOneTimePreKeyCount());
    }

    @Test
    public void testForgedSignedPreKeyRejected() throws Exception {
        DeviceRecord published = directory.get("bob", "phone");
        SignedPreKey genuine = published.getSignedPreKey();
        byte[] forgedSignature = IdentityKeyPair.generate().sign(genuine.getPublicKey());
        DeviceRecord forged = new DeviceRecord(published.getDeviceId(), published.getDeviceName(),
            published.getIdentityKey(), new SignedPreKey(genuine.getId(), genuine.getPublicKey(), forgedSignature,
            genuine.getTimestamp()), published.getOneTimePreKeys(), published.getRegistrationId(),
            published.getRegisteredAt(), published.getLastSeenAt());

        try {
            alice.establisher.initiate(BOB, forged);
            fail("forged bundle accepted");
        } catch (PeerBundleInvalidException e) {
            // expected
        }
        assertTrue(aliceAudit.contains(AuditEventType.SECURITY_INCIDENT));
        assertTrue(directory.getConsumed().isEmpty());
    }

    @Test
    public void testMissingSignedPreKey() throws Exception {
        DeviceRecord published = directory.get("bob", "phone");
        DeviceRecord unsigned = new DeviceRecord(published.getDeviceId(), published.getDeviceName(),
            published.getIdentityKey(), null, published.getOneTimePreKeys(), published.getRegistrationId(),
            published.getRegisteredAt(), published.getLastSeenAt());

        try {
            alice.establisher.initiate(BOB, unsigned);
            fail("bundle without signed pre-key accepted");
        } catch (KeyExhaustedException e) {
            // expected
        }
    }

    @Test
    public void testInitiateRequiresIdentity() throws Exception {
        TestParty carol = new TestParty("carol", "tablet", directory, new MutableClock());

        try {
            carol.establisher.initiate(BOB, directory.get("bob", "phone"));
            fail("initiated without an identity");
        } catch (KeyExhaustedException e) {
            // expected
        }
    }

    @Test
    public void testTamperedFirstMessageKeepsPreKey() throws Exception {
        alice.deviceDirectory.establishSession("bob", "phone");
        EncryptedEnvelope first = alice.ratchetEngine.encryptEnvelope("bob:phone", "hi".getBytes(UTF_8));
        RatchetMessage message = first.getMessage();
        byte[] ciphertext = message.getCiphertext();
        ciphertext[ciphertext.length - 1] ^= 0x01;
        EncryptedEnvelope tampered = new EncryptedEnvelope(
            new RatchetMessage(message.getHeader(), ciphertext, message.getMac()), first.getHandshake());

        try {
            bob.deviceDirectory.decryptFromDevice("alice", "laptop", tampered);
            fail("tampered handshake message accepted");
        } catch (AuthenticationFailedException e) {
            // expected
        }
        assertNotNull(bob.keyMaterialStore.loadPreKey(1));
        assertFalse(bob.ratchetEngine.hasSession("alice:laptop"));

        assertArrayEquals("hi".getBytes(UTF_8), bob.deviceDirectory.decryptFromDevice("alice", "laptop", first));
    }

    @Test
    public void testReplayedHandshakeAfterSessionLoss() throws Exception {
        alice.deviceDirectory.establishSession("bob", "phone");
        EncryptedEnvelope first = alice.ratchetEngine.encryptEnvelope("bob:phone", "hi".getBytes(UTF_8));
        bob.deviceDirectory.decryptFromDevice("alice", "laptop", first);
        bob.ratchetEngine.deleteSession("alice:laptop");

        try {
            bob.deviceDirectory.decryptFromDevice("alice", "laptop", first);
            fail("replayed handshake accepted");
        } catch (KeyExhaustedException e) {
            // expected
        }
        assertFalse(bob.ratchetEngine.hasSession("alice:laptop"));
    }

    @Test
    public void testInterruptedInitiateLeavesNoTrace() throws Exception {
        Thread.currentThread().interrupt();
        try {
            alice.deviceDirectory.establishSession("bob", "phone");
            fail("interrupted establishment completed");
        } catch (CancellationException e) {
            // expected
        } finally {
            Thread.interrupted();
        }

        assertTrue(directory.getConsumed().isEmpty());
        assertEquals(5, directory.get("bob", "phone").getOneTimePreKeys().size());
        assertFalse(alice.ratchetEngine.hasSession("bob:phone"));
    }

    @Test
    public void testSessionAddressParsing() {
        SessionAddress address = SessionAddress.fromSessionId("user:with:colons:device-1");

        assertEquals("user:with:colons", address.getUserId());
        assertEquals("device-1", address.getDeviceId());
        assertEquals("user:with:colons:device-1", address.toSessionId());
    }
}
