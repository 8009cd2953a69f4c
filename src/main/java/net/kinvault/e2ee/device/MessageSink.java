package net.kinvault.e2ee.device;

import net.kinvault.e2ee.message.EncryptedEnvelope;

import java.io.IOException;

/**
 * Delivers envelopes produced by fan-out to the transport of the embedding application.
 */
public interface MessageSink {
    void deliver(String userId, String deviceId, EncryptedEnvelope envelope) throws IOException;
}
