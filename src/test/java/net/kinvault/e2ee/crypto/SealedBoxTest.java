package net.kinvault.e2ee.crypto;

import net.kinvault.e2ee.AuthenticationFailedException;
import org.junit.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.fail;

public class SealedBoxTest {

    @Test
    public void testOpensForRecipient() throws Exception {
        IdentityKeyPair recipient = IdentityKeyPair.generate();
        byte[] sealed = SealedBox.seal(recipient.getPublicKey(), "backup".getBytes(UTF_8));

        assertArrayEquals("backup".getBytes(UTF_8), SealedBox.open(recipient, sealed));
    }

    @Test
    public void testRejectsOtherRecipient() throws Exception {
        IdentityKeyPair recipient = IdentityKeyPair.generate();
        byte[] sealed = SealedBox.seal(recipient.getPublicKey(), "backup".getBytes(UTF_8));

        try {
            SealedBox.open(IdentityKeyPair.generate(), sealed);
            fail("opened with the wrong key");
        } catch (AuthenticationFailedException e) {
            // expected
        }
    }

    @Test(expected = AuthenticationFailedException.class)
    public void testRejectsTruncated() throws Exception {
        SealedBox.open(IdentityKeyPair.generate(), new byte[10]);
    }
}
