package net.kinvault.e2ee.crypto;

import net.kinvault.e2ee.KeyGenerationException;

import javax.security.auth.Destroyable;

/**
 * Long-lived device identity: X25519 agreement pair plus Ed25519 signing pair.
 */
public final class IdentityKeyPair implements AutoCloseable, Destroyable {
    private final DhKeyPair agreementKeyPair;
    private final byte[] signingPublicKey;
    private final SecretBytes signingPrivateKey;

    public IdentityKeyPair(DhKeyPair agreementKeyPair, byte[] signingPublicKey, SecretBytes signingPrivateKey) {
        this.agreementKeyPair = agreementKeyPair;
        this.signingPublicKey = signingPublicKey.clone();
        this.signingPrivateKey = signingPrivateKey;
    }

    public static IdentityKeyPair generate() throws KeyGenerationException {
        DhKeyPair agreement = Crypto.generateDh();
        return Crypto.generateSigningKeyPair(agreement);
    }

    public IdentityKey getPublicKey() {
        return new IdentityKey(agreementKeyPair.getPublicKey(), signingPublicKey);
    }

    public DhKeyPair getAgreementKeyPair() {
        return agreementKeyPair;
    }

    public byte[] getSigningPublicKey() {
        return signingPublicKey.clone();
    }

    public SecretBytes getSigningPrivateKey() {
        return signingPrivateKey;
    }

    public byte[] sign(byte[] message) {
        return Crypto.sign(signingPrivateKey, message);
    }

    public IdentityKeyPair copy() {
        return new IdentityKeyPair(agreementKeyPair.copy(), signingPublicKey, signingPrivateKey.duplicate());
    }

    @Override
    public void destroy() {
        agreementKeyPair.destroy();
        signingPrivateKey.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return agreementKeyPair.isDestroyed() && signingPrivateKey.isDestroyed();
    }

    @Override
    public void close() {
        destroy();
    }
}
