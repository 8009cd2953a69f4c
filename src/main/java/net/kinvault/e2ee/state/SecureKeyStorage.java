package net.kinvault.e2ee.state;

import net.kinvault.e2ee.StorageFailureException;

import java.util.List;

/**
 * Platform secure storage (keychain, keystore, HSM). Values are opaque byte strings.
 */
public interface SecureKeyStorage {
    void set(String key, byte[] value) throws StorageFailureException;

    /**
     * @return the stored value, or null if absent
     */
    byte[] get(String key) throws StorageFailureException;

    void delete(String key) throws StorageFailureException;

    /**
     * @return all stored keys starting with {@code prefix}
     */
    List<String> keys(String prefix) throws StorageFailureException;
}
