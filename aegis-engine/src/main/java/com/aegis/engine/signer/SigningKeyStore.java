package com.aegis.engine.signer;

import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Instant;
import java.util.Map;

/**
 * Storage for the signer's key material.
 * <p>
 * Exactly one key pair is active at a time. Retired and trusted keys are kept
 * as public keys only, so records they signed remain verifiable.
 */
public interface SigningKeyStore {

    /**
     * Stores a new active key pair. Its public key also becomes resolvable by id.
     */
    void storeActiveKey(String keyId, KeyPair keyPair, Instant createdAt);

    /**
     * @return the active key pair, or null if none was generated yet
     */
    KeyPair loadActiveKeyPair();

    /**
     * @return id of the active key, or null if none
     */
    String getActiveKeyId();

    /**
     * @return creation time of the active key, or null if none
     */
    Instant getActiveKeyCreatedAt();

    /**
     * Drops the active private key. Its public key stays resolvable.
     */
    void retireActiveKey();

    /**
     * Registers a public key for verification only.
     */
    void storePublicKey(String keyId, PublicKey publicKey);

    /**
     * @return the public key with this id, or null if unknown
     */
    PublicKey loadPublicKey(String keyId);

    /**
     * All known public keys, in registration order.
     */
    Map<String, PublicKey> publicKeys();

    /**
     * Deletes all stored keys.
     */
    void wipe();
}
