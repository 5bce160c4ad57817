package com.aegis.engine.signer;

import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process-local key store. Private keys never leave this object except to the
 * owning {@link EvidenceSigner}.
 */
public class InMemorySigningKeyStore implements SigningKeyStore {

    private final Map<String, PublicKey> publicKeys = new LinkedHashMap<>();
    private String activeKeyId;
    private KeyPair activeKeyPair;
    private Instant activeKeyCreatedAt;

    @Override
    public synchronized void storeActiveKey(String keyId, KeyPair keyPair, Instant createdAt) {
        Objects.requireNonNull(keyId, "Key ID cannot be null");
        Objects.requireNonNull(keyPair, "Key pair cannot be null");
        this.activeKeyId = keyId;
        this.activeKeyPair = keyPair;
        this.activeKeyCreatedAt = createdAt;
        publicKeys.put(keyId, keyPair.getPublic());
    }

    @Override
    public synchronized KeyPair loadActiveKeyPair() {
        return activeKeyPair;
    }

    @Override
    public synchronized String getActiveKeyId() {
        return activeKeyId;
    }

    @Override
    public synchronized Instant getActiveKeyCreatedAt() {
        return activeKeyCreatedAt;
    }

    @Override
    public synchronized void retireActiveKey() {
        activeKeyId = null;
        activeKeyPair = null;
        activeKeyCreatedAt = null;
    }

    @Override
    public synchronized void storePublicKey(String keyId, PublicKey publicKey) {
        Objects.requireNonNull(keyId, "Key ID cannot be null");
        Objects.requireNonNull(publicKey, "Public key cannot be null");
        publicKeys.putIfAbsent(keyId, publicKey);
    }

    @Override
    public synchronized PublicKey loadPublicKey(String keyId) {
        return keyId != null ? publicKeys.get(keyId) : null;
    }

    @Override
    public synchronized Map<String, PublicKey> publicKeys() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(publicKeys));
    }

    @Override
    public synchronized void wipe() {
        retireActiveKey();
        publicKeys.clear();
    }
}
