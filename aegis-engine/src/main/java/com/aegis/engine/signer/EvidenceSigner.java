package com.aegis.engine.signer;

import com.aegis.core.domain.Evidence;
import com.aegis.core.domain.SignedEvidence;
import com.aegis.core.json.CanonicalJson;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hashes and signs evidence and ledger record headers.
 * <p>
 * Keys are EC secp256r1, signatures SHA256withECDSA encoded as Base64. Each key
 * is identified by a prefix of the SHA-256 of its encoded public key, so a
 * key id can be checked against the key it names.
 * <p>
 * Verification never throws: any malformed input, unknown key or bad
 * signature yields {@code false}.
 */
public class EvidenceSigner {

    private static final Logger log = LoggerFactory.getLogger(EvidenceSigner.class);

    private static final String KEY_ALGORITHM = "EC";
    private static final String CURVE = "secp256r1";
    private static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";
    private static final String PEM_HEADER = "-----BEGIN PUBLIC KEY-----";
    private static final String PEM_FOOTER = "-----END PUBLIC KEY-----";

    private final SigningKeyStore keyStore;
    private final Clock clock;

    public EvidenceSigner(SigningKeyStore keyStore, Clock clock) {
        this.keyStore = Objects.requireNonNull(keyStore, "Key store cannot be null");
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public EvidenceSigner() {
        this(new InMemorySigningKeyStore(), Clock.systemUTC());
    }

    // ==================== Keys ====================

    /**
     * Generates a fresh key pair and makes it the active key. Any previously
     * active key is retired; its public key stays available for verification.
     *
     * @return id of the new key
     * @throws SignerException if the platform cannot generate EC keys
     */
    public synchronized String generateKeyPair() {
        KeyPair keyPair = newKeyPair();
        String keyId = computeKeyId(keyPair.getPublic());
        if (keyStore.getActiveKeyId() != null) {
            keyStore.retireActiveKey();
        }
        keyStore.storeActiveKey(keyId, keyPair, clock.instant());
        log.info("Generated signing key {}", keyId);
        return keyId;
    }

    /**
     * Returns the active key id, generating a key pair on first use.
     */
    public synchronized String ensureKey() {
        String keyId = keyStore.getActiveKeyId();
        return keyId != null ? keyId : generateKeyPair();
    }

    /**
     * Retires the active key and activates a new one.
     *
     * @return id of the new key
     */
    public synchronized String rotateKey() {
        String previous = keyStore.getActiveKeyId();
        String keyId = generateKeyPair();
        log.info("Rotated signing key {} -> {}", previous, keyId);
        return keyId;
    }

    public boolean hasKeys() {
        return keyStore.getActiveKeyId() != null;
    }

    public String getKeyId() {
        return keyStore.getActiveKeyId();
    }

    public Instant getKeyCreatedAt() {
        return keyStore.getActiveKeyCreatedAt();
    }

    /**
     * PEM encoding of the active public key, or null if no key exists yet.
     */
    public String exportPublicKey() {
        return exportPublicKey(keyStore.getActiveKeyId());
    }

    /**
     * PEM encoding of a known public key, or null if the id is unknown.
     */
    public String exportPublicKey(String keyId) {
        PublicKey publicKey = keyStore.loadPublicKey(keyId);
        return publicKey != null ? toPem(publicKey) : null;
    }

    /**
     * All known public keys as PEM, keyed by key id.
     */
    public Map<String, String> exportPublicKeys() {
        Map<String, String> result = new LinkedHashMap<>();
        keyStore.publicKeys().forEach((keyId, publicKey) -> result.put(keyId, toPem(publicKey)));
        return result;
    }

    /**
     * Registers another signer's public key for verification.
     *
     * @throws SignerException if the PEM is malformed or does not hash to {@code keyId}
     */
    public void trustPublicKey(String keyId, String pem) {
        Objects.requireNonNull(keyId, "Key ID cannot be null");
        PublicKey publicKey = parsePublicKey(pem);
        String derived = computeKeyId(publicKey);
        if (!derived.equals(keyId)) {
            throw new SignerException("Public key does not match key id " + keyId + " (derived " + derived + ")");
        }
        keyStore.storePublicKey(keyId, publicKey);
    }

    public PublicKey publicKey(String keyId) {
        return keyStore.loadPublicKey(keyId);
    }

    // ==================== Hashing ====================

    /**
     * SHA-256 hex digest of a payload's canonical JSON. Strings (plain or as a
     * JSON text node) are hashed as their UTF-8 text.
     */
    public String hashContent(Object payload) {
        byte[] bytes;
        if (payload instanceof String text) {
            bytes = text.getBytes(StandardCharsets.UTF_8);
        } else if (payload instanceof TextNode textNode) {
            bytes = textNode.asText().getBytes(StandardCharsets.UTF_8);
        } else {
            bytes = CanonicalJson.canonicalBytes(payload);
        }
        return sha256Hex(bytes);
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new SignerException("SHA-256 is not available", e);
        }
    }

    // ==================== Evidence ====================

    /**
     * Hashes the evidence content and signs its canonical identity, generating
     * a key pair first if none exists.
     */
    public SignedEvidence sign(Evidence evidence, String signerId) {
        Objects.requireNonNull(evidence, "Evidence cannot be null");
        Objects.requireNonNull(signerId, "Signer ID cannot be null");
        String keyId;
        String signature;
        String contentHash = hashContent(evidence.content());
        synchronized (this) {
            keyId = ensureKey();
            signature = signBytes(CanonicalJson.canonicalBytes(signingPayload(evidence, contentHash)));
        }
        return new SignedEvidence(evidence, contentHash, signature, clock.instant(), signerId, keyId);
    }

    /**
     * Verifies against the public key named by the evidence's key id.
     */
    public boolean verify(SignedEvidence signed) {
        if (signed == null) {
            return false;
        }
        return verify(signed, keyStore.loadPublicKey(signed.keyId()));
    }

    /**
     * Recomputes the content hash from the current content, then checks the
     * signature. False when either check fails or no public key is given.
     */
    public boolean verify(SignedEvidence signed, PublicKey publicKey) {
        if (signed == null || publicKey == null) {
            return false;
        }
        try {
            String currentHash = hashContent(signed.evidence().content());
            if (!currentHash.equals(signed.contentHash())) {
                log.debug("Content hash mismatch for evidence {}", signed.id());
                return false;
            }
            byte[] payload = CanonicalJson.canonicalBytes(signingPayload(signed.evidence(), signed.contentHash()));
            return verifyBytes(payload, signed.signature(), publicKey);
        } catch (RuntimeException e) {
            log.debug("Evidence {} failed verification: {}", signed.id(), e.getMessage());
            return false;
        }
    }

    // ==================== Arbitrary payloads ====================

    /**
     * Signs the canonical form of a payload with the named key.
     *
     * @throws SignerException if {@code keyId} is no longer the active key
     */
    public synchronized String signPayload(Object payload, String keyId) {
        if (keyId == null || !keyId.equals(keyStore.getActiveKeyId())) {
            throw new SignerException("Key " + keyId + " is not the active signing key");
        }
        return signBytes(CanonicalJson.canonicalBytes(payload));
    }

    public boolean verifyPayload(Object payload, String signature, String keyId) {
        PublicKey publicKey = keyStore.loadPublicKey(keyId);
        if (publicKey == null || signature == null) {
            return false;
        }
        try {
            return verifyBytes(CanonicalJson.canonicalBytes(payload), signature, publicKey);
        } catch (RuntimeException e) {
            log.debug("Payload signature check failed: {}", e.getMessage());
            return false;
        }
    }

    // ==================== Internals ====================

    private static ObjectNode signingPayload(Evidence evidence, String contentHash) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", evidence.id());
        node.put("type", evidence.type().wireName());
        node.put("source", evidence.source());
        node.put("projectId", evidence.projectId());
        node.put("timestamp", evidence.timestamp().toString());
        node.put("contentHash", contentHash);
        node.set("metadata", CanonicalJson.toTree(evidence.metadata()));
        return node;
    }

    private String signBytes(byte[] data) {
        KeyPair keyPair = keyStore.loadActiveKeyPair();
        if (keyPair == null) {
            throw new SignerException("No active signing key");
        }
        try {
            Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
            signature.initSign(keyPair.getPrivate());
            signature.update(data);
            return Base64.getEncoder().encodeToString(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new SignerException("Failed to sign payload", e);
        }
    }

    /**
     * Checks a Base64 signature over raw bytes without consulting any key store.
     */
    public static boolean verifyDetached(byte[] data, String signatureBase64, PublicKey publicKey) {
        if (data == null || signatureBase64 == null || publicKey == null) {
            return false;
        }
        return verifyBytes(data, signatureBase64, publicKey);
    }

    private static boolean verifyBytes(byte[] data, String signatureBase64, PublicKey publicKey) {
        try {
            Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
            signature.initVerify(publicKey);
            signature.update(data);
            return signature.verify(Base64.getDecoder().decode(signatureBase64));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }

    private static KeyPair newKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
            generator.initialize(new ECGenParameterSpec(CURVE));
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new SignerException("Failed to generate EC key pair", e);
        }
    }

    static String computeKeyId(PublicKey publicKey) {
        return "key-" + sha256Hex(publicKey.getEncoded()).substring(0, 32);
    }

    static String toPem(PublicKey publicKey) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(publicKey.getEncoded());
        return PEM_HEADER + "\n" + body + "\n" + PEM_FOOTER + "\n";
    }

    /**
     * Parses a PEM-encoded EC public key.
     *
     * @throws SignerException if the text is not a valid key
     */
    public static PublicKey parsePublicKey(String pem) {
        if (pem == null || !pem.contains(PEM_HEADER)) {
            throw new SignerException("Not a PEM public key");
        }
        String body = pem.replace(PEM_HEADER, "").replace(PEM_FOOTER, "").replaceAll("\\s", "");
        try {
            byte[] der = Base64.getDecoder().decode(body);
            return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new SignerException("Malformed PEM public key", e);
        }
    }
}
