package com.fintech.webhook.security;

import com.fintech.webhook.config.WebhookProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.util.Base64;

/**
 * Verifies batch signatures with SHA512withRSA (PKCS#1 v1.5) over the canonical string.
 * <p>
 * The key is loaded once at startup. When loading fails the verifier has no key and
 * every verification fails.
 */
@Slf4j
@Component
public class SignatureVerifier {

    static final String ALGORITHM = "SHA512withRSA";

    private final PublicKey publicKey;

    @Autowired
    public SignatureVerifier(WebhookProperties properties, PublicKeyLoader loader) {
        this(loadKey(properties.getSignature().getPublicKeyPath(), loader));
    }

    SignatureVerifier(PublicKey publicKey) {
        this.publicKey = publicKey;
    }

    private static PublicKey loadKey(String location, PublicKeyLoader loader) {
        try {
            PublicKey key = loader.load(location);
            log.info("Loaded bank public key from {} (canonical scheme {})", location, SignatureCanonicalizer.VERSION);
            return key;
        } catch (IOException | GeneralSecurityException e) {
            log.error("Could not load bank public key from {}, signature checks will fail: {}",
                    location, e.getMessage());
            return null;
        }
    }

    public boolean hasTrustedKey() {
        return publicKey != null;
    }

    public boolean verify(String sourceAppId, String batchId, String timestamp, String signatureBase64) {
        if (publicKey == null || signatureBase64 == null) {
            return false;
        }

        byte[] signatureBytes;
        try {
            signatureBytes = Base64.getDecoder().decode(signatureBase64.trim());
        } catch (IllegalArgumentException e) {
            log.debug("Signature is not valid base64: {}", e.getMessage());
            return false;
        }

        try {
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(SignatureCanonicalizer.canonicalize(sourceAppId, batchId, timestamp));
            return verifier.verify(signatureBytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available in this JVM", e);
        } catch (InvalidKeyException | SignatureException e) {
            log.debug("Signature verification error: {}", e.getMessage());
            return false;
        }
    }
}
