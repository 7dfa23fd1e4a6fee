package com.fintech.webhook.security;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Reads an RSA public key from a PEM file holding either a {@code PUBLIC KEY}
 * block or an X.509 {@code CERTIFICATE}. Paths prefixed with {@code classpath:}
 * are resolved against the classpath, anything else against the file system.
 */
@Component
public class PublicKeyLoader {

    private static final String CLASSPATH_PREFIX = "classpath:";

    public PublicKey load(String location) throws IOException, GeneralSecurityException {
        Resource resource = location.startsWith(CLASSPATH_PREFIX)
                ? new ClassPathResource(location.substring(CLASSPATH_PREFIX.length()))
                : new FileSystemResource(location);

        try (InputStream in = resource.getInputStream()) {
            return parse(new String(in.readAllBytes(), StandardCharsets.US_ASCII));
        }
    }

    public PublicKey parse(String pem) throws GeneralSecurityException {
        PublicKey key;
        if (pem.contains("-----BEGIN CERTIFICATE-----")) {
            byte[] der = decodeBlock(pem, "CERTIFICATE");
            X509Certificate certificate = (X509Certificate) CertificateFactory.getInstance("X.509")
                    .generateCertificate(new ByteArrayInputStream(der));
            key = certificate.getPublicKey();
        } else if (pem.contains("-----BEGIN PUBLIC KEY-----")) {
            byte[] der = decodeBlock(pem, "PUBLIC KEY");
            key = KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } else {
            throw new GeneralSecurityException("No PUBLIC KEY or CERTIFICATE block found");
        }

        if (!"RSA".equals(key.getAlgorithm())) {
            throw new GeneralSecurityException("Expected an RSA key, got " + key.getAlgorithm());
        }
        return key;
    }

    private static byte[] decodeBlock(String pem, String label) throws GeneralSecurityException {
        String begin = "-----BEGIN " + label + "-----";
        String end = "-----END " + label + "-----";
        int start = pem.indexOf(begin);
        int stop = pem.indexOf(end, start);
        if (stop < 0) {
            throw new GeneralSecurityException("Unterminated " + label + " block");
        }
        String body = pem.substring(start + begin.length(), stop).replaceAll("\\s", "");
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Invalid base64 in " + label + " block", e);
        }
    }
}
