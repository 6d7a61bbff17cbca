package com.campusauth.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Locale;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Process-wide signing material, resolved once at startup.
 * <p>
 * {@code HS256} uses {@code jwt.secret} (Base64 or raw text, at least 256 bits).
 * {@code RS256} uses {@code jwt.private-key} / {@code jwt.public-key}, given either as PEM or as
 * Base64-encoded PEM. Any misconfiguration fails construction, so the context refuses to start.
 */
@Component
public class JwtKeyProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtKeyProvider.class);

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_HMAC_KEY_BYTES = 32;
    private static final int MIN_RSA_KEY_BITS = 2048;

    private final SigningAlgorithm algorithm;
    private final String keyId;
    private final SecretKey secretKey;
    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    public JwtKeyProvider(
            @Value("${jwt.algorithm:HS256}") String algorithm,
            @Value("${jwt.secret:}") String secret,
            @Value("${jwt.private-key:}") String privateKeyPem,
            @Value("${jwt.public-key:}") String publicKeyPem,
            @Value("${jwt.key-id:}") String keyId
    ) {
        this.algorithm = SigningAlgorithm.from(algorithm);
        this.keyId = StringUtils.hasText(keyId) ? keyId.trim() : null;
        if (this.algorithm == SigningAlgorithm.HS256) {
            this.secretKey = hmacKey(secret);
            this.privateKey = null;
            this.publicKey = null;
        } else {
            this.secretKey = null;
            this.privateKey = rsaPrivateKey(privateKeyPem);
            this.publicKey = rsaPublicKey(publicKeyPem);
        }
        log.info("JWT signing configured: algorithm={} keyId={}", this.algorithm, this.keyId);
    }

    public SigningAlgorithm getAlgorithm() {
        return algorithm;
    }

    public String getKeyId() {
        return keyId;
    }

    public JwtBuilder sign(JwtBuilder builder) {
        if (keyId != null) {
            builder.header().keyId(keyId).and();
        }
        if (algorithm == SigningAlgorithm.HS256) {
            return builder.signWith(secretKey, Jwts.SIG.HS256);
        }
        return builder.signWith(privateKey, Jwts.SIG.RS256);
    }

    public JwtParserBuilder verifyWith(JwtParserBuilder parserBuilder) {
        if (algorithm == SigningAlgorithm.HS256) {
            return parserBuilder.verifyWith(secretKey);
        }
        return parserBuilder.verifyWith(publicKey);
    }

    private static SecretKey hmacKey(String secret) {
        if (!StringUtils.hasText(secret)) {
            throw new IllegalStateException("jwt.secret must be set when jwt.algorithm=HS256");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_HMAC_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least " + MIN_HMAC_KEY_BYTES + " bytes");
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    private static PrivateKey rsaPrivateKey(String configured) {
        byte[] der = pemToDer(configured, "jwt.private-key");
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("jwt.private-key is not a PKCS#8 RSA private key", ex);
        }
    }

    private static PublicKey rsaPublicKey(String configured) {
        byte[] der = pemToDer(configured, "jwt.public-key");
        PublicKey key;
        try {
            key = KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("jwt.public-key is not an X.509 RSA public key", ex);
        }
        if (key instanceof RSAPublicKey rsaKey && rsaKey.getModulus().bitLength() < MIN_RSA_KEY_BITS) {
            throw new IllegalStateException("jwt.public-key must be at least " + MIN_RSA_KEY_BITS + " bits");
        }
        return key;
    }

    private static byte[] pemToDer(String configured, String property) {
        if (!StringUtils.hasText(configured)) {
            throw new IllegalStateException(property + " must be set when jwt.algorithm=RS256");
        }
        String pem = configured.trim();
        if (!pem.contains("-----BEGIN")) {
            try {
                pem = new String(Base64.getMimeDecoder().decode(pem), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException(property + " is neither PEM nor Base64-encoded PEM", ex);
            }
        }
        String body = pem.replaceAll("-----(BEGIN|END) [A-Z ]+-----", "").replaceAll("\\s", "");
        try {
            return Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException(property + " contains an invalid PEM body", ex);
        }
    }

    public enum SigningAlgorithm {
        HS256,
        RS256;

        static SigningAlgorithm from(String value) {
            if (!StringUtils.hasText(value)) {
                return HS256;
            }
            try {
                return SigningAlgorithm.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("Unsupported jwt.algorithm: " + value, ex);
            }
        }
    }
}
