package tech.noetzold.verification_api.certificate;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * HMAC-SHA256 over the canonical certificate body, Base64 encoded. Without a configured key a
 * random one is generated at startup, so signatures only check out within the same process.
 */
@Slf4j
@Component
public class CertificateSigner {

    public static final String ALGORITHM = "HMAC-SHA256";
    private static final String MAC_ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public CertificateSigner(@Value("${verification.certificate.signing-key:}") String signingKey) {
        byte[] secret;
        if (signingKey == null || signingKey.isBlank()) {
            secret = new byte[32];
            new SecureRandom().nextBytes(secret);
            log.warn("verification.certificate.signing-key is not set; certificates are signed with an ephemeral key");
        } else {
            secret = signingKey.getBytes(StandardCharsets.UTF_8);
        }
        this.key = new SecretKeySpec(secret, MAC_ALGORITHM);
    }

    public String sign(String canonical) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(key);
            return Base64.getEncoder().encodeToString(mac.doFinal(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot sign certificate with " + ALGORITHM, e);
        }
    }

    /** Constant-time check of a signature against the exact canonical body it was issued for. */
    public boolean verify(String canonical, String signature) {
        if (canonical == null || signature == null) return false;
        return MessageDigest.isEqual(sign(canonical).getBytes(StandardCharsets.US_ASCII),
                signature.getBytes(StandardCharsets.US_ASCII));
    }
}
