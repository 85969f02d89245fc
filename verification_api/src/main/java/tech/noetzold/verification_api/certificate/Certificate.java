package tech.noetzold.verification_api.certificate;

/**
 * @param digest      SHA-256 over {@code canonical}
 * @param inputDigest SHA-256 of the verified text
 * @param canonical   the exact bytes that were hashed and signed, kept for independent recomputation
 * @param signature   Base64 {@link CertificateSigner#ALGORITHM} over {@code canonical}
 */
public record Certificate(String digest, String inputDigest, String canonical, String signature) {

    public String algorithm() {
        return CertificateSigner.ALGORITHM;
    }
}
