package tech.noetzold.verification_api.model;

public record CertificateCheckResponse(boolean valid, String certificate_digest, String signature_algorithm) {}
