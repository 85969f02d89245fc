package tech.noetzold.verification_api.model;

import jakarta.validation.constraints.NotBlank;

/**
 * @param certificate the canonical certificate body exactly as returned by {@code /verify}
 */
public record CertificateCheckRequest(@NotBlank String certificate, @NotBlank String certificate_signature) {}
