package tech.noetzold.verification_api.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record VerifyRequest(
        @NotNull String text,
        @NotBlank String ontology_name,
        String ontology_version,
        List<String> rules
) {}
