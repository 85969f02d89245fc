package tech.noetzold.verification_api.model;

public record OntologyInfo(String name, String version, String digest, int constraints_checked) {}
