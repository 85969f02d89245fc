package tech.noetzold.verification_api.model;

import java.util.List;

public record OntologyListResponse(List<OntologySummary> ontologies, int total) {}
