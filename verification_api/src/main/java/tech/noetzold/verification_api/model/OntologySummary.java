package tech.noetzold.verification_api.model;

/**
 * One catalog entry. {@code error} carries the load failure code when the latest document cannot
 * be served; the other fields are then null.
 */
public record OntologySummary(
        String name,
        String version,
        String description,
        Integer constraint_count,
        boolean available,
        String error
) {
    public static OntologySummary of(Ontology o) {
        return new OntologySummary(o.name(), o.version(), o.description(), o.constraints().size(), true, null);
    }

    public static OntologySummary unavailable(String name, String error) {
        return new OntologySummary(name, null, null, null, false, error);
    }
}
