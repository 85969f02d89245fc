package tech.noetzold.verification_api.ontology;

import java.util.List;
import java.util.Optional;

/**
 * Key-addressable store of raw ontology documents.
 */
public interface OntologySource {

    /**
     * @param version a specific version, or {@code null} for the latest one
     * @return the raw document, or empty when no such document exists
     * @throws StorageUnavailableException when the store cannot be read
     */
    Optional<String> fetch(String name, String version);

    /**
     * Names that have a latest document, sorted. Stores that cannot enumerate their keys return an
     * empty list.
     *
     * @throws StorageUnavailableException when the store cannot be read
     */
    default List<String> list() {
        return List.of();
    }

    static String key(String name, String version) {
        return version == null || version.isBlank()
                ? name + "/latest/ontology.json"
                : name + "/v" + version + "/ontology.json";
    }
}
