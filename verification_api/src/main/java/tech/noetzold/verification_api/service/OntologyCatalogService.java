package tech.noetzold.verification_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.verification_api.model.OntologyListResponse;
import tech.noetzold.verification_api.model.OntologySummary;
import tech.noetzold.verification_api.ontology.OntologyCache;
import tech.noetzold.verification_api.ontology.OntologyLoadException;
import tech.noetzold.verification_api.ontology.OntologySource;
import tech.noetzold.verification_api.ontology.StorageUnavailableException;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists what the ontology store offers. Each latest document goes through the cache, so listing
 * also warms it; a document that fails to load is listed as unavailable instead of failing the call.
 */
@Slf4j
@Service
public class OntologyCatalogService {

    private final OntologySource source;
    private final OntologyCache cache;

    public OntologyCatalogService(OntologySource source, OntologyCache cache) {
        this.source = source;
        this.cache = cache;
    }

    public OntologyListResponse list() {
        List<String> names;
        try {
            names = source.list();
        } catch (StorageUnavailableException e) {
            throw new OntologyLoadException(OntologyLoadException.Reason.UNAVAILABLE, null, null, e.getMessage(), e);
        }
        List<OntologySummary> entries = new ArrayList<>();
        for (String name : names) {
            try {
                entries.add(OntologySummary.of(cache.get(name, null)));
            } catch (OntologyLoadException e) {
                log.warn("Listing {} as unavailable: {}", name, e.getMessage());
                entries.add(OntologySummary.unavailable(name, "ONTOLOGY_" + e.getReason().name()));
            }
        }
        log.debug("Listed {} ontologies", entries.size());
        return new OntologyListResponse(entries, entries.size());
    }
}
