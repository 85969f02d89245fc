package tech.noetzold.verification_api.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tech.noetzold.verification_api.model.Constraint;
import tech.noetzold.verification_api.model.Ontology;
import tech.noetzold.verification_api.model.VerificationResult;
import tech.noetzold.verification_api.util.CanonicalJson;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, expiring cache of pipeline results for identical requests. The key binds the text, the
 * ontology's identity and digest, and the checked constraint ids, so a changed ontology never hits.
 */
@Slf4j
@Component
public class VerificationResultCache {

    private final boolean enabled;
    private final Cache<String, VerificationResult> results;

    public VerificationResultCache(@Value("${verification.result-cache.enabled:true}") boolean enabled,
                                   @Value("${verification.result-cache.max-size:1000}") long maxSize,
                                   @Value("${verification.result-cache.ttl-seconds:300}") long ttlSeconds) {
        this.enabled = enabled;
        this.results = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxSize))
                .expireAfterWrite(Math.max(1, ttlSeconds), TimeUnit.SECONDS)
                .build();
    }

    public static String key(Ontology ontology, String text, List<Constraint> constraints) {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("ontology", ontology.name());
        key.put("version", ontology.version());
        key.put("digest", ontology.digest());
        key.put("text", text == null ? "" : text);
        key.put("rules", constraints.stream().map(Constraint::id).sorted().toList());
        return CanonicalJson.digest(key);
    }

    public Optional<VerificationResult> get(String key) {
        if (!enabled) return Optional.empty();
        VerificationResult hit = results.getIfPresent(key);
        if (hit != null) {
            log.debug("Result cache hit for {}", key);
        }
        return Optional.ofNullable(hit);
    }

    public void put(String key, VerificationResult result) {
        if (enabled) {
            results.put(key, result);
        }
    }

    public long size() {
        results.cleanUp();
        return results.estimatedSize();
    }
}
