package tech.noetzold.verification_api.ontology;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tech.noetzold.verification_api.model.Ontology;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Process-wide ontology cache keyed by {@code (name, version)}. Each key is loaded at most once:
 * concurrent first requests wait on the same in-flight load. Successful loads are kept for the
 * life of the process; failed loads are dropped so the next request tries again.
 */
@Slf4j
@Component
public class OntologyCache {

    static final String LATEST = "latest";
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");
    private static final Pattern SAFE_VERSION = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._+-]{0,63}");

    private final OntologySource source;
    private final OntologyParser parser;
    private final Executor loadExecutor;
    private final long loadTimeoutMs;
    private final Map<OntologyKey, CompletableFuture<Ontology>> entries = new ConcurrentHashMap<>();

    public OntologyCache(OntologySource source,
                         OntologyParser parser,
                         @Qualifier("ontologyLoadExecutor") Executor loadExecutor,
                         @Value("${verification.ontology.load-timeout-ms:2000}") long loadTimeoutMs) {
        this.source = source;
        this.parser = parser;
        this.loadExecutor = loadExecutor;
        this.loadTimeoutMs = loadTimeoutMs;
    }

    public Ontology get(String name, String version) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            throw new OntologyLoadException(OntologyLoadException.Reason.NOT_FOUND, name, null,
                    "Invalid ontology name '" + name + "'", null);
        }
        String requested = version == null || version.isBlank() ? LATEST : version.trim();
        if (!SAFE_VERSION.matcher(requested).matches() || requested.contains("..")) {
            throw new OntologyLoadException(OntologyLoadException.Reason.NOT_FOUND, name, null,
                    "Invalid ontology version '" + version + "'", null);
        }
        OntologyKey key = new OntologyKey(name, requested);

        CompletableFuture<Ontology> created = new CompletableFuture<>();
        CompletableFuture<Ontology> existing = entries.putIfAbsent(key, created);
        CompletableFuture<Ontology> future = existing != null ? existing : created;
        if (existing == null) {
            startLoad(key, created);
        }

        try {
            return future.get(loadTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Ontology {} not available after {}ms", key, loadTimeoutMs);
            throw new OntologyLoadException(OntologyLoadException.Reason.TIMEOUT, name, null,
                    "Timed out loading ontology '" + name + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OntologyLoadException(OntologyLoadException.Reason.UNAVAILABLE, name, null,
                    "Interrupted while loading ontology '" + name + "'", e);
        } catch (ExecutionException e) {
            throw translate(name, e.getCause());
        }
    }

    public int size() {
        return (int) entries.values().stream().filter(f -> f.isDone() && !f.isCompletedExceptionally()).count();
    }

    private void startLoad(OntologyKey key, CompletableFuture<Ontology> target) {
        Runnable task = () -> {
            try {
                Ontology loaded = load(key);
                target.complete(loaded);
            } catch (Throwable t) {
                // drop before completing so that waiters' retries start a fresh load
                entries.remove(key, target);
                target.completeExceptionally(t);
            }
        };
        try {
            loadExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            entries.remove(key, target);
            target.completeExceptionally(new StorageUnavailableException("Ontology loader saturated", e));
        }
    }

    private Ontology load(OntologyKey key) {
        String version = LATEST.equals(key.version()) ? null : key.version();
        long start = System.currentTimeMillis();
        String document = source.fetch(key.name(), version)
                .orElseThrow(() -> OntologyLoadException.notFound(key.name(), version));
        Ontology ontology;
        try {
            ontology = parser.parse(document);
        } catch (OntologyLoadException e) {
            log.error("Ontology {} rejected: {}", key, e.getMessage());
            throw e.forOntology(key.name());
        }
        if (!ontology.name().equals(key.name())) {
            log.error("Ontology document stored under {} declares name '{}'", key, ontology.name());
            throw new OntologyLoadException(OntologyLoadException.Reason.INVALID, key.name(), null,
                    "Ontology document for '" + key.name() + "' declares name '" + ontology.name() + "'", null);
        }
        if (version != null && !ontology.version().equals(version)) {
            log.error("Ontology document stored under {} declares version '{}'", key, ontology.version());
            throw new OntologyLoadException(OntologyLoadException.Reason.INVALID, key.name(), null,
                    "Ontology document for '" + key.name() + "' version " + version
                            + " declares version '" + ontology.version() + "'", null);
        }
        log.info("Loaded ontology {} v{} ({} constraints, {} extractors) in {}ms",
                ontology.name(), ontology.version(), ontology.constraints().size(),
                ontology.extractors().size(), System.currentTimeMillis() - start);
        return ontology;
    }

    private OntologyLoadException translate(String name, Throwable cause) {
        if (cause instanceof OntologyLoadException ole) {
            return ole.forOntology(name);
        }
        if (cause instanceof StorageUnavailableException sue) {
            return new OntologyLoadException(OntologyLoadException.Reason.UNAVAILABLE, name, null,
                    sue.getMessage(), sue);
        }
        log.error("Unexpected failure loading ontology {}", name, cause);
        return new OntologyLoadException(OntologyLoadException.Reason.UNAVAILABLE, name, null,
                "Ontology '" + name + "' could not be loaded", cause);
    }

    record OntologyKey(String name, String version) {
        @Override
        public String toString() {
            return name + ":" + version;
        }
    }
}
