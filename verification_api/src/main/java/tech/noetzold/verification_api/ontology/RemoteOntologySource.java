package tech.noetzold.verification_api.ontology;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Fetches ontology documents from an HTTP object store. The store lists its ontologies in an
 * {@code index.json} array of names at its root.
 */
@Slf4j
public class RemoteOntologySource implements OntologySource {

    static final String INDEX = "index.json";
    private static final ParameterizedTypeReference<List<String>> NAMES = new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final Duration timeout;

    public RemoteOntologySource(WebClient webClient, long timeoutMs) {
        this.webClient = webClient;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Optional<String> fetch(String name, String version) {
        String key = OntologySource.key(name, version);
        try {
            return webClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/" + key).build())
                    .<Optional<String>>exchangeToMono(resp -> {
                        if (resp.statusCode().is2xxSuccessful()) {
                            return resp.bodyToMono(String.class).map(Optional::of);
                        } else if (resp.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return Mono.just(Optional.<String>empty());
                        }
                        return resp.createException().flatMap(ex -> Mono.<Optional<String>>error(ex));
                    })
                    .timeout(timeout)
                    .blockOptional()
                    .flatMap(o -> o);
        } catch (Exception e) {
            log.warn("Ontology store error for {}: {}", key, e.getMessage());
            throw new StorageUnavailableException("Ontology store unavailable for " + key, e);
        }
    }

    @Override
    public List<String> list() {
        try {
            List<String> names = webClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/" + INDEX).build())
                    .<List<String>>exchangeToMono(resp -> {
                        if (resp.statusCode().is2xxSuccessful()) {
                            return resp.bodyToMono(NAMES);
                        } else if (resp.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return Mono.just(List.<String>of());
                        }
                        return resp.createException().flatMap(ex -> Mono.<List<String>>error(ex));
                    })
                    .timeout(timeout)
                    .blockOptional()
                    .orElse(List.of());
            return names.stream().distinct().sorted().toList();
        } catch (Exception e) {
            log.warn("Ontology store error listing {}: {}", INDEX, e.getMessage());
            throw new StorageUnavailableException("Ontology store unavailable for " + INDEX, e);
        }
    }
}
