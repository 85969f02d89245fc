package tech.noetzold.verification_api.ontology;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RemoteOntologySourceTest {

    private static RemoteOntologySource source(ExchangeFunction exchange, long timeoutMs) {
        WebClient client = WebClient.builder()
                .baseUrl("http://ontology-store.test")
                .exchangeFunction(exchange)
                .build();
        return new RemoteOntologySource(client, timeoutMs);
    }

    private static Mono<ClientResponse> respond(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    void fetchesDocumentByKey() {
        AtomicReference<URI> requested = new AtomicReference<>();
        RemoteOntologySource source = source(req -> {
            requested.set(req.url());
            return respond(HttpStatus.OK, "{\"name\":\"m\"}");
        }, 1000);

        assertEquals(Optional.of("{\"name\":\"m\"}"), source.fetch("m", "1.0.0"));
        assertEquals("/m/v1.0.0/ontology.json", requested.get().getPath());
    }

    @Test
    void notFoundIsEmpty() {
        RemoteOntologySource source = source(req -> respond(HttpStatus.NOT_FOUND, ""), 1000);

        assertTrue(source.fetch("m", null).isEmpty());
    }

    @Test
    void serverErrorIsUnavailable() {
        RemoteOntologySource source = source(req -> respond(HttpStatus.INTERNAL_SERVER_ERROR, "boom"), 1000);

        assertThrows(StorageUnavailableException.class, () -> source.fetch("m", null));
    }

    @Test
    void slowStoreIsUnavailable() {
        RemoteOntologySource source = source(req -> respond(HttpStatus.OK, "{}").delayElement(Duration.ofSeconds(2)), 50);

        assertThrows(StorageUnavailableException.class, () -> source.fetch("m", null));
    }

    @Test
    void listsNamesFromStoreIndex() {
        AtomicReference<URI> requested = new AtomicReference<>();
        RemoteOntologySource source = source(req -> {
            requested.set(req.url());
            return respond(HttpStatus.OK, "[\"b-rules\",\"a-rules\",\"b-rules\"]");
        }, 1000);

        assertEquals(List.of("a-rules", "b-rules"), source.list());
        assertEquals("/index.json", requested.get().getPath());
    }

    @Test
    void missingIndexListsNothing() {
        RemoteOntologySource source = source(req -> respond(HttpStatus.NOT_FOUND, ""), 1000);

        assertTrue(source.list().isEmpty());
    }
}
