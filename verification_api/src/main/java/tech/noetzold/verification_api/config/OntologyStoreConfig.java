package tech.noetzold.verification_api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.verification_api.ontology.OntologySource;
import tech.noetzold.verification_api.ontology.RemoteOntologySource;
import tech.noetzold.verification_api.ontology.ResourceOntologySource;

@Slf4j
@Configuration
public class OntologyStoreConfig {

    @Bean
    public OntologySource ontologySource(ResourceLoader resourceLoader,
                                         @Value("${verification.ontology.location:classpath:ontologies/}") String location,
                                         @Value("${verification.ontology.remote-url:}") String remoteUrl,
                                         @Value("${verification.ontology.load-timeout-ms:2000}") long timeoutMs) {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            log.info("Serving ontologies from {}", location);
            return new ResourceOntologySource(resourceLoader, location);
        }
        log.info("Serving ontologies from remote store {}", remoteUrl);
        WebClient webClient = WebClient.builder()
                .baseUrl(remoteUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        return new RemoteOntologySource(webClient, timeoutMs);
    }
}
