package tech.noetzold.verification_api.ontology;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceOntologySourceTest {

    private final ResourceOntologySource source =
            new ResourceOntologySource(new DefaultResourceLoader(), "classpath:ontologies/");

    @Test
    void readsLatestAndPinnedVersions() {
        assertTrue(source.fetch("pricing-fixture", null).orElseThrow().contains("\"1.0.0\""));
        assertTrue(source.fetch("pricing-fixture", "0.9.0").orElseThrow().contains("\"0.9.0\""));
    }

    @Test
    void unknownNameOrVersionIsEmpty() {
        assertTrue(source.fetch("no-such-ontology", null).isEmpty());
        assertTrue(source.fetch("pricing-fixture", "7.7.7").isEmpty());
    }

    @Test
    void pathTraversalIsEmpty() {
        assertTrue(source.fetch("../application.properties", null).isEmpty());
        assertTrue(source.fetch("pricing-fixture", "0.9.0/../../pricing-fixture/latest").isEmpty());
    }

    @Test
    void keyLayout() {
        assertEquals("m/latest/ontology.json", OntologySource.key("m", null));
        assertEquals("m/v1.2/ontology.json", OntologySource.key("m", "1.2"));
    }

    @Test
    void listsEveryOntologyWithALatestDocument() {
        List<String> names = source.list();

        assertTrue(names.containsAll(List.of("customer-service-v1", "medical-safety-v1",
                "mortgage-compliance-v1", "pricing-fixture")), names.toString());
        assertEquals(names.stream().sorted().toList(), names);
    }
}
