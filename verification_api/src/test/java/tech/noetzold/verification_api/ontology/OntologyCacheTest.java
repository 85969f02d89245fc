package tech.noetzold.verification_api.ontology;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import tech.noetzold.verification_api.TestOntologies;
import tech.noetzold.verification_api.model.Ontology;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OntologyCacheTest {

    private final OntologyParser parser = new OntologyParser(new ObjectMapper());
    private final ExecutorService loadPool = Executors.newFixedThreadPool(4);
    private final String fixture = TestOntologies.document("pricing-fixture");

    @AfterEach
    void tearDown() {
        loadPool.shutdownNow();
    }

    private OntologyCache cache(OntologySource source, long timeoutMs) {
        return new OntologyCache(source, parser, loadPool, timeoutMs);
    }

    @Test
    void concurrentFirstRequestsShareOneLoad() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        OntologyCache cache = cache((name, version) -> {
            fetches.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.of(fixture);
        }, 5000);

        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<Ontology>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(callers.submit(() -> cache.get("pricing-fixture", null)));
            }
            Thread.sleep(100);
            release.countDown();

            Ontology first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Ontology> f : results) {
                assertSame(first, f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            callers.shutdownNow();
        }
        assertEquals(1, fetches.get());
        assertEquals(1, cache.size());
    }

    @Test
    void loadedOntologyIsReused() {
        AtomicInteger fetches = new AtomicInteger();
        OntologyCache cache = cache((name, version) -> {
            fetches.incrementAndGet();
            return Optional.of(fixture);
        }, 1000);

        Ontology a = cache.get("pricing-fixture", null);
        Ontology b = cache.get("pricing-fixture", "");

        assertSame(a, b);
        assertEquals(1, fetches.get());
    }

    @Test
    void failedLoadIsNotCached() {
        AtomicInteger fetches = new AtomicInteger();
        OntologyCache cache = cache((name, version) -> {
            if (fetches.incrementAndGet() == 1) {
                throw new StorageUnavailableException("store down", null);
            }
            return Optional.of(fixture);
        }, 1000);

        OntologyLoadException ex = assertThrows(OntologyLoadException.class, () -> cache.get("pricing-fixture", null));
        assertEquals(OntologyLoadException.Reason.UNAVAILABLE, ex.getReason());
        assertEquals(0, cache.size());

        assertEquals("pricing-fixture", cache.get("pricing-fixture", null).name());
        assertEquals(2, fetches.get());
    }

    @Test
    void slowStoreTimesOut() {
        CountDownLatch never = new CountDownLatch(1);
        OntologyCache cache = cache((name, version) -> {
            try {
                never.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.of(fixture);
        }, 50);

        OntologyLoadException ex = assertThrows(OntologyLoadException.class, () -> cache.get("pricing-fixture", null));
        assertEquals(OntologyLoadException.Reason.TIMEOUT, ex.getReason());
        never.countDown();
    }

    @Test
    void absentDocumentIsNotFound() {
        OntologyCache cache = cache((name, version) -> Optional.empty(), 1000);

        OntologyLoadException ex = assertThrows(OntologyLoadException.class, () -> cache.get("nothing-here", "2.0"));
        assertEquals(OntologyLoadException.Reason.NOT_FOUND, ex.getReason());
        assertEquals("nothing-here", ex.getOntologyName());
    }

    @Test
    void invalidDocumentCarriesOntologyName() {
        OntologyCache cache = cache((name, version) -> Optional.of("{\"version\":\"1\"}"), 1000);

        OntologyLoadException ex = assertThrows(OntologyLoadException.class, () -> cache.get("broken", null));
        assertEquals(OntologyLoadException.Reason.INVALID, ex.getReason());
        assertEquals("broken", ex.getOntologyName());
    }

    @Test
    void unsafeNameIsRejectedWithoutFetching() {
        AtomicInteger fetches = new AtomicInteger();
        OntologyCache cache = cache((name, version) -> {
            fetches.incrementAndGet();
            return Optional.empty();
        }, 1000);

        assertThrows(OntologyLoadException.class, () -> cache.get("../secrets", null));
        assertEquals(0, fetches.get());
    }

    @Test
    void unsafeVersionIsRejectedWithoutFetching() {
        AtomicInteger fetches = new AtomicInteger();
        OntologyCache cache = cache((name, version) -> {
            fetches.incrementAndGet();
            return Optional.of(fixture);
        }, 1000);

        OntologyLoadException ex = assertThrows(OntologyLoadException.class,
                () -> cache.get("pricing-fixture", "0.9.0/../../mortgage-compliance-v1/latest"));
        assertEquals(OntologyLoadException.Reason.NOT_FOUND, ex.getReason());
        for (int i = 0; i < 20; i++) {
            String alias = "1.0.0/./" + i;
            assertThrows(OntologyLoadException.class, () -> cache.get("pricing-fixture", alias));
        }
        assertThrows(OntologyLoadException.class, () -> cache.get("pricing-fixture", ".."));
        assertEquals(0, fetches.get());
        assertEquals(0, cache.size());
    }

    @Test
    void documentDeclaringAnotherNameIsInvalid() {
        OntologyCache cache = cache((name, version) -> Optional.of(fixture), 1000);

        OntologyLoadException ex = assertThrows(OntologyLoadException.class, () -> cache.get("mortgage-compliance-v1", null));
        assertEquals(OntologyLoadException.Reason.INVALID, ex.getReason());
        assertEquals("mortgage-compliance-v1", ex.getOntologyName());
        assertEquals(0, cache.size());
    }

    @Test
    void pinnedDocumentDeclaringAnotherVersionIsInvalid() {
        OntologyCache cache = cache((name, version) -> Optional.of(fixture), 1000);

        OntologyLoadException ex = assertThrows(OntologyLoadException.class, () -> cache.get("pricing-fixture", "2.0.0"));
        assertEquals(OntologyLoadException.Reason.INVALID, ex.getReason());
        assertEquals("1.0.0", cache.get("pricing-fixture", "1.0.0").version());
    }

    @Test
    void versionsAreCachedSeparately() {
        OntologyCache cache = cache(new ResourceOntologySource(new DefaultResourceLoader(), "classpath:ontologies"), 2000);

        assertEquals("1.0.0", cache.get("pricing-fixture", null).version());
        assertEquals("0.9.0", cache.get("pricing-fixture", "0.9.0").version());
        assertEquals(2, cache.size());
    }
}
