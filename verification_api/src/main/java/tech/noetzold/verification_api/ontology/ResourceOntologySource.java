package tech.noetzold.verification_api.ontology;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Reads documents from any Spring resource location ({@code classpath:}, {@code file:}, ...)
 * using the {@code {name}/latest/ontology.json} and {@code {name}/v{version}/ontology.json} layout.
 */
@Slf4j
public class ResourceOntologySource implements OntologySource {

    private final ResourceLoader resourceLoader;
    private final String location;

    public ResourceOntologySource(ResourceLoader resourceLoader, String location) {
        this.resourceLoader = resourceLoader;
        this.location = location.endsWith("/") ? location : location + "/";
    }

    @Override
    public Optional<String> fetch(String name, String version) {
        if (!safeSegment(name) || (version != null && !version.isBlank() && !safeSegment(version))) {
            return Optional.empty();
        }
        Resource resource = resourceLoader.getResource(location + OntologySource.key(name, version));
        if (!resource.exists()) {
            log.debug("No ontology document at {}", resource.getDescription());
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot read " + resource.getDescription(), e);
        }
    }

    @Override
    public List<String> list() {
        ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver(resourceLoader);
        // classpath* so documents spread over several classpath roots are all seen
        String root = location.startsWith("classpath:")
                ? "classpath*:" + location.substring("classpath:".length())
                : location;
        String suffix = "/latest/ontology.json";
        try {
            TreeSet<String> names = new TreeSet<>();
            for (Resource r : resolver.getResources(root + "*" + suffix)) {
                String uri = r.getURI().toString();
                if (!uri.endsWith(suffix)) continue;
                String dir = uri.substring(0, uri.length() - suffix.length());
                names.add(dir.substring(dir.lastIndexOf('/') + 1));
            }
            return new ArrayList<>(names);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot list ontologies under " + location, e);
        }
    }

    private static boolean safeSegment(String s) {
        return s != null && !s.isBlank() && !s.contains("..") && !s.contains("/") && !s.contains("\\");
    }
}
