package com.evcharge.anomaly.repository;

import com.evcharge.anomaly.engine.scoring.ScorerArtifact;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads pre-fit scorer artifacts (JSON) from a Spring resource location,
 * "classpath:models/..." by default or "file:..." for an external model.
 */
@Repository
public class ScorerArtifactRepository {

    private static final Logger log = LoggerFactory.getLogger(ScorerArtifactRepository.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    // Artifacts already read, by location
    private final Map<String, ScorerArtifact> artifactCache = new ConcurrentHashMap<>();

    public ScorerArtifactRepository(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @return the parsed artifact, or null if the location is missing or does not hold a readable artifact
     */
    public ScorerArtifact load(String location) {
        if (location == null || location.isBlank()) {
            log.error("No scorer artifact location configured");
            return null;
        }

        ScorerArtifact cached = artifactCache.get(location);
        if (cached != null) return cached;

        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("Scorer artifact not found at {}", location);
            return null;
        }

        try (InputStream in = resource.getInputStream()) {
            ScorerArtifact artifact = objectMapper.readValue(in, ScorerArtifact.class);
            artifactCache.put(location, artifact);
            log.info("Read scorer artifact {} v{} from {}", artifact.getId(), artifact.getVersion(), location);
            return artifact;
        } catch (IOException e) {
            log.error("Failed to read scorer artifact from {}", location, e);
            return null;
        }
    }
}
