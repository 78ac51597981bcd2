package com.ddosshield.core.scoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link ModelArtifact} JSON documents from the file system or the
 * classpath ({@code classpath:} prefix).
 */
public final class ArtifactLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactLoader.class);

    static final String CLASSPATH_PREFIX = "classpath:";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ArtifactLoader() {
    }

    /**
     * @param location file path or {@code classpath:} resource
     * @return parsed artifact
     * @throws IllegalArgumentException if the artifact does not exist
     * @throws IllegalStateException    if it cannot be read or parsed
     */
    public static ModelArtifact load(String location) {
        Objects.requireNonNull(location, "Artifact location must not be null");
        ModelArtifact artifact;
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            InputStream is = ArtifactLoader.class.getClassLoader().getResourceAsStream(resource);
            if (is == null) {
                throw new IllegalArgumentException("Model artifact not found on classpath: " + resource);
            }
            try (is) {
                artifact = MAPPER.readValue(is, ModelArtifact.class);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Malformed model artifact: " + location, e);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read model artifact: " + location, e);
            }
        } else {
            try (InputStream is = Files.newInputStream(Path.of(location))) {
                artifact = MAPPER.readValue(is, ModelArtifact.class);
            } catch (NoSuchFileException e) {
                throw new IllegalArgumentException("Model artifact not found: " + location, e);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Malformed model artifact: " + location, e);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read model artifact: " + location, e);
            }
        }
        LOG.debug("Loaded {} from {}", artifact, location);
        return artifact;
    }
}
