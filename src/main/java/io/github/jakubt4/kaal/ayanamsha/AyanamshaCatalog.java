package io.github.jakubt4.kaal.ayanamsha;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reference constants for every {@link AyanamshaSystem}, read from a JSON
 * document so the numbers can be swapped without touching code.
 *
 * <p>Unknown system keys fail deserialisation; a missing system fails
 * {@link #load}. Both happen at start-up, never at lookup time.
 */
@Slf4j
public final class AyanamshaCatalog {

    public static final String DEFAULT_RESOURCE = "ayanamsha/systems.json";

    private final String version;
    private final Map<AyanamshaSystem, AyanamshaModel> models;

    private AyanamshaCatalog(final String version, final Map<AyanamshaSystem, AyanamshaModel> models) {
        this.version = version;
        this.models = Collections.unmodifiableMap(models);
    }

    record Document(String version, Map<AyanamshaSystem, AyanamshaModel> systems) {
    }

    public static AyanamshaCatalog load(final ObjectMapper objectMapper, final String resource) {
        final var url = AyanamshaCatalog.class.getClassLoader().getResource(resource);
        if (url == null) {
            throw new IllegalStateException(resource + " not found on classpath");
        }
        try (var in = url.openStream()) {
            return of(objectMapper.readValue(in, Document.class));
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read ayanamsha constants from " + resource, e);
        }
    }

    static AyanamshaCatalog of(final Document document) {
        if (document.systems() == null) {
            throw new IllegalStateException("Ayanamsha document has no systems");
        }
        final var models = new EnumMap<AyanamshaSystem, AyanamshaModel>(AyanamshaSystem.class);
        for (final var system : AyanamshaSystem.values()) {
            final var model = document.systems().get(system);
            if (model == null) {
                throw new IllegalStateException("No ayanamsha constants for " + system);
            }
            models.put(system, model);
        }
        log.info("Ayanamsha constants loaded — version={}, systems={}", document.version(), models.size());
        return new AyanamshaCatalog(document.version(), models);
    }

    public AyanamshaModel model(final AyanamshaSystem system) {
        return models.get(system);
    }

    public String version() {
        return version;
    }
}
