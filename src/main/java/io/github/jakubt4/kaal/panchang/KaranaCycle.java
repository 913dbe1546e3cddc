package io.github.jakubt4.kaal.panchang;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Mapping of the 60 half-tithi slots of a lunar month onto karana names.
 *
 * <p>The layout is data: {@code leading} fixed karanas, then the movable group
 * repeated until the trailing fixed karanas close the month. Traditional layout
 * is Kimstughna, eight rounds of Bava..Vishti, then Shakuni, Chatushpada, Naga.
 */
@Slf4j
public final class KaranaCycle {

    public static final String DEFAULT_RESOURCE = "panchang/karana-cycle.json";

    private final String version;
    private final Karana[] slots;

    private KaranaCycle(final String version, final Karana[] slots) {
        this.version = version;
        this.slots = slots;
    }

    record Document(String version, List<Karana> leading, List<Karana> repeating, List<Karana> trailing) {
    }

    public static KaranaCycle load(final ObjectMapper objectMapper, final String resource) {
        final var url = KaranaCycle.class.getClassLoader().getResource(resource);
        if (url == null) {
            throw new IllegalStateException(resource + " not found on classpath");
        }
        try (var in = url.openStream()) {
            return of(objectMapper.readValue(in, Document.class));
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read karana cycle from " + resource, e);
        }
    }

    static KaranaCycle of(final Document document) {
        final var leading = orEmpty(document.leading());
        final var trailing = orEmpty(document.trailing());
        final var repeating = orEmpty(document.repeating());
        final var free = Karana.SLOTS - leading.size() - trailing.size();
        if (repeating.isEmpty() || free <= 0 || free % repeating.size() != 0) {
            throw new IllegalStateException("Karana cycle does not fill " + Karana.SLOTS + " slots: leading="
                    + leading.size() + ", repeating=" + repeating.size() + ", trailing=" + trailing.size());
        }
        final var all = new ArrayList<Karana>(Karana.SLOTS);
        all.addAll(leading);
        for (var i = 0; i < free; i++) {
            all.add(repeating.get(i % repeating.size()));
        }
        all.addAll(trailing);
        log.info("Karana cycle loaded — version={}, movable rounds={}", document.version(), free / repeating.size());
        return new KaranaCycle(document.version(), all.toArray(new Karana[0]));
    }

    /**
     * @param slot half-tithi index, 0..59
     */
    public Karana at(final int slot) {
        return slots[Math.floorMod(slot, Karana.SLOTS)];
    }

    public String version() {
        return version;
    }

    private static List<Karana> orEmpty(final List<Karana> list) {
        return list == null ? List.of() : list;
    }
}
