package io.github.jakubt4.kaal.config;

import io.github.jakubt4.kaal.error.EphemerisUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.orekit.data.DirectoryCrawler;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrekitConfigTest {

    @Test
    void directoryOnDiskIsCrawled(@TempDir final Path data) {
        assertThat(OrekitConfig.crawlerFor(data.toString())).containsInstanceOf(DirectoryCrawler.class);
    }

    @Test
    void unknownLocationHasNoCrawler() {
        assertThat(OrekitConfig.crawlerFor("no-such-orekit-data.zip")).isEmpty();
    }

    @Test
    void missingDataFailsStartUp() {
        final var config = new OrekitConfig("no-such-orekit-data.zip");

        assertThatThrownBy(config::init)
                .isInstanceOf(EphemerisUnavailableException.class)
                .satisfies(e -> assertThat(((EphemerisUnavailableException) e).context())
                        .containsEntry("location", "no-such-orekit-data.zip"));
    }
}
