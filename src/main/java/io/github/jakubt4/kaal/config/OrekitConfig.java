package io.github.jakubt4.kaal.config;

import io.github.jakubt4.kaal.error.EphemerisUnavailableException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataContext;
import org.orekit.data.DataProvider;
import org.orekit.data.DirectoryCrawler;
import org.orekit.data.ZipJarCrawler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Registers the Orekit data set (JPL ephemerides, Earth orientation parameters,
 * leap seconds) with Orekit's {@link DataContext}.
 *
 * <p>{@code kaal.ephemeris.orekit-data} names either a directory or a zip archive
 * on the file system, or a zip archive on the classpath; it defaults to
 * {@code orekit-data.zip} on the classpath. Only active when the Orekit
 * ephemeris provider is selected. Beans that call Orekit inject this
 * configuration to guarantee ordering.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "kaal.ephemeris.provider", havingValue = "orekit")
public class OrekitConfig {

    public static final String DEFAULT_DATA = "orekit-data.zip";

    private final String dataLocation;

    public OrekitConfig(@Value("${kaal.ephemeris.orekit-data:" + DEFAULT_DATA + "}") final String dataLocation) {
        this.dataLocation = dataLocation;
    }

    /**
     * @throws EphemerisUnavailableException if the data set cannot be found
     */
    @PostConstruct
    public void init() {
        final var provider = crawlerFor(dataLocation).orElseThrow(() -> new EphemerisUnavailableException(
                "Orekit data not found on the file system or classpath",
                Map.of("location", dataLocation, "provider", "orekit")));
        final var manager = DataContext.getDefault().getDataProvidersManager();
        if (manager.getProviders().isEmpty()) {
            manager.addProvider(provider);
            log.info("Orekit data registered from {}", dataLocation);
        } else {
            log.debug("Orekit data already registered, ignoring {}", dataLocation);
        }
    }

    /**
     * Crawler for a directory or zip on the file system, else for a zip on the
     * classpath.
     */
    public static Optional<DataProvider> crawlerFor(final String location) {
        final var path = Path.of(location);
        if (Files.isDirectory(path)) {
            return Optional.of(new DirectoryCrawler(path.toFile()));
        }
        if (Files.isRegularFile(path)) {
            return Optional.of(new ZipJarCrawler(path.toFile()));
        }
        final var resource = OrekitConfig.class.getClassLoader().getResource(location);
        return resource == null ? Optional.empty() : Optional.of(new ZipJarCrawler(resource));
    }
}
