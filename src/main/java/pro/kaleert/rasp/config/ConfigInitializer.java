package pro.kaleert.rasp.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Puts an external {@code config.yml} in front of the packaged properties.
 * <p>
 * The file is looked up in the working directory unless {@code -Drasp.config=<path>} points elsewhere.
 * When it doesn't exist yet the bundled default is written there, so directories can be changed
 * for the next run without rebuilding.
 */
@Slf4j
public class ConfigInitializer implements ApplicationContextInitializer<ConfigurableApplicationContext> {

    static final String CONFIG_FILENAME = "config.yml";
    static final String CONFIG_LOCATION_PROPERTY = "rasp.config";
    static final String PROPERTY_SOURCE_NAME = "external-yaml-config";

    private final Path configFile;

    public ConfigInitializer() {
        this(resolveDefaultLocation());
    }

    ConfigInitializer(Path configFile) {
        this.configFile = configFile;
    }

    private static Path resolveDefaultLocation() {
        String override = System.getProperty(CONFIG_LOCATION_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Path.of(override);
        }
        return Path.of(System.getProperty("user.dir"), CONFIG_FILENAME);
    }

    @Override
    public void initialize(ConfigurableApplicationContext applicationContext) {
        if (Files.notExists(configFile)) {
            log.warn("Config file '{}' not found, writing the default one", configFile.toAbsolutePath());
            writeDefaultConfig();
        }

        if (Files.isRegularFile(configFile)) {
            addPropertySource(applicationContext);
        }
    }

    private void writeDefaultConfig() {
        try (InputStream stream = getClass().getClassLoader().getResourceAsStream(CONFIG_FILENAME)) {
            if (stream == null) {
                log.error("Default {} not found in classpath, built-in defaults stay in effect", CONFIG_FILENAME);
                return;
            }
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(stream, configFile);
            log.info("Default config created: {}", configFile.toAbsolutePath());
        } catch (IOException e) {
            // not fatal, the packaged defaults still apply
            log.error("Failed to create default config file {}", configFile, e);
        }
    }

    private void addPropertySource(ConfigurableApplicationContext context) {
        try {
            List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                    .load(PROPERTY_SOURCE_NAME, new FileSystemResource(configFile));

            if (!sources.isEmpty()) {
                context.getEnvironment().getPropertySources().addFirst(sources.get(0));
                log.info("Loaded external configuration from {}", configFile.getFileName());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load " + configFile, e);
        }
    }
}
