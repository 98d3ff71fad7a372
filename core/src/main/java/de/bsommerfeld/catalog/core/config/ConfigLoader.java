package de.bsommerfeld.catalog.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link CatalogConfig} from a TOML file. A missing file is created
 * with the defaults so operators have a template to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    public static CatalogConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, writing defaults", path.toAbsolutePath());
            CatalogConfig defaults = new CatalogConfig();
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(path.toFile(), defaults);
            return defaults;
        }
        LOG.info("Loading configuration from {}", path.toAbsolutePath());
        return MAPPER.readValue(path.toFile(), CatalogConfig.class);
    }
}
