package me.christianrobert.trigconv.translator.mapping;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.trigconv.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads the mapping tables from {@code mappings/*.csv} on the classpath, or from the directory
 * named by {@code mapping.directory} when that is configured.
 *
 * <p>Tables are loaded once per source location and cached; changing {@code mapping.directory}
 * makes the next call reload. A file that is missing or unreadable yields an empty table, which
 * the translator reports as an identity mapping.</p>
 */
@ApplicationScoped
public class ClasspathMappingTableProvider implements MappingTableProvider {

    private static final Logger log = LoggerFactory.getLogger(ClasspathMappingTableProvider.class);

    static final String CLASSPATH_PREFIX = "mappings/";

    @Inject
    ConfigService configService;

    private volatile CachedTables cached;

    public ClasspathMappingTableProvider() {
    }

    public ClasspathMappingTableProvider(ConfigService configService) {
        this.configService = configService;
    }

    @Override
    public MappingTables getTables() {
        String directory = configService != null ? configService.getConfigValueAsString(ConfigService.MAPPING_DIRECTORY) : null;
        String location = directory == null || directory.trim().isEmpty() ? null : directory.trim();

        CachedTables current = cached;
        if (current != null && Objects.equals(current.location, location)) {
            return current.tables;
        }

        MappingTables tables = new MappingTables(
                load(MappingTables.FUNCTIONS, location),
                load(MappingTables.TYPES, location),
                load(MappingTables.EXCEPTIONS, location));
        log.info("Loaded mapping tables from {}: {}", location == null ? "classpath" : location, tables);
        cached = new CachedTables(location, tables);
        return tables;
    }

    private MappingTable load(String tableName, String directory) {
        String fileName = tableName + ".csv";
        try {
            if (directory != null) {
                Path path = Path.of(directory, fileName);
                if (!Files.isRegularFile(path)) {
                    log.warn("Mapping file {} not found, using an empty table", path);
                    return MappingTable.empty(tableName);
                }
                try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                    return CsvMappingTableLoader.load(tableName, reader);
                }
            }

            InputStream stream = Thread.currentThread().getContextClassLoader()
                    .getResourceAsStream(CLASSPATH_PREFIX + fileName);
            if (stream == null) {
                log.warn("Mapping resource {}{} not found, using an empty table", CLASSPATH_PREFIX, fileName);
                return MappingTable.empty(tableName);
            }
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                return CsvMappingTableLoader.load(tableName, reader);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to read mapping table {}, using an empty table: {}", tableName, e.getMessage());
            return MappingTable.empty(tableName);
        }
    }

    private static class CachedTables {
        private final String location;
        private final MappingTables tables;

        CachedTables(String location, MappingTables tables) {
            this.location = location;
            this.tables = tables;
        }
    }
}
