package io.tapdb.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads template configuration files.
 *
 * <p>Layout: {@code <configDir>/<category>/*.json}, plus JSON files directly in
 * {@code configDir}. Directories whose name starts with {@code _} are skipped.
 * Unparseable files are returned with their parse error rather than thrown.
 */
public class TemplateConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(TemplateConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public List<TemplateDocument> loadDirectory(Path configDir) {
        if (!Files.isDirectory(configDir)) {
            throw new TemplateConfigException("Template config directory not found: " + configDir, null);
        }
        List<TemplateDocument> documents = new ArrayList<>();
        for (Path entry : sortedEntries(configDir)) {
            if (Files.isDirectory(entry)) {
                if (entry.getFileName().toString().startsWith("_")) {
                    log.debug("Skipping config directory {}", entry);
                    continue;
                }
                for (Path file : sortedEntries(entry)) {
                    if (isJsonFile(file)) {
                        documents.add(loadFile(configDir, file));
                    }
                }
            } else if (isJsonFile(entry)) {
                documents.add(loadFile(configDir, entry));
            }
        }
        log.info("Loaded {} template config file(s) from {}", documents.size(), configDir);
        return documents;
    }

    public TemplateDocument loadFile(Path file) {
        return loadFile(file.getParent() == null ? file : file.getParent(), file);
    }

    /** Parse already-read JSON text, e.g. from a classpath resource. */
    public TemplateDocument parse(String sourceFile, String json) {
        try {
            return TemplateDocument.parsed(sourceFile, MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("Config file {} is not valid JSON: {}", sourceFile, e.getOriginalMessage());
            return TemplateDocument.unparseable(sourceFile, e.getOriginalMessage());
        }
    }

    private TemplateDocument loadFile(Path root, Path file) {
        String sourceFile = root.relativize(file).toString().replace('\\', '/');
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            log.error("Failed to read config file {}", file, e);
            throw new TemplateConfigException("Failed to read config file " + file, e);
        }
        return parse(sourceFile, json);
    }

    private static boolean isJsonFile(Path path) {
        return Files.isRegularFile(path) && path.getFileName().toString().endsWith(".json");
    }

    private static List<Path> sortedEntries(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to list config directory {}", dir, e);
            throw new TemplateConfigException("Failed to list config directory " + dir, e);
        }
    }
}
