package com.acks.config;

import com.acks.model.DungeonMap;
import com.acks.model.FightRef;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads map templates, i.e. {@link DungeonMap} JSON documents a DM prepared ahead of play.
 * <p>
 * Templates are read from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:maps/*.json}: maps shipped with the server</li>
 *   <li>External folder: {@code ./maps/} next to the running jar, for the DM's own maps</li>
 * </ol>
 * If an external template has the same {@code id} as a bundled one, the external one wins.
 */
@Component
@Slf4j
public class MapTemplateLoader {

    private final ObjectMapper objectMapper;

    private final Path externalDir;

    @Autowired
    public MapTemplateLoader(ObjectMapper objectMapper) {
        this(objectMapper, Paths.get("maps"));
    }

    MapTemplateLoader(ObjectMapper objectMapper, Path externalDir) {
        this.objectMapper = objectMapper;
        this.externalDir = externalDir;
    }

    /**
     * All readable templates keyed by map id. Unreadable files are logged and skipped.
     */
    public Map<String, DungeonMap> loadTemplates() {
        Map<String, DungeonMap> templates = new LinkedHashMap<>();
        loadClasspathTemplates(templates);
        loadExternalTemplates(templates);
        log.info("Found {} map template(s): {}", templates.size(), List.copyOf(templates.keySet()));
        return templates;
    }

    // ── classpath templates ─────────────────────────────────────────────

    private void loadClasspathTemplates(Map<String, DungeonMap> templates) {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:maps/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    accept(templates, objectMapper.readValue(is, DungeonMap.class), resource.getFilename());
                } catch (IOException | RuntimeException e) {
                    log.error("Failed to load bundled map template: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for map templates: {}", e.getMessage());
        }
    }

    // ── external templates (./maps/ folder) ─────────────────────────────

    private void loadExternalTemplates(Map<String, DungeonMap> templates) {
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external map directory at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(path -> loadExternalFile(templates, path));
        } catch (IOException e) {
            log.error("Error reading external map directory", e);
        }
    }

    private void loadExternalFile(Map<String, DungeonMap> templates, Path path) {
        try {
            accept(templates, objectMapper.readValue(path.toFile(), DungeonMap.class), path.toString());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load map template: {}", path, e);
        }
    }

    private static void accept(Map<String, DungeonMap> templates, DungeonMap map, String source) {
        FightRef.requireValidId("map", map.getId());
        map.setRevision(0);
        if (templates.put(map.getId(), map) != null) {
            log.info("Map template '{}' from {} replaces an earlier one", map.getId(), source);
        } else {
            log.debug("Read map template '{}' ({}) from {}", map.getName(), map.getId(), source);
        }
    }
}
