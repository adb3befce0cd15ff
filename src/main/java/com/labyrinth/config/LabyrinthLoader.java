package com.labyrinth.config;

import com.labyrinth.model.Coordinate;
import com.labyrinth.model.GridMap;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads all available labyrinth layouts at startup.
 * <p>
 * Layouts are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:labyrinths/*.json} – built-in layouts</li>
 *   <li>External folder: {@code ./labyrinths/} next to the running jar – custom layouts</li>
 * </ol>
 * If a custom layout has the same {@code id} as a built-in one, the custom one wins.
 * Layouts that fail validation are logged and skipped.
 */
@Component
@Slf4j
public class LabyrinthLoader {

    static final String EXTERNAL_DIR = "labyrinths";

    private final ObjectMapper objectMapper;

    /** All loaded layouts keyed by their id. */
    @Getter
    private final Map<String, LabyrinthDefinition> layouts = new LinkedHashMap<>();

    public LabyrinthLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadLayouts() {
        loadClasspathLayouts();
        loadExternalLayouts();

        if (layouts.isEmpty()) {
            log.warn("No labyrinth layouts found! A game cannot start without at least one layout.");
        } else {
            log.info("Loaded {} labyrinth layout(s): {}", layouts.size(), layouts.keySet());
        }
    }

    /**
     * Get a specific layout by its id.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public LabyrinthDefinition getLayout(String layoutId) {
        LabyrinthDefinition layout = layouts.get(layoutId);
        if (layout == null) {
            throw new IllegalArgumentException("Unknown labyrinth layout: " + layoutId
                    + ". Available layouts: " + layouts.keySet());
        }
        return layout;
    }

    /**
     * Check that a layout is playable: a rectangular grid of known codes, special cells
     * on passable terrain and enough floor for the hazards.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    static void validate(LabyrinthDefinition layout) {
        if (layout.id() == null || layout.id().isBlank()) {
            throw new IllegalArgumentException("Layout has no id");
        }
        GridMap grid = GridMap.fromRows(layout.grid());
        requirePassable(grid, layout.start(), "start");
        requirePassable(grid, layout.key(), "key");
        requirePassable(grid, layout.golem(), "golem");
        if (layout.hearts() != null) {
            layout.hearts().forEach(heart -> requirePassable(grid, heart, "heart"));
        }
        if (layout.hazardCount() < 0) {
            throw new IllegalArgumentException("Hazard count must not be negative");
        }
        int floor = grid.floorCells().size();
        if (floor < layout.hazardCount()) {
            throw new IllegalArgumentException("Layout '" + layout.id() + "' has " + floor
                    + " floor cells, fewer than its " + layout.hazardCount() + " hazards");
        }
    }

    private static void requirePassable(GridMap grid, List<Integer> pair, String what) {
        Coordinate cell = Coordinate.fromPair(pair);
        if (!grid.isPassable(cell)) {
            throw new IllegalArgumentException("The " + what + " cell " + cell + " is not passable");
        }
    }

    // ── classpath layouts ───────────────────────────────────────────────

    private void loadClasspathLayouts() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:labyrinths/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    register(objectMapper.readValue(is, LabyrinthDefinition.class), resource.getFilename());
                } catch (IOException | JacksonException | IllegalArgumentException e) {
                    log.error("Failed to load classpath layout: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for labyrinth layouts: {}", e.getMessage());
        }
    }

    // ── external layouts (./labyrinths/ folder) ─────────────────────────

    private void loadExternalLayouts() {
        Path externalDir = Paths.get(EXTERNAL_DIR);
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external layouts directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalLayoutFile);
        } catch (IOException e) {
            log.error("Error reading external layouts directory", e);
        }
    }

    void loadExternalLayoutFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            register(objectMapper.readValue(is, LabyrinthDefinition.class), path.toString());
        } catch (IOException | JacksonException | IllegalArgumentException e) {
            log.error("Failed to load custom layout: {}", path, e);
        }
    }

    private void register(LabyrinthDefinition layout, String source) {
        validate(layout);
        layouts.put(layout.id(), layout);
        log.info("Loaded labyrinth '{}' ({}) from {}", layout.name(), layout.id(), source);
    }
}
