package com.labyrinth.config;

import java.util.List;

/**
 * Layout of a playable labyrinth, loaded from a JSON file.
 * Coordinates are {@code [row, column]} pairs.
 *
 * @param id          unique slug, e.g. "classic"
 * @param name        human-readable name
 * @param grid        terrain rows, top to bottom; 0 wall, 1 floor, 2 special floor
 * @param start       cell every new hero starts on
 * @param key         where the key lies at the start of a game
 * @param hearts      healing stations
 * @param golem       the guarded exit
 * @param hazardCount how many floor cells catch fire each round
 */
public record LabyrinthDefinition(
        String id,
        String name,
        List<List<Integer>> grid,
        List<Integer> start,
        List<Integer> key,
        List<List<Integer>> hearts,
        List<Integer> golem,
        int hazardCount
) {}
