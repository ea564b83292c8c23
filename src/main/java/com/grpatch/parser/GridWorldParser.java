package com.grpatch.parser;

import com.grpatch.gridworld.Cell;
import com.grpatch.gridworld.GridWorld;
import com.grpatch.gridworld.MovingObstacleGridWorld;

/**
 * Reads grid descriptions. Lines starting with {@code #} and blank lines before the size line are
 * ignored. The size line holds the number of rows and columns; each following line describes one
 * row, using {@code ' '} (empty), {@code '*'} (wall), {@code 'I'} (possible initial cell) and
 * {@code 'G'} (goal). Characters beyond the column count are ignored, missing rows are empty and
 * lines after the last row are ignored.
 */
public final class GridWorldParser {
    private GridWorldParser() {
    }

    public static GridWorld parse(String description, String prefix) {
        return parse(description, prefix, false);
    }

    /** Also accepts {@code 'E'}, the center of a troll region with radius 1. */
    public static MovingObstacleGridWorld parseWithTrolls(String description, String prefix) {
        return (MovingObstacleGridWorld) parse(description, prefix, true);
    }

    private static GridWorld parse(String description, String prefix, boolean trolls) {
        GridWorld world = null;
        int row = -1;
        for (String line : description.split("\\R", -1)) {
            if (world == null) {
                String stripped = line.strip();
                if (stripped.isEmpty() || stripped.startsWith("#")) {
                    continue;
                }
                String[] size = stripped.split("\\s+");
                if (size.length < 2) {
                    throw new IllegalArgumentException("Malformed grid size line '%s'".formatted(line));
                }
                int rows = ParseUtil.parseInt(size[0], "grid size");
                int cols = ParseUtil.parseInt(size[1], "grid size");
                if (rows <= 0 || cols <= 0) {
                    throw new IllegalArgumentException("Invalid grid size %dx%d".formatted(rows, cols));
                }
                world = trolls ? new MovingObstacleGridWorld(rows, cols, prefix) : new GridWorld(rows, cols, prefix);
                row = 0;
                continue;
            }
            if (row >= world.rows()) {
                break;
            }
            for (int j = 0; j < Math.min(line.length(), world.cols()); j++) {
                Cell cell = Cell.of(row, j);
                char symbol = line.charAt(j);
                switch (symbol) {
                    case ' ' -> world.setEmpty(cell);
                    case '*' -> world.setOccupied(cell);
                    case 'I' -> world.addInit(cell);
                    case 'G' -> world.addGoal(cell);
                    case 'E' -> {
                        if (!trolls) {
                            throw new IllegalArgumentException("Unrecognized row symbol 'E' in row %d".formatted(row));
                        }
                        ((MovingObstacleGridWorld) world).addTroll(new MovingObstacleGridWorld.Troll(cell, 1));
                    }
                    default -> throw new IllegalArgumentException(
                        "Unrecognized row symbol '%s' in row %d".formatted(symbol, row));
                }
            }
            row++;
        }
        if (world == null) {
            throw new IllegalArgumentException("Malformed grid description: missing size line");
        }
        return world;
    }
}
