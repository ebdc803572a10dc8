package com.overflowgrid.simulation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plain text grids: one row per line, cells separated by whitespace.
 * Blank lines and lines starting with {@code #} are skipped.
 */
public final class GridTextFormat {

    private GridTextFormat() {
    }

    public static Grid load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            return read(reader);
        }
    }

    public static Grid parse(String text) {
        Objects.requireNonNull(text, "text");
        try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
            return read(reader);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read grid text", ex);
        }
    }

    public static String format(Grid grid) {
        Objects.requireNonNull(grid, "grid");
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < grid.rows(); row++) {
            if (row > 0) {
                builder.append('\n');
            }
            for (int col = 0; col < grid.columns(); col++) {
                if (col > 0) {
                    builder.append(' ');
                }
                builder.append(grid.get(row, col));
            }
        }
        return builder.toString();
    }

    private static Grid read(BufferedReader reader) throws IOException {
        List<int[]> rows = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] parts = trimmed.split("\\s+");
            if (!rows.isEmpty() && parts.length != rows.get(0).length) {
                throw new InvalidGridException("Line " + lineNo + " has " + parts.length
                        + " values, expected " + rows.get(0).length);
            }
            int[] values = new int[parts.length];
            for (int i = 0; i < parts.length; i++) {
                values[i] = parseValue(parts[i], lineNo);
            }
            rows.add(values);
        }
        if (rows.isEmpty()) {
            throw new InvalidGridException("Grid text contains no rows");
        }
        return Grid.of(rows.toArray(new int[0][]));
    }

    private static int parseValue(String raw, int lineNo) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new InvalidGridException("Invalid value '" + raw + "' on line " + lineNo, ex);
        }
    }
}
