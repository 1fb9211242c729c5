package io.opscan.model;

/**
 * A source span inside a compilation unit.
 * Lines and columns are 1-based; a location with line 0 is unknown.
 *
 * @param path        Path of the compilation unit as reported by the host
 * @param startLine   First line of the span
 * @param startColumn First column of the span
 * @param endLine     Last line of the span
 * @param endColumn   Column just past the end of the span
 */
public record Location(
        String path,
        int startLine,
        int startColumn,
        int endLine,
        int endColumn
) {
    /**
     * Location used for nodes and symbols the host could not place in source.
     */
    public static final Location NONE = new Location("", 0, 0, 0, 0);

    /**
     * Compact constructor with validation.
     */
    public Location {
        if (path == null) {
            path = "";
        }
        if (startLine < 0 || startColumn < 0 || endLine < 0 || endColumn < 0) {
            throw new IllegalArgumentException("location coordinates cannot be negative");
        }
        if (endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
            throw new IllegalArgumentException("location end precedes start: "
                    + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn);
        }
    }

    /**
     * Creates a location from a span string of the form {@code line:col-line:col}
     * (or {@code line:col} for a single point).
     */
    public static Location parse(String path, String span) {
        if (span == null || span.isBlank()) {
            return new Location(path, 0, 0, 0, 0);
        }
        String[] ends = span.trim().split("-", 2);
        int[] start = parsePoint(ends[0], span);
        int[] end = ends.length == 2 ? parsePoint(ends[1], span) : start;
        return new Location(path, start[0], start[1], end[0], end[1]);
    }

    private static int[] parsePoint(String point, String span) {
        String[] parts = point.trim().split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid span '" + span + "', expected line:col-line:col");
        }
        try {
            return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid span '" + span + "', expected line:col-line:col", e);
        }
    }

    /**
     * Returns true if the host placed this location in source.
     */
    public boolean isKnown() {
        return startLine > 0;
    }

    /**
     * Returns a copy of this span attached to another compilation unit path.
     */
    public Location withPath(String newPath) {
        return new Location(newPath, startLine, startColumn, endLine, endColumn);
    }

    /**
     * Returns a display-friendly location string, e.g. {@code src/R.cs(12,5)}.
     */
    public String display() {
        if (!isKnown()) {
            return path.isEmpty() ? "<unknown>" : path;
        }
        return path + "(" + startLine + "," + startColumn + ")";
    }
}
