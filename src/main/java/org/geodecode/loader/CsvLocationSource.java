package org.geodecode.loader;

import lombok.extern.slf4j.Slf4j;
import org.geodecode.model.Coordinate;
import org.geodecode.model.Location;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads places from a {@code rg_cities1000.csv}-style file.
 *
 * <h2>Expected header</h2>
 * <p>The first row names the columns. These must be present, in any order;
 * extra columns are ignored:</p>
 * <table>
 *   <tr><th>Name</th><th>Description</th></tr>
 *   <tr><td>lat</td><td>Latitude, decimal degrees</td></tr>
 *   <tr><td>lon</td><td>Longitude, decimal degrees</td></tr>
 *   <tr><td>city</td><td>Place name</td></tr>
 *   <tr><td>admin1</td><td>First-level subdivision</td></tr>
 *   <tr><td>admin2</td><td>Second-level subdivision</td></tr>
 *   <tr><td>cc</td><td>ISO 3166 alpha-2 country code</td></tr>
 * </table>
 *
 * <p>Rows with a wrong field count, unparsable coordinates or coordinates
 * outside the geographic range are skipped. A missing source, an unreadable
 * header or a missing required column yields an empty list.</p>
 */
@Slf4j
public final class CsvLocationSource implements LocationSource {

    static final String COL_LAT = "lat";
    static final String COL_LON = "lon";
    static final String COL_CITY = "city";
    static final String COL_ADMIN1 = "admin1";
    static final String COL_ADMIN2 = "admin2";
    static final String COL_CC = "cc";

    private static final List<String> REQUIRED_COLUMNS =
            List.of(COL_LAT, COL_LON, COL_CITY, COL_ADMIN1, COL_ADMIN2, COL_CC);
    private static final char BOM = '\uFEFF';

    private final CsvSourceConfig config;

    public CsvLocationSource() {
        this(CsvSourceConfig.defaults());
    }

    public CsvLocationSource(CsvSourceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public List<Location> load(boolean verbose) {
        long start = System.nanoTime();
        List<Location> locations;
        try (BufferedReader reader = open()) {
            if (reader == null) {
                return List.of();
            }
            locations = read(reader, verbose);
        } catch (IOException e) {
            log.error("Error reading location data: {}", e.getMessage(), e);
            return List.of();
        }

        if (verbose) {
            log.info("Parsed {} valid rows in {} ms",
                    locations.size(), (System.nanoTime() - start) / 1_000_000L);
        }
        return locations;
    }

    /**
     * Opens the configured file, falling back to the classpath resource.
     *
     * @return reader, or null when no source exists.
     */
    private BufferedReader open() throws IOException {
        Path path = config.getPath();
        if (path != null) {
            if (Files.isRegularFile(path)) {
                return Files.newBufferedReader(path, StandardCharsets.UTF_8);
            }
            log.warn("Data file '{}' not found, falling back to resource {}", path, config.getResource());
        }

        InputStream in = CsvLocationSource.class.getResourceAsStream(config.getResource());
        if (in == null) {
            log.error("Data resource '{}' not found", config.getResource());
            return null;
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    /**
     * Parses header and rows from an open reader.
     *
     * @param reader CSV text, header first.
     * @param verbose log skipped rows at warn instead of debug.
     * @return immutable list of valid locations in file order.
     * @throws IOException if reading fails.
     */
    static List<Location> read(BufferedReader reader, boolean verbose) throws IOException {
        String headerLine = reader.readLine();
        if (headerLine == null) {
            log.error("Error reading CSV header: empty input");
            return List.of();
        }
        if (!headerLine.isEmpty() && headerLine.charAt(0) == BOM) {
            headerLine = headerLine.substring(1);
        }

        String[] header = parseCsvLine(headerLine);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            columns.putIfAbsent(header[i].trim(), i);
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                log.error("CSV file missing required column: {}", required);
                return List.of();
            }
        }

        int latCol = columns.get(COL_LAT);
        int lonCol = columns.get(COL_LON);
        int cityCol = columns.get(COL_CITY);
        int admin1Col = columns.get(COL_ADMIN1);
        int admin2Col = columns.get(COL_ADMIN2);
        int ccCol = columns.get(COL_CC);

        List<Location> locations = new ArrayList<>();
        String line;
        int row = 0;
        while ((line = reader.readLine()) != null) {
            row++;
            if (line.isBlank()) {
                continue;
            }

            String[] fields = parseCsvLine(line);
            if (fields.length != header.length) {
                log.warn("Skipping row {} due to read error: expected {} fields, got {}",
                        row, header.length, fields.length);
                continue;
            }

            String latText = fields[latCol].trim();
            String lonText = fields[lonCol].trim();
            double lat;
            double lon;
            try {
                lat = Double.parseDouble(latText);
                lon = Double.parseDouble(lonText);
            } catch (NumberFormatException e) {
                logSkippedRow(verbose, row, latText, lonText, e.getMessage());
                continue;
            }
            if (!Coordinate.isValid(lat, lon)) {
                logSkippedRow(verbose, row, latText, lonText, "out of range");
                continue;
            }

            locations.add(Location.builder()
                    .lat(lat)
                    .lon(lon)
                    .city(fields[cityCol])
                    .admin1(fields[admin1Col])
                    .admin2(fields[admin2Col])
                    .cc(fields[ccCol].trim())
                    .build());
        }
        return Collections.unmodifiableList(locations);
    }

    private static void logSkippedRow(boolean verbose, int row, String lat, String lon, String reason) {
        if (verbose) {
            log.warn("Skipping row {} with invalid coordinates: lat='{}', lon='{}' ({})",
                    row, lat, lon, reason);
        } else {
            log.debug("Skipping row {} with invalid coordinates: lat='{}', lon='{}' ({})",
                    row, lat, lon, reason);
        }
    }

    /**
     * Splits one CSV line, honouring double quotes and {@code ""} escapes.
     *
     * @param line CSV line to parse
     * @return array of field values
     */
    static String[] parseCsvLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());

        return fields.toArray(new String[0]);
    }
}
