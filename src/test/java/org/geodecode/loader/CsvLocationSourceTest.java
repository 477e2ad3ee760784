package org.geodecode.loader;

import org.geodecode.model.Location;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CSV Location Source Tests")
class CsvLocationSourceTest {

    private static final String HEADER = "lat,lon,city,admin1,admin2,cc";

    // =====================================================================
    // PARSING
    // =====================================================================

    @Test
    @DisplayName("Valid rows are parsed in file order")
    void testParsesRowsInOrder() throws IOException {
        List<Location> locations = read(
                HEADER,
                "42.5,1.5,Andorra la Vella,Andorra la Vella,,AD",
                "64.73424,177.5103,Anadyr,Chukotka,,RU"
        );

        assertEquals(2, locations.size());
        Location first = locations.get(0);
        assertEquals(42.5, first.getLat(), 0.0);
        assertEquals(1.5, first.getLon(), 0.0);
        assertEquals("Andorra la Vella", first.getCity());
        assertEquals("Andorra la Vella", first.getAdmin1());
        assertEquals("", first.getAdmin2());
        assertEquals("AD", first.getCc());
        assertEquals("", first.getCountry());
        assertEquals("Anadyr", locations.get(1).getCity());
    }

    @Test
    @DisplayName("Column order follows the header and extra columns are ignored")
    void testHeaderDrivenColumns() throws IOException {
        List<Location> locations = read(
                "cc,population,city,admin2,admin1,lon,lat",
                "GH,445205,Takoradi,,Western,-1.75536,4.88447"
        );

        assertEquals(1, locations.size());
        Location takoradi = locations.get(0);
        assertEquals(4.88447, takoradi.getLat(), 0.0);
        assertEquals(-1.75536, takoradi.getLon(), 0.0);
        assertEquals("Western", takoradi.getAdmin1());
        assertEquals("GH", takoradi.getCc());
    }

    @Test
    @DisplayName("Quoted fields keep commas and escaped quotes")
    void testQuotedFields() throws IOException {
        List<Location> locations = read(
                HEADER,
                "38.89511,-77.03637,\"Washington, D.C.\",District of Columbia,\"The \"\"District\"\"\",US"
        );

        assertEquals(1, locations.size());
        assertEquals("Washington, D.C.", locations.get(0).getCity());
        assertEquals("The \"District\"", locations.get(0).getAdmin2());
    }

    @Test
    @DisplayName("Rows with unparsable, out-of-range or missing values are skipped")
    void testInvalidRowsSkipped() throws IOException {
        List<Location> locations = read(
                HEADER,
                "abc,10.0,BadLat,,,XX",
                "10.0,,MissingLon,,,XX",
                "91.0,10.0,TooNorth,,,XX",
                "10.0,-180.5,TooWest,,,XX",
                "NaN,0.0,NotANumber,,,XX",
                "1.0,2.0,TooFewFields,,XX",
                "",
                "90.0,180.0,Corner,,,XX"
        );

        assertEquals(1, locations.size());
        assertEquals("Corner", locations.get(0).getCity());
    }

    @Test
    @DisplayName("Missing required column or empty input yields no records")
    void testBrokenHeader() throws IOException {
        assertTrue(read("lat,lon,city,admin1,cc", "1.0,2.0,X,Y,ZZ").isEmpty());
        assertTrue(read().isEmpty());
    }

    @Test
    @DisplayName("Byte order mark before the header is tolerated")
    void testByteOrderMark() throws IOException {
        List<Location> locations = read("\uFEFF" + HEADER, "1.0,2.0,X,,,ZZ");
        assertEquals(1, locations.size());
    }

    @Test
    @DisplayName("Returned list is immutable")
    void testResultImmutable() throws IOException {
        List<Location> locations = read(HEADER, "1.0,2.0,X,,,ZZ");
        assertThrows(UnsupportedOperationException.class, () -> locations.add(locations.get(0)));
    }

    @Test
    @DisplayName("CSV line splitter handles empty trailing fields")
    void testParseCsvLine() {
        assertArrayEquals(new String[]{"a", "", "c", ""}, CsvLocationSource.parseCsvLine("a,,c,"));
        assertArrayEquals(new String[]{""}, CsvLocationSource.parseCsvLine(""));
    }

    // =====================================================================
    // SOURCES
    // =====================================================================

    @Test
    @DisplayName("Configured file path is read when present")
    void testLoadFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("places.csv");
        Files.write(file, List.of(HEADER, "5.0,5.0,X,,,ZZ"), StandardCharsets.UTF_8);

        CsvLocationSource source = new CsvLocationSource(CsvSourceConfig.builder().path(file).build());
        List<Location> locations = source.load(true);

        assertEquals(1, locations.size());
        assertEquals("X", locations.get(0).getCity());
    }

    @Test
    @DisplayName("Missing file falls back to the bundled resource")
    void testMissingPathFallsBackToResource(@TempDir Path dir) {
        CsvLocationSource source = new CsvLocationSource(
                CsvSourceConfig.builder().path(dir.resolve("missing.csv")).build());

        assertTrue(source.load(false).size() > 50);
    }

    @Test
    @DisplayName("Bundled dataset loads with every record in range")
    void testBundledDataset() {
        List<Location> locations = new CsvLocationSource().load(false);

        assertTrue(locations.size() > 50);
        for (Location location : locations) {
            assertTrue(location.coordinate().isValid(), "out of range: " + location);
            assertEquals(2, location.getCc().length(), "bad country code: " + location);
        }
    }

    @Test
    @DisplayName("Unknown classpath resource yields no records instead of failing")
    void testMissingResource() {
        CsvLocationSource source = new CsvLocationSource(
                CsvSourceConfig.builder().resource("/does-not-exist.csv").build());

        assertTrue(source.load(false).isEmpty());
    }

    private static List<Location> read(String... lines) throws IOException {
        String text = String.join("\n", lines);
        try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
            return CsvLocationSource.read(reader, true);
        }
    }
}
