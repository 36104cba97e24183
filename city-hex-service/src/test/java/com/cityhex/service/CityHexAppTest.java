package com.cityhex.service;

import com.uber.h3core.H3Core;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CityHexAppTest {

    @TempDir
    Path tempDir;

    @Test
    void missingCommandPrintsUsage() {
        assertEquals(2, CityHexApp.run(new String[] {}));
        assertEquals(2, CityHexApp.run(new String[] {"--in-memory", "frobnicate"}));
        assertEquals(2, CityHexApp.run(new String[] {"--in-memory", "cell"}));
    }

    @Test
    void inMemoryCellQuerySucceeds() throws IOException {
        String cell = H3Core.newInstance().latLngToCellAddress(37.76, -122.445, 6);
        assertEquals(0, CityHexApp.run(new String[] {"--in-memory", "--sample", "cell", cell}));
    }

    @Test
    void inMemoryPolygonQueryReportsClientErrors() throws IOException {
        Path request = tempDir.resolve("request.json");
        Files.writeString(request, """
            {"geometry": {"type": "Polygon", "coordinates": [[[0, 0], [1, 0], [1, 1], [0, 0]]]}, "resolution": 0}""");

        assertEquals(1, CityHexApp.run(new String[] {"--in-memory", "--sample", "polygon", request.toString()}));
    }
}
