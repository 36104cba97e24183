package com.cityhex.common.key;

import com.cityhex.common.config.IndexSettings;
import com.cityhex.common.error.InvalidResolutionException;
import com.cityhex.common.grid.H3HexGrid;
import com.uber.h3core.H3Core;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndexKeyCodecTest {

    private static H3Core h3;
    private static IndexKeyCodec codec;

    @BeforeAll
    static void setUp() throws IOException {
        h3 = H3Core.newInstance();
        codec = new IndexKeyCodec(new H3HexGrid(h3), IndexSettings.defaults());
    }

    @Test
    void encodeJoinsChainAndAppendsEntityId() {
        var key = codec.encode(17, List.of("A2", "A3", "A4", "A5", "A6", "A7", "A8"), "0");
        assertEquals("17", key.partitionKey());
        assertEquals("A2#A3#A4#A5#A6#A7#A8#0", key.sortKey());
    }

    @Test
    void encodeLeafCellUsesBaseCellAndFullChain() {
        String leaf = h3.latLngToCellAddress(37.7749, -122.4194, 8);
        var key = codec.encode(leaf, "42");

        assertEquals(Integer.toString(h3.getBaseCellNumber(leaf)), key.partitionKey());
        String[] segments = key.sortKey().split("#");
        assertEquals(8, segments.length);
        for (int r = 2; r <= 8; r++) {
            assertEquals(h3.cellToParentAddress(leaf, r), segments[r - 2]);
        }
        assertEquals("42", segments[7]);
    }

    @Test
    void encodeRejectsNonLeafCell() {
        String cell = h3.latLngToCellAddress(37.7749, -122.4194, 6);
        assertThrows(InvalidResolutionException.class, () -> codec.encode(cell, "1"));
    }

    @Test
    void queryPrefixOfLeafMatchesItsOwnSortKey() {
        String leaf = h3.latLngToCellAddress(37.7749, -122.4194, 8);
        var key = codec.encode(leaf, "7");
        var prefix = codec.queryPrefix(leaf);

        assertEquals(key.partitionKey(), prefix.partitionKey());
        assertTrue(key.sortKey().startsWith(prefix.sortKeyPrefix()));
        assertEquals(8, prefix.resolution());
    }

    @Test
    void ancestorPrefixContainsDescendantPrefix() {
        String leaf = h3.latLngToCellAddress(47.6062, -122.3321, 8);
        for (int coarse = 2; coarse <= 8; coarse++) {
            var ancestor = codec.queryPrefix(h3.cellToParentAddress(leaf, coarse));
            for (int fine = coarse; fine <= 8; fine++) {
                var descendant = codec.queryPrefix(h3.cellToParentAddress(leaf, fine));
                assertEquals(ancestor.partitionKey(), descendant.partitionKey());
                assertTrue(descendant.sortKeyPrefix().startsWith(ancestor.sortKeyPrefix()),
                           "res " + fine + " prefix must extend res " + coarse + " prefix");
            }
        }
    }

    @Test
    void siblingPrefixesDoNotOverlap() {
        String parent = h3.latLngToCellAddress(37.7749, -122.4194, 5);
        var children = h3.cellToChildren(parent, 6);
        var first = codec.queryPrefix(children.get(0)).sortKeyPrefix();
        for (String sibling : children.subList(1, children.size())) {
            assertFalse(codec.queryPrefix(sibling).sortKeyPrefix().startsWith(first));
        }
    }

    @Test
    void queryPrefixOutsideIndexedRangeFails() {
        String coarse = h3.latLngToCellAddress(37.7749, -122.4194, 1);
        String fine = h3.latLngToCellAddress(37.7749, -122.4194, 9);
        assertThrows(InvalidResolutionException.class, () -> codec.queryPrefix(coarse));
        assertThrows(InvalidResolutionException.class, () -> codec.queryPrefix(fine));
    }
}
