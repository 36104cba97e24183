package com.cityhex.common.grid;

import com.cityhex.common.geo.AreaGeometry;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Pure hierarchical-grid functions the index depends on. Cells are string addresses.
 * Implementations must be thread-safe; one instance is shared by every query thread.
 */
public interface HexGrid {

    int minSupportedResolution();

    int maxSupportedResolution();

    /** Cells at {@code resolution} whose centers fall inside the geometry; empty when nothing is covered. */
    Set<String> polygonToCells(AreaGeometry geometry, int resolution);

    String cellToParent(String cell, int resolution);

    List<String> cellToChildren(String cell, int resolution);

    /** Collapses every complete sibling set into its parent, recursively. */
    Set<String> compact(Collection<String> cells);

    int baseCell(String cell);

    int resolution(String cell);

    boolean isValidCell(String cell);
}
