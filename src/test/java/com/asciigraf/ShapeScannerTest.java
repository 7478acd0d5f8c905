package com.asciigraf;

import com.asciigraf.config.DiagramOptions;
import com.asciigraf.grid.Cell;
import com.asciigraf.grid.GridLoader;
import com.asciigraf.parser.DiagramDtos;
import com.asciigraf.parser.DiagramDtos.NodeRegion;
import com.asciigraf.parser.RegionMap;
import com.asciigraf.parser.ShapeScanner;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShapeScannerTest {
    private final GridLoader loader = new GridLoader();
    private final ShapeScanner scanner = new ShapeScanner();

    private ShapeScanner.ScanResult scan(String diagram) {
        return scanner.scan(loader.load(diagram), DiagramOptions.DEFAULT);
    }

    @Test
    void findsBoxesInReadingOrder() {
        var result = scan("""
                      +---+
                      | B |
                +---+ +---+
                | A |
                +---+
                """);
        assertEquals(2, result.regions().size());
        NodeRegion first = result.regions().get(0);
        assertEquals("B", first.label());
        assertEquals(new Cell(0, 6), first.topLeft());
        assertEquals(2, first.bottom());
        assertEquals(10, first.right());
        assertEquals("A", result.regions().get(1).label());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void joinsMultiLineLabelsAndDropsBlankLines() {
        var result = scan("""
                +-------+
                |       |
                | hello |
                |  world|
                |       |
                +-------+
                """);
        assertEquals(1, result.regions().size());
        assertEquals("hello world", result.regions().get(0).label());
    }

    @Test
    void claimsBorderAndInterior() {
        var result = scan("""
                +---+
                | A |
                +---+
                """);
        RegionMap map = result.regionMap();
        assertEquals(0, map.ownerAt(0, 0));
        assertEquals(0, map.ownerAt(1, 2));
        assertEquals(0, map.ownerAt(2, 4));
        assertEquals(RegionMap.NONE, map.ownerAt(1, 5));
        assertEquals(new NodeRegion(0, 0, 0, 2, 4, "A"), result.regions().get(0));
    }

    @Test
    void smallestBoxIsOneByOneInterior() {
        var result = scan("+-+\n|x|\n+-+");
        assertEquals(1, result.regions().size());
        assertEquals("x", result.regions().get(0).label());

        assertTrue(scan("+-+\n+-+").regions().isEmpty());
        assertTrue(scan("++\n++").regions().isEmpty());
    }

    @Test
    void unclosedBorderIsReportedAndLeftUnclaimed() {
        var result = scan("""
                +---+
                | A |
                +---+

                +----+
                |  broken
                """);
        assertEquals(1, result.regions().size());
        assertEquals(RegionMap.NONE, result.regionMap().ownerAt(4, 0));
        assertTrue(result.diagnostics().stream()
                .anyMatch(d -> d.code().equals(DiagramDtos.MALFORMED_REGION) && d.row() == 4 && d.col() == 0));
    }

    @Test
    void nestedBorderIsNotANode() {
        var result = scan("""
                +---------+
                | +-+     |
                | | |  X  |
                | +-+     |
                +---------+
                """);
        assertEquals(1, result.regions().size());
        assertEquals("X", result.regions().get(0).label());
        assertEquals(RegionMap.NONE, result.regionMap().ownerAt(1, 2));
        assertEquals(RegionMap.NONE, result.regionMap().ownerAt(2, 4));
        assertEquals(0, result.regionMap().ownerAt(2, 3));
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.code().equals(DiagramDtos.NESTED_REGION)));
    }

    @Test
    void connectorLeavingThroughTheBorderKeepsTheBox() {
        var result = scan("""
                  |
                +-+-+
                | A |
                +---+
                """);
        assertEquals(1, result.regions().size());
        assertEquals(new Cell(1, 0), result.regions().get(0).topLeft());
        assertEquals("A", result.regions().get(0).label());
    }

    @Test
    void textOnlyInputHasNoRegions() {
        var result = scan("just some words\nand + a - few | glyphs");
        assertTrue(result.regions().isEmpty());
        assertTrue(result.diagnostics().isEmpty());
    }
}
