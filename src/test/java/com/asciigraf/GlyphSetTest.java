package com.asciigraf;

import com.asciigraf.config.DiagramOptions;
import com.asciigraf.config.DiagramProperties;
import com.asciigraf.config.Glyph;
import com.asciigraf.config.GlyphSet;
import com.asciigraf.grid.Direction;
import com.asciigraf.parser.DiagramDtos.GlyphRole;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class GlyphSetTest {

    @Test
    void classifiesDefaultDialect() {
        GlyphSet glyphs = GlyphSet.DEFAULT;
        assertEquals(Glyph.JUNCTION, glyphs.classify('+'));
        assertEquals(Glyph.HORIZONTAL, glyphs.classify('-'));
        assertEquals(Glyph.HORIZONTAL, glyphs.classify('='));
        assertEquals(Glyph.VERTICAL, glyphs.classify('|'));
        assertEquals(Glyph.ARROW_UP, glyphs.classify('^'));
        assertEquals(Glyph.ARROW_DOWN, glyphs.classify('v'));
        assertEquals(Glyph.ARROW_LEFT, glyphs.classify('<'));
        assertEquals(Glyph.ARROW_RIGHT, glyphs.classify('>'));
        assertEquals(Glyph.TEXT, glyphs.classify('x'));
        assertEquals(Glyph.TEXT, glyphs.classify('\t'));
        assertEquals(Glyph.TEXT, glyphs.classify(' '));
    }

    @Test
    void cornersCountAsBorderOnBothAxes() {
        GlyphSet glyphs = GlyphSet.DEFAULT;
        assertTrue(glyphs.isCorner('+'));
        assertTrue(glyphs.isHorizontalBorder('+'));
        assertTrue(glyphs.isVerticalBorder('+'));
        assertTrue(glyphs.isHorizontalBorder('-'));
        assertFalse(glyphs.isHorizontalBorder('='));
        assertFalse(glyphs.isVerticalBorder('-'));
    }

    @Test
    void glyphPortsFollowTheirAxis() {
        assertTrue(Glyph.JUNCTION.hasHorizontalPort());
        assertTrue(Glyph.JUNCTION.hasVerticalPort());
        assertTrue(Glyph.ARROW_LEFT.hasHorizontalPort());
        assertFalse(Glyph.ARROW_LEFT.hasVerticalPort());
        assertFalse(Glyph.TEXT.hasHorizontalPort());
        assertEquals(Direction.DOWN, Glyph.ARROW_DOWN.pointing());
        assertNull(Glyph.HORIZONTAL.pointing());
    }

    @Test
    void rolesOpenOnlyAlongTheirStroke() {
        assertEquals(EnumSet.of(Direction.LEFT, Direction.RIGHT), GlyphRole.HORIZONTAL.openSides());
        assertEquals(EnumSet.of(Direction.UP, Direction.DOWN), GlyphRole.ARROW_DOWN.openSides());
        assertEquals(EnumSet.allOf(Direction.class), GlyphRole.JUNCTION.openSides());
        assertTrue(GlyphRole.ARROW_RIGHT.isArrowhead());
        assertFalse(GlyphRole.CORNER.isArrowhead());
    }

    @Test
    void rejectsInvalidOptions() {
        assertThrows(IllegalArgumentException.class, () -> new GlyphSet("", "-", "|", "-", "|", "+", '^', 'v', '<', '>', '(', ')'));
        assertThrows(IllegalArgumentException.class, () -> DiagramOptions.DEFAULT.withLabelMargin(-1));
        assertThrows(IllegalArgumentException.class, () -> DiagramOptions.DEFAULT.withEndpointTolerance(-1));
    }

    @Test
    void propertiesBuildOptionsAndRejectMultiCharacterArrows() {
        DiagramProperties properties = new DiagramProperties();
        assertEquals(DiagramOptions.DEFAULT, properties.toOptions());

        properties.getGlyphs().setArrowRight("->");
        assertThrows(IllegalStateException.class, properties::toOptions);
    }
}
