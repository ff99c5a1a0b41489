package com.largomodo.demstitch.core.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TileShapeTest {

    @ParameterizedTest
    @CsvSource({
            "150x225, 150, 225",
            "750X1125, 750, 1125",
            "' 4 x 5 ', 4, 5"
    })
    void testParse(String text, int rows, int cols) {
        assertEquals(new TileShape(rows, cols), TileShape.parse(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "150", "150x", "x225", "150*225", "0x5", "-1x5", "axb"})
    void testParseRejectsMalformed(String text) {
        assertThrows(IllegalArgumentException.class, () -> TileShape.parse(text));
    }

    @Test
    void testToStringRoundTripsThroughParse() {
        TileShape shape = new TileShape(150, 225);

        assertEquals("150x225", shape.toString());
        assertEquals(shape, TileShape.parse(shape.toString()));
    }
}
