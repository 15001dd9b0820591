package com.openforge.recall.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingConverterTest {

    private final EmbeddingConverter converter = new EmbeddingConverter();

    @Test
    void shouldWriteCommaSeparatedFloats() {
        assertEquals("0.5,-1.25,3.0", converter.convertToDatabaseColumn(new float[]{0.5f, -1.25f, 3f}));
        assertArrayEquals(new float[]{0.5f, -1.25f, 3f}, converter.convertToEntityAttribute("0.5, -1.25,3.0"));
    }

    @Test
    void shouldMapEmptyVectorsToNull() {
        assertNull(converter.convertToDatabaseColumn(null));
        assertNull(converter.convertToDatabaseColumn(new float[0]));
        assertNull(converter.convertToEntityAttribute(null));
        assertNull(converter.convertToEntityAttribute(" "));
    }
}
