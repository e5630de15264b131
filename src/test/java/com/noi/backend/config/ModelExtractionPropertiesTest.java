package com.noi.backend.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ModelExtractionPropertiesTest {

    @Test
    void backoffFor_doublesUpToCap() {
        ModelExtractionProperties properties = new ModelExtractionProperties();

        assertEquals(0, properties.backoffFor(0));
        assertEquals(1000, properties.backoffFor(1));
        assertEquals(2000, properties.backoffFor(2));
        assertEquals(4000, properties.backoffFor(3));
        assertEquals(8000, properties.backoffFor(4));
        assertEquals(8000, properties.backoffFor(10));
    }

    @Test
    void backoffFor_zeroBaseDisablesWaiting() {
        ModelExtractionProperties properties = new ModelExtractionProperties();
        properties.setBaseDelayMs(0);

        assertEquals(0, properties.backoffFor(3));
    }
}
