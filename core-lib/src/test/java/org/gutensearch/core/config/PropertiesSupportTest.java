package org.gutensearch.core.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesSupportTest {

    @Test
    void loadsClasspathResource() {
        Properties p = PropertiesSupport.loadProperties(PropertiesSupportTest.class, "support-test.properties");

        assertEquals("7002", p.getProperty("server.port"));
        assertTrue(PropertiesSupport.loadProperties(PropertiesSupportTest.class, "missing.properties").isEmpty());
    }

    @Test
    void aliasOverridesKeyOnlyWhenSet() {
        Properties p = new Properties();
        p.setProperty("server.port", "7002");
        p.setProperty("PORT", "  ");

        PropertiesSupport.applyAlias(p, "PORT", "server.port");
        assertEquals("7002", p.getProperty("server.port"));

        p.setProperty("PORT", " 9000 ");
        PropertiesSupport.applyAlias(p, "PORT", "server.port");
        assertEquals("9000", p.getProperty("server.port"));
    }

    @Test
    void typedReadersHandleBlankAndInvalidValues() {
        Properties p = new Properties();
        p.setProperty("a", " 42 ");
        p.setProperty("b", "");
        p.setProperty("c", "x");
        p.setProperty("d", "TRUE");

        assertEquals(42, PropertiesSupport.requireInt(p, "a"));
        assertEquals(7, PropertiesSupport.optionalInt(p, "b", 7));
        assertEquals("fallback", PropertiesSupport.optionalString(p, "b", "fallback"));
        assertTrue(PropertiesSupport.optionalBoolean(p, "d", false));
        assertFalse(PropertiesSupport.optionalBoolean(p, "missing", false));

        assertThrows(IllegalStateException.class, () -> PropertiesSupport.requireString(p, "b"));
        assertThrows(IllegalStateException.class, () -> PropertiesSupport.requireInt(p, "c"));
    }

    @Test
    void splitsCsv() {
        assertEquals(List.of("a", "b"), PropertiesSupport.splitCsv(" a, ,b ,"));
        assertEquals(List.of(1), PropertiesSupport.splitCsvInts("  ", List.of(1)));
        assertEquals(List.of(5701, 5702), PropertiesSupport.splitCsvInts("5701,5702", List.of()));
    }
}
