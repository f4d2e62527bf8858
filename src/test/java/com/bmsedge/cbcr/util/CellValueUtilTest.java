package com.bmsedge.cbcr.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CellValueUtilTest {

    @Test
    @DisplayName("Should coerce untrusted cell content without throwing")
    void testCoerceIntegerPermissive() {
        assertEquals(0L, CellValueUtil.coerceInteger(""));
        assertEquals(0L, CellValueUtil.coerceInteger("abc"));
        assertEquals(0L, CellValueUtil.coerceInteger(null));
        assertEquals(12L, CellValueUtil.coerceInteger("12.5"));
        assertEquals(-7L, CellValueUtil.coerceInteger("-7"));
        assertEquals(0L, CellValueUtil.coerceInteger("3.3.3"));
        assertEquals(42L, CellValueUtil.coerceInteger(42));
        assertEquals(7L, CellValueUtil.coerceInteger("007"));
    }

    @Test
    @DisplayName("Should truncate native numeric cells and reject odd values")
    void testCoerceIntegerNativeNumbers() {
        assertEquals(1000000L, CellValueUtil.coerceInteger(1000000.0d));
        assertEquals(-25000L, CellValueUtil.coerceInteger(-25000.9d));
        assertEquals(0L, CellValueUtil.coerceInteger(Double.NaN));
        assertEquals(0L, CellValueUtil.coerceInteger(Boolean.TRUE));
        assertEquals(0L, CellValueUtil.coerceInteger("--5"));
        assertEquals(0L, CellValueUtil.coerceInteger("5-"));
        assertEquals(0L, CellValueUtil.coerceInteger("1,000"));
        assertEquals(0L, CellValueUtil.coerceInteger("-"));
    }

    @ParameterizedTest
    @CsvSource({
            "2025-01-31, 2025-01-31",
            "31/01/2025, 2025-01-31",
            "01/31/2025, 2025-01-31",
            "31-01-2025, 2025-01-31",
            "2025/01/31, 2025-01-31",
            "1/2/2025, 2025-02-01"
    })
    @DisplayName("Should normalize every supported date pattern")
    void testFormatDateSupportedPatterns(String raw, String expected) {
        assertEquals(expected, CellValueUtil.formatDate(raw));
    }

    @Test
    @DisplayName("Should return unparseable dates verbatim")
    void testFormatDateUnparseable() {
        assertEquals("not-a-date", CellValueUtil.formatDate("not-a-date"));
        assertEquals("31/02/2025", CellValueUtil.formatDate("31/02/2025"));
    }

    @Test
    @DisplayName("Should format native date values directly")
    void testFormatDateNativeValues() {
        assertEquals("2025-03-15", CellValueUtil.formatDate(LocalDateTime.of(2025, 3, 15, 0, 0)));
        assertEquals("2025-03-15", CellValueUtil.formatDate(LocalDate.of(2025, 3, 15)));
        assertNull(CellValueUtil.formatDate(null));
    }

    @Test
    @DisplayName("Should escape markup characters")
    void testEscapeXml() {
        assertEquals("Acme &lt;Holdings&gt; &amp; Co", CellValueUtil.escapeXml("Acme <Holdings> & Co"));
        assertEquals("O'Brien \"Ltd\"", CellValueUtil.escapeXml("O'Brien \"Ltd\""));
        assertEquals("O&apos;Brien &quot;Ltd&quot;", CellValueUtil.escapeXmlAttribute("O'Brien \"Ltd\""));
        assertEquals("", CellValueUtil.escapeXml(null));
        assertEquals("ab", CellValueUtil.escapeXml("a\u0001b"));
    }

    @Test
    @DisplayName("Should render whole doubles without a decimal part")
    void testToText() {
        assertEquals("120", CellValueUtil.toText(120.0d));
        assertEquals("12.5", CellValueUtil.toText(12.5d));
        assertEquals("Acme", CellValueUtil.toText("  Acme "));
        assertEquals("", CellValueUtil.toText(null));
        assertEquals("N/A", CellValueUtil.textOrDefault("   ", "N/A"));
    }
}
