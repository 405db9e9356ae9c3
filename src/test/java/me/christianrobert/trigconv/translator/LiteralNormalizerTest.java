package me.christianrobert.trigconv.translator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LiteralNormalizerTest {

    private final LiteralNormalizer literals = new LiteralNormalizer();

    @Test
    void numbers() {
        assertEquals("0.5", literals.normalizeNumber(".5"));
        assertEquals("5.0", literals.normalizeNumber("5."));
        assertEquals("1E5", literals.normalizeNumber("1e5"));
        assertEquals("42", literals.normalizeNumber("42"));
    }

    @Test
    void dateFormats() {
        assertEquals("'DD-MON-YYYY'", literals.normalizeDateFormat("'DD-MON-RRRR'"));
        assertEquals("'YYYY-MM-DD HH24:MI:SS.US'", literals.normalizeDateFormat("'SYYYY-MM-DD HH24:MI:SS.FF'"));
        assertEquals("'HH24:MI:SS.FF3 TZ'", literals.normalizeDateFormat("'HH24:MI:SS.FF3 TZR'"));
    }

    @Test
    void quotedFormatTextUntouched() {
        assertEquals("'YYYY\"RR\"MM'", literals.normalizeDateFormat("'RRRR\"RR\"MM'"));
    }

    @Test
    void eachDistinctLiteralNormalizedOnce() {
        literals.normalizeNumber(".5");
        literals.normalizeNumber(".5");
        literals.normalizeDateFormat("'DD-MON-RR'");
        literals.normalizeDateFormat("'DD-MON-RR'");

        assertEquals(2, literals.getNormalizationCount());
    }
}
