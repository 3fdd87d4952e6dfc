package it.floro.marginboard.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class ChartCellTest {

    @Test
    void excludedCellHasNoValue() {
        assertTrue(ChartCell.EXCLUDED.isExcluded());
        assertEquals("#N/A", ChartCell.EXCLUDED.json());
        assertThrows(IllegalStateException.class, ChartCell.EXCLUDED::value);
    }

    @Test
    void numericCellsCompareByValue() {
        assertEquals(ChartCell.of(new BigDecimal("0.40")), ChartCell.of(new BigDecimal("0.4")));
        assertNotEquals(ChartCell.of(BigDecimal.ZERO), ChartCell.EXCLUDED);
        assertFalse(ChartCell.of(BigDecimal.ONE).isExcluded());
    }
}
