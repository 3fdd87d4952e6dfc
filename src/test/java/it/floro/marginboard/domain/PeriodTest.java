package it.floro.marginboard.domain;

import it.floro.marginboard.error.PeriodFormatException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PeriodTest {

    @Test
    void parsesCanonicalLabel() {
        Period p = Period.parse("2023 Q1");
        assertEquals(2023, p.year());
        assertEquals(Quarter.Q1, p.quarter());
        assertEquals("2023 Q1", p.label());
    }

    @Test
    void parseIgnoresSurroundingWhitespace() {
        assertEquals(new Period(2024, Quarter.Q4), Period.parse("  2024 Q4 "));
    }

    @Test
    void rejectsMalformedLabels() {
        assertThrows(PeriodFormatException.class, () -> Period.parse("2023-Q1"));
        assertThrows(PeriodFormatException.class, () -> Period.parse("Q1 2023"));
        assertThrows(PeriodFormatException.class, () -> Period.parse("2023 Q5"));
        assertThrows(PeriodFormatException.class, () -> Period.parse(""));
        assertThrows(PeriodFormatException.class, () -> Period.parse(null));
    }

    @Test
    void malformedLabelIsReported() {
        PeriodFormatException ex = assertThrows(PeriodFormatException.class, () -> Period.parse("FY23"));
        assertEquals("FY23", ex.getLabel());
    }

    @Test
    void ordersByYearThenQuarter() {
        List<Period> periods = new ArrayList<>(List.of(
                Period.parse("2024 Q1"), Period.parse("2023 Q4"), Period.parse("2023 Q2"), Period.parse("2024 Q3")));
        Collections.sort(periods);
        assertEquals(List.of("2023 Q2", "2023 Q4", "2024 Q1", "2024 Q3"),
                periods.stream().map(Period::label).toList());
    }

    @Test
    void sameQuarterPreviousYear() {
        assertEquals(Period.parse("2023 Q3"), Period.parse("2024 Q3").sameQuarterPreviousYear());
    }

    @Test
    void quarterParsingIsCaseSensitive() {
        assertEquals(Quarter.Q2, Quarter.ofNullable(" Q2 "));
        assertNull(Quarter.ofNullable("q2"));
        assertNull(Quarter.ofNullable("Q0"));
        assertNull(Quarter.ofNullable("2"));
        assertNull(Quarter.ofNullable(" "));
    }
}
