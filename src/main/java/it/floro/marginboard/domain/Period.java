package it.floro.marginboard.domain;

import it.floro.marginboard.error.PeriodFormatException;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Periodo trimestrale (anno + trimestre) con etichetta canonica "YYYY Qn".
 *
 * Ordinamento totale per (anno, numero del trimestre). L'etichetta canonica è
 * la chiave con cui righe grezze, righe di griglia e righe del grafico vengono
 * confrontate.
 */
public record Period(int year, Quarter quarter) implements Comparable<Period> {

    private static final Pattern LABEL = Pattern.compile("^(\\d{4})\\s+(Q[1-4])$");

    private static final Comparator<Period> ORDER =
            Comparator.comparingInt(Period::year).thenComparingInt(p -> p.quarter().number());

    public Period {
        Objects.requireNonNull(quarter, "quarter");
    }

    /**
     * Interpreta un'etichetta "YYYY Qn" (spazi iniziali/finali ignorati).
     *
     * @param label Etichetta del periodo (es. "2023 Q1")
     * @return Period corrispondente
     * @throws PeriodFormatException se l'etichetta non rispetta il formato
     */
    public static Period parse(String label) {
        if (label == null) throw new PeriodFormatException("null");
        Matcher m = LABEL.matcher(label.trim());
        if (!m.matches()) throw new PeriodFormatException(label);
        return new Period(Integer.parseInt(m.group(1)), Quarter.valueOf(m.group(2)));
    }

    /** Stesso trimestre dell'anno precedente. */
    public Period sameQuarterPreviousYear() {
        return new Period(year - 1, quarter);
    }

    /** Etichetta canonica, es. "2024 Q3". */
    public String label() {
        return year + " " + quarter.name();
    }

    @Override
    public int compareTo(Period other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return label();
    }
}
