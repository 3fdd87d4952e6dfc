package it.floro.marginboard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Cella numerica della tabella sorgente del grafico.
 *
 * Può contenere un valore decimale oppure il sentinella non tracciabile
 * {@link #EXCLUDED}, serializzato come "#N/A" in modo che il grafico salti il punto.
 */
public final class ChartCell {

    public static final String NOT_PLOTTABLE = "#N/A";

    public static final ChartCell EXCLUDED = new ChartCell(null);

    private final BigDecimal value;

    private ChartCell(BigDecimal value) {
        this.value = value;
    }

    public static ChartCell of(BigDecimal value) {
        return new ChartCell(Objects.requireNonNull(value, "value"));
    }

    public boolean isExcluded() {
        return value == null;
    }

    /**
     * @return Valore della cella
     * @throws IllegalStateException se la cella è il sentinella escluso
     */
    public BigDecimal value() {
        if (value == null) throw new IllegalStateException("Excluded chart cell has no value");
        return value;
    }

    @JsonValue
    public Object json() {
        return value != null ? value : NOT_PLOTTABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChartCell other)) return false;
        if (value == null || other.value == null) return value == other.value;
        return value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value != null ? value.toPlainString() : NOT_PLOTTABLE;
    }
}
