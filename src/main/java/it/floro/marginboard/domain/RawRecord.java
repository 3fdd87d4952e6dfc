package it.floro.marginboard.domain;

import java.math.BigDecimal;

/**
 * Record che rappresenta una riga transazionale del foglio "Raw Data".
 *
 * Immutabile: creato dal loader a partire dai valori grezzi, letto in sola
 * lettura dagli stadi successivi.
 */
public record RawRecord(
        String product,                     // Nome prodotto (trimmed)
        int year,                           // Anno fiscale
        Quarter quarter,                    // Trimestre
        BigDecimal revenue,                 // Ricavo (0 se cella non numerica)
        BigDecimal marginAmount             // Margine in valore assoluto (0 se cella non numerica)
) {

    /** Periodo di appartenenza della riga. */
    public Period period() {
        return new Period(year, quarter);
    }
}
