package it.floro.marginboard.domain;

import java.util.Map;

/**
 * Riga della tabella "Chart Data": un periodo, una colonna per prodotto e il ricavo totale.
 *
 * La mappa dei margini mantiene l'ordine delle colonne prodotto configurato.
 */
public record ChartRow(
        String period,                          // Etichetta "YYYY Qn", sempre valorizzata
        Map<String, ChartCell> productMargins,  // prodotto → margine medio ponderato
        ChartCell totalRevenue                  // Ricavo totale del periodo (tutti i prodotti)
) {

    /** True se ogni cella numerica della riga è il sentinella non tracciabile. */
    public boolean isExcluded() {
        return totalRevenue.isExcluded()
                && productMargins.values().stream().allMatch(ChartCell::isExcluded);
    }
}
