package it.floro.marginboard.service;

import it.floro.marginboard.domain.Period;
import it.floro.marginboard.domain.RawRecord;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Service di aggregazione dei record grezzi.
 *
 * Fornisce somme esatte (equivalenti a SUMIFS) su tre chiavi:
 * 1. ricavo per (prodotto, periodo)
 * 2. margine per (prodotto, periodo)
 * 3. ricavo per periodo, tutti i prodotti (colonna "Total Revenue" del grafico)
 *
 * Il match sul prodotto è case-sensitive dopo trim; il periodo viene confrontato
 * per etichetta canonica "YYYY Qn". Nessun match → 0.
 */
@Service
public class RevenueAggregator {

    /**
     * Somma dei ricavi di un prodotto in un periodo.
     *
     * @param records Record grezzi
     * @param product Nome prodotto
     * @param period Periodo
     * @return Somma ricavi (0 se nessuna riga corrisponde)
     */
    public BigDecimal sumRevenue(List<RawRecord> records, String product, Period period) {
        return sum(records, matches(product, period), RawRecord::revenue);
    }

    /**
     * Somma dei margini (valore assoluto) di un prodotto in un periodo.
     *
     * @param records Record grezzi
     * @param product Nome prodotto
     * @param period Periodo
     * @return Somma margini (0 se nessuna riga corrisponde)
     */
    public BigDecimal sumMargin(List<RawRecord> records, String product, Period period) {
        return sum(records, matches(product, period), RawRecord::marginAmount);
    }

    /**
     * Somma dei ricavi di tutti i prodotti in un periodo.
     *
     * @param records Record grezzi
     * @param period Periodo
     * @return Ricavo totale del periodo (0 se nessuna riga corrisponde)
     */
    public BigDecimal sumRevenueByPeriod(List<RawRecord> records, Period period) {
        String label = period.label();
        return sum(records, r -> r.period().label().equals(label), RawRecord::revenue);
    }

    // ========= METODI HELPER PRIVATI =========

    private static Predicate<RawRecord> matches(String product, Period period) {
        final String key = product == null ? "" : product.trim();
        final String label = period.label();
        return r -> r.product() != null
                && r.product().trim().equals(key)
                && r.period().label().equals(label);
    }

    private static BigDecimal sum(List<RawRecord> records, Predicate<RawRecord> filter,
                                  Function<RawRecord, BigDecimal> value) {
        return records.stream()
                .filter(filter)
                .map(value)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
