package it.floro.marginboard.service;

import it.floro.marginboard.config.DashboardProperties;
import it.floro.marginboard.config.DashboardProperties.Columns;
import it.floro.marginboard.domain.Quarter;
import it.floro.marginboard.domain.RawRecord;
import it.floro.marginboard.error.EmptyDatasetException;
import it.floro.marginboard.error.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Componente che normalizza il foglio "Raw Data" in una lista di {@link RawRecord}.
 *
 * Responsabilità:
 * - Validare la presenza di almeno una riga dati (EmptyDatasetException)
 * - Localizzare le colonne per nome esatto di intestazione (SchemaException se mancanti)
 * - Scartare le righe con anno o trimestre vuoti (chiavi non aggregabili)
 * - Convertire ricavo e margine in BigDecimal, con fallback a 0 per celle sporche
 *
 * Input: matrice di valori come letta dall'area usata del foglio,
 * prima riga = intestazioni. Le celle possono essere stringhe o numeri.
 */
@Component
public class RawDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(RawDataLoader.class);

    /**
     * Scala massima (in valore assoluto) accettata per una cella numerica:
     * copre ogni double finito, da 4.9E-324 a 1.8E308.
     */
    private static final int MAX_SCALE = 400;

    private final Columns columns;

    public RawDataLoader(DashboardProperties properties) {
        this.columns = properties.columns();
    }

    /**
     * Carica e tipizza il dataset grezzo.
     *
     * Algoritmo:
     * 1. Meno di 2 righe (solo intestazione o niente) → EmptyDatasetException
     * 2. Indicizza le intestazioni (trim) e verifica le colonne obbligatorie
     * 3. Per ogni riga dati: salta se anno/trimestre vuoti o non validi,
     *    altrimenti crea un RawRecord con ricavo e margine coerciti
     *
     * @param values Matrice di celle, prima riga = intestazioni
     * @return Lista immutabile di RawRecord nell'ordine del foglio
     * @throws EmptyDatasetException se non ci sono righe dati
     * @throws SchemaException se manca una delle intestazioni obbligatorie
     */
    public List<RawRecord> load(List<? extends List<?>> values) {
        if (values == null || values.size() < 2) {
            throw new EmptyDatasetException();
        }

        Map<String, Integer> index = indexHeaders(values.get(0));
        List<String> missing = new ArrayList<>();
        for (String required : List.of(columns.year(), columns.quarter(), columns.revenue(),
                columns.margin(), columns.product())) {
            if (!index.containsKey(required)) missing.add(required);
        }
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }

        int productIdx = index.get(columns.product());
        int yearIdx = index.get(columns.year());
        int quarterIdx = index.get(columns.quarter());
        int revenueIdx = index.get(columns.revenue());
        int marginIdx = index.get(columns.margin());

        List<RawRecord> records = new ArrayList<>(values.size() - 1);
        int skipped = 0;
        for (int i = 1; i < values.size(); i++) {
            List<?> row = values.get(i);
            String yearText = text(cell(row, yearIdx));
            String quarterText = text(cell(row, quarterIdx));

            // Chiavi vuote: riga non aggregabile
            if (yearText.isEmpty() || quarterText.isEmpty()) {
                skipped++;
                continue;
            }

            Integer year = parseYear(yearText);
            Quarter quarter = Quarter.ofNullable(quarterText);
            if (year == null || quarter == null) {
                logger.debug("Riga {} scartata: anno '{}' o trimestre '{}' non validi", i, yearText, quarterText);
                skipped++;
                continue;
            }

            records.add(new RawRecord(
                    text(cell(row, productIdx)),
                    year,
                    quarter,
                    toDecimal(cell(row, revenueIdx)),
                    toDecimal(cell(row, marginIdx))
            ));
        }

        logger.debug("Dataset caricato: {} record validi, {} righe scartate", records.size(), skipped);
        return Collections.unmodifiableList(records);
    }

    // ========= METODI UTILITY PRIVATI =========

    /**
     * Mappa intestazione (trim) → indice di colonna. In caso di duplicati vince la prima.
     */
    private static Map<String, Integer> indexHeaders(List<?> headerRow) {
        Map<String, Integer> index = new LinkedHashMap<>();
        if (headerRow == null) return index;
        for (int c = 0; c < headerRow.size(); c++) {
            index.putIfAbsent(text(headerRow.get(c)), c);
        }
        return index;
    }

    private static Object cell(List<?> row, int idx) {
        return (row == null || idx >= row.size()) ? null : row.get(idx);
    }

    /**
     * Testo trimmato di una cella; i numeri interi perdono il ".0" dei fogli di calcolo.
     */
    private static String text(Object v) {
        if (v == null) return "";
        if (v instanceof Double || v instanceof Float) {
            double d = ((Number) v).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d)) return String.valueOf((long) d);
        }
        if (v instanceof BigDecimal bd) return bd.stripTrailingZeros().toPlainString();
        return String.valueOf(v).trim();
    }

    private static Integer parseYear(String s) {
        try {
            return Integer.valueOf(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Coercizione permissiva a decimale: celle vuote, non numeriche o fuori scala valgono 0.
     *
     * Esempi:
     * - 1000 → 1000
     * - "250.5" → 250.5
     * - "n/d", "", null, NaN → 0
     * - "1e999999999" → 0 (non rappresentabile come double)
     */
    static BigDecimal toDecimal(Object v) {
        if (v == null) return BigDecimal.ZERO;
        if (v instanceof BigDecimal bd) return bounded(bd);
        if (v instanceof BigInteger bi) return bounded(new BigDecimal(bi));
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            return BigDecimal.valueOf(((Number) v).longValue());
        }
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : BigDecimal.ZERO;
        }
        String s = String.valueOf(v).trim();
        if (s.isEmpty()) return BigDecimal.ZERO;
        try {
            return bounded(new BigDecimal(s));
        } catch (NumberFormatException e) {
            logger.trace("Valore non numerico '{}' sostituito con 0", s);
            return BigDecimal.ZERO;
        }
    }

    /**
     * Accetta solo valori rappresentabili come double finito, con scala entro MAX_SCALE.
     */
    private static BigDecimal bounded(BigDecimal bd) {
        if (bd.scale() > MAX_SCALE || bd.scale() < -MAX_SCALE || !Double.isFinite(bd.doubleValue())) {
            logger.trace("Valore fuori scala (scale {}) sostituito con 0", bd.scale());
            return BigDecimal.ZERO;
        }
        return bd;
    }
}
