package it.floro.marginboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.List;

/**
 * Configurazione del dashboard margini (prefisso "dashboard" in application.yml).
 *
 * Raggruppa le liste fisse che guidano la pipeline:
 * - columns: nomi delle intestazioni del foglio dati grezzi
 * - products: prodotti della griglia, un blocco contiguo di periodi per prodotto
 * - chartProducts: colonne prodotto della tabella grafico (vuoto = products)
 * - periods: sequenza ordinata dei periodi (righe del dashboard)
 * - excludedPeriod: periodo la cui riga del grafico non viene tracciata
 * - health: soglie di classificazione del margine
 * - simulator: parametri del dataset di esempio
 *
 * Valori mancanti ricadono sui default: quattro prodotti, 2023 Q1 … 2024 Q4, escluso 2023 Q1.
 */
@ConfigurationProperties(prefix = "dashboard")
public record DashboardProperties(
        Columns columns,
        List<String> products,
        List<String> chartProducts,
        List<String> periods,
        String excludedPeriod,
        Health health,
        Simulator simulator
) {

    public static final List<String> DEFAULT_PRODUCTS =
            List.of("Widget Pro", "Widget Standard", "Service Package", "Accessory Kit");

    public static final List<String> DEFAULT_PERIODS = List.of(
            "2023 Q1", "2023 Q2", "2023 Q3", "2023 Q4",
            "2024 Q1", "2024 Q2", "2024 Q3", "2024 Q4");

    public DashboardProperties {
        columns = columns != null ? columns : Columns.defaults();
        products = (products == null || products.isEmpty()) ? DEFAULT_PRODUCTS : List.copyOf(products);
        chartProducts = (chartProducts == null || chartProducts.isEmpty()) ? products : List.copyOf(chartProducts);
        periods = (periods == null || periods.isEmpty()) ? DEFAULT_PERIODS : List.copyOf(periods);
        excludedPeriod = excludedPeriod != null ? excludedPeriod.trim() : periods.get(0).trim();
        health = health != null ? health : Health.defaults();
        simulator = simulator != null ? simulator : Simulator.defaults();
    }

    /** Configurazione con tutti i valori di default. */
    public static DashboardProperties defaults() {
        return new DashboardProperties(null, null, null, null, null, null, null);
    }

    /**
     * Intestazioni attese nel foglio "Raw Data" (match esatto dopo trim).
     */
    public record Columns(String product, String year, String quarter, String revenue, String margin) {

        public Columns {
            product = orDefault(product, "Product");
            year = orDefault(year, "Year");
            quarter = orDefault(quarter, "Quarter");
            revenue = orDefault(revenue, "Revenue");
            margin = orDefault(margin, "Margin");
        }

        public static Columns defaults() {
            return new Columns(null, null, null, null, null);
        }
    }

    /**
     * Soglie di salute del margine.
     * - margine > strongAbove → Strong
     * - moderateFrom ≤ margine ≤ strongAbove → Moderate
     * - margine < moderateFrom → At Risk
     */
    public record Health(BigDecimal strongAbove, BigDecimal moderateFrom) {

        public Health {
            strongAbove = strongAbove != null ? strongAbove : new BigDecimal("0.35");
            moderateFrom = moderateFrom != null ? moderateFrom : new BigDecimal("0.20");
        }

        public static Health defaults() {
            return new Health(null, null);
        }
    }

    /**
     * Parametri del simulatore di vendite.
     *
     * @param seed Seed fisso per reproducibilità
     * @param rowsPerPeriod Righe transazionali generate per prodotto e periodo
     */
    public record Simulator(Long seed, Integer rowsPerPeriod) {

        public Simulator {
            seed = seed != null ? seed : 42L;
            rowsPerPeriod = rowsPerPeriod != null && rowsPerPeriod > 0 ? rowsPerPeriod : 6;
        }

        public static Simulator defaults() {
            return new Simulator(null, null);
        }
    }

    private static String orDefault(String v, String fallback) {
        return (v == null || v.isBlank()) ? fallback : v.trim();
    }
}
