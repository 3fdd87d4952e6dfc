package it.floro.marginboard.simulator;

import it.floro.marginboard.config.DashboardProperties.Columns;
import it.floro.marginboard.domain.Period;
import it.floro.marginboard.error.PeriodFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Simulatore di un foglio "Raw Data" di vendite trimestrali con variabilità stagionale e stocastica.
 *
 * Responsabilità:
 * - Generazione di righe transazionali (ordine, anno, trimestre, prodotto, ricavo, costo, margine)
 * - Profili prodotto invarianti: ricavo base per ordine e margine percentuale di riferimento
 * - Stagionalità trimestrale del ricavo (picco in Q4)
 * - Deriva del margine autocorrelata tra trimestri (processo AR(1))
 * - Anomalie tipiche di un foglio reale: celle non numeriche, chiavi vuote,
 *   prodotti lanciati a metà sequenza (trimestri senza vendite)
 *
 * Architettura:
 * - Seed fisso + Random internalizzato: stesso seed produce lo stesso foglio
 * - Output come matrice di celle (prima riga = intestazioni), la stessa forma
 *   che il loader riceve da un foglio di calcolo o da una richiesta REST
 */
public class SalesSimulator {

    private static final Logger logger = LoggerFactory.getLogger(SalesSimulator.class);

    /**
     * Generatore di numeri casuali con seed fisso per reproducibilità.
     */
    private final Random rnd;
    private final Columns columns;
    private final List<String> products;
    private final List<Period> periods;
    private final int rowsPerPeriod;

    // ========================================================================
    // PARAMETRI DI CONFIGURAZIONE GLOBALI
    // ========================================================================

    /**
     * Probabilità che una riga contenga una cella sporca (ricavo/margine non numerico
     * oppure trimestre vuoto).
     */
    private static final double DIRTY_ROW_PROBABILITY = 0.02;

    /**
     * Ampiezza della stagionalità del ricavo: Q4 +15%, Q1 -15%.
     */
    private static final double SEASONAL_AMPLITUDE = 0.15;

    // ========================================================================
    // PROFILI PRODOTTO (Invarianti)
    // ========================================================================

    /**
     * Ricavo medio per ordine di ogni prodotto.
     */
    private double[] baseRevenue;

    /**
     * Margine percentuale di riferimento di ogni prodotto.
     * Valori distribuiti attorno alle soglie di salute (0.20 / 0.35).
     */
    private double[] baseMargin;

    /**
     * Indice del primo periodo con vendite per ogni prodotto.
     */
    private int[] launchIndex;

    // ========================================================================
    // COSTRUTTORE
    // ========================================================================

    /**
     * Inizializza il simulatore.
     *
     * @param seed Seed per il generatore Random (stesso seed = stessi dati)
     * @param columns Nomi delle intestazioni da scrivere nella prima riga
     * @param products Prodotti da simulare
     * @param periodLabels Sequenza dei periodi (etichette non valide vengono ignorate)
     * @param rowsPerPeriod Righe transazionali per prodotto e periodo
     */
    public SalesSimulator(long seed, Columns columns, List<String> products,
                          List<String> periodLabels, int rowsPerPeriod) {
        this.rnd = new Random(seed);
        this.columns = columns;
        this.products = List.copyOf(products);
        this.periods = parseValid(periodLabels);
        this.rowsPerPeriod = rowsPerPeriod;
        initProductProfiles();
    }

    // ========================================================================
    // GENERAZIONE
    // ========================================================================

    /**
     * Genera il foglio completo.
     *
     * Per ogni periodo e prodotto (dal suo periodo di lancio in poi):
     * 1. Aggiorna la deriva del margine del prodotto (AR(1))
     * 2. Genera rowsPerPeriod ordini con ricavo = base × stagionalità × rumore
     * 3. Margine = ricavo × (margine base + deriva + rumore), costo = ricavo - margine
     * 4. Con probabilità DIRTY_ROW_PROBABILITY sporca una cella della riga
     *
     * @return Matrice di celle, prima riga = intestazioni
     */
    public List<List<Object>> generate() {
        List<List<Object>> sheet = new ArrayList<>();
        sheet.add(List.of("Order ID", columns.year(), columns.quarter(), columns.product(),
                columns.revenue(), "Cost", columns.margin()));

        // ===== PARAMETRI AR(1) =====
        double phi = 0.6, sigma = 0.03;
        double[] drift = new double[products.size()];

        int orderId = 1;
        for (int pi = 0; pi < periods.size(); pi++) {
            Period period = periods.get(pi);
            double season = 1.0 + SEASONAL_AMPLITUDE * seasonFactor(period);

            for (int p = 0; p < products.size(); p++) {
                drift[p] = phi * drift[p] + gauss(0, sigma);
                if (pi < launchIndex[p]) continue;  // prodotto non ancora lanciato

                for (int r = 0; r < rowsPerPeriod; r++) {
                    double revenue = Math.max(0, baseRevenue[p] * season * (1 + gauss(0, 0.12)));
                    double marginPct = clamp(baseMargin[p] + drift[p] + gauss(0, 0.02), -0.2, 0.8);
                    double margin = revenue * marginPct;

                    List<Object> row = new ArrayList<>(7);
                    row.add(String.format("SO-%05d", orderId++));
                    row.add(period.year());
                    row.add(period.quarter().name());
                    row.add(products.get(p));
                    row.add(money(revenue));
                    row.add(money(revenue - margin));
                    row.add(money(margin));

                    if (rnd.nextDouble() < DIRTY_ROW_PROBABILITY) {
                        dirty(row);
                    }
                    sheet.add(row);
                }
            }
        }
        return sheet;
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    /**
     * Profili invarianti: ricavo base in [2.000, 12.000], margine base in [0.12, 0.48].
     * L'ultimo prodotto viene lanciato al terzo periodo, così la griglia contiene
     * trimestri senza vendite (margine N/A).
     */
    private void initProductProfiles() {
        int n = products.size();
        baseRevenue = new double[n];
        baseMargin = new double[n];
        launchIndex = new int[n];

        for (int p = 0; p < n; p++) {
            baseRevenue[p] = 2000 + 10000 * rnd.nextDouble();
            baseMargin[p] = 0.12 + 0.36 * rnd.nextDouble();
            launchIndex[p] = 0;
        }
        if (n > 1 && periods.size() > 2) {
            launchIndex[n - 1] = 2;
        }
    }

    /**
     * Sporca la riga come accade nei fogli compilati a mano.
     */
    private void dirty(List<Object> row) {
        switch (rnd.nextInt(3)) {
            case 0 -> row.set(4, "n/d");    // ricavo non numerico
            case 1 -> row.set(6, "");       // margine vuoto
            default -> row.set(2, "");      // trimestre vuoto: riga non aggregabile
        }
    }

    /**
     * Stagionalità per trimestre in [-1, 1]: Q1 -1, Q2 -0.33, Q3 +0.33, Q4 +1.
     */
    private static double seasonFactor(Period period) {
        return (period.quarter().number() - 2.5) / 1.5;
    }

    private double gauss(double mean, double std) {
        return mean + std * rnd.nextGaussian();
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static BigDecimal money(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP);
    }

    private static List<Period> parseValid(List<String> labels) {
        List<Period> out = new ArrayList<>();
        for (String label : labels) {
            try {
                out.add(Period.parse(label));
            } catch (PeriodFormatException e) {
                logger.debug("Periodo ignorato dal simulatore: {}", e.getMessage());
            }
        }
        return out;
    }
}
