package it.floro.marginboard.service;

import it.floro.marginboard.config.DashboardProperties;
import it.floro.marginboard.domain.RawRecord;
import it.floro.marginboard.simulator.SalesSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service che mantiene il dataset grezzo corrente del dashboard.
 *
 * Responsabilità:
 * - Generazione e caricamento lazy del dataset di esempio (SalesSimulator)
 * - Caching thread-safe dei record in memoria (volatile + sync)
 * - Sostituzione del dataset con un foglio caricato dal client
 *
 * Architettura:
 * - Lazy initialization: il dataset di esempio viene generato al primo accesso
 * - Double-checked locking: sincronizzazione solo sul primo caricamento
 * - Sostituzione atomica: il nuovo foglio viene validato dal loader prima di
 *   rimpiazzare la cache, un foglio non valido lascia intatto il dataset corrente
 */
@Service
public class RawDataService {

    private static final Logger logger = LoggerFactory.getLogger(RawDataService.class);

    /**
     * Cache dei record correnti. Volatile assicura visibilità tra thread.
     */
    private volatile List<RawRecord> cached;

    private final DashboardProperties properties;
    private final RawDataLoader loader;

    public RawDataService(DashboardProperties properties, RawDataLoader loader) {
        this.properties = properties;
        this.loader = loader;
    }

    /**
     * Restituisce i record correnti, generando il dataset di esempio al primo accesso.
     *
     * @return Lista immutabile di RawRecord
     */
    public List<RawRecord> getRecords() {
        ensureDataLoaded();
        return cached;
    }

    /**
     * Sostituisce il dataset con un foglio fornito dal client.
     *
     * @param values Matrice di celle, prima riga = intestazioni
     * @return Record caricati
     * @throws it.floro.marginboard.error.DatasetException se il foglio non è valido (cache invariata)
     */
    public List<RawRecord> replace(List<? extends List<?>> values) {
        List<RawRecord> loaded = loader.load(values);
        synchronized (this) {
            cached = loaded;
        }
        logger.info("Dataset sostituito: {} record", loaded.size());
        return loaded;
    }

    /**
     * Forza la rigenerazione del dataset di esempio.
     */
    public synchronized void regenerate() {
        cached = generateSample();
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    private void ensureDataLoaded() {
        if (cached == null) {
            synchronized (this) {
                if (cached == null) {
                    cached = generateSample();
                }
            }
        }
    }

    /**
     * Genera il foglio di esempio e lo fa passare dal loader, come un foglio reale.
     */
    private List<RawRecord> generateSample() {
        DashboardProperties.Simulator sim = properties.simulator();
        SalesSimulator simulator = new SalesSimulator(
                sim.seed(),
                properties.columns(),
                properties.products(),
                properties.periods(),
                sim.rowsPerPeriod()
        );
        List<RawRecord> records = loader.load(simulator.generate());
        logger.info("Dataset di esempio generato (seed {}): {} record", sim.seed(), records.size());
        return records;
    }
}
