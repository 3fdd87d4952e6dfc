package it.floro.marginboard.domain;

/**
 * Classificazione dello stato di salute del margine medio ponderato.
 */
public enum HealthStatus {
    STRONG("Strong"),
    MODERATE("Moderate"),
    AT_RISK("At Risk"),
    NOT_AVAILABLE("N/A");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    /** Etichetta mostrata nella colonna "Health" del dashboard. */
    public String label() {
        return label;
    }
}
