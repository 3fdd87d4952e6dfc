package it.floro.marginboard.error;

/**
 * Etichetta di periodo non interpretabile come "YYYY Qn".
 *
 * Non interrompe il calcolo: la riga di griglia (o di grafico) corrispondente
 * assume valori NotAvailable.
 */
public class PeriodFormatException extends DatasetException {

    private final String label;

    public PeriodFormatException(String label) {
        super("Period label '" + label + "' is not in 'YYYY Qn' form");
        this.label = label;
    }

    public PeriodFormatException(String label, Throwable cause) {
        super("Period label '" + label + "' is not in 'YYYY Qn' form", cause);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
