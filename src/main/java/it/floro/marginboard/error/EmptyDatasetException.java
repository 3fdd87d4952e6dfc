package it.floro.marginboard.error;

/** Il dataset non contiene alcuna riga dati oltre all'intestazione. */
public class EmptyDatasetException extends DatasetException {

    public EmptyDatasetException() {
        super("Raw Data sheet looks empty (no rows found)");
    }
}
