package it.floro.marginboard.error;

/**
 * Radice della tassonomia di errori del dataset grezzo.
 *
 * Tutte le eccezioni sono unchecked: gli errori di forma dei dati vengono
 * riportati al chiamante (controller REST o test) senza obbligare ogni stadio
 * della pipeline a dichiararli.
 */
public class DatasetException extends RuntimeException {

    public DatasetException(String message) {
        super(message);
    }

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
