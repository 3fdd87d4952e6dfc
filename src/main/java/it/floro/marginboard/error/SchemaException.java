package it.floro.marginboard.error;

import java.util.List;

/** Intestazioni obbligatorie mancanti nel foglio dati grezzi. Fatale, prima di ogni aggregazione. */
public class SchemaException extends DatasetException {

    private final List<String> missingHeaders;

    public SchemaException(List<String> missingHeaders) {
        super("Raw Data must include headers: " + String.join(", ", missingHeaders) + " (exact spelling)");
        this.missingHeaders = List.copyOf(missingHeaders);
    }

    public List<String> getMissingHeaders() {
        return missingHeaders;
    }
}
