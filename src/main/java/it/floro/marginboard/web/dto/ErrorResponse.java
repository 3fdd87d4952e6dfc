package it.floro.marginboard.web.dto;

/**
 * Corpo di risposta per gli errori del dataset.
 */
public record ErrorResponse(
        String error,                       // Tipo di errore, es. "SCHEMA", "EMPTY_DATASET"
        String message                      // Messaggio leggibile
) {}
