package it.floro.marginboard.config;

import it.floro.marginboard.error.DatasetException;
import it.floro.marginboard.error.EmptyDatasetException;
import it.floro.marginboard.error.SchemaException;
import it.floro.marginboard.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler per gli errori di forma del dataset grezzo.
 *
 * Gli errori di schema interrompono il calcolo e vengono riportati al client
 * come 400 con un corpo JSON leggibile.
 */
@RestControllerAdvice
@Order(-1) // Alta priorità
public class DashboardExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(DashboardExceptionHandler.class);

    /**
     * Intestazioni obbligatorie mancanti.
     */
    @ExceptionHandler(SchemaException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleSchema(SchemaException ex) {
        logger.warn("Foglio dati rifiutato, intestazioni mancanti: {}", ex.getMissingHeaders());
        return new ErrorResponse("SCHEMA", ex.getMessage());
    }

    /**
     * Foglio senza righe dati.
     */
    @ExceptionHandler(EmptyDatasetException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleEmpty(EmptyDatasetException ex) {
        logger.warn("Foglio dati rifiutato: {}", ex.getMessage());
        return new ErrorResponse("EMPTY_DATASET", ex.getMessage());
    }

    /**
     * Altri errori del dataset non recuperati localmente.
     */
    @ExceptionHandler(DatasetException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleDataset(DatasetException ex) {
        logger.warn("Errore nel dataset: {}", ex.getMessage());
        return new ErrorResponse("DATASET", ex.getMessage());
    }
}
