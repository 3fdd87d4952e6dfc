package it.floro.marginboard.web.dto;

import java.util.List;

/**
 * Corpo JSON con il foglio "Raw Data": matrice di celle, prima riga = intestazioni.
 *
 * Esempio:
 * {
 *   "values": [
 *     ["Year", "Quarter", "Product", "Revenue", "Margin"],
 *     [2023, "Q1", "Widget Pro", 1000, 400]
 *   ]
 * }
 */
public record DatasetRequest(List<List<Object>> values) {}
