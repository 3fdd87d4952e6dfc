package it.floro.marginboard.domain;

/**
 * Trimestre dell'anno solare.
 */
public enum Quarter {
    Q1, // gen-feb-mar
    Q2, // apr-mag-giu
    Q3, // lug-ago-set
    Q4; // ott-nov-dic

    /**
     * @return Numero del trimestre (1-4)
     */
    public int number() {
        return ordinal() + 1;
    }

    /**
     * Parsing del trimestre da cella di foglio.
     *
     * Accetta solo "Q1".."Q4" (maiuscolo, spazi attorno ignorati): "q1" non è un trimestre
     * valido, come nelle etichette canoniche "YYYY Qn".
     *
     * @param s Valore della cella
     * @return Quarter corrispondente, o null se la stringa non è un trimestre valido
     */
    public static Quarter ofNullable(String s) {
        if (s == null || s.isBlank()) return null;
        return switch (s.trim()) {
            case "Q1" -> Q1;
            case "Q2" -> Q2;
            case "Q3" -> Q3;
            case "Q4" -> Q4;
            default -> null;
        };
    }
}
