package starabund.domain.fit;

/**
 * Parámetros atmosféricos que puede liberar un ajuste.
 */
public enum FitParameter {
    TEFF("Teff"),
    FEH("[Fe/H]"),
    ALPHA_FE("[alpha/Fe]"),
    LOGG("logg");

    private final String label;

    FitParameter(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
