package starabund.domain.fit;

/**
 * Cotas fijas del espacio de parámetros. El optimizador nunca evalúa fuera de ellas.
 */
public record ParameterBounds(
        double teffMin, double teffMax,
        double fehMin, double fehMax,
        double alphaFeMin, double alphaFeMax,
        double loggMin, double loggMax
) {

    public ParameterBounds {
        if (teffMin > teffMax || fehMin > fehMax || alphaFeMin > alphaFeMax || loggMin > loggMax) {
            throw new IllegalArgumentException("Cotas inconsistentes: mínimo mayor que máximo.");
        }
    }

    /**
     * Teff∈[3500,8000], [Fe/H]∈[-4.5,0], [alpha/Fe]∈[-0.8,1.2], logg∈[0,5].
     */
    public static ParameterBounds standard() {
        return new ParameterBounds(3500.0, 8000.0, -4.5, 0.0, -0.8, 1.2, 0.0, 5.0);
    }

    public double lower(FitParameter parameter) {
        switch (parameter) {
            case TEFF: return teffMin;
            case FEH: return fehMin;
            case ALPHA_FE: return alphaFeMin;
            case LOGG: return loggMin;
            default: throw new IllegalArgumentException("Parámetro desconocido: " + parameter);
        }
    }

    public double upper(FitParameter parameter) {
        switch (parameter) {
            case TEFF: return teffMax;
            case FEH: return fehMax;
            case ALPHA_FE: return alphaFeMax;
            case LOGG: return loggMax;
            default: throw new IllegalArgumentException("Parámetro desconocido: " + parameter);
        }
    }

    public double clamp(FitParameter parameter, double value) {
        return Math.max(lower(parameter), Math.min(upper(parameter), value));
    }
}
