package starabund.domain.fit;

import lombok.Builder;
import lombok.With;

/**
 * Vector de parámetros atmosféricos. Inmutable: cada etapa del ajuste devuelve uno nuevo.
 * <p>
 * Como clave de caché se compara componente a componente con {@link Double#compare},
 * es decir, dos vectores solo son iguales si sus valores son idénticos bit a bit.
 *
 * @param teff    Temperatura efectiva [K].
 * @param feh     Metalicidad [Fe/H] [dex].
 * @param alphaFe Abundancia [alpha/Fe] [dex].
 * @param logg    Gravedad superficial log g [dex].
 */
@Builder
@With
public record ParameterVector(double teff, double feh, double alphaFe, double logg) {

    public double get(FitParameter parameter) {
        switch (parameter) {
            case TEFF: return teff;
            case FEH: return feh;
            case ALPHA_FE: return alphaFe;
            case LOGG: return logg;
            default: throw new IllegalArgumentException("Parámetro desconocido: " + parameter);
        }
    }

    public ParameterVector with(FitParameter parameter, double value) {
        switch (parameter) {
            case TEFF: return withTeff(value);
            case FEH: return withFeh(value);
            case ALPHA_FE: return withAlphaFe(value);
            case LOGG: return withLogg(value);
            default: throw new IllegalArgumentException("Parámetro desconocido: " + parameter);
        }
    }

    @Override
    public String toString() {
        return String.format("Teff=%.1f, [Fe/H]=%.4f, [alpha/Fe]=%.4f, logg=%.3f", teff, feh, alphaFe, logg);
    }
}
