package starabund.domain.spectrum;

import java.util.Objects;

/**
 * Las tres máscaras que usa el ajuste de un espectro.
 *
 * @param metallicity Regiones sensibles a [Fe/H].
 * @param alpha       Regiones sensibles a [alpha/Fe].
 * @param general     Píxeles válidos del espectro completo.
 */
public record SpectralMasks(FitMask metallicity, FitMask alpha, FitMask general) {

    public SpectralMasks {
        Objects.requireNonNull(metallicity, "La máscara de metalicidad no puede ser nula.");
        Objects.requireNonNull(alpha, "La máscara alfa no puede ser nula.");
        Objects.requireNonNull(general, "La máscara general no puede ser nula.");
        if (metallicity.size() != general.size() || alpha.size() != general.size()) {
            throw new IllegalArgumentException("Las tres máscaras deben definirse sobre el mismo espectro.");
        }
    }
}
