package starabund.physics.i;

import starabund.domain.spectrum.ResolutionProfile;
import starabund.domain.spectrum.SyntheticSpectrum;

/**
 * Lleva un espectro sintético nativo a la resolución del instrumento sobre una malla concreta.
 * El perfil debe estar restringido a la misma máscara que seleccionó {@code targetWavelengths}.
 */
@FunctionalInterface
public interface IResolutionMatcher {
    double[] match(SyntheticSpectrum model, double[] targetWavelengths, ResolutionProfile profile);
}
