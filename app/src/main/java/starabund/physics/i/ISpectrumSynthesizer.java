package starabund.physics.i;

import starabund.domain.fit.ParameterVector;
import starabund.domain.spectrum.SyntheticSpectrum;

/**
 * Genera el espectro sintético (resolución nativa) que cubre una malla destino.
 */
@FunctionalInterface
public interface ISpectrumSynthesizer {
    SyntheticSpectrum synthesize(double[] targetWavelengths, ParameterVector parameters);
}
