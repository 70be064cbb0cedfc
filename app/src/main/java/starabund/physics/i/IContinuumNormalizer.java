package starabund.physics.i;

import starabund.domain.spectrum.ObservedSpectrum;

/**
 * Normalización inicial del continuo (externa).
 */
@FunctionalInterface
public interface IContinuumNormalizer {
    /**
     * @return Continuo inicial, un valor por píxel del espectro.
     */
    double[] normalize(ObservedSpectrum spectrum);
}
