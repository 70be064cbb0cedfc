package starabund.physics.i;

import starabund.domain.spectrum.ObservedSpectrum;

/**
 * Refinamiento externo del continuo a partir del mejor espectro sintético.
 */
@FunctionalInterface
public interface IContinuumRefiner {
    /**
     * @param spectrum  Espectro observado con el continuo actual.
     * @param modelFlux Mejor espectro sintético sobre la malla observada completa.
     * @return Continuo refinado, un valor por píxel.
     */
    double[] refine(ObservedSpectrum spectrum, double[] modelFlux);
}
