package starabund.physics.i;

import starabund.domain.spectrum.SyntheticSpectrum;

/**
 * Convolución gaussiana de anchura variable por píxel y remuestreo sobre una malla destino.
 */
@FunctionalInterface
public interface IGaussianSmoother {
    /**
     * @param model             Espectro a resolución nativa.
     * @param targetWavelengths Malla destino [Å].
     * @param sigma             σ gaussiana para cada píxel destino [Å]; misma longitud que la malla.
     * @return Flujo suavizado sobre la malla destino.
     */
    double[] smooth(SyntheticSpectrum model, double[] targetWavelengths, double[] sigma);
}
