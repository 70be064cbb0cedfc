package starabund.physics.solver;

import starabund.domain.exception.DataCoverageException;
import starabund.domain.spectrum.FitMask;
import starabund.domain.spectrum.ObservedSpectrum;

import java.util.Arrays;

/**
 * Datos de un ajuste: longitudes de onda, flujo normalizado al continuo y pesos (1/σ²)
 * de los píxeles de una única máscara, opcionalmente precedidos por el píxel ancla.
 *
 * @param wavelengths Longitudes de onda [Å].
 * @param flux        Flujo normalizado (o el valor del ancla en la posición 0).
 * @param weights     1/σ² por dato.
 * @param anchored    {@code true} si la posición 0 es el píxel ancla.
 */
public record FitArrays(double[] wavelengths, double[] flux, double[] weights, boolean anchored) {

    /**
     * Extrae los datos de la máscara con el continuo actual del espectro.
     *
     * @throws DataCoverageException si la máscara no selecciona ningún píxel.
     */
    public static FitArrays of(ObservedSpectrum spectrum, FitMask mask) {
        if (mask.isEmpty()) {
            throw new DataCoverageException("La máscara de ajuste de " + spectrum.getId() + " no selecciona ningún píxel.");
        }
        return new FitArrays(
                spectrum.maskedWavelengths(mask),
                spectrum.normalizedFlux(mask),
                spectrum.normalizedWeights(mask),
                false);
    }

    /**
     * Número de píxeles espectrales (sin contar el ancla).
     */
    public int pixelCount() {
        return anchored ? flux.length - 1 : flux.length;
    }

    /**
     * Antepone un pseudo-píxel con la longitud de onda del primer píxel de la máscara,
     * valor {@code value} y σ = {@code sigma} · sqrt(flexFactor / N_pix).
     * Su influencia relativa disminuye al crecer el número de píxeles espectrales.
     */
    public FitArrays withAnchor(double value, double sigma, double flexFactor) {
        if (anchored) {
            throw new IllegalStateException("Los datos ya contienen el píxel ancla.");
        }
        double anchorSigma = anchorSigma(sigma, flexFactor);
        return new FitArrays(
                prepend(wavelengths[0], wavelengths),
                prepend(value, flux),
                prepend(1.0 / (anchorSigma * anchorSigma), weights),
                true);
    }

    public double anchorSigma(double sigma, double flexFactor) {
        return sigma * Math.sqrt(flexFactor / pixelCount());
    }

    /**
     * Longitudes de onda de los píxeles espectrales (sin el ancla).
     */
    public double[] spectralWavelengths() {
        return anchored ? Arrays.copyOfRange(wavelengths, 1, wavelengths.length) : wavelengths;
    }

    private static double[] prepend(double head, double[] tail) {
        double[] out = new double[tail.length + 1];
        out[0] = head;
        System.arraycopy(tail, 0, out, 1, tail.length);
        return out;
    }
}
