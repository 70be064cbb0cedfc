package starabund.domain.spectrum;

import lombok.Getter;
import starabund.domain.fit.AbundanceResult;

import java.util.Arrays;
import java.util.Objects;

/**
 * Espectro observado: longitud de onda, flujo, varianza inversa y continuo por píxel.
 * <p>
 * Los arrays de observación son inmutables. El continuo es el único campo que cambia
 * durante el ajuste (se refina en cada iteración). Al terminar, el pipeline escribe
 * sobre el propio objeto la estimación fotométrica usada y el {@link AbundanceResult}.
 * <p>
 * Los métodos {@code normalized*} son el contrato de acceso del motor de ajuste:
 * devuelven los valores de los píxeles de una máscara divididos por el continuo actual.
 */
public class ObservedSpectrum {

    @Getter
    private final String id;
    private final double[] wavelength;
    private final double[] flux;
    private final double[] inverseVariance;
    private double[] continuum;

    @Getter
    private PhotometricEstimate photometry;
    @Getter
    private AbundanceResult result;

    public ObservedSpectrum(String id, double[] wavelength, double[] flux, double[] inverseVariance) {
        this.id = Objects.requireNonNull(id, "El identificador del espectro no puede ser nulo.");
        Objects.requireNonNull(wavelength, "El array de longitudes de onda no puede ser nulo.");
        Objects.requireNonNull(flux, "El array de flujo no puede ser nulo.");
        Objects.requireNonNull(inverseVariance, "El array de varianza inversa no puede ser nulo.");
        int n = wavelength.length;
        if (flux.length != n || inverseVariance.length != n) {
            throw new IllegalArgumentException("Todos los arrays del espectro deben tener la misma longitud.");
        }
        this.wavelength = wavelength.clone();
        this.flux = flux.clone();
        this.inverseVariance = inverseVariance.clone();
        this.continuum = new double[n];
        Arrays.fill(this.continuum, 1.0);
    }

    public int size() {
        return wavelength.length;
    }

    public double[] getWavelength() {
        return wavelength.clone();
    }

    public double[] getFlux() {
        return flux.clone();
    }

    public double[] getInverseVariance() {
        return inverseVariance.clone();
    }

    public double[] getContinuum() {
        return continuum.clone();
    }

    public double getWavelengthAt(int pixel) {
        return wavelength[pixel];
    }

    public double getFluxAt(int pixel) {
        return flux[pixel];
    }

    public double getInverseVarianceAt(int pixel) {
        return inverseVariance[pixel];
    }

    /**
     * Sustituye el continuo (inicial o refinado).
     *
     * @throws IllegalArgumentException si la longitud no coincide con la del espectro.
     */
    public void setContinuum(double[] continuum) {
        Objects.requireNonNull(continuum, "El continuo no puede ser nulo.");
        if (continuum.length != wavelength.length) {
            throw new IllegalArgumentException("El continuo tiene " + continuum.length
                    + " píxeles, el espectro " + wavelength.length + ".");
        }
        this.continuum = continuum.clone();
    }

    public void setPhotometry(PhotometricEstimate photometry) {
        this.photometry = photometry;
    }

    public void setResult(AbundanceResult result) {
        this.result = result;
    }

    // --- Contrato de acceso para el ajuste ---

    public double[] maskedWavelengths(FitMask mask) {
        return mask.select(wavelength);
    }

    /**
     * flujo / continuo en los píxeles de la máscara. Los valores no finitos
     * (continuo nulo, flujo corrupto) se devuelven como 0; su peso es 0.
     */
    public double[] normalizedFlux(FitMask mask) {
        requireMaskSize(mask);
        double[] out = new double[mask.count()];
        int k = 0;
        for (int i = 0; i < wavelength.length; i++) {
            if (!mask.isSelected(i)) continue;
            double f = flux[i] / continuum[i];
            out[k++] = Double.isFinite(f) ? f : 0.0;
        }
        return out;
    }

    /**
     * Pesos 1/σ² del flujo normalizado: ivar·continuo². Píxeles con varianza inversa
     * nula o flujo normalizado no finito tienen peso 0.
     */
    public double[] normalizedWeights(FitMask mask) {
        requireMaskSize(mask);
        double[] out = new double[mask.count()];
        int k = 0;
        for (int i = 0; i < wavelength.length; i++) {
            if (!mask.isSelected(i)) continue;
            double w = inverseVariance[i] * continuum[i] * continuum[i];
            boolean valid = Double.isFinite(w) && w > 0.0 && Double.isFinite(flux[i] / continuum[i]);
            out[k++] = valid ? w : 0.0;
        }
        return out;
    }

    private void requireMaskSize(FitMask mask) {
        if (mask.size() != wavelength.length) {
            throw new IllegalArgumentException("La máscara (" + mask.size() + ") no corresponde a este espectro ("
                    + wavelength.length + ").");
        }
    }

    @Override
    public String toString() {
        return "ObservedSpectrum{id=" + id + ", pixels=" + wavelength.length + "}";
    }
}
