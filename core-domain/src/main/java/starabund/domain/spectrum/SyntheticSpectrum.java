package starabund.domain.spectrum;

import java.util.Arrays;
import java.util.Objects;

/**
 * Espectro sintético (normalizado al continuo) a resolución nativa de la rejilla,
 * o ya recortado/concatenado por el proveedor.
 *
 * @param wavelengths Longitudes de onda [Å], crecientes.
 * @param flux        Flujo relativo para cada longitud de onda.
 */
public record SyntheticSpectrum(double[] wavelengths, double[] flux) {

    public SyntheticSpectrum {
        Objects.requireNonNull(wavelengths, "El array de longitudes de onda no puede ser nulo.");
        Objects.requireNonNull(flux, "El array de flujo no puede ser nulo.");
        if (wavelengths.length != flux.length) {
            throw new IllegalArgumentException("Longitudes de onda (" + wavelengths.length
                    + ") y flujo (" + flux.length + ") deben tener la misma longitud.");
        }
        wavelengths = wavelengths.clone();
        flux = flux.clone();
    }

    @Override
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    @Override
    public double[] flux() {
        return flux.clone();
    }

    public static SyntheticSpectrum empty() {
        return new SyntheticSpectrum(new double[0], new double[0]);
    }

    public int size() {
        return wavelengths.length;
    }

    public boolean isEmpty() {
        return wavelengths.length == 0;
    }

    /**
     * Conserva solo los puntos con lower &lt; λ &lt; upper.
     */
    public SyntheticSpectrum trim(double lower, double upper) {
        int n = 0;
        for (double w : wavelengths) {
            if (w > lower && w < upper) n++;
        }
        double[] w = new double[n];
        double[] f = new double[n];
        int k = 0;
        for (int i = 0; i < wavelengths.length; i++) {
            if (wavelengths[i] > lower && wavelengths[i] < upper) {
                w[k] = wavelengths[i];
                f[k] = flux[i];
                k++;
            }
        }
        return new SyntheticSpectrum(w, f);
    }

    /**
     * Concatena {@code other} a continuación de este espectro, sin reordenar.
     */
    public SyntheticSpectrum concat(SyntheticSpectrum other) {
        double[] w = Arrays.copyOf(wavelengths, wavelengths.length + other.wavelengths.length);
        double[] f = Arrays.copyOf(flux, flux.length + other.flux.length);
        System.arraycopy(other.wavelengths, 0, w, wavelengths.length, other.wavelengths.length);
        System.arraycopy(other.flux, 0, f, flux.length, other.flux.length);
        return new SyntheticSpectrum(w, f);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyntheticSpectrum that = (SyntheticSpectrum) o;
        return Arrays.equals(wavelengths, that.wavelengths) && Arrays.equals(flux, that.flux);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(wavelengths) + Arrays.hashCode(flux);
    }

    @Override
    public String toString() {
        if (isEmpty()) return "SyntheticSpectrum{empty}";
        return "SyntheticSpectrum{points=" + size() + ", range=[" + wavelengths[0] + ", "
                + wavelengths[wavelengths.length - 1] + "]}";
    }
}
