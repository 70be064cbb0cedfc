package starabund.domain.spectrum;

import java.util.Arrays;
import java.util.Objects;

/**
 * Anchura gaussiana (σ = FWHM/2.35, en Å) del perfil instrumental para cada píxel.
 * <p>
 * Inmutable durante toda la resolución de un espectro. Siempre es un array de
 * longitud fija; la restricción a una máscara devuelve otro perfil.
 *
 * @param sigma σ por píxel [Å].
 */
public record ResolutionProfile(double[] sigma) {

    public ResolutionProfile {
        Objects.requireNonNull(sigma, "El array de resolución no puede ser nulo.");
        for (double s : sigma) {
            if (!(s >= 0.0) || Double.isInfinite(s)) {
                throw new IllegalArgumentException("σ de resolución inválida: " + s);
            }
        }
        sigma = sigma.clone();
    }

    @Override
    public double[] sigma() {
        return sigma.clone();
    }

    public int length() {
        return sigma.length;
    }

    public double sigmaAt(int pixel) {
        return sigma[pixel];
    }

    /**
     * Perfil restringido a los píxeles seleccionados por la máscara.
     */
    public ResolutionProfile subset(FitMask mask) {
        return new ResolutionProfile(mask.select(sigma));
    }

    /**
     * @throws IllegalArgumentException si el perfil no cubre exactamente {@code pixels} píxeles.
     */
    public void requireLength(int pixels) {
        if (sigma.length != pixels) {
            throw new IllegalArgumentException("El perfil de resolución tiene " + sigma.length
                    + " píxeles, se esperaban " + pixels + ".");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(sigma, ((ResolutionProfile) o).sigma);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(sigma);
    }

    @Override
    public String toString() {
        return "ResolutionProfile{pixels=" + sigma.length + "}";
    }
}
