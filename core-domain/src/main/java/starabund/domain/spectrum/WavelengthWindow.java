package starabund.domain.spectrum;

/**
 * Intervalo de longitudes de onda [Å].
 *
 * @param start Extremo inferior.
 * @param stop  Extremo superior.
 */
public record WavelengthWindow(double start, double stop) {

    public WavelengthWindow {
        if (!(stop >= start)) {
            throw new IllegalArgumentException("Ventana inválida: start=" + start + " > stop=" + stop);
        }
    }

    /** start &lt; λ &lt; stop */
    public boolean containsOpen(double wavelength) {
        return wavelength > start && wavelength < stop;
    }

    /** start ≤ λ &lt; stop */
    public boolean containsHalfOpen(double wavelength) {
        return wavelength >= start && wavelength < stop;
    }

    /** start ≤ λ ≤ stop */
    public boolean containsClosed(double wavelength) {
        return wavelength >= start && wavelength <= stop;
    }
}
