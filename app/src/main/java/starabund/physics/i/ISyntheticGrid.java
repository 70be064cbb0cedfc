package starabund.physics.i;

import starabund.domain.fit.ParameterVector;
import starabund.domain.spectrum.SyntheticSpectrum;

import java.nio.file.Path;

/**
 * Interpolador externo de la rejilla de espectros sintéticos. Devuelve el espectro a
 * resolución nativa para un punto arbitrario (Teff, logg, [Fe/H], [alpha/Fe]).
 */
@FunctionalInterface
public interface ISyntheticGrid {
    /**
     * @param point           Punto del espacio de parámetros.
     * @param dataPath        Directorio de la rejilla (uno por brazo).
     * @param wavelengthStart Inicio del rango a leer [Å], o {@code null} para el rango propio de la rejilla.
     * @param wavelengthStop  Fin del rango a leer [Å], o {@code null}.
     */
    SyntheticSpectrum interpolate(ParameterVector point, Path dataPath, Double wavelengthStart, Double wavelengthStop);
}
