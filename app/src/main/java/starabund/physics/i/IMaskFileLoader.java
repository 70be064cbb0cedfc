package starabund.physics.i;

import starabund.config.SpectralMode;
import starabund.domain.exception.MissingMaskFileException;
import starabund.domain.spectrum.FitMask;
import starabund.domain.spectrum.ObservedSpectrum;
import starabund.domain.spectrum.WavelengthWindow;

import java.nio.file.Path;
import java.util.List;

/**
 * Cargador externo de definiciones de máscara (ventanas de longitud de onda).
 */
public interface IMaskFileLoader {

    /**
     * Localiza y lee las ventanas de la máscara {@code name} para un modo.
     *
     * @throws MissingMaskFileException si la definición no existe o no se puede leer.
     */
    List<WavelengthWindow> locate(String name, SpectralMode mode, Path root);

    /**
     * Máscara de los píxeles válidos que caen dentro de alguna ventana.
     */
    FitMask constructMask(ObservedSpectrum spectrum, List<WavelengthWindow> windows);

    /**
     * Máscara general: píxeles válidos del espectro, sin ventanas.
     */
    FitMask constructMask(ObservedSpectrum spectrum);
}
