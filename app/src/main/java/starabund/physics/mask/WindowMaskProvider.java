package starabund.physics.mask;

import lombok.extern.slf4j.Slf4j;
import starabund.config.SpectralMode;
import starabund.domain.spectrum.FitMask;
import starabund.domain.spectrum.ObservedSpectrum;
import starabund.domain.spectrum.SpectralMasks;
import starabund.domain.spectrum.WavelengthWindow;
import starabund.physics.i.IMaskFileLoader;
import starabund.physics.i.IMaskProvider;

import java.nio.file.Path;
import java.util.List;

/**
 * Construye las tres máscaras del ajuste (metalicidad, alfa, general) a partir de las
 * ventanas de longitud de onda definidas para cada modo del instrumento.
 */
@Slf4j
public class WindowMaskProvider implements IMaskProvider {

    public static final String METALLICITY_MASK = "mask_fe_pfs_final";
    public static final String ALPHA_MASK = "mask_alphafe_pfs_final";

    private final IMaskFileLoader loader;

    public WindowMaskProvider(IMaskFileLoader loader) {
        this.loader = loader;
    }

    @Override
    public SpectralMasks loadMasks(ObservedSpectrum spectrum, SpectralMode mode, Path root) {
        // Ambas definiciones deben existir antes de construir nada
        List<WavelengthWindow> fehWindows = loader.locate(METALLICITY_MASK, mode, root);
        List<WavelengthWindow> alphaWindows = loader.locate(ALPHA_MASK, mode, root);

        FitMask metallicity = loader.constructMask(spectrum, fehWindows);
        FitMask alpha = loader.constructMask(spectrum, alphaWindows);
        FitMask general = loader.constructMask(spectrum);

        log.info("Máscaras de {} ({}): [Fe/H]={} px, [alpha/Fe]={} px, general={} px",
                spectrum.getId(), mode, metallicity.count(), alpha.count(), general.count());
        return new SpectralMasks(metallicity, alpha, general);
    }
}
