package starabund.factory;

import lombok.extern.slf4j.Slf4j;
import starabund.config.SpectralDefaults;
import starabund.config.SpectralMode;
import starabund.domain.spectrum.ResolutionProfile;
import starabund.domain.spectrum.WavelengthWindow;

/**
 * Construye el perfil de resolución instrumental (σ por píxel) a partir del modo
 * del espectrógrafo y de la malla observada.
 * <p>
 * Los píxeles dentro de la cobertura azul del modo (intervalo abierto) usan la FWHM
 * del brazo azul; el resto, la FWHM roja del modo. σ = FWHM · fwhmToSigma.
 */
@Slf4j
public class ResolutionProfileFactory {

    private final SpectralDefaults defaults;

    public ResolutionProfileFactory(SpectralDefaults defaults) {
        this.defaults = defaults;
    }

    public ResolutionProfile create(double[] wavelengths, SpectralMode mode) {
        WavelengthWindow blue = defaults.coverage("blue" + mode.getCode());
        double blueSigma = defaults.fwhm("blue") * defaults.getFwhmToSigma();
        double redSigma = defaults.fwhm("red" + mode.getCode()) * defaults.getFwhmToSigma();

        double[] sigma = new double[wavelengths.length];
        int bluePixels = 0;
        for (int i = 0; i < wavelengths.length; i++) {
            if (blue.containsOpen(wavelengths[i])) {
                sigma[i] = blueSigma;
                bluePixels++;
            } else {
                sigma[i] = redSigma;
            }
        }
        log.debug("Perfil de resolución ({}): {} píxeles azules (σ={} Å), {} rojos (σ={} Å)",
                mode, bluePixels, blueSigma, wavelengths.length - bluePixels, redSigma);
        return new ResolutionProfile(sigma);
    }
}
