package starabund.physics.i;

import starabund.config.SpectralMode;
import starabund.domain.spectrum.ObservedSpectrum;
import starabund.domain.spectrum.SpectralMasks;

import java.nio.file.Path;

@FunctionalInterface
public interface IMaskProvider {
    SpectralMasks loadMasks(ObservedSpectrum spectrum, SpectralMode mode, Path root);
}
