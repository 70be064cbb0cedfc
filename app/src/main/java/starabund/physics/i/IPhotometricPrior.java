package starabund.physics.i;

import starabund.domain.spectrum.ObservedSpectrum;
import starabund.domain.spectrum.PhotometricEstimate;

/**
 * Estimación externa de Teff y logg a partir de la fotometría de banda ancha.
 */
@FunctionalInterface
public interface IPhotometricPrior {
    PhotometricEstimate estimate(ObservedSpectrum spectrum, double distanceModulus, double distanceModulusError);
}
