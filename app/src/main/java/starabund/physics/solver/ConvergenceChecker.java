package starabund.physics.solver;

import starabund.config.SpectralDefaults;
import starabund.domain.fit.ParameterVector;

/**
 * Criterio de convergencia del bucle de continuo: todas las diferencias absolutas
 * entre iterados consecutivos por debajo (estrictamente) de su umbral.
 * logg solo cuenta cuando es parámetro libre.
 */
public class ConvergenceChecker {

    private final double teffThreshold;
    private final double fehThreshold;
    private final double alphaFeThreshold;
    private final double loggThreshold;

    public ConvergenceChecker(SpectralDefaults defaults) {
        this.teffThreshold = defaults.getTeffThreshold();
        this.fehThreshold = defaults.getFehThreshold();
        this.alphaFeThreshold = defaults.getAlphaFeThreshold();
        this.loggThreshold = defaults.getLoggThreshold();
    }

    public boolean isConverged(ParameterVector previous, ParameterVector current, boolean fitLogg) {
        boolean converged = Math.abs(current.teff() - previous.teff()) < teffThreshold
                && Math.abs(current.feh() - previous.feh()) < fehThreshold
                && Math.abs(current.alphaFe() - previous.alphaFe()) < alphaFeThreshold;
        if (fitLogg) {
            converged = converged && Math.abs(current.logg() - previous.logg()) < loggThreshold;
        }
        return converged;
    }
}
