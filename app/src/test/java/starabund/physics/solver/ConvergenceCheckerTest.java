package starabund.physics.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import starabund.config.SpectralDefaults;
import starabund.domain.fit.ParameterVector;

import static org.junit.jupiter.api.Assertions.*;

class ConvergenceCheckerTest {

    private final ConvergenceChecker checker = new ConvergenceChecker(SpectralDefaults.standard());
    private final ParameterVector previous = new ParameterVector(5000.0, -1.0, 0.2, 2.0);

    @Test
    @DisplayName("Diferencias por debajo de todos los umbrales convergen")
    void smallChanges_shouldConverge() {
        ParameterVector current = new ParameterVector(5000.9, -1.0009, 0.2009, 2.5);

        assertTrue(checker.isConverged(previous, current, false));
    }

    @Test
    @DisplayName("El umbral es estricto: una diferencia igual al umbral no converge")
    void thresholdIsStrict() {
        assertFalse(checker.isConverged(previous, previous.withTeff(5001.0), false));
    }

    @Test
    @DisplayName("logg solo cuenta cuando es parámetro libre")
    void logg_onlyWhenFree() {
        ParameterVector current = previous.withLogg(2.1);

        assertTrue(checker.isConverged(previous, current, false));
        assertFalse(checker.isConverged(previous, current, true));
    }

    @Test
    @DisplayName("Un cambio en [alpha/Fe] por encima del umbral impide la convergencia")
    void alphaChange_shouldPreventConvergence() {
        assertFalse(checker.isConverged(previous, previous.withAlphaFe(0.21), false));
    }
}
