package starabund.physics.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import starabund.domain.exception.DataCoverageException;
import starabund.domain.spectrum.FitMask;
import starabund.domain.spectrum.ObservedSpectrum;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pruebas de extracción de datos por máscara y del píxel ancla fotométrico.
 */
class FitArraysTest {

    private final ObservedSpectrum spectrum = new ObservedSpectrum("s",
            new double[]{5000.0, 5001.0, 5002.0, 5003.0},
            new double[]{0.9, 0.8, 0.7, 0.6},
            new double[]{4.0, 4.0, 4.0, 4.0});

    @Test
    @DisplayName("El ancla se antepone con σ = σ_Teff·sqrt(flex/N)")
    void withAnchor_shouldPrependScaledPseudoPixel() {
        // ARRANGE
        FitArrays data = FitArrays.of(spectrum, FitMask.all(4));

        // ACT
        FitArrays anchored = data.withAnchor(5200.0, 100.0, 400.0);

        // ASSERT
        double expectedSigma = 100.0 * Math.sqrt(400.0 / 4.0);
        assertTrue(anchored.anchored());
        assertEquals(4, anchored.pixelCount());
        assertEquals(5, anchored.flux().length);
        assertEquals(5200.0, anchored.flux()[0]);
        assertEquals(5000.0, anchored.wavelengths()[0]);
        assertEquals(1.0 / (expectedSigma * expectedSigma), anchored.weights()[0], 1e-15);
        assertArrayEquals(data.wavelengths(), anchored.spectralWavelengths());
    }

    @Test
    @DisplayName("El peso relativo del ancla disminuye al crecer el número de píxeles")
    void anchorSigma_shouldGrowWithFewerPixels() {
        FitArrays four = FitArrays.of(spectrum, FitMask.all(4));
        FitArrays two = FitArrays.of(spectrum, new FitMask(new boolean[]{true, true, false, false}));

        assertTrue(two.anchorSigma(100.0, 400.0) > four.anchorSigma(100.0, 400.0));
    }

    @Test
    @DisplayName("Una máscara vacía lanza DataCoverageException")
    void of_emptyMask_shouldThrow() {
        assertThrows(DataCoverageException.class, () -> FitArrays.of(spectrum, new FitMask(new boolean[4])));
    }

    @Test
    @DisplayName("No se puede anteponer el ancla dos veces")
    void withAnchor_twice_shouldThrow() {
        FitArrays anchored = FitArrays.of(spectrum, FitMask.all(4)).withAnchor(5000.0, 50.0, 400.0);

        assertThrows(IllegalStateException.class, () -> anchored.withAnchor(5000.0, 50.0, 400.0));
    }
}
