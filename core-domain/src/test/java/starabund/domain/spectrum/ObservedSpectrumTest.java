package starabund.domain.spectrum;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pruebas unitarias para {@link ObservedSpectrum}: inmutabilidad de la observación y
 * contrato de acceso normalizado al continuo.
 */
class ObservedSpectrumTest {

    private ObservedSpectrum spectrum;

    @BeforeEach
    void setUp() {
        spectrum = new ObservedSpectrum("star-001",
                new double[]{5000.0, 5000.5, 5001.0, 5001.5},
                new double[]{2.0, 1.0, Double.NaN, 4.0},
                new double[]{100.0, 0.0, 100.0, 25.0});
    }

    @Test
    @DisplayName("El continuo inicial es 1 en todos los píxeles")
    void constructor_shouldInitializeUnitContinuum() {
        assertArrayEquals(new double[]{1.0, 1.0, 1.0, 1.0}, spectrum.getContinuum());
    }

    @Test
    @DisplayName("Los arrays devueltos son copias: modificarlos no altera el espectro")
    void getters_shouldReturnCopies() {
        // ARRANGE
        double[] flux = spectrum.getFlux();

        // ACT
        flux[0] = -99.0;

        // ASSERT
        assertEquals(2.0, spectrum.getFluxAt(0));
    }

    @Test
    @DisplayName("Debe rechazar arrays de longitudes distintas")
    void constructor_withMismatchedArrays_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new ObservedSpectrum("x",
                new double[]{1.0, 2.0}, new double[]{1.0}, new double[]{1.0, 1.0}));
    }

    @Test
    @DisplayName("setContinuum debe rechazar un continuo de otra longitud")
    void setContinuum_withWrongLength_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> spectrum.setContinuum(new double[]{1.0}));
    }

    @Test
    @DisplayName("El flujo normalizado divide por el continuo y anula los valores no finitos")
    void normalizedFlux_shouldDivideByContinuum() {
        // ARRANGE
        spectrum.setContinuum(new double[]{2.0, 2.0, 2.0, 0.0});

        // ACT
        double[] normalized = spectrum.normalizedFlux(FitMask.all(4));

        // ASSERT
        assertArrayEquals(new double[]{1.0, 0.5, 0.0, 0.0}, normalized, 1e-12);
    }

    @Test
    @DisplayName("Los pesos son ivar·continuo² y valen 0 en píxeles inválidos")
    void normalizedWeights_shouldScaleInverseVarianceByContinuum() {
        // ARRANGE
        spectrum.setContinuum(new double[]{2.0, 2.0, 2.0, 2.0});

        // ACT
        double[] weights = spectrum.normalizedWeights(FitMask.all(4));

        // ASSERT
        assertEquals(400.0, weights[0], 1e-12);
        assertEquals(0.0, weights[1], "ivar nula => peso nulo");
        assertEquals(0.0, weights[2], "flujo NaN => peso nulo");
        assertEquals(100.0, weights[3], 1e-12);
    }

    @Test
    @DisplayName("Los accesos enmascarados respetan el orden de los píxeles seleccionados")
    void maskedAccess_shouldFollowMaskOrder() {
        // ARRANGE
        FitMask mask = new FitMask(new boolean[]{false, true, false, true});

        // ACT
        double[] wavelengths = spectrum.maskedWavelengths(mask);
        double[] flux = spectrum.normalizedFlux(mask);

        // ASSERT
        assertArrayEquals(new double[]{5000.5, 5001.5}, wavelengths);
        assertArrayEquals(new double[]{1.0, 4.0}, flux);
    }

    @Test
    @DisplayName("Una máscara de otro espectro debe rechazarse")
    void normalizedFlux_withForeignMask_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> spectrum.normalizedFlux(FitMask.all(3)));
    }
}
