package starabund.config;

import lombok.Builder;
import lombok.Value;
import starabund.domain.fit.ParameterBounds;
import starabund.domain.fit.ParameterVector;
import starabund.domain.spectrum.WavelengthWindow;

import java.util.Map;

/**
 * Constantes físicas y numéricas del pipeline agrupadas en un único objeto inmutable.
 * <p>
 * Se construye una vez al arrancar el proceso ({@link #standard()}) y se pasa
 * explícitamente a cada componente, de modo que el comportamiento del solver queda
 * determinado solo por sus entradas. Los tests construyen variantes con {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class SpectralDefaults {

    /**
     * Conversión FWHM -> σ gaussiana.
     */
    double fwhmToSigma;

    /**
     * FWHM instrumental [Å] por brazo: "blue", "redlr", "redmr", "nir".
     */
    Map<String, Double> resolutionFwhm;

    /**
     * Cobertura del instrumento por brazo y modo: "bluelr", "bluemr", "redlr", "redmr", "nir".
     */
    Map<String, WavelengthWindow> instrumentCoverage;

    /**
     * Cobertura de las rejillas sintéticas; se interpretan como [start, stop).
     */
    WavelengthWindow blueGridCoverage;
    WavelengthWindow redGridCoverage;

    /**
     * Rango de lectura pasado al interpolador de cada rejilla. {@code null} = rango propio de la rejilla.
     */
    Double blueGridStart;
    Double blueGridStop;
    Double redGridStart;
    Double redGridStop;

    /**
     * Peso del píxel ancla fotométrico: σ_ancla = σ_Teff · sqrt(flexFactor / N_pix).
     */
    double flexFactor;

    // Umbrales de convergencia del bucle de continuo
    double teffThreshold;
    double fehThreshold;
    double alphaFeThreshold;
    double loggThreshold;
    int maxIterations;

    // Semillas
    double fehSeed;
    double alphaFeSeed;
    double loggSeed;

    ParameterBounds bounds;

    /**
     * Tolerancia relativa (coste, parámetros y ortogonalidad) de cada ajuste no lineal.
     */
    double optimizerTolerance;
    int maxEvaluations;
    int maxOptimizerIterations;

    /**
     * Paso relativo de las diferencias finitas del jacobiano: h = step · max(|x|, 1).
     */
    double jacobianRelativeStep;

    public static SpectralDefaults standard() {
        return SpectralDefaults.builder()
                .fwhmToSigma(1.0 / 2.35)
                .resolutionFwhm(Map.of(
                        "blue", 2.1,
                        "redlr", 2.7,
                        "redmr", 1.6,
                        "nir", 2.4))
                .instrumentCoverage(Map.of(
                        "bluemr", new WavelengthWindow(3800.0, 6500.0),
                        "bluelr", new WavelengthWindow(3800.0, 6300.0),
                        "redlr", new WavelengthWindow(6300.0, 9700.0),
                        "redmr", new WavelengthWindow(7100.0, 8850.0),
                        "nir", new WavelengthWindow(9400.0, 12600.0)))
                .blueGridCoverage(new WavelengthWindow(4100.0, 6300.0))
                .redGridCoverage(new WavelengthWindow(6300.0, 9100.0))
                .blueGridStart(null)
                .blueGridStop(null)
                .redGridStart(6300.0)
                .redGridStop(9100.0)
                .flexFactor(400.0)
                .teffThreshold(1.0)
                .fehThreshold(0.001)
                .alphaFeThreshold(0.001)
                .loggThreshold(0.001)
                .maxIterations(50)
                .fehSeed(-2.0)
                .alphaFeSeed(0.0)
                .loggSeed(1.0)
                .bounds(ParameterBounds.standard())
                .optimizerTolerance(1e-10)
                .maxEvaluations(2000)
                .maxOptimizerIterations(500)
                .jacobianRelativeStep(1e-6)
                .build();
    }

    public double fwhm(String arm) {
        Double value = resolutionFwhm.get(arm);
        if (value == null) {
            throw new IllegalArgumentException("No hay resolución definida para el brazo " + arm);
        }
        return value;
    }

    public WavelengthWindow coverage(String arm) {
        WavelengthWindow window = instrumentCoverage.get(arm);
        if (window == null) {
            throw new IllegalArgumentException("No hay cobertura definida para " + arm);
        }
        return window;
    }

    /**
     * Vector inicial del bucle: Teff y logg fotométricos, [Fe/H] y [alpha/Fe] por defecto.
     * Con logg libre, la semilla de logg es {@link #getLoggSeed()}.
     */
    public ParameterVector seed(double photometricTeff, double photometricLogg, boolean fitLogg) {
        return new ParameterVector(photometricTeff, fehSeed, alphaFeSeed, fitLogg ? loggSeed : photometricLogg);
    }
}
