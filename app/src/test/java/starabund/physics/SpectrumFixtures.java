package starabund.physics;

import starabund.config.SpectralDefaults;
import starabund.config.SpectralMode;
import starabund.domain.fit.ParameterVector;
import starabund.domain.spectrum.FitMask;
import starabund.domain.spectrum.ObservedSpectrum;
import starabund.domain.spectrum.ResolutionProfile;
import starabund.domain.spectrum.SpectralMasks;
import starabund.domain.spectrum.SyntheticSpectrum;
import starabund.domain.spectrum.WavelengthWindow;
import starabund.factory.ResolutionProfileFactory;
import starabund.physics.resolution.GaussianKernelSmoother;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Espectros observados sintéticos y máscaras coherentes con {@link AnalyticSyntheticGrid}.
 * <p>
 * Todas las máscaras incluyen dos ventanas de continuo en los extremos de la malla observada,
 * de modo que el recorte del proveedor es el mismo para cualquier máscara y el modelo
 * reproduce exactamente los datos sin ruido.
 */
public final class SpectrumFixtures {

    public static final double OBS_START = 4200.0;
    public static final double OBS_STOP = 6200.0;
    public static final double OBS_STEP = 0.5;
    public static final double LINE_HALF_WINDOW = 3.0;

    private static final WavelengthWindow BLUE_EDGE = new WavelengthWindow(OBS_START, OBS_START + 10.0);
    private static final WavelengthWindow RED_EDGE = new WavelengthWindow(OBS_STOP - 10.0, OBS_STOP);

    private SpectrumFixtures() {
    }

    public static double[] observedWavelengths() {
        int n = (int) Math.round((OBS_STOP - OBS_START) / OBS_STEP) + 1;
        double[] w = new double[n];
        for (int i = 0; i < n; i++) {
            w[i] = OBS_START + i * OBS_STEP;
        }
        return w;
    }

    public static ResolutionProfile profile(double[] wavelengths) {
        return new ResolutionProfileFactory(SpectralDefaults.standard()).create(wavelengths, SpectralMode.MEDIUM);
    }

    /**
     * Flujo observado (continuo = 1) sin ruido para los parámetros dados.
     */
    public static double[] modelFlux(ParameterVector truth, double[] wavelengths) {
        SyntheticSpectrum nativeSpectrum = new AnalyticSyntheticGrid()
                .interpolate(truth, null, null, null)
                .trim(wavelengths[0], wavelengths[wavelengths.length - 1]);
        return new GaussianKernelSmoother().smooth(nativeSpectrum, wavelengths, profile(wavelengths).sigma());
    }

    public static ObservedSpectrum noiseless(String id, ParameterVector truth, double inverseVariance) {
        double[] w = observedWavelengths();
        double[] ivar = new double[w.length];
        Arrays.fill(ivar, inverseVariance);
        return new ObservedSpectrum(id, w, modelFlux(truth, w), ivar);
    }

    public static ObservedSpectrum noisy(String id, ParameterVector truth, double inverseVariance, long seed) {
        double[] w = observedWavelengths();
        double[] flux = modelFlux(truth, w);
        Random random = new Random(seed);
        double sigma = 1.0 / Math.sqrt(inverseVariance);
        for (int i = 0; i < flux.length; i++) {
            flux[i] += sigma * random.nextGaussian();
        }
        double[] ivar = new double[w.length];
        Arrays.fill(ivar, inverseVariance);
        return new ObservedSpectrum(id, w, flux, ivar);
    }

    public static List<WavelengthWindow> metallicityWindows() {
        return windowsAround(AnalyticSyntheticGrid.FE_LINES);
    }

    public static List<WavelengthWindow> alphaWindows() {
        return windowsAround(AnalyticSyntheticGrid.ALPHA_LINES);
    }

    public static SpectralMasks masks(ObservedSpectrum spectrum) {
        double[] w = spectrum.getWavelength();
        return new SpectralMasks(
                maskOf(w, metallicityWindows()),
                maskOf(w, alphaWindows()),
                FitMask.all(w.length));
    }

    /**
     * Máscaras con un número exacto de píxeles de metalicidad y alfa. Cada una incluye los dos
     * píxeles extremos de la malla; el resto se reparte entre las líneas, los más cercanos al centro primero.
     */
    public static SpectralMasks masksWithCounts(ObservedSpectrum spectrum, int metallicityPixels, int alphaPixels) {
        double[] w = spectrum.getWavelength();
        return new SpectralMasks(
                maskWithCount(w, AnalyticSyntheticGrid.FE_LINES, metallicityPixels),
                maskWithCount(w, AnalyticSyntheticGrid.ALPHA_LINES, alphaPixels),
                FitMask.all(w.length));
    }

    private static FitMask maskWithCount(double[] wavelengths, double[][] lines, int pixels) {
        boolean[] selected = new boolean[wavelengths.length];
        selected[0] = true;
        selected[wavelengths.length - 1] = true;
        int remaining = pixels - 2;
        for (int l = 0; l < lines.length; l++) {
            int perLine = remaining / lines.length + (l < remaining % lines.length ? 1 : 0);
            int centre = (int) Math.round((lines[l][0] - wavelengths[0]) / OBS_STEP);
            for (int k = 0; k < perLine; k++) {
                // 0, -1, +1, -2, +2, ...
                int offset = (k % 2 == 1) ? -(k + 1) / 2 : k / 2;
                selected[centre + offset] = true;
            }
        }
        return new FitMask(selected);
    }

    private static List<WavelengthWindow> windowsAround(double[][] lines) {
        List<WavelengthWindow> windows = new ArrayList<>();
        windows.add(BLUE_EDGE);
        for (double[] line : lines) {
            windows.add(new WavelengthWindow(line[0] - LINE_HALF_WINDOW, line[0] + LINE_HALF_WINDOW));
        }
        windows.add(RED_EDGE);
        return windows;
    }

    private static FitMask maskOf(double[] wavelengths, List<WavelengthWindow> windows) {
        boolean[] selected = new boolean[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            for (WavelengthWindow window : windows) {
                if (window.containsClosed(wavelengths[i])) {
                    selected[i] = true;
                    break;
                }
            }
        }
        return new FitMask(selected);
    }
}
