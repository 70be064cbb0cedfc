package starabund.physics;

import starabund.domain.fit.ParameterVector;
import starabund.domain.spectrum.SyntheticSpectrum;
import starabund.physics.i.ISyntheticGrid;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rejilla sintética analítica para tests: continuo plano con líneas gaussianas de absorción
 * cuya profundidad depende de los cuatro parámetros.
 * <p>
 * - Líneas de Fe: profundidad según [Fe/H], con sensibilidad a Teff (excitación) y a logg
 *   de signo alterno, para que Teff, [Fe/H] y logg sean separables.
 * - Líneas alfa: profundidad según [Fe/H] + [alpha/Fe].
 * <p>
 * Profundidad: d = 0.8·A/(1+A), con A = s·exp(ln10·abund/2 + c·(Teff-5000)/1000 + g·(logg-2.5)).
 */
public class AnalyticSyntheticGrid implements ISyntheticGrid {

    public static final double STEP = 0.5;
    public static final double DEFAULT_START = 4000.0;
    public static final double DEFAULT_STOP = 6400.0;
    public static final double LINE_WIDTH = 0.5;

    // {centro, s, c, g}
    public static final double[][] FE_LINES = {
            {4300, 4.0, 0.8, 0.4}, {4450, 4.0, -0.8, 0.4}, {4600, 4.0, 0.8, -0.4}, {4750, 4.0, -0.8, -0.4},
            {4900, 3.0, 0.8, 0.4}, {5050, 3.0, -0.8, 0.4}, {5200, 3.0, 0.8, -0.4}, {5350, 3.0, -0.8, -0.4},
            {5500, 5.0, 0.8, 0.4}, {5650, 5.0, -0.8, 0.4}, {5800, 5.0, 0.8, -0.4}, {5950, 5.0, -0.8, -0.4},
            {6100, 4.0, 0.0, 0.0}
    };
    public static final double[][] ALPHA_LINES = {
            {4375, 4.0, 0.3, 0.2}, {4675, 4.0, 0.3, 0.2}, {4975, 4.0, 0.3, 0.2},
            {5275, 4.0, 0.3, 0.2}, {5575, 4.0, 0.3, 0.2}, {5875, 4.0, 0.3, 0.2}
    };

    private final AtomicInteger calls = new AtomicInteger();

    public int getCalls() {
        return calls.get();
    }

    @Override
    public SyntheticSpectrum interpolate(ParameterVector point, Path dataPath, Double wavelengthStart, Double wavelengthStop) {
        calls.incrementAndGet();
        double start = wavelengthStart != null ? wavelengthStart : DEFAULT_START;
        double stop = wavelengthStop != null ? wavelengthStop : DEFAULT_STOP;
        int n = (int) Math.floor((stop - start) / STEP) + 1;

        double[] w = new double[n];
        double[] f = new double[n];
        for (int i = 0; i < n; i++) {
            w[i] = start + i * STEP;
            f[i] = fluxAt(w[i], point);
        }
        return new SyntheticSpectrum(w, f);
    }

    public static double fluxAt(double wavelength, ParameterVector p) {
        double flux = 1.0;
        for (double[] line : FE_LINES) {
            flux -= profile(wavelength, line, p, p.feh());
        }
        for (double[] line : ALPHA_LINES) {
            flux -= profile(wavelength, line, p, p.feh() + p.alphaFe());
        }
        return flux;
    }

    private static double profile(double wavelength, double[] line, ParameterVector p, double abundance) {
        double u = (wavelength - line[0]) / LINE_WIDTH;
        if (Math.abs(u) > 10) return 0.0;
        double a = line[1] * Math.exp(Math.log(10) * abundance / 2.0
                + line[2] * (p.teff() - 5000.0) / 1000.0
                + line[3] * (p.logg() - 2.5));
        double depth = 0.8 * a / (1.0 + a);
        return depth * Math.exp(-0.5 * u * u);
    }
}
