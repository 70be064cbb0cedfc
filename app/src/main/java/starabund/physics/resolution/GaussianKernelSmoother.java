package starabund.physics.resolution;

import starabund.domain.spectrum.SyntheticSpectrum;
import starabund.physics.i.IGaussianSmoother;
import starabund.physics.i.ISolverComponent;

import java.util.Arrays;

/**
 * Suavizado gaussiano de anchura variable y remuestreo en una sola pasada.
 * <p>
 * Para cada píxel destino λt con anchura σ, el flujo es la media ponderada por
 * exp(-½((λ-λt)/σ)²) de los puntos nativos en [λt - 4σ, λt + 4σ]. Si la ventana no
 * contiene puntos nativos (o σ = 0) se interpola linealmente, con extrapolación
 * constante en los bordes.
 */
public class GaussianKernelSmoother implements IGaussianSmoother, ISolverComponent {

    private static final double KERNEL_HALF_WIDTH = 4.0; // en unidades de σ

    @Override
    public String getName() {
        return "Gaussian-Kernel";
    }

    @Override
    public String getDescription() {
        return "Convolución gaussiana normalizada de σ por píxel (truncada a ±4σ) evaluada directamente en la malla destino.";
    }

    @Override
    public double[] smooth(SyntheticSpectrum model, double[] targetWavelengths, double[] sigma) {
        if (sigma.length != targetWavelengths.length) {
            throw new IllegalArgumentException("Se necesita una σ por píxel destino.");
        }
        final double[] w = model.wavelengths();
        final double[] f = model.flux();
        double[] out = new double[targetWavelengths.length];
        if (w.length == 0) {
            Arrays.fill(out, Double.NaN);
            return out;
        }

        for (int t = 0; t < targetWavelengths.length; t++) {
            final double center = targetWavelengths[t];
            final double s = sigma[t];
            if (s <= 0.0) {
                out[t] = interpolate(w, f, center);
                continue;
            }
            int from = lowerBound(w, center - KERNEL_HALF_WIDTH * s);
            int to = lowerBound(w, center + KERNEL_HALF_WIDTH * s); // exclusivo
            double sumW = 0.0;
            double sumWF = 0.0;
            for (int i = from; i < to; i++) {
                double u = (w[i] - center) / s;
                double k = Math.exp(-0.5 * u * u);
                sumW += k;
                sumWF += k * f[i];
            }
            out[t] = (sumW > 0.0) ? sumWF / sumW : interpolate(w, f, center);
        }
        return out;
    }

    /**
     * Primer índice con w[i] >= value.
     */
    private static int lowerBound(double[] w, double value) {
        int lo = 0;
        int hi = w.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (w[mid] < value) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    static double interpolate(double[] w, double[] f, double x) {
        if (x <= w[0]) return f[0];
        if (x >= w[w.length - 1]) return f[f.length - 1];
        int hi = lowerBound(w, x);
        int lo = hi - 1;
        double span = w[hi] - w[lo];
        if (span <= 0.0) return f[hi];
        double frac = (x - w[lo]) / span;
        return f[lo] + frac * (f[hi] - f[lo]);
    }
}
