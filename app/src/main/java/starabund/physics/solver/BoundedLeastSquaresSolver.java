package starabund.physics.solver;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import starabund.config.SpectralDefaults;
import starabund.domain.exception.OptimizerFailureException;
import starabund.domain.fit.NonlinearFitResult;
import starabund.physics.i.ISolverComponent;

/**
 * Mínimos cuadrados no lineales acotados (Levenberg-Marquardt de commons-math3).
 * <p>
 * - Las cotas se imponen por construcción: un {@link ParameterValidator} recorta cada
 *   punto propuesto antes de evaluar el modelo.
 * - El jacobiano se calcula por diferencias finitas hacia delante (hacia atrás si el paso
 *   saldría de la cota superior).
 * - Los pesos son incertidumbres absolutas (1/σ²): la covarianza devuelta es (JᵀWJ)⁻¹
 *   sin reescalar por el χ² reducido.
 * <p>
 * Sin estado mutable: una instancia puede reutilizarse para todos los ajustes de un espectro.
 */
@Slf4j
public class BoundedLeastSquaresSolver implements ISolverComponent {

    // Umbral de singularidad para la inversión de JᵀWJ
    private static final double COVARIANCE_SINGULARITY_THRESHOLD = 1e-14;

    private final double tolerance;
    private final int maxEvaluations;
    private final int maxIterations;
    private final double relativeStep;

    public BoundedLeastSquaresSolver(SpectralDefaults defaults) {
        this.tolerance = defaults.getOptimizerTolerance();
        this.maxEvaluations = defaults.getMaxEvaluations();
        this.maxIterations = defaults.getMaxOptimizerIterations();
        this.relativeStep = defaults.getJacobianRelativeStep();
    }

    @Override
    public String getName() {
        return "Bounded-Levenberg-Marquardt";
    }

    @Override
    public String getDescription() {
        return "Levenberg-Marquardt con cotas por recorte, jacobiano por diferencias finitas y pesos absolutos.";
    }

    /**
     * Resuelve el problema.
     *
     * @throws OptimizerFailureException si se agota el presupuesto de evaluaciones o iteraciones,
     *                                   el optimizador no puede reducir más el coste, o la covarianza es singular.
     */
    public NonlinearFitResult solve(FitProblem problem) {
        final int n = problem.dimension();
        final double[] lower = problem.lower();
        final double[] upper = problem.upper();

        double[] start = new double[n];
        for (int j = 0; j < n; j++) {
            start[j] = clamp(problem.start()[j], lower[j], upper[j]);
        }

        MultivariateJacobianFunction function = point -> evaluate(problem, point.toArray());

        LeastSquaresProblem lsp = new LeastSquaresBuilder()
                .start(start)
                .model(function)
                .target(problem.observed())
                .weight(new DiagonalMatrix(problem.weights()))
                .parameterValidator(new BoundsValidator(lower, upper))
                .lazyEvaluation(false)
                .maxEvaluations(maxEvaluations)
                .maxIterations(maxIterations)
                .build();

        LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(tolerance)
                .withParameterRelativeTolerance(tolerance)
                .withOrthoTolerance(tolerance);

        try {
            LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(lsp);
            double[] best = optimum.getPoint().toArray();
            for (int j = 0; j < n; j++) {
                best[j] = clamp(best[j], lower[j], upper[j]);
            }
            double[][] covariance = optimum.getCovariances(COVARIANCE_SINGULARITY_THRESHOLD).getData();
            double cost = optimum.getCost();

            NonlinearFitResult result = new NonlinearFitResult(
                    problem.parameters(), best, covariance,
                    cost * cost, optimum.getEvaluations(), optimum.getIterations());
            log.debug("Ajuste {} completado: {}", problem.parameters(), result);
            return result;
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new OptimizerFailureException("El ajuste de " + problem.parameters()
                    + " no alcanzó la tolerancia " + tolerance + ": " + e.getMessage(), e);
        }
    }

    private Pair<RealVector, RealMatrix> evaluate(FitProblem problem, double[] x) {
        final int n = x.length;
        double[] value = problem.model().apply(x);
        double[][] jacobian = new double[value.length][n];

        for (int j = 0; j < n; j++) {
            double h = relativeStep * Math.max(Math.abs(x[j]), 1.0);
            if (x[j] + h > problem.upper()[j]) {
                h = -h;
            }
            double[] shifted = x.clone();
            shifted[j] += h;
            double[] valueShifted = problem.model().apply(shifted);
            for (int i = 0; i < value.length; i++) {
                jacobian[i][j] = (valueShifted[i] - value[i]) / h;
            }
        }
        return new Pair<>(new ArrayRealVector(value, false), new Array2DRowRealMatrix(jacobian, false));
    }

    private static double clamp(double value, double lower, double upper) {
        return Math.max(lower, Math.min(upper, value));
    }

    /**
     * Recorta cada componente a su intervalo [lower, upper].
     */
    private static class BoundsValidator implements ParameterValidator {
        private final double[] lower;
        private final double[] upper;

        BoundsValidator(double[] lower, double[] upper) {
            this.lower = lower;
            this.upper = upper;
        }

        @Override
        public RealVector validate(RealVector params) {
            double[] p = params.toArray();
            for (int j = 0; j < p.length; j++) {
                p[j] = clamp(p[j], lower[j], upper[j]);
            }
            return new ArrayRealVector(p, false);
        }
    }
}
