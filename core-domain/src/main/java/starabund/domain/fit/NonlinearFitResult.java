package starabund.domain.fit;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Resultado de un ajuste no lineal acotado sobre un subconjunto de parámetros.
 *
 * @param parameters  Parámetros libres, en el orden de {@code values} y de la covarianza.
 * @param values      Mejor ajuste.
 * @param covariance  Matriz de covarianza (incertidumbres absolutas).
 * @param chiSquare   χ² ponderado en el mínimo.
 * @param evaluations Evaluaciones del modelo consumidas.
 * @param iterations  Iteraciones del optimizador.
 */
public record NonlinearFitResult(
        List<FitParameter> parameters,
        double[] values,
        double[][] covariance,
        double chiSquare,
        int evaluations,
        int iterations
) {

    public NonlinearFitResult {
        Objects.requireNonNull(parameters, "La lista de parámetros no puede ser nula.");
        Objects.requireNonNull(values, "Los valores ajustados no pueden ser nulos.");
        Objects.requireNonNull(covariance, "La covarianza no puede ser nula.");
        int n = parameters.size();
        if (values.length != n || covariance.length != n) {
            throw new IllegalArgumentException("Dimensiones inconsistentes en el resultado del ajuste.");
        }
        parameters = List.copyOf(parameters);
        values = values.clone();
        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            if (covariance[i].length != n) {
                throw new IllegalArgumentException("La covarianza debe ser cuadrada.");
            }
            copy[i] = covariance[i].clone();
        }
        covariance = copy;
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    /**
     * Copia profunda de la covarianza.
     */
    @Override
    public double[][] covariance() {
        double[][] copy = new double[covariance.length][];
        for (int i = 0; i < covariance.length; i++) {
            copy[i] = covariance[i].clone();
        }
        return copy;
    }

    private int indexOf(FitParameter parameter) {
        int idx = parameters.indexOf(parameter);
        if (idx < 0) {
            throw new IllegalArgumentException(parameter + " no es un parámetro libre de este ajuste.");
        }
        return idx;
    }

    public boolean isFree(FitParameter parameter) {
        return parameters.contains(parameter);
    }

    public double value(FitParameter parameter) {
        return values[indexOf(parameter)];
    }

    /**
     * sqrt de la entrada diagonal de la covarianza.
     */
    public double uncertainty(FitParameter parameter) {
        int i = indexOf(parameter);
        return Math.sqrt(covariance[i][i]);
    }

    /**
     * Aplica los valores ajustados sobre un vector base.
     */
    public ParameterVector applyTo(ParameterVector base) {
        ParameterVector out = base;
        for (int i = 0; i < parameters.size(); i++) {
            out = out.with(parameters.get(i), values[i]);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NonlinearFitResult that = (NonlinearFitResult) o;
        return Double.compare(chiSquare, that.chiSquare) == 0
                && evaluations == that.evaluations
                && iterations == that.iterations
                && parameters.equals(that.parameters)
                && Arrays.equals(values, that.values)
                && Arrays.deepEquals(covariance, that.covariance);
    }

    @Override
    public int hashCode() {
        int result = parameters.hashCode();
        result = 31 * result + Arrays.hashCode(values);
        result = 31 * result + Arrays.deepHashCode(covariance);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NonlinearFitResult{");
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(parameters.get(i).getLabel()).append('=').append(values[i])
                    .append("±").append(Math.sqrt(covariance[i][i]));
        }
        return sb.append(", chi2=").append(chiSquare).append(", evals=").append(evaluations).append('}').toString();
    }
}
