package starabund.physics.solver;

import lombok.Builder;
import starabund.domain.fit.FitParameter;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Problema de mínimos cuadrados ponderado y acotado.
 *
 * @param parameters Parámetros libres, en el orden de los vectores.
 * @param start      Punto inicial (se recorta a las cotas).
 * @param lower      Cotas inferiores.
 * @param upper      Cotas superiores.
 * @param observed   Datos a ajustar.
 * @param weights    1/σ² de cada dato; 0 excluye el dato.
 * @param model      Predicción del modelo para un vector de parámetros libres; misma longitud que {@code observed}.
 */
@Builder
public record FitProblem(
        List<FitParameter> parameters,
        double[] start,
        double[] lower,
        double[] upper,
        double[] observed,
        double[] weights,
        Function<double[], double[]> model
) {

    public FitProblem {
        Objects.requireNonNull(parameters, "Los parámetros libres no pueden ser nulos.");
        Objects.requireNonNull(model, "La función modelo no puede ser nula.");
        int n = parameters.size();
        if (n == 0) {
            throw new IllegalArgumentException("El ajuste necesita al menos un parámetro libre.");
        }
        if (start.length != n || lower.length != n || upper.length != n) {
            throw new IllegalArgumentException("Punto inicial y cotas deben tener un valor por parámetro.");
        }
        if (observed.length != weights.length) {
            throw new IllegalArgumentException("Se necesita un peso por dato observado.");
        }
        if (observed.length < n) {
            throw new IllegalArgumentException("Hay menos datos (" + observed.length + ") que parámetros (" + n + ").");
        }
        parameters = List.copyOf(parameters);
    }

    public int dimension() {
        return parameters.size();
    }
}
