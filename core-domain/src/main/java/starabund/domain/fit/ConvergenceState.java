package starabund.domain.fit;

import lombok.With;

import java.util.Objects;

/**
 * Estado inmutable del bucle de refinamiento del continuo.
 *
 * @param iteration Pasadas completadas del bucle.
 * @param previous  Iterado anterior, contra el que se mide la convergencia.
 * @param current   Último iterado (igual a {@code previous} antes de la primera pasada).
 * @param converged {@code true} si el último chequeo cumplió todos los umbrales.
 */
@With
public record ConvergenceState(int iteration, ParameterVector previous, ParameterVector current, boolean converged) {

    public ConvergenceState {
        Objects.requireNonNull(previous, "El iterado anterior no puede ser nulo.");
        Objects.requireNonNull(current, "El iterado actual no puede ser nulo.");
        if (iteration < 0) {
            throw new IllegalArgumentException("El número de iteraciones no puede ser negativo.");
        }
    }

    public static ConvergenceState initial(ParameterVector seed) {
        return new ConvergenceState(0, seed, seed, false);
    }

    /**
     * Registra el resultado de una pasada. Si no ha convergido, el nuevo iterado pasa a ser
     * el "anterior" de la siguiente pasada.
     */
    public ConvergenceState advance(ParameterVector next, boolean nextConverged) {
        ParameterVector newPrevious = nextConverged ? previous : next;
        return new ConvergenceState(iteration + 1, newPrevious, next, nextConverged);
    }

    /**
     * El bucle termina al converger o al agotar {@code maxIterations} pasadas.
     */
    public boolean isTerminal(int maxIterations) {
        return converged || iteration >= maxIterations;
    }
}
