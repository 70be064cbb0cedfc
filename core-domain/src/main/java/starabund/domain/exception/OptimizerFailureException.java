package starabund.domain.exception;

/**
 * Un ajuste de mínimos cuadrados acotado no ha alcanzado su tolerancia dentro de su
 * presupuesto de evaluaciones, o su matriz de covarianza es singular.
 * Se propaga al llamador sin reintentos.
 */
public class OptimizerFailureException extends AbundanceException {

    public OptimizerFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
