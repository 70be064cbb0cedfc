package starabund.domain.exception;

/**
 * Ningún píxel observado cae dentro de la cobertura de las rejillas sintéticas
 * (o una máscara de ajuste no selecciona ningún píxel). No hay recuperación posible.
 */
public class DataCoverageException extends AbundanceException {

    public DataCoverageException(String message) {
        super(message);
    }
}
