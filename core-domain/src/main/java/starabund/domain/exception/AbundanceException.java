package starabund.domain.exception;

/**
 * Raíz de la jerarquía de errores del pipeline de abundancias.
 * <p>
 * Todas las excepciones son no comprobadas: representan condiciones fatales
 * para el espectro en curso que el llamador decide si registra o propaga.
 */
public class AbundanceException extends RuntimeException {

    public AbundanceException(String message) {
        super(message);
    }

    public AbundanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
