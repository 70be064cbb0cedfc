package starabund.domain.exception;

import lombok.Getter;

/**
 * No se ha podido localizar o leer una definición de máscara espectral.
 */
@Getter
public class MissingMaskFileException extends AbundanceException {

    private final String maskName;

    public MissingMaskFileException(String maskName, String message) {
        super(message);
        this.maskName = maskName;
    }

    public MissingMaskFileException(String maskName, String message, Throwable cause) {
        super(message, cause);
        this.maskName = maskName;
    }
}
