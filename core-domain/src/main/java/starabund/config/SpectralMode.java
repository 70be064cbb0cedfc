package starabund.config;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Modo de resolución del espectrógrafo.
 */
public enum SpectralMode {
    LOW("lr"),
    MEDIUM("mr");

    private final String code;

    SpectralMode(String code) {
        this.code = code;
    }

    /**
     * Sufijo corto ("lr"/"mr") usado en las tablas de resolución y en los nombres de máscara.
     */
    public String getCode() {
        return code;
    }

    /**
     * Acepta tanto el nombre del enum como el código corto.
     */
    @JsonCreator
    public static SpectralMode fromCode(String value) {
        for (SpectralMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value) || mode.code.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Modo espectral desconocido: " + value);
    }
}
