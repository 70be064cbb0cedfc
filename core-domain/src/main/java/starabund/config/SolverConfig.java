package starabund.config;

import lombok.Builder;
import lombok.With;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuración de ejecución aceptada por el pipeline de abundancias.
 * <p>
 * Las rutas se guardan como texto para que el objeto se serialice a JSON tal cual.
 *
 * @param mode                   Modo de resolución del instrumento.
 * @param maskRoot               Directorio raíz de las definiciones de máscara.
 * @param blueGridPath           Directorio de la rejilla sintética del brazo azul.
 * @param redGridPath            Directorio de la rejilla sintética del brazo rojo.
 * @param distanceModulus        Módulo de distancia (m - M) [mag].
 * @param distanceModulusError   Incertidumbre del módulo de distancia [mag].
 * @param fitLogg                Si {@code true}, logg es parámetro libre; si no, se fija a la fotometría.
 * @param threadCount            Hilos para el procesamiento por lotes (un espectro por hilo).
 */
@Builder
@With
public record SolverConfig(
        SpectralMode mode,
        String maskRoot,
        String blueGridPath,
        String redGridPath,
        double distanceModulus,
        double distanceModulusError,
        boolean fitLogg,
        int threadCount
) {

    public SolverConfig {
        Objects.requireNonNull(mode, "El modo espectral no puede ser nulo.");
        if (maskRoot == null) maskRoot = "./";
        if (blueGridPath == null) blueGridPath = "../gridie/";
        if (redGridPath == null) redGridPath = "../grid7/";
        if (threadCount <= 0) threadCount = 1;
        if (distanceModulusError < 0) {
            throw new IllegalArgumentException("La incertidumbre del módulo de distancia no puede ser negativa.");
        }
    }

    /**
     * Valores por defecto: m - M = 22 ± 0.1, logg fijo, un hilo.
     */
    public static SolverConfig defaults(SpectralMode mode) {
        return SolverConfig.builder()
                .mode(mode)
                .distanceModulus(22.0)
                .distanceModulusError(0.1)
                .fitLogg(false)
                .threadCount(1)
                .build();
    }

    public Path maskRootPath() {
        return Path.of(maskRoot);
    }

    public Path blueGridDirectory() {
        return Path.of(blueGridPath);
    }

    public Path redGridDirectory() {
        return Path.of(redGridPath);
    }
}
