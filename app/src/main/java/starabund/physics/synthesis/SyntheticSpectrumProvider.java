package starabund.physics.synthesis;

import lombok.extern.slf4j.Slf4j;
import starabund.config.SolverConfig;
import starabund.config.SpectralDefaults;
import starabund.domain.exception.DataCoverageException;
import starabund.domain.fit.ParameterVector;
import starabund.domain.spectrum.SyntheticSpectrum;
import starabund.domain.spectrum.WavelengthWindow;
import starabund.physics.i.ISpectrumSynthesizer;
import starabund.physics.i.ISyntheticGrid;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Proveedor de espectros sintéticos a partir de una rejilla de dos brazos (azul y rojo).
 * <p>
 * La cobertura se decide una sola vez, en el constructor, a partir de las longitudes de
 * onda observadas que superan la máscara general. Cada brazo activo tiene su propia
 * caché privada; nunca se consulta (ni se lee de la rejilla) un brazo sin cobertura.
 * <p>
 * Una instancia por espectro: el estado (cachés) no se comparte entre espectros ni hilos.
 */
@Slf4j
public class SyntheticSpectrumProvider implements ISpectrumSynthesizer {

    private final ISyntheticGrid grid;
    private final SolverConfig config;
    private final SpectralDefaults defaults;
    private final Map<SpectralArm, SyntheticSpectrumCache> caches = new EnumMap<>(SpectralArm.class);

    /**
     * @param grid                 Interpolador de la rejilla.
     * @param config               Configuración (rutas de cada brazo).
     * @param defaults             Ventanas de cobertura y rangos de lectura.
     * @param coverageWavelengths  Longitudes de onda observadas tras aplicar la máscara general.
     * @throws DataCoverageException si ningún píxel cae en la cobertura de algún brazo.
     */
    public SyntheticSpectrumProvider(ISyntheticGrid grid, SolverConfig config, SpectralDefaults defaults,
                                     double[] coverageWavelengths) {
        this.grid = grid;
        this.config = config;
        this.defaults = defaults;

        for (SpectralArm arm : SpectralArm.values()) {
            WavelengthWindow window = arm.coverage(defaults);
            int pixels = 0;
            for (double w : coverageWavelengths) {
                if (window.containsHalfOpen(w)) pixels++;
            }
            if (pixels > 0) {
                caches.put(arm, new SyntheticSpectrumCache(arm));
            }
            log.debug("Brazo {}: {} píxeles observados en [{}, {})", arm, pixels, window.start(), window.stop());
        }

        if (caches.isEmpty()) {
            throw new DataCoverageException("Ningún píxel observado cae dentro de la cobertura de las rejillas sintéticas.");
        }
        log.info("SyntheticSpectrumProvider inicializado. Brazos activos={}", caches.keySet());
    }

    public Set<SpectralArm> getActiveArms() {
        return Collections.unmodifiableSet(caches.keySet());
    }

    public boolean covers(SpectralArm arm) {
        return caches.containsKey(arm);
    }

    /**
     * Caché de un brazo activo, o {@code null} si el brazo no tiene cobertura.
     */
    public SyntheticSpectrumCache getCache(SpectralArm arm) {
        return caches.get(arm);
    }

    /**
     * Espectro nativo que cubre (min, max) de la malla destino. Con ambos brazos activos
     * devuelve el tramo azul seguido del rojo; al ser disjuntos, el orden creciente se mantiene.
     */
    @Override
    public SyntheticSpectrum synthesize(double[] targetWavelengths, ParameterVector parameters) {
        if (targetWavelengths.length == 0) {
            throw new IllegalArgumentException("La malla destino está vacía.");
        }
        double lower = Double.POSITIVE_INFINITY;
        double upper = Double.NEGATIVE_INFINITY;
        for (double w : targetWavelengths) {
            lower = Math.min(lower, w);
            upper = Math.max(upper, w);
        }

        SyntheticSpectrum stitched = null;
        for (Map.Entry<SpectralArm, SyntheticSpectrumCache> entry : caches.entrySet()) {
            SyntheticSpectrum trimmed = readArm(entry.getKey(), entry.getValue(), parameters).trim(lower, upper);
            stitched = (stitched == null) ? trimmed : stitched.concat(trimmed);
        }
        return stitched;
    }

    private SyntheticSpectrum readArm(SpectralArm arm, SyntheticSpectrumCache cache, ParameterVector parameters) {
        return cache.getOrLoad(parameters, key -> grid.interpolate(
                key,
                arm.dataPath(config),
                arm.gridStart(defaults),
                arm.gridStop(defaults)
        ));
    }
}
