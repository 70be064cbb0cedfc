package starabund.physics.synthesis;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import starabund.domain.fit.ParameterVector;
import starabund.domain.spectrum.SyntheticSpectrum;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Memoización de espectros nativos de un brazo, indexada por el vector de parámetros exacto.
 * <p>
 * La clave es la tupla de doubles tal cual: dos vectores nominalmente iguales pero no
 * idénticos bit a bit fallan por separado. Solo acierta cuando el optimizador vuelve a
 * evaluar exactamente el mismo punto, lo que no está garantizado entre plataformas;
 * es una optimización, no una garantía de corrección.
 * <p>
 * No es thread-safe: pertenece a una única instancia del proveedor.
 */
@Slf4j
public class SyntheticSpectrumCache {

    @Getter
    private final SpectralArm arm;
    private final Map<ParameterVector, SyntheticSpectrum> entries = new HashMap<>();

    @Getter
    private long hits;
    @Getter
    private long misses;

    public SyntheticSpectrumCache(SpectralArm arm) {
        this.arm = arm;
    }

    public SyntheticSpectrum getOrLoad(ParameterVector key, Function<ParameterVector, SyntheticSpectrum> loader) {
        SyntheticSpectrum cached = entries.get(key);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        SyntheticSpectrum loaded = loader.apply(key);
        entries.put(key, loaded);
        log.debug("Caché {}: nuevo espectro para [{}] ({} entradas)", arm, key, entries.size());
        return loaded;
    }

    public boolean contains(ParameterVector key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }
}
