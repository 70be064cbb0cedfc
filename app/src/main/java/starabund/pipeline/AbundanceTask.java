package starabund.pipeline;

import lombok.RequiredArgsConstructor;
import starabund.domain.fit.AbundanceResult;
import starabund.domain.spectrum.ObservedSpectrum;

import java.util.concurrent.Callable;

/**
 * Tarea que mide un único espectro. Diseñada para ejecutarse en un pool de hilos:
 * cada tarea tiene su propio proveedor sintético, así que no comparte estado mutable.
 */
@RequiredArgsConstructor
public class AbundanceTask implements Callable<AbundanceResult> {

    private final AbundancePipeline pipeline;
    private final ObservedSpectrum spectrum;

    @Override
    public AbundanceResult call() {
        return pipeline.measure(spectrum);
    }
}
