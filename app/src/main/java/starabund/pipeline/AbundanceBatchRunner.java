package starabund.pipeline;

import lombok.extern.slf4j.Slf4j;
import starabund.domain.fit.AbundanceResult;
import starabund.domain.spectrum.ObservedSpectrum;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Procesa muchos espectros en paralelo, un pipeline por espectro (paralelismo a nivel de
 * instancia; cada medición es secuencial). El fallo de un espectro no detiene al resto.
 */
@Slf4j
public class AbundanceBatchRunner implements AutoCloseable {

    private final AbundancePipeline pipeline;
    private final ExecutorService threadPool;

    public AbundanceBatchRunner(AbundancePipeline pipeline) {
        this.pipeline = pipeline;
        int threads = Math.max(pipeline.getConfig().threadCount(), 1);
        this.threadPool = Executors.newFixedThreadPool(threads);
        log.info("AbundanceBatchRunner inicializado con {} hilos.", threads);
    }

    /**
     * Mide todos los espectros. Los resultados mantienen el orden de entrada.
     */
    public List<BatchOutcome> runAll(List<ObservedSpectrum> spectra) {
        long startTime = System.currentTimeMillis();
        List<AbundanceTask> tasks = new ArrayList<>(spectra.size());
        for (ObservedSpectrum spectrum : spectra) {
            tasks.add(new AbundanceTask(pipeline, spectrum));
        }

        List<Future<AbundanceResult>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Procesamiento por lotes interrumpido.", e);
        }

        List<BatchOutcome> outcomes = new ArrayList<>(spectra.size());
        int failures = 0;
        for (int i = 0; i < spectra.size(); i++) {
            String id = spectra.get(i).getId();
            try {
                outcomes.add(new BatchOutcome(id, futures.get(i).get(), null));
            } catch (ExecutionException e) {
                failures++;
                log.error("Fallo al medir {}: {}", id, e.getCause().getMessage(), e.getCause());
                outcomes.add(new BatchOutcome(id, null, e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Procesamiento por lotes interrumpido.", e);
            }
        }
        log.info("Lote de {} espectros completado en {} ms ({} fallos).",
                spectra.size(), System.currentTimeMillis() - startTime, failures);
        return outcomes;
    }

    @Override
    public void close() {
        threadPool.shutdown();
        log.info("AbundanceBatchRunner cerrado.");
    }
}
