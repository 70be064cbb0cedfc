package starabund.pipeline;

import starabund.domain.fit.AbundanceResult;

/**
 * Resultado de un espectro dentro de un lote: o bien un {@link AbundanceResult},
 * o bien el error que lo detuvo.
 *
 * @param spectrumId Identificador del espectro.
 * @param result     Resultado; {@code null} si falló.
 * @param error      Excepción que detuvo el espectro; {@code null} si tuvo éxito.
 */
public record BatchOutcome(String spectrumId, AbundanceResult result, Throwable error) {

    public boolean isSuccess() {
        return error == null;
    }
}
