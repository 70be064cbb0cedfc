package starabund.domain.fit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Salida final del pipeline para un espectro.
 *
 * @param parameters   Teff y logg del último iterado del bucle; [Fe/H] y [alpha/Fe] de la secuencia final.
 * @param teffError    Incertidumbre de Teff (covarianza de la última etapa A) [K].
 * @param fehError     Incertidumbre de [Fe/H] (último re-ajuste de metalicidad) [dex].
 * @param alphaFeError Incertidumbre de [alpha/Fe] (re-ajuste alfa de la secuencia final) [dex].
 * @param loggError    Incertidumbre de logg; NaN si logg estaba fijado a la fotometría.
 * @param converged    {@code false} si el bucle agotó el límite de iteraciones.
 * @param iterations   Pasadas ejecutadas del bucle de continuo.
 * @param modelFlux    Mejor espectro sintético, remuestreado sobre la malla observada.
 */
@Builder
public record AbundanceResult(
        ParameterVector parameters,
        double teffError,
        double fehError,
        double alphaFeError,
        double loggError,
        boolean converged,
        int iterations,
        double[] modelFlux
) {

    public AbundanceResult {
        Objects.requireNonNull(parameters, "Los parámetros finales no pueden ser nulos.");
        Objects.requireNonNull(modelFlux, "El espectro sintético final no puede ser nulo.");
        modelFlux = modelFlux.clone();
    }

    @Override
    public double[] modelFlux() {
        return modelFlux.clone();
    }

    /**
     * 1 = convergido, 0 = límite de iteraciones alcanzado.
     */
    @JsonIgnore
    public int convergeFlag() {
        return converged ? 1 : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AbundanceResult that = (AbundanceResult) o;
        return Double.compare(teffError, that.teffError) == 0
                && Double.compare(fehError, that.fehError) == 0
                && Double.compare(alphaFeError, that.alphaFeError) == 0
                && Double.compare(loggError, that.loggError) == 0
                && converged == that.converged
                && iterations == that.iterations
                && parameters.equals(that.parameters)
                && Arrays.equals(modelFlux, that.modelFlux);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(parameters, teffError, fehError, alphaFeError, loggError, converged, iterations);
        return 31 * result + Arrays.hashCode(modelFlux);
    }

    @Override
    public String toString() {
        return "AbundanceResult{" + parameters
                + String.format(", errors=[%.1f, %.4f, %.4f, %.3f]", teffError, fehError, alphaFeError, loggError)
                + ", converged=" + converged + ", iterations=" + iterations + "}";
    }
}
