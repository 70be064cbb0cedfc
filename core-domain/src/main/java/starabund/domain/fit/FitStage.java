package starabund.domain.fit;

/**
 * Estados del motor de ajuste. Las etapas FIT_TEFF_METALLICITY..CHECK_CONVERGENCE
 * se repiten en bucle hasta la convergencia o el límite de iteraciones.
 */
public enum FitStage {
    INIT,
    FIT_TEFF_METALLICITY,
    FIT_ALPHA,
    SYNTHESIZE_BEST,
    REFINE_CONTINUUM,
    CHECK_CONVERGENCE,
    FINALIZE_SEQUENCE,
    DONE
}
