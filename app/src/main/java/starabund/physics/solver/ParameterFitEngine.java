package starabund.physics.solver;

import lombok.extern.slf4j.Slf4j;
import starabund.config.SpectralDefaults;
import starabund.domain.fit.AbundanceResult;
import starabund.domain.fit.ConvergenceState;
import starabund.domain.fit.FitParameter;
import starabund.domain.fit.FitStage;
import starabund.domain.fit.NonlinearFitResult;
import starabund.domain.fit.ParameterBounds;
import starabund.domain.fit.ParameterVector;
import starabund.domain.spectrum.ObservedSpectrum;
import starabund.domain.spectrum.PhotometricEstimate;
import starabund.domain.spectrum.ResolutionProfile;
import starabund.domain.spectrum.SpectralMasks;
import starabund.physics.i.IContinuumRefiner;
import starabund.physics.i.IResolutionMatcher;
import starabund.physics.i.ISolverComponent;
import starabund.physics.i.ISpectrumSynthesizer;

import java.util.List;
import java.util.function.Function;

/**
 * Motor de ajuste autoconsistente de parámetros atmosféricos.
 * <p>
 * Bucle (máximo {@code maxIterations} pasadas):
 * <ol>
 *     <li>Etapa A: Teff y [Fe/H] (y logg si es libre) sobre la máscara de metalicidad, con el
 *     píxel ancla fotométrico antepuesto. [alpha/Fe] fijo al iterado anterior.</li>
 *     <li>Etapa B: [alpha/Fe] sobre la máscara alfa, con el resto fijo a la etapa A.</li>
 *     <li>Síntesis del mejor espectro sobre la malla observada completa.</li>
 *     <li>Refinamiento externo del continuo.</li>
 *     <li>Chequeo de convergencia contra el iterado anterior.</li>
 * </ol>
 * Después, siempre, la secuencia final de tres ajustes de un parámetro
 * ([Fe/H] -> [alpha/Fe] -> [Fe/H]) que no toca el continuo.
 * <p>
 * La no convergencia no es un error: se informa en {@link AbundanceResult#converged()}.
 * El estado del bucle es un {@link ConvergenceState} inmutable; el único efecto lateral
 * es la actualización del continuo del espectro.
 */
@Slf4j
public class ParameterFitEngine implements ISolverComponent {

    private static final List<FitParameter> TEFF_FEH = List.of(FitParameter.TEFF, FitParameter.FEH);
    private static final List<FitParameter> TEFF_FEH_LOGG = List.of(FitParameter.TEFF, FitParameter.FEH, FitParameter.LOGG);
    private static final List<FitParameter> FEH_ONLY = List.of(FitParameter.FEH);
    private static final List<FitParameter> ALPHA_ONLY = List.of(FitParameter.ALPHA_FE);

    private final ISpectrumSynthesizer synthesizer;
    private final IResolutionMatcher matcher;
    private final IContinuumRefiner refiner;
    private final BoundedLeastSquaresSolver solver;
    private final ConvergenceChecker convergenceChecker;
    private final SpectralDefaults defaults;

    public ParameterFitEngine(ISpectrumSynthesizer synthesizer,
                              IResolutionMatcher matcher,
                              IContinuumRefiner refiner,
                              BoundedLeastSquaresSolver solver,
                              SpectralDefaults defaults) {
        if (defaults.getMaxIterations() < 1) {
            throw new IllegalArgumentException("El bucle de continuo necesita al menos una iteración.");
        }
        this.synthesizer = synthesizer;
        this.matcher = matcher;
        this.refiner = refiner;
        this.solver = solver;
        this.convergenceChecker = new ConvergenceChecker(defaults);
        this.defaults = defaults;
        log.info("{} inicializado. Máx. iteraciones={}", getName(), defaults.getMaxIterations());
    }

    @Override
    public String getName() {
        return String.format("SelfConsistentFit[Opt:%s + Match:%s]",
                solver.getName(), ISolverComponent.nameOf(matcher));
    }

    @Override
    public String getDescription() {
        return "Ajustes escalonados Teff/[Fe/H] + [alpha/Fe] con refinamiento iterativo del continuo, "
                + "prior fotométrico como píxel ancla y secuencia final de desacoplamiento.";
    }

    /**
     * Ajusta partiendo de la semilla estándar (Teff y logg fotométricos, [Fe/H] = -2, [alpha/Fe] = 0).
     * El continuo inicial debe estar ya asignado en el espectro.
     */
    public AbundanceResult fit(ObservedSpectrum spectrum, SpectralMasks masks, ResolutionProfile profile,
                               PhotometricEstimate photometry, boolean fitLogg) {
        ParameterVector seed = defaults.seed(photometry.teff(), photometry.logg(), fitLogg);
        return fit(spectrum, masks, profile, photometry, fitLogg, seed);
    }

    /**
     * Ajusta partiendo de una semilla arbitraria, que actúa como "iterado anterior" de la primera pasada.
     */
    public AbundanceResult fit(ObservedSpectrum spectrum, SpectralMasks masks, ResolutionProfile profile,
                               PhotometricEstimate photometry, boolean fitLogg, ParameterVector seed) {
        profile.requireLength(spectrum.size());
        FitContext context = new FitContext(
                spectrum, masks, photometry, fitLogg,
                profile,
                profile.subset(masks.metallicity()),
                profile.subset(masks.alpha()));

        log.info("[{}] {}: semilla {} (logg libre={})", FitStage.INIT, spectrum.getId(), seed, fitLogg);

        ConvergenceState state = ConvergenceState.initial(seed);
        NonlinearFitResult lastStageA = null;

        while (!state.isTerminal(defaults.getMaxIterations())) {
            IterationOutcome outcome = iterate(context, state.previous());
            lastStageA = outcome.stageA();

            log.debug("[{}] {}", FitStage.CHECK_CONVERGENCE, spectrum.getId());
            boolean converged = convergenceChecker.isConverged(state.previous(), outcome.parameters(), fitLogg);
            state = state.advance(outcome.parameters(), converged);
            log.info("Iteración {} de {}: {}", state.iteration(), spectrum.getId(), outcome.parameters());
        }

        if (state.converged()) {
            log.info("Continuo convergido para {} en {} iteraciones.", spectrum.getId(), state.iteration());
        } else {
            log.warn("Máximo de iteraciones de continuo ({}) alcanzado para {}: se finaliza con el último iterado.",
                    defaults.getMaxIterations(), spectrum.getId());
        }

        return finalizeSequence(context, state, lastStageA);
    }

    /**
     * Una pasada completa del bucle: etapa A, etapa B, síntesis y refinamiento del continuo.
     */
    IterationOutcome iterate(FitContext context, ParameterVector previous) {
        ObservedSpectrum spectrum = context.spectrum();
        PhotometricEstimate photometry = context.photometry();

        log.debug("[{}] {}", FitStage.FIT_TEFF_METALLICITY, spectrum.getId());
        FitArrays metallicity = FitArrays.of(spectrum, context.masks().metallicity())
                .withAnchor(photometry.teff(), photometry.teffError(), defaults.getFlexFactor());
        List<FitParameter> freeA = context.fitLogg() ? TEFF_FEH_LOGG : TEFF_FEH;
        NonlinearFitResult stageA = solveStage(freeA, previous, startOf(freeA, previous),
                metallicity, context.metallicityProfile());
        ParameterVector afterA = stageA.applyTo(previous);

        log.debug("[{}] {}", FitStage.FIT_ALPHA, spectrum.getId());
        FitArrays alpha = FitArrays.of(spectrum, context.masks().alpha());
        NonlinearFitResult stageB = solveStage(ALPHA_ONLY, afterA, new double[]{defaults.getAlphaFeSeed()},
                alpha, context.alphaProfile());
        ParameterVector current = stageB.applyTo(afterA);

        log.debug("[{}] {}", FitStage.SYNTHESIZE_BEST, spectrum.getId());
        double[] bestFit = modelFlux(spectrum.getWavelength(), current, context.fullProfile());

        log.debug("[{}] {}", FitStage.REFINE_CONTINUUM, spectrum.getId());
        spectrum.setContinuum(refiner.refine(spectrum, bestFit));

        return new IterationOutcome(current, stageA, stageB);
    }

    /**
     * Re-ajusta [Fe/H], luego [alpha/Fe] con esa [Fe/H], y de nuevo [Fe/H] con esa [alpha/Fe].
     * Teff y logg quedan en el último iterado del bucle.
     */
    private AbundanceResult finalizeSequence(FitContext context, ConvergenceState state, NonlinearFitResult stageA) {
        ObservedSpectrum spectrum = context.spectrum();
        log.debug("[{}] {}", FitStage.FINALIZE_SEQUENCE, spectrum.getId());

        FitArrays metallicity = FitArrays.of(spectrum, context.masks().metallicity());
        FitArrays alpha = FitArrays.of(spectrum, context.masks().alpha());
        double[] fehStart = {defaults.getFehSeed()};
        double[] alphaStart = {defaults.getAlphaFeSeed()};

        ParameterVector loopFinal = state.current();
        NonlinearFitResult firstFeh = solveStage(FEH_ONLY, loopFinal, fehStart, metallicity, context.metallicityProfile());
        ParameterVector afterFirstFeh = firstFeh.applyTo(loopFinal);

        NonlinearFitResult alphaRefit = solveStage(ALPHA_ONLY, afterFirstFeh, alphaStart, alpha, context.alphaProfile());
        ParameterVector afterAlpha = alphaRefit.applyTo(afterFirstFeh);

        NonlinearFitResult finalFeh = solveStage(FEH_ONLY, afterAlpha, fehStart, metallicity, context.metallicityProfile());
        ParameterVector finalParameters = finalFeh.applyTo(afterAlpha);

        double[] finalModel = modelFlux(spectrum.getWavelength(), finalParameters, context.fullProfile());

        AbundanceResult result = AbundanceResult.builder()
                .parameters(finalParameters)
                .teffError(stageA.uncertainty(FitParameter.TEFF))
                .fehError(finalFeh.uncertainty(FitParameter.FEH))
                .alphaFeError(alphaRefit.uncertainty(FitParameter.ALPHA_FE))
                .loggError(context.fitLogg() ? stageA.uncertainty(FitParameter.LOGG) : Double.NaN)
                .converged(state.converged())
                .iterations(state.iteration())
                .modelFlux(finalModel)
                .build();

        log.info("[{}] {}: {}", FitStage.DONE, spectrum.getId(), result);
        return result;
    }

    /**
     * Ajusta {@code free} sobre {@code base}. Si los datos llevan ancla, el modelo antepone
     * la Teff de prueba, de modo que el residuo del ancla es (Teff prueba - Teff fotométrica).
     */
    private NonlinearFitResult solveStage(List<FitParameter> free, ParameterVector base, double[] start,
                                          FitArrays data, ResolutionProfile profile) {
        final double[] target = data.spectralWavelengths();
        final boolean anchored = data.anchored();
        ParameterBounds bounds = defaults.getBounds();

        double[] lower = new double[free.size()];
        double[] upper = new double[free.size()];
        for (int j = 0; j < free.size(); j++) {
            lower[j] = bounds.lower(free.get(j));
            upper[j] = bounds.upper(free.get(j));
        }

        Function<double[], double[]> model = x -> {
            ParameterVector trial = base;
            for (int j = 0; j < x.length; j++) {
                trial = trial.with(free.get(j), x[j]);
            }
            double[] flux = modelFlux(target, trial, profile);
            if (!anchored) {
                return flux;
            }
            double[] withAnchor = new double[flux.length + 1];
            withAnchor[0] = trial.teff();
            System.arraycopy(flux, 0, withAnchor, 1, flux.length);
            return withAnchor;
        };

        return solver.solve(FitProblem.builder()
                .parameters(free)
                .start(start)
                .lower(lower)
                .upper(upper)
                .observed(data.flux())
                .weights(data.weights())
                .model(model)
                .build());
    }

    private double[] modelFlux(double[] target, ParameterVector parameters, ResolutionProfile profile) {
        return matcher.match(synthesizer.synthesize(target, parameters), target, profile);
    }

    private static double[] startOf(List<FitParameter> free, ParameterVector vector) {
        double[] start = new double[free.size()];
        for (int j = 0; j < start.length; j++) {
            start[j] = vector.get(free.get(j));
        }
        return start;
    }

    /**
     * Entradas invariantes durante la resolución de un espectro.
     */
    record FitContext(
            ObservedSpectrum spectrum,
            SpectralMasks masks,
            PhotometricEstimate photometry,
            boolean fitLogg,
            ResolutionProfile fullProfile,
            ResolutionProfile metallicityProfile,
            ResolutionProfile alphaProfile
    ) {
    }

    /**
     * Resultado de una pasada del bucle.
     */
    record IterationOutcome(ParameterVector parameters, NonlinearFitResult stageA, NonlinearFitResult stageB) {
    }
}
