package starabund.pipeline;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import starabund.config.SolverConfig;
import starabund.config.SpectralDefaults;
import starabund.domain.fit.AbundanceResult;
import starabund.domain.spectrum.ObservedSpectrum;
import starabund.domain.spectrum.PhotometricEstimate;
import starabund.domain.spectrum.ResolutionProfile;
import starabund.domain.spectrum.SpectralMasks;
import starabund.factory.ResolutionProfileFactory;
import starabund.physics.i.ISolverComponent;
import starabund.physics.mask.WindowMaskProvider;
import starabund.physics.resolution.GaussianResolutionMatcher;
import starabund.physics.solver.BoundedLeastSquaresSolver;
import starabund.physics.solver.ParameterFitEngine;
import starabund.physics.synthesis.SyntheticSpectrumProvider;

/**
 * Facade de alto nivel: mide Teff, logg, [Fe/H] y [alpha/Fe] de un espectro observado.
 * <p>
 * Pasos: prior fotométrico, perfil de resolución, máscaras, proveedor sintético (con
 * cachés nuevas para este espectro), continuo inicial, motor de ajuste y escritura
 * del resultado sobre el propio espectro.
 * <p>
 * El pipeline no guarda estado entre espectros; todo el estado mutable (cachés,
 * continuo) vive en objetos creados para cada llamada a {@link #measure}.
 */
@Slf4j
public class AbundancePipeline {

    @Getter
    private final SolverConfig config;
    private final SpectralDefaults defaults;
    private final AbundanceCollaborators collaborators;
    private final ResolutionProfileFactory profileFactory;
    private final WindowMaskProvider maskProvider;

    public AbundancePipeline(SolverConfig config, SpectralDefaults defaults, AbundanceCollaborators collaborators) {
        this.config = config;
        this.defaults = defaults;
        this.collaborators = collaborators;
        this.profileFactory = new ResolutionProfileFactory(defaults);
        this.maskProvider = new WindowMaskProvider(collaborators.getMaskFileLoader());
        log.info("AbundancePipeline inicializado. Modo={}, logg libre={}, máscaras en {}, suavizado={}",
                config.mode(), config.fitLogg(), config.maskRoot(),
                ISolverComponent.nameOf(collaborators.getSmoother()));
    }

    public AbundanceResult measure(ObservedSpectrum spectrum) {
        long startTime = System.currentTimeMillis();
        log.info("Midiendo abundancias de {} ({} píxeles)", spectrum.getId(), spectrum.size());

        PhotometricEstimate photometry = collaborators.getPhotometricPrior()
                .estimate(spectrum, config.distanceModulus(), config.distanceModulusError());
        spectrum.setPhotometry(photometry);
        log.debug("Prior fotométrico de {}: {}", spectrum.getId(), photometry);

        ResolutionProfile profile = profileFactory.create(spectrum.getWavelength(), config.mode());
        SpectralMasks masks = maskProvider.loadMasks(spectrum, config.mode(), config.maskRootPath());

        SyntheticSpectrumProvider provider = new SyntheticSpectrumProvider(
                collaborators.getSyntheticGrid(), config, defaults,
                spectrum.maskedWavelengths(masks.general()));

        spectrum.setContinuum(collaborators.getContinuumNormalizer().normalize(spectrum));

        ParameterFitEngine engine = new ParameterFitEngine(
                provider,
                new GaussianResolutionMatcher(collaborators.getSmoother()),
                collaborators.getContinuumRefiner(),
                new BoundedLeastSquaresSolver(defaults),
                defaults);

        AbundanceResult result = engine.fit(spectrum, masks, profile, photometry, config.fitLogg());
        spectrum.setResult(result);

        log.info("{} completado en {} ms: {}", spectrum.getId(), System.currentTimeMillis() - startTime, result);
        return result;
    }
}
