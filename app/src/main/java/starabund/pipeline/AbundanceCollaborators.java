package starabund.pipeline;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import starabund.physics.i.IContinuumNormalizer;
import starabund.physics.i.IContinuumRefiner;
import starabund.physics.i.IGaussianSmoother;
import starabund.physics.i.IMaskFileLoader;
import starabund.physics.i.IPhotometricPrior;
import starabund.physics.i.ISyntheticGrid;
import starabund.physics.mask.TextMaskFileLoader;
import starabund.physics.resolution.GaussianKernelSmoother;

/**
 * Colaboradores externos del pipeline. En procesamiento por lotes se comparten entre
 * hilos, así que sus implementaciones deben ser thread-safe (o sin estado).
 */
@Value
@Builder
public class AbundanceCollaborators {

    @NonNull
    IPhotometricPrior photometricPrior;

    @NonNull
    IContinuumNormalizer continuumNormalizer;

    @NonNull
    IContinuumRefiner continuumRefiner;

    @NonNull
    ISyntheticGrid syntheticGrid;

    /**
     * Por defecto, {@link GaussianKernelSmoother}.
     */
    @NonNull
    @Builder.Default
    IGaussianSmoother smoother = new GaussianKernelSmoother();

    /**
     * Por defecto, {@link TextMaskFileLoader}.
     */
    @NonNull
    @Builder.Default
    IMaskFileLoader maskFileLoader = new TextMaskFileLoader();
}
