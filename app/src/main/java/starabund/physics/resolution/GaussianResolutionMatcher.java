package starabund.physics.resolution;

import starabund.domain.spectrum.ResolutionProfile;
import starabund.domain.spectrum.SyntheticSpectrum;
import starabund.physics.i.IGaussianSmoother;
import starabund.physics.i.IResolutionMatcher;
import starabund.physics.i.ISolverComponent;

/**
 * Adapta el perfil tipado de resolución al suavizador gaussiano externo.
 * Hay que invocarlo por separado para cada máscara, con el perfil restringido a ella.
 */
public class GaussianResolutionMatcher implements IResolutionMatcher, ISolverComponent {

    private final IGaussianSmoother smoother;

    public GaussianResolutionMatcher(IGaussianSmoother smoother) {
        this.smoother = smoother;
    }

    @Override
    public String getName() {
        return "ResolutionMatch[" + ISolverComponent.nameOf(smoother) + "]";
    }

    @Override
    public double[] match(SyntheticSpectrum model, double[] targetWavelengths, ResolutionProfile profile) {
        profile.requireLength(targetWavelengths.length);
        double[] out = smoother.smooth(model, targetWavelengths, profile.sigma());
        if (out.length != targetWavelengths.length) {
            throw new IllegalStateException("El suavizador devolvió " + out.length + " puntos para una malla de "
                    + targetWavelengths.length + ".");
        }
        return out;
    }
}
