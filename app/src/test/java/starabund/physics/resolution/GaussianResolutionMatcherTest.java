package starabund.physics.resolution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import starabund.domain.spectrum.ResolutionProfile;
import starabund.domain.spectrum.SyntheticSpectrum;
import starabund.physics.i.IGaussianSmoother;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GaussianResolutionMatcherTest {

    private final SyntheticSpectrum model = new SyntheticSpectrum(new double[]{1.0, 2.0}, new double[]{1.0, 1.0});

    @Test
    @DisplayName("Delega en el suavizador con la σ del perfil")
    void match_shouldDelegateWithProfileSigma() {
        // ARRANGE
        IGaussianSmoother smoother = mock(IGaussianSmoother.class);
        double[] target = {1.2, 1.8};
        double[] sigma = {0.5, 0.6};
        when(smoother.smooth(model, target, sigma)).thenReturn(new double[]{0.9, 0.8});
        GaussianResolutionMatcher matcher = new GaussianResolutionMatcher(smoother);

        // ACT
        double[] out = matcher.match(model, target, new ResolutionProfile(sigma));

        // ASSERT
        assertArrayEquals(new double[]{0.9, 0.8}, out);
        verify(smoother).smooth(model, target, sigma);
    }

    @Test
    @DisplayName("Un perfil de otra longitud se rechaza antes de llamar al suavizador")
    void match_withWrongProfileLength_shouldThrow() {
        IGaussianSmoother smoother = mock(IGaussianSmoother.class);
        GaussianResolutionMatcher matcher = new GaussianResolutionMatcher(smoother);

        assertThrows(IllegalArgumentException.class,
                () -> matcher.match(model, new double[]{1.5}, new ResolutionProfile(new double[]{0.5, 0.5})));
        verifyNoInteractions(smoother);
    }

    @Test
    @DisplayName("Una salida de longitud incorrecta del suavizador es un error")
    void match_withBadSmootherOutput_shouldThrow() {
        IGaussianSmoother smoother = mock(IGaussianSmoother.class);
        when(smoother.smooth(any(), any(), any())).thenReturn(new double[3]);
        GaussianResolutionMatcher matcher = new GaussianResolutionMatcher(smoother);

        assertThrows(IllegalStateException.class,
                () -> matcher.match(model, new double[]{1.5}, new ResolutionProfile(new double[]{0.5})));
    }

    @Test
    @DisplayName("El nombre del adaptador incluye el del suavizador, o su clase si no es un componente")
    void getName_shouldIncludeSmootherName() {
        assertEquals("ResolutionMatch[Gaussian-Kernel]",
                new GaussianResolutionMatcher(new GaussianKernelSmoother()).getName());

        IGaussianSmoother lambda = (m, target, sigma) -> target.clone();
        String name = new GaussianResolutionMatcher(lambda).getName();
        assertTrue(name.startsWith("ResolutionMatch[") && !name.contains("null"), name);
    }
}
