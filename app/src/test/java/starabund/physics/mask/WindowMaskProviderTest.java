package starabund.physics.mask;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import starabund.config.SpectralMode;
import starabund.domain.exception.MissingMaskFileException;
import starabund.domain.spectrum.FitMask;
import starabund.domain.spectrum.ObservedSpectrum;
import starabund.domain.spectrum.SpectralMasks;
import starabund.domain.spectrum.WavelengthWindow;
import starabund.physics.i.IMaskFileLoader;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WindowMaskProviderTest {

    @Mock
    private IMaskFileLoader loader;

    private WindowMaskProvider provider;
    private ObservedSpectrum spectrum;
    private final Path root = Path.of("masks");

    @BeforeEach
    void setUp() {
        provider = new WindowMaskProvider(loader);
        spectrum = new ObservedSpectrum("s", new double[]{5000.0, 5001.0}, new double[]{1.0, 1.0}, new double[]{1.0, 1.0});
    }

    @Test
    @DisplayName("Construye las máscaras de metalicidad, alfa y general con sus ventanas")
    void loadMasks_shouldBuildThreeMasks() {
        // ARRANGE
        List<WavelengthWindow> feh = List.of(new WavelengthWindow(5000.0, 5000.5));
        List<WavelengthWindow> alpha = List.of(new WavelengthWindow(5000.5, 5001.0));
        FitMask fehMask = new FitMask(new boolean[]{true, false});
        FitMask alphaMask = new FitMask(new boolean[]{false, true});
        when(loader.locate(WindowMaskProvider.METALLICITY_MASK, SpectralMode.LOW, root)).thenReturn(feh);
        when(loader.locate(WindowMaskProvider.ALPHA_MASK, SpectralMode.LOW, root)).thenReturn(alpha);
        when(loader.constructMask(spectrum, feh)).thenReturn(fehMask);
        when(loader.constructMask(spectrum, alpha)).thenReturn(alphaMask);
        when(loader.constructMask(spectrum)).thenReturn(FitMask.all(2));

        // ACT
        SpectralMasks masks = provider.loadMasks(spectrum, SpectralMode.LOW, root);

        // ASSERT
        assertEquals(fehMask, masks.metallicity());
        assertEquals(alphaMask, masks.alpha());
        assertEquals(FitMask.all(2), masks.general());
    }

    @Test
    @DisplayName("Si falta la máscara alfa no se construye ninguna máscara")
    void loadMasks_missingAlpha_shouldFailBeforeBuilding() {
        // ARRANGE
        when(loader.locate(WindowMaskProvider.METALLICITY_MASK, SpectralMode.MEDIUM, root))
                .thenReturn(List.of(new WavelengthWindow(5000.0, 5001.0)));
        when(loader.locate(WindowMaskProvider.ALPHA_MASK, SpectralMode.MEDIUM, root))
                .thenThrow(new MissingMaskFileException(WindowMaskProvider.ALPHA_MASK, "no existe"));

        // ACT & ASSERT
        MissingMaskFileException ex = assertThrows(MissingMaskFileException.class,
                () -> provider.loadMasks(spectrum, SpectralMode.MEDIUM, root));
        assertEquals(WindowMaskProvider.ALPHA_MASK, ex.getMaskName());
        verify(loader, never()).constructMask(any(), anyList());
        verify(loader, never()).constructMask(any());
    }
}
