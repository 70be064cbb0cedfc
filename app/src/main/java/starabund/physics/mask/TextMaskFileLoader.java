package starabund.physics.mask;

import lombok.extern.slf4j.Slf4j;
import starabund.config.SpectralMode;
import starabund.domain.exception.MissingMaskFileException;
import starabund.domain.spectrum.FitMask;
import starabund.domain.spectrum.ObservedSpectrum;
import starabund.domain.spectrum.WavelengthWindow;
import starabund.physics.i.IMaskFileLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lee definiciones de máscara en texto plano: {@code <root>/<nombre>_<modo>.txt}.
 * <p>
 * Cada línea útil contiene dos columnas, inicio y fin de la ventana [Å], separadas por
 * espacios, tabuladores o comas. Las líneas vacías y las que empiezan por '#' se ignoran.
 * <p>
 * Un píxel es válido si su flujo es finito y su varianza inversa positiva; las máscaras
 * con ventanas seleccionan los píxeles válidos dentro de alguna ventana (extremos incluidos).
 */
@Slf4j
public class TextMaskFileLoader implements IMaskFileLoader {

    private static final String EXTENSION = ".txt";

    public Path resolve(String name, SpectralMode mode, Path root) {
        return root.resolve(name + "_" + mode.getCode() + EXTENSION);
    }

    @Override
    public List<WavelengthWindow> locate(String name, SpectralMode mode, Path root) {
        Path file = resolve(name, mode, root);
        if (!Files.isRegularFile(file)) {
            throw new MissingMaskFileException(name, "No existe la definición de máscara: " + file.toAbsolutePath());
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Error al leer la máscara {}", file.toAbsolutePath(), e);
            throw new MissingMaskFileException(name, "No se pudo leer la máscara " + file.toAbsolutePath(), e);
        }

        List<WavelengthWindow> windows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] cols = line.split("[\\s,]+");
            if (cols.length < 2) {
                throw new IllegalArgumentException(file.getFileName() + ":" + (i + 1) + ": se esperaban dos columnas.");
            }
            try {
                windows.add(new WavelengthWindow(Double.parseDouble(cols[0]), Double.parseDouble(cols[1])));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(file.getFileName() + ":" + (i + 1) + ": valor no numérico.", e);
            }
        }
        log.debug("Máscara {} ({}): {} ventanas", name, mode, windows.size());
        return windows;
    }

    @Override
    public FitMask constructMask(ObservedSpectrum spectrum, List<WavelengthWindow> windows) {
        boolean[] selected = validPixels(spectrum);
        for (int i = 0; i < selected.length; i++) {
            if (!selected[i]) continue;
            double w = spectrum.getWavelengthAt(i);
            boolean inside = false;
            for (WavelengthWindow window : windows) {
                if (window.containsClosed(w)) {
                    inside = true;
                    break;
                }
            }
            selected[i] = inside;
        }
        return new FitMask(selected);
    }

    @Override
    public FitMask constructMask(ObservedSpectrum spectrum) {
        return new FitMask(validPixels(spectrum));
    }

    private static boolean[] validPixels(ObservedSpectrum spectrum) {
        boolean[] valid = new boolean[spectrum.size()];
        for (int i = 0; i < valid.length; i++) {
            double ivar = spectrum.getInverseVarianceAt(i);
            valid[i] = Double.isFinite(spectrum.getFluxAt(i))
                    && Double.isFinite(spectrum.getWavelengthAt(i))
                    && Double.isFinite(ivar) && ivar > 0.0;
        }
        return valid;
    }
}
