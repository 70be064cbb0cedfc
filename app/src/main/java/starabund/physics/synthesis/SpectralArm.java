package starabund.physics.synthesis;

import starabund.config.SolverConfig;
import starabund.config.SpectralDefaults;
import starabund.domain.spectrum.WavelengthWindow;

import java.nio.file.Path;

/**
 * Brazos disjuntos de la rejilla sintética. El orden de declaración es el orden
 * de concatenación (azul antes que rojo).
 */
public enum SpectralArm {
    BLUE {
        @Override
        public WavelengthWindow coverage(SpectralDefaults defaults) {
            return defaults.getBlueGridCoverage();
        }

        @Override
        public Double gridStart(SpectralDefaults defaults) {
            return defaults.getBlueGridStart();
        }

        @Override
        public Double gridStop(SpectralDefaults defaults) {
            return defaults.getBlueGridStop();
        }

        @Override
        public Path dataPath(SolverConfig config) {
            return config.blueGridDirectory();
        }
    },
    RED {
        @Override
        public WavelengthWindow coverage(SpectralDefaults defaults) {
            return defaults.getRedGridCoverage();
        }

        @Override
        public Double gridStart(SpectralDefaults defaults) {
            return defaults.getRedGridStart();
        }

        @Override
        public Double gridStop(SpectralDefaults defaults) {
            return defaults.getRedGridStop();
        }

        @Override
        public Path dataPath(SolverConfig config) {
            return config.redGridDirectory();
        }
    };

    public abstract WavelengthWindow coverage(SpectralDefaults defaults);

    public abstract Double gridStart(SpectralDefaults defaults);

    public abstract Double gridStop(SpectralDefaults defaults);

    public abstract Path dataPath(SolverConfig config);
}
