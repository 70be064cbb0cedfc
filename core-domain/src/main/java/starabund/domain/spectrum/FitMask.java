package starabund.domain.spectrum;

import java.util.Arrays;
import java.util.Objects;

/**
 * Selector booleano inmutable sobre los píxeles de un {@link ObservedSpectrum}.
 * <p>
 * Se construye una única vez por espectro y solo se lee a partir de entonces.
 *
 * @param selected Un valor por píxel del espectro observado; {@code true} si el píxel entra en el ajuste.
 */
public record FitMask(boolean[] selected) {

    public FitMask {
        Objects.requireNonNull(selected, "El array de selección no puede ser nulo.");
        selected = selected.clone();
    }

    /**
     * Copia del selector; la máscara no cambia tras construirse.
     */
    @Override
    public boolean[] selected() {
        return selected.clone();
    }

    /**
     * Máscara que selecciona todos los píxeles.
     */
    public static FitMask all(int size) {
        boolean[] s = new boolean[size];
        Arrays.fill(s, true);
        return new FitMask(s);
    }

    /**
     * Longitud del espectro sobre el que se define la máscara (no el número de píxeles seleccionados).
     */
    public int size() {
        return selected.length;
    }

    public boolean isSelected(int pixel) {
        return selected[pixel];
    }

    /**
     * Número de píxeles seleccionados.
     */
    public int count() {
        int c = 0;
        for (boolean b : selected) {
            if (b) c++;
        }
        return c;
    }

    public boolean isEmpty() {
        return count() == 0;
    }

    /**
     * Extrae, en orden, los valores de los píxeles seleccionados.
     *
     * @throws IllegalArgumentException si el array no tiene la longitud de la máscara.
     */
    public double[] select(double[] values) {
        if (values.length != selected.length) {
            throw new IllegalArgumentException("Longitud " + values.length + " incompatible con la máscara (" + selected.length + ").");
        }
        double[] out = new double[count()];
        int k = 0;
        for (int i = 0; i < selected.length; i++) {
            if (selected[i]) out[k++] = values[i];
        }
        return out;
    }

    /**
     * Intersección con otra máscara de la misma longitud.
     */
    public FitMask and(FitMask other) {
        if (other.size() != size()) {
            throw new IllegalArgumentException("Las máscaras deben tener la misma longitud.");
        }
        boolean[] s = new boolean[selected.length];
        for (int i = 0; i < s.length; i++) {
            s[i] = selected[i] && other.selected[i];
        }
        return new FitMask(s);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(selected, ((FitMask) o).selected);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(selected);
    }

    @Override
    public String toString() {
        return "FitMask{selected=" + count() + "/" + selected.length + "}";
    }
}
