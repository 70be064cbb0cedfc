package starabund.domain.spectrum;

/**
 * Estimación fotométrica usada como prior del ajuste.
 *
 * @param teff      Temperatura efectiva fotométrica [K].
 * @param teffError Incertidumbre de la temperatura fotométrica [K].
 * @param logg      Gravedad superficial fotométrica [dex].
 */
public record PhotometricEstimate(double teff, double teffError, double logg) {

    public PhotometricEstimate {
        if (!(teffError > 0.0)) {
            throw new IllegalArgumentException("La incertidumbre fotométrica de Teff debe ser positiva: " + teffError);
        }
    }
}
