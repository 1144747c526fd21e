package hydrogenlab.domain.spectrometer;

/**
 * Número de fotones emitidos con una longitud de onda dada.
 */
public record SpectrometerDataPoint(int wavelength, int numberOfPhotonsEmitted) {

    public SpectrometerDataPoint {
        if (wavelength <= 0 || numberOfPhotonsEmitted < 0) {
            throw new IllegalArgumentException(String.format("Punto de espectrómetro inválido (λ=%d, n=%d)", wavelength, numberOfPhotonsEmitted));
        }
    }
}
