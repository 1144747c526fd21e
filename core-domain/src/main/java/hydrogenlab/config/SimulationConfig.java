package hydrogenlab.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import hydrogenlab.domain.atom.AtomicModelKind;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Contenedor principal para todas las configuraciones de una simulación.
 * Agrupa la configuración física del átomo con los parámetros de la luz, la caja y el espectrómetro.
 */
@Value
@Builder
@With
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationConfig {

    /**
     * Semilla del generador aleatorio compartido por todas las decisiones estocásticas.
     */
    long seed;

    /**
     * Lado de la caja de observación (centrada en el átomo).
     */
    @Builder.Default
    double boxSize = 460.0;

    /**
     * Velocidad constante de los fotones (unidades/s).
     */
    @Builder.Default
    double photonSpeed = 300.0;

    /**
     * Número máximo de fotones de la fuente que ocupan la caja a la vez.
     */
    @Builder.Default
    int maxLightPhotons = 20;

    /**
     * Probabilidad de que la luz blanca elija una longitud de onda absorbible desde el estado fundamental.
     */
    @Builder.Default
    double whiteLightTransitionWeight = 0.40;

    /**
     * Rango de longitudes de onda de la fuente (nm).
     */
    @Builder.Default
    int minWavelength = 92;
    @Builder.Default
    int maxWavelength = 750;

    @Builder.Default
    int defaultMonochromaticWavelength = 380;

    /**
     * Máximo de instantáneas vivas del espectrómetro.
     */
    @Builder.Default
    int maxSpectrometerSnapshots = 3;

    /**
     * Cada cuántos segundos el gestor metaestable dispara un fotón con luz blanca.
     */
    @Builder.Default
    double exciteAtomInterval = 2.0;

    /**
     * Modelo activo al arrancar y tras un reset.
     */
    @Builder.Default
    AtomicModelKind initialModel = AtomicModelKind.BOHR;

    @Builder.Default
    AtomConfig atomConfig = AtomConfig.getDefaultAtom();

    /**
     * Comprueba la coherencia de los parámetros.
     *
     * @return la propia configuración, para encadenar.
     * @throws IllegalArgumentException si algún parámetro está fuera de rango.
     */
    public SimulationConfig validate() {
        if (boxSize <= 0 || photonSpeed <= 0 || maxLightPhotons <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Caja, velocidad y número de fotones deben ser > 0 (box=%s, speed=%s, photons=%d)",
                    boxSize, photonSpeed, maxLightPhotons));
        }
        if (whiteLightTransitionWeight < 0 || whiteLightTransitionWeight > 1) {
            throw new IllegalArgumentException("whiteLightTransitionWeight fuera de [0, 1]: " + whiteLightTransitionWeight);
        }
        if (minWavelength <= 0 || minWavelength > maxWavelength) {
            throw new IllegalArgumentException(String.format("Rango de longitudes de onda inválido [%d, %d]", minWavelength, maxWavelength));
        }
        if (defaultMonochromaticWavelength < minWavelength || defaultMonochromaticWavelength > maxWavelength) {
            throw new IllegalArgumentException("Longitud de onda monocromática por defecto fuera de rango: " + defaultMonochromaticWavelength);
        }
        if (maxSpectrometerSnapshots < 0 || exciteAtomInterval <= 0) {
            throw new IllegalArgumentException("maxSpectrometerSnapshots debe ser >= 0 y exciteAtomInterval > 0");
        }
        if (initialModel == null || atomConfig == null) {
            throw new IllegalArgumentException("initialModel y atomConfig son obligatorios");
        }
        if (atomConfig.orbitRadius(6) + atomConfig.electronRadius() > boxSize / 2) {
            throw new IllegalArgumentException("La órbita n=6 no cabe en la caja de observación");
        }
        return this;
    }

    public static SimulationConfig getDefault() {
        return SimulationConfig.builder().build();
    }
}
