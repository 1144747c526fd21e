package hydrogenlab.config;

import hydrogenlab.domain.atom.AtomicModelKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigTest {

    @Test
    @DisplayName("La configuración por defecto es válida y usa los valores de referencia")
    void getDefault_shouldBeValid() {
        // ACT
        SimulationConfig config = SimulationConfig.getDefault().validate();

        // ASSERT
        assertEquals(460.0, config.getBoxSize());
        assertEquals(20, config.getMaxLightPhotons());
        assertEquals(0.40, config.getWhiteLightTransitionWeight());
        assertEquals(92, config.getMinWavelength());
        assertEquals(750, config.getMaxWavelength());
        assertEquals(380, config.getDefaultMonochromaticWavelength());
        assertEquals(3, config.getMaxSpectrometerSnapshots());
        assertEquals(AtomicModelKind.BOHR, config.getInitialModel());
        assertNotNull(config.getAtomConfig());
    }

    @Test
    @DisplayName("validate rechaza una longitud de onda monocromática fuera de rango")
    void validate_shouldRejectMonochromaticOutOfRange() {
        SimulationConfig config = SimulationConfig.getDefault().withDefaultMonochromaticWavelength(900);

        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    @DisplayName("validate rechaza una caja en la que no cabe la órbita n=6")
    void validate_shouldRejectTooSmallBox() {
        SimulationConfig config = SimulationConfig.getDefault().withBoxSize(100.0);

        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    @DisplayName("AtomConfig: el umbral de colisión es la suma de radios y r(n) = n²·r1")
    void atomConfig_shouldDeriveThresholdAndRadius() {
        AtomConfig atom = AtomConfig.getDefaultAtom();

        assertEquals(19.5, atom.collisionThreshold(), 1e-12);
        assertEquals(6.0, atom.orbitRadius(1), 1e-12);
        assertEquals(216.0, atom.orbitRadius(6), 1e-12);
    }

    @Test
    @DisplayName("AtomConfig rechaza probabilidades fuera de [0, 1]")
    void atomConfig_shouldRejectInvalidProbability() {
        AtomConfig atom = AtomConfig.getDefaultAtom();

        assertThrows(IllegalArgumentException.class, () -> atom.withAbsorptionProbability(1.5));
    }
}
