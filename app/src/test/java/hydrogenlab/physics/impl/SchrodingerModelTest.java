package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.particle.Photon;
import hydrogenlab.domain.quantum.SchrodingerQuantumNumbers;
import hydrogenlab.physics.solver.OrbitalDensityField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchrodingerModelTest {

    @Mock
    private RandomGenerator random;

    private AtomConfig config;
    private SchrodingerModel model;
    private final List<PhotonEmittedEvent> emitted = new ArrayList<>();

    @BeforeEach
    void setUp() {
        config = AtomConfig.getDefaultAtom();
        model = new SchrodingerModel(config, random, StateScope.root("test"));
        model.addPhotonEmittedListener(emitted::add);
    }

    private Photon photonAt(int wavelength, double x, double y) {
        return new Photon(1L, wavelength, new Vector2(x, y), Math.PI / 2, 300.0, config.photonRadius(), false);
    }

    @Test
    @DisplayName("En el estado metaestable la absorción es segura y respeta |Δl| = 1")
    void processPhoton_metastableAbsorptionIsCertain() {
        // ARRANGE
        model.restoreState(SchrodingerQuantumNumbers.METASTABLE_STATE);
        when(random.nextInt(anyInt())).thenReturn(0);

        // ACT
        model.processPhoton(photonAt(656, 0.0, -24.0));

        // ASSERT
        SchrodingerQuantumNumbers state = model.getNLM();
        assertEquals(3, state.n());
        assertEquals(1, state.l());
        assertFalse(model.isMetastable());
        verify(random, never()).nextDouble();
    }

    @Test
    @DisplayName("Fuera del estado metaestable la absorción depende de la probabilidad")
    void processPhoton_regularAbsorptionCanFail() {
        when(random.nextDouble()).thenReturn(0.9);

        model.processPhoton(photonAt(122, 0.0, -6.0));

        assertEquals(SchrodingerQuantumNumbers.GROUND_STATE, model.getNLM());
    }

    @Test
    @DisplayName("(2,0,0) no decae nunca espontáneamente")
    void step_metastableStateNeverDecays() {
        // ARRANGE
        model.restoreState(SchrodingerQuantumNumbers.METASTABLE_STATE);
        when(random.nextDouble()).thenReturn(0.0);

        // ACT
        for (int i = 0; i < 50; i++) {
            model.step(0.1);
        }

        // ASSERT
        assertEquals(SchrodingerQuantumNumbers.METASTABLE_STATE, model.getNLM());
        assertTrue(emitted.isEmpty());
    }

    @Test
    @DisplayName("Un estado con l=1 decae a (1,0,0) emitiendo desde la órbita fundamental")
    void step_shouldDecayFromPState() {
        // ARRANGE
        model.restoreState(new SchrodingerQuantumNumbers(2, 1, 0));
        when(random.nextDouble()).thenReturn(0.0);
        when(random.nextInt(anyInt())).thenReturn(0);

        // ACT
        model.step(1.5);

        // ASSERT
        assertEquals(SchrodingerQuantumNumbers.GROUND_STATE, model.getNLM());
        assertEquals(1, emitted.size());
        assertEquals(122, emitted.get(0).wavelength());
        assertEquals(config.groundOrbitRadius(), emitted.get(0).position().magnitude(), 1e-9);
    }

    @Test
    @DisplayName("Emisión estimulada desde (2,1,m): baja a (1,0,0) y emite un fotón coherente")
    void processPhoton_shouldStimulateEmissionFromPState() {
        // ARRANGE
        model.restoreState(new SchrodingerQuantumNumbers(2, 1, 1));
        when(random.nextDouble()).thenReturn(0.0);
        when(random.nextInt(anyInt())).thenReturn(0);
        Photon photon = photonAt(122, 0.0, -24.0);

        // ACT
        model.processPhoton(photon);

        // ASSERT
        assertEquals(SchrodingerQuantumNumbers.GROUND_STATE, model.getNLM());
        assertEquals(1, emitted.size());
        PhotonEmittedEvent event = emitted.get(0);
        assertEquals(122, event.wavelength());
        assertEquals(photon.getDirection(), event.direction(), 1e-12);
        assertEquals(24.0, event.position().x(), 1e-9);
        assertTrue(event.emittedByAtom());
        assertTrue(photon.isCollided());
    }

    @Test
    @DisplayName("(2,0,0) no tiene emisión estimulada hacia n=1: el estado se mantiene y no se emite nada")
    void processPhoton_metastableStateIgnoresDownwardWavelength() {
        // ARRANGE
        model.restoreState(SchrodingerQuantumNumbers.METASTABLE_STATE);
        Photon photon = photonAt(122, 0.0, -24.0);

        // ACT
        model.processPhoton(photon);

        // ASSERT
        assertEquals(SchrodingerQuantumNumbers.METASTABLE_STATE, model.getNLM());
        assertTrue(emitted.isEmpty());
        verifyNoInteractions(random);
    }

    @Test
    @DisplayName("La colisión usa el anillo de brillo")
    void collides_shouldUseBrightnessRing() {
        model.restoreState(SchrodingerQuantumNumbers.METASTABLE_STATE);

        assertTrue(model.collides(photonAt(656, 0.0, -46.0)));
        assertFalse(model.collides(photonAt(656, 0.0, -47.0)));
    }

    @Test
    @DisplayName("El modo experimento comparte la física; los modelos no cuánticos de Schrödinger se rechazan")
    void constructor_shouldAcceptOnlySchrodingerKinds() {
        SchrodingerModel experiment = new SchrodingerModel(AtomicModelKind.EXPERIMENT, config, random, StateScope.root("test"));

        assertEquals("EXPERIMENT", experiment.getName());
        assertEquals(SchrodingerQuantumNumbers.GROUND_STATE, experiment.getNLM());
        assertThrows(IllegalArgumentException.class,
                () -> new SchrodingerModel(AtomicModelKind.BOHR, config, random, StateScope.root("test")));
    }

    @Test
    @DisplayName("Densidad de probabilidad del estado actual y campo normalizado")
    void densityField_shouldBeNormalized() {
        model.restoreState(new SchrodingerQuantumNumbers(2, 1, 0));

        OrbitalDensityField field = model.getDensityField(16);

        double max = 0.0;
        for (int row = 0; row < field.gridSize(); row++) {
            for (int column = 0; column < field.gridSize(); column++) {
                max = Math.max(max, field.valueAt(row, column));
            }
        }
        assertEquals(1.0, max, 1e-12);
        assertEquals(24.0, field.extent(), 1e-12);
        assertTrue(model.getProbabilityDensity(0.0, 6.0) > 0.0);
    }

    @Test
    @DisplayName("Reset vuelve a (1,0,0)")
    void reset_shouldReturnToGroundState() {
        model.restoreState(new SchrodingerQuantumNumbers(4, 3, -2));

        model.reset();
        model.reset();

        assertEquals(SchrodingerQuantumNumbers.GROUND_STATE, model.getNLM());
        assertEquals(1, model.getN());
    }
}
