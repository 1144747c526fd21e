package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.event.PhotonAbsorbedEvent;
import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.particle.Photon;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlumPuddingModelTest {

    // (50 - 4.5) · sqrt(0.25)
    private static final double START_X = 22.75;

    @Mock
    private RandomGenerator random;

    private final List<PhotonEmittedEvent> emitted = new ArrayList<>();
    private final List<PhotonAbsorbedEvent> absorbed = new ArrayList<>();

    private PlumPuddingModel newModel() {
        PlumPuddingModel model = new PlumPuddingModel(AtomConfig.getDefaultAtom(), random, StateScope.root("test"));
        model.addPhotonEmittedListener(emitted::add);
        model.addPhotonAbsorbedListener(absorbed::add);
        return model;
    }

    private Photon photonAt(int wavelength, double x, double y) {
        return new Photon(4L, wavelength, new Vector2(x, y), Math.PI / 2, 300.0, 15.0, false);
    }

    @Test
    @DisplayName("El electrón empieza en reposo dentro del pudin")
    void constructor_shouldPlaceElectronInsidePudding() {
        when(random.nextDouble()).thenReturn(0.25, 0.0);

        PlumPuddingModel model = newModel();

        assertEquals(START_X, model.getElectron().getPosition().x(), 1e-9);
        assertEquals(0.0, model.getElectron().getPosition().y(), 1e-9);
        assertFalse(model.getElectron().isMoving());
    }

    @Test
    @DisplayName("Absorbe 150 nm, oscila y emite 150 nm tras cinco cruces por el centro")
    void absorbThenEmitAfterCrossings() {
        // ARRANGE
        when(random.nextDouble()).thenReturn(0.25, 0.0, 0.5);
        when(random.nextBoolean()).thenReturn(false);
        PlumPuddingModel model = newModel();

        // ACT
        model.processPhoton(photonAt(150, START_X, -10.0));
        boolean movingAfterAbsorption = model.getElectron().isMoving();
        for (int i = 0; i < 300; i++) {
            model.step(0.01);
        }

        // ASSERT
        assertTrue(movingAfterAbsorption);
        assertEquals(1, absorbed.size());
        assertEquals(4L, absorbed.get(0).photonId());
        assertEquals(1, emitted.size());
        assertEquals(150, emitted.get(0).wavelength());
        assertTrue(emitted.get(0).emittedByAtom());
        assertEquals(5, model.getElectron().getNumberOfCrossings());
        assertFalse(model.getElectron().isMoving());
    }

    @Test
    @DisplayName("El electrón se queda dentro de la cuerda del pudin mientras oscila")
    void oscillation_shouldStayInsidePudding() {
        when(random.nextDouble()).thenReturn(0.25, 0.0, 0.5);
        when(random.nextBoolean()).thenReturn(true);
        PlumPuddingModel model = newModel();
        model.processPhoton(photonAt(150, START_X, 0.0));

        for (int i = 0; i < 200; i++) {
            model.step(0.01);
            assertTrue(Math.abs(model.getElectron().getPosition().x()) <= 45.5 + 1e-9);
        }
        assertTrue(model.getElectron().getNumberOfCrossings() > 0);
    }

    @Test
    @DisplayName("Otras longitudes de onda no interactúan")
    void processPhoton_shouldIgnoreOtherWavelengths() {
        when(random.nextDouble()).thenReturn(0.25, 0.0);
        PlumPuddingModel model = newModel();
        Photon photon = photonAt(122, START_X, 0.0);

        model.processPhoton(photon);

        assertFalse(photon.isCollided());
        assertFalse(model.getElectron().isMoving());
        assertTrue(absorbed.isEmpty());
    }

    @Test
    @DisplayName("Si falla la tirada de absorción el fotón no vuelve a interactuar")
    void processPhoton_failedRollConsumesPhoton() {
        when(random.nextDouble()).thenReturn(0.25, 0.0, 0.9);
        PlumPuddingModel model = newModel();
        Photon photon = photonAt(150, START_X, 0.0);

        model.processPhoton(photon);

        assertTrue(photon.isCollided());
        assertFalse(model.getElectron().isMoving());
        assertTrue(absorbed.isEmpty());
    }

    @Test
    @DisplayName("Reset detiene el electrón y lo devuelve a su posición inicial")
    void reset_shouldStopElectron() {
        when(random.nextDouble()).thenReturn(0.25, 0.0, 0.5);
        when(random.nextBoolean()).thenReturn(false);
        PlumPuddingModel model = newModel();
        model.processPhoton(photonAt(150, START_X, 0.0));
        model.step(0.05);

        model.reset();
        model.reset();

        assertFalse(model.getElectron().isMoving());
        assertEquals(0, model.getElectron().getNumberOfCrossings());
        assertEquals(START_X, model.getElectron().getPosition().x(), 1e-9);
    }
}
