package hydrogenlab.physics.simulator;

import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.geometry.ZoomedInBox;
import hydrogenlab.domain.particle.Photon;
import hydrogenlab.physics.i.IHydrogenAtom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PhotonPoolTest {

    @Mock
    private IHydrogenAtom atom;

    private PhotonPool pool;

    @BeforeEach
    void setUp() {
        pool = new PhotonPool(new ZoomedInBox(440.0), 300.0, 15.0);
    }

    private static PhotonEmittedEvent upwardsAt(int wavelength, double x, double y, boolean fromAtom) {
        return new PhotonEmittedEvent(wavelength, new Vector2(x, y), Math.PI / 2, fromAtom);
    }

    @Test
    @DisplayName("Cada fotón recibe una identidad única y se puede eliminar por ella")
    void add_shouldAssignSequentialIds() {
        Photon first = pool.add(upwardsAt(122, 0.0, 0.0, false));
        Photon second = pool.add(upwardsAt(656, 0.0, 0.0, true));

        assertNotEquals(first.getId(), second.getId());
        assertTrue(second.isEmittedByAtom());
        assertEquals(300.0, second.getSpeed());
        assertTrue(pool.remove(first.getId()));
        assertFalse(pool.remove(first.getId()));
        assertEquals(1, pool.size());
    }

    @Test
    @DisplayName("Los fotones que salen de la caja se eliminan y se notifican; el resto lo procesa el átomo")
    void step_shouldRemoveExitingPhotons() {
        // ARRANGE
        doCallRealMethod().when(atom).movePhoton(any(Photon.class), anyDouble());
        Photon leaving = pool.add(upwardsAt(122, 0.0, 219.0, true));
        Photon staying = pool.add(upwardsAt(122, 0.0, 0.0, false));
        List<Photon> exited = new ArrayList<>();
        pool.addExitListener(exited::add);

        // ACT
        pool.step(0.01, atom);

        // ASSERT
        assertEquals(List.of(leaving), exited);
        assertEquals(1, pool.size());
        assertEquals(3.0, staying.getPosition().y(), 1e-9);
        verify(atom).processPhoton(staying);
        verify(atom, never()).processPhoton(leaving);
    }

    @Test
    @DisplayName("Un fotón eliminado durante el paso no se procesa")
    void step_shouldSkipPhotonsRemovedMidStep() {
        // ARRANGE
        Photon first = pool.add(upwardsAt(122, 0.0, 0.0, false));
        Photon second = pool.add(upwardsAt(122, 10.0, 0.0, false));
        doAnswer(invocation -> pool.remove(second.getId())).when(atom).processPhoton(first);

        // ACT
        pool.step(0.01, atom);

        // ASSERT
        verify(atom, never()).processPhoton(second);
        assertEquals(1, pool.size());
    }

    @Test
    @DisplayName("Clear vacía el conjunto")
    void clear_shouldRemoveAll() {
        pool.add(upwardsAt(122, 0.0, 0.0, false));
        pool.add(upwardsAt(122, 0.0, 0.0, false));

        pool.clear();

        assertTrue(pool.isEmpty());
        assertTrue(pool.getPhotons().isEmpty());
    }
}
