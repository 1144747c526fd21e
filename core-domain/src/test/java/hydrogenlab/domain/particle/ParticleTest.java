package hydrogenlab.domain.particle;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.StateScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParticleTest {

    @Test
    @DisplayName("Protón y neutrón son contenedores de posición y radio con nombre jerárquico")
    void nucleons_shouldHoldPositionAndRadius() {
        StateScope scope = StateScope.root("atom");
        Proton proton = new Proton(scope, Vector2.ZERO, 7.5);
        Neutron neutron = new Neutron(scope, new Vector2(3.0, 0.0), 7.5);

        assertEquals(Vector2.ZERO, proton.getPosition());
        assertEquals(7.5, neutron.getRadius());
        assertEquals("atom.proton.position", proton.positionProperty().getName());
        assertEquals("atom.neutron.position", neutron.positionProperty().getName());
    }

    @Test
    @DisplayName("Reset devuelve la partícula a su posición inicial y notifica el cambio")
    void reset_shouldRestoreInitialPosition() {
        Neutron neutron = new Neutron(StateScope.root("atom"), Vector2.ZERO, 7.5);
        List<Vector2> notified = new ArrayList<>();
        neutron.positionProperty().addListener((oldValue, newValue) -> notified.add(newValue));

        neutron.setPosition(new Vector2(1.0, 1.0));
        neutron.reset();

        assertEquals(Vector2.ZERO, neutron.getPosition());
        assertEquals(List.of(new Vector2(1.0, 1.0), Vector2.ZERO), notified);
    }

    @Test
    @DisplayName("El fotón avanza en línea recta según su dirección y velocidad")
    void photon_shouldMoveStraight() {
        Photon photon = new Photon(1L, 656, new Vector2(0.0, -220.0), Math.PI / 2, 300.0, 15.0, false);

        photon.move(0.1);

        assertEquals(0.0, photon.getPosition().x(), 1e-9);
        assertEquals(-190.0, photon.getPosition().y(), 1e-9);
        assertFalse(photon.isCollided());
        assertEquals("photons.1.position", photon.positionProperty().getName());
    }

    @Test
    @DisplayName("Un fotón necesita longitud de onda positiva")
    void photon_shouldRejectNonPositiveWavelength() {
        assertThrows(IllegalArgumentException.class,
                () -> new Photon(1L, 0, Vector2.ZERO, 0.0, 300.0, 15.0, false));
    }
}
