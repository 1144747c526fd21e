package hydrogenlab.physics.simulator;

import hydrogenlab.config.SimulationConfig;
import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.ZoomedInBox;
import hydrogenlab.domain.observable.StateScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LightSourceTest {

    @Mock
    private RandomGenerator random;

    private final SimulationConfig config = SimulationConfig.getDefault();
    private final ZoomedInBox box = new ZoomedInBox(440.0);
    private final List<PhotonEmittedEvent> emitted = new ArrayList<>();

    private LightSource light;

    @BeforeEach
    void setUp() {
        light = new LightSource(config, box, random, StateScope.root("test"));
        light.addPhotonEmittedListener(emitted::add);
    }

    @Test
    @DisplayName("El intervalo entre emisiones es (alto / velocidad) / N")
    void dtBetweenEmissions_shouldFollowBoxTransitTime() {
        assertEquals((440.0 / 300.0) / 20, light.getDtBetweenEmissions(), 1e-12);
    }

    @Test
    @DisplayName("Apagada no emite ni consume aleatoriedad")
    void step_offShouldNotEmit() {
        light.step(1.0);

        assertTrue(emitted.isEmpty());
        verifyNoInteractions(random);
    }

    @Test
    @DisplayName("Luz blanca: emite desde el borde inferior hacia arriba y conserva el exceso de tiempo")
    void step_shouldEmitFromBottomEdgeAndKeepRemainder() {
        // ARRANGE
        when(random.nextDouble()).thenReturn(0.5, 0.1);
        when(random.nextInt(5)).thenReturn(2);
        light.setOn(true);

        // ACT
        light.step(0.05);
        int afterFirstStep = emitted.size();
        light.step(0.05);

        // ASSERT
        assertEquals(0, afterFirstStep);
        assertEquals(1, emitted.size());
        PhotonEmittedEvent event = emitted.get(0);
        assertEquals(97, event.wavelength());
        assertEquals(0.0, event.position().x(), 1e-9);
        assertEquals(box.minY(), event.position().y(), 1e-9);
        assertEquals(Math.PI / 2, event.direction(), 1e-12);
        assertFalse(event.emittedByAtom());
        assertEquals(0.1 - light.getDtBetweenEmissions(), light.getDtSinceLastEmission(), 1e-9);
    }

    @Test
    @DisplayName("Luz blanca: si la tirada supera el peso se elige cualquier longitud de onda del rango")
    void chooseWavelength_whiteOutsideTransitionWeight() {
        when(random.nextDouble()).thenReturn(0.7);
        when(random.nextInt(92, 751)).thenReturn(500);

        assertEquals(500, light.chooseWavelength());
    }

    @Test
    @DisplayName("Monocromática: siempre la longitud de onda configurada")
    void chooseWavelength_monochromatic() {
        light.setMode(LightMode.MONOCHROMATIC);
        light.setMonochromaticWavelength(122);

        assertEquals(122, light.chooseWavelength());
        verifyNoInteractions(random);
    }

    @Test
    @DisplayName("La longitud de onda monocromática debe estar en [92, 750]")
    void setMonochromaticWavelength_shouldValidateRange() {
        assertThrows(IllegalArgumentException.class, () -> light.setMonochromaticWavelength(91));
        assertThrows(IllegalArgumentException.class, () -> light.setMonochromaticWavelength(751));

        light.setMonochromaticWavelength(92);
        light.setMonochromaticWavelength(750);
        assertEquals(750, light.getMonochromaticWavelength());
    }

    @Test
    @DisplayName("En un segundo emite unas 1/intervalo veces")
    void step_shouldEmitAtConfiguredRate() {
        LightSource seeded = new LightSource(config, box, new Random(7L), StateScope.root("test"));
        List<PhotonEmittedEvent> events = new ArrayList<>();
        seeded.addPhotonEmittedListener(events::add);
        seeded.setOn(true);

        for (int i = 0; i < 100; i++) {
            seeded.step(0.01);
        }

        assertTrue(events.size() >= 13 && events.size() <= 14, "emisiones: " + events.size());
        for (PhotonEmittedEvent event : events) {
            assertTrue(event.wavelength() >= 92 && event.wavelength() <= 750);
            assertTrue(box.contains(event.position()));
        }
    }

    @Test
    @DisplayName("Reset apaga la luz y restaura modo y longitud de onda")
    void reset_shouldRestoreDefaults() {
        light.setOn(true);
        light.setMode(LightMode.MONOCHROMATIC);
        light.setMonochromaticWavelength(656);

        light.reset();

        assertFalse(light.isOn());
        assertEquals(LightMode.WHITE, light.getMode());
        assertEquals(380, light.getMonochromaticWavelength());
        assertEquals(0.0, light.getDtSinceLastEmission());
    }
}
