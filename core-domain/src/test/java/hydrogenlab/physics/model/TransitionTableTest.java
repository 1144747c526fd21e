package hydrogenlab.physics.model;

import hydrogenlab.domain.quantum.StateTransition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransitionTableTest {

    private final TransitionTable table = TransitionTable.getInstance();

    @Test
    @DisplayName("Series de Lyman y Balmer con los valores conocidos")
    void wavelengthsAbsorbableFrom_shouldMatchKnownSeries() {
        assertEquals(List.of(122, 103, 97, 95, 94), table.wavelengthsAbsorbableFrom(1));
        assertEquals(List.of(656, 486, 434, 410), table.wavelengthsAbsorbableFrom(2));
        assertEquals(List.of(1876, 1282, 1094), table.wavelengthsAbsorbableFrom(3));
        assertEquals(List.of(4052, 2626), table.wavelengthsAbsorbableFrom(4));
        assertEquals(List.of(7460), table.wavelengthsAbsorbableFrom(5));
        assertTrue(table.wavelengthsAbsorbableFrom(6).isEmpty());
    }

    @Test
    @DisplayName("Ida y vuelta: toda λ con transición (n1, n2) aparece exactamente en la lista de n1")
    void transitionFor_shouldRoundTrip() {
        List<Integer> all = table.allKnownWavelengths();
        assertEquals(15, all.size());

        for (int wavelength : all) {
            StateTransition transition = table.transitionFor(wavelength).orElseThrow();
            for (int n = 1; n <= 6; n++) {
                boolean listed = table.wavelengthsAbsorbableFrom(n).contains(wavelength);
                assertEquals(n == transition.lower(), listed,
                        "λ=" + wavelength + " debe aparecer sólo en la lista de n=" + transition.lower());
            }
            assertEquals(wavelength, table.getAbsorptionWavelength(transition.lower(), transition.upper()));
        }
    }

    @Test
    @DisplayName("Longitudes de onda desconocidas no tienen transición")
    void transitionFor_shouldBeEmptyForUnknownWavelength() {
        assertEquals(Optional.empty(), table.transitionFor(500));
        assertTrue(table.getHigherStateForWavelength(1, 500).isEmpty());
    }

    @Test
    @DisplayName("Estados superior e inferior para una longitud de onda")
    void higherAndLowerState_shouldResolveFromCurrentState() {
        assertEquals(2, table.getHigherStateForWavelength(1, 122).getAsInt());
        assertTrue(table.getHigherStateForWavelength(2, 122).isEmpty());
        assertEquals(1, table.getLowerStateForWavelength(2, 122).getAsInt());
        assertEquals(2, table.getLowerStateForWavelength(3, 656).getAsInt());
    }

    @Test
    @DisplayName("La conversión λ <-> energía es monótona e invertible")
    void energyConversion_shouldBeMonotonicAndInvertible() {
        List<Integer> all = table.allKnownWavelengths();
        for (int i = 1; i < all.size(); i++) {
            assertTrue(TransitionTable.wavelengthToEnergy(all.get(i)) < TransitionTable.wavelengthToEnergy(all.get(i - 1)));
        }
        for (int wavelength : all) {
            double energy = TransitionTable.wavelengthToEnergy(wavelength);
            assertEquals(wavelength, Math.round(TransitionTable.energyToWavelength(energy)));
        }
    }

    @Test
    @DisplayName("Intensidades de transición de la tabla de referencia")
    void getTransitionStrength_shouldReturnTableValues() {
        assertEquals(12.53, table.getTransitionStrength(2, 1));
        assertEquals(0.87, table.getTransitionStrength(3, 2));
        assertEquals(0.0, table.getTransitionStrength(5, 3));
        assertEquals(0.0, table.getTransitionStrength(1, 2));
    }

    @Test
    @DisplayName("Clasificación UV / visible / IR")
    void spectralRanges_shouldPartitionTable() {
        assertEquals(List.of(94, 95, 97, 103, 122), table.getUltravioletWavelengths());
        assertEquals(List.of(410, 434, 486, 656), table.getVisibleWavelengths());
        assertEquals(6, table.getInfraredWavelengths().size());
    }

    @Test
    @DisplayName("n fuera de [1, 6] se rechaza")
    void wavelengthsAbsorbableFrom_shouldRejectInvalidState() {
        assertThrows(IllegalArgumentException.class, () -> table.wavelengthsAbsorbableFrom(0));
        assertThrows(IllegalArgumentException.class, () -> table.wavelengthsAbsorbableFrom(7));
    }
}
