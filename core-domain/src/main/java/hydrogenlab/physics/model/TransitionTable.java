package hydrogenlab.physics.model;

import hydrogenlab.domain.quantum.StateTransition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Datos físicos del espectro del hidrógeno (series de Lyman, Balmer, Paschen, Brackett y Pfund).
 * <p>
 * Cada longitud de onda (nm, entera) se calcula con la fórmula de Rydberg
 * λ = hc / (13.6 eV · (1/n1² - 1/n2²)) para 1 ≤ n1 &lt; n2 ≤ 6. Todas las longitudes resultantes son distintas,
 * así que la tabla se puede indexar por longitud de onda.
 * <p>
 * Inmutable y compartida por todo el proceso.
 */
public final class TransitionTable {

    /**
     * Constante de Planck por velocidad de la luz, en eV·nm.
     */
    public static final double HC = 1240.0;
    public static final double RYDBERG_ENERGY = 13.6; // eV

    public static final int MIN_STATE = 1;
    public static final int MAX_STATE = 6;

    public static final int MIN_VISIBLE_WAVELENGTH = 380;
    public static final int MAX_VISIBLE_WAVELENGTH = 750;

    /**
     * Intensidades relativas de transición, indexadas [nSuperior - 1][nInferior - 1].
     */
    private static final double[][] TRANSITION_STRENGTHS = {
            {0, 0, 0, 0, 0},
            {12.53, 0, 0, 0, 0},
            {3.34, 0.87, 0, 0, 0},
            {1.36, 0.24, 0.07, 0, 0},
            {0.69, 0.11, 0, 0.04, 0},
            {0.39, 0.06, 0.02, 0, 0}
    };

    private static final TransitionTable INSTANCE = new TransitionTable();

    private final Map<Integer, StateTransition> transitionsByWavelength;
    private final Map<Integer, List<Integer>> absorbableWavelengths;

    private TransitionTable() {
        Map<Integer, StateTransition> byWavelength = new TreeMap<>();
        Map<Integer, List<Integer>> byLowerState = new LinkedHashMap<>();
        for (int n1 = MIN_STATE; n1 <= MAX_STATE; n1++) {
            List<Integer> wavelengths = new ArrayList<>();
            for (int n2 = n1 + 1; n2 <= MAX_STATE; n2++) {
                int wavelength = computeWavelength(n1, n2);
                StateTransition previous = byWavelength.put(wavelength, new StateTransition(n1, n2));
                if (previous != null) {
                    throw new IllegalStateException("Longitud de onda duplicada en la tabla de transiciones: " + wavelength);
                }
                wavelengths.add(wavelength);
            }
            byLowerState.put(n1, Collections.unmodifiableList(wavelengths));
        }
        this.transitionsByWavelength = Collections.unmodifiableMap(byWavelength);
        this.absorbableWavelengths = Collections.unmodifiableMap(byLowerState);
    }

    public static TransitionTable getInstance() {
        return INSTANCE;
    }

    private static int computeWavelength(int n1, int n2) {
        double deltaEnergy = RYDBERG_ENERGY * ((1.0 / (n1 * n1)) - (1.0 / (n2 * n2)));
        return (int) Math.round(HC / deltaEnergy);
    }

    /**
     * Longitudes de onda capaces de excitar el estado n, ordenadas por estado destino creciente.
     * Para n = 6 la lista está vacía.
     */
    public List<Integer> wavelengthsAbsorbableFrom(int n) {
        checkState(n);
        return absorbableWavelengths.get(n);
    }

    public Optional<StateTransition> transitionFor(int wavelength) {
        return Optional.ofNullable(transitionsByWavelength.get(wavelength));
    }

    /**
     * Todas las longitudes de onda conocidas, en orden ascendente.
     */
    public List<Integer> allKnownWavelengths() {
        return List.copyOf(transitionsByWavelength.keySet());
    }

    public int getAbsorptionWavelength(int nLower, int nUpper) {
        checkState(nLower);
        checkState(nUpper);
        if (nLower >= nUpper) {
            throw new IllegalArgumentException(String.format("Absorción requiere n1 < n2 (n1=%d, n2=%d)", nLower, nUpper));
        }
        return computeWavelength(nLower, nUpper);
    }

    public int getEmissionWavelength(int nUpper, int nLower) {
        return getAbsorptionWavelength(nLower, nUpper);
    }

    /**
     * Estado superior alcanzable desde n absorbiendo la longitud de onda dada.
     */
    public OptionalInt getHigherStateForWavelength(int n, int wavelength) {
        return transitionFor(wavelength)
                .filter(t -> t.lower() == n)
                .map(t -> OptionalInt.of(t.upper()))
                .orElseGet(OptionalInt::empty);
    }

    /**
     * Estado inferior alcanzable desde n emitiendo (de forma estimulada) la longitud de onda dada.
     */
    public OptionalInt getLowerStateForWavelength(int n, int wavelength) {
        return transitionFor(wavelength)
                .filter(t -> t.upper() == n)
                .map(t -> OptionalInt.of(t.lower()))
                .orElseGet(OptionalInt::empty);
    }

    /**
     * Intensidad relativa de la transición nUpper -> nLower. Cero si no está permitida.
     */
    public double getTransitionStrength(int nUpper, int nLower) {
        checkState(nUpper);
        checkState(nLower);
        if (nLower >= nUpper) {
            return 0.0;
        }
        return TRANSITION_STRENGTHS[nUpper - 1][nLower - 1];
    }

    public List<Integer> getVisibleWavelengths() {
        return filter(w -> w >= MIN_VISIBLE_WAVELENGTH && w <= MAX_VISIBLE_WAVELENGTH);
    }

    public List<Integer> getUltravioletWavelengths() {
        return filter(w -> w < MIN_VISIBLE_WAVELENGTH);
    }

    public List<Integer> getInfraredWavelengths() {
        return filter(w -> w > MAX_VISIBLE_WAVELENGTH);
    }

    private List<Integer> filter(Predicate<Integer> predicate) {
        return transitionsByWavelength.keySet().stream()
                .filter(predicate)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * E = hc / λ, en eV.
     */
    public static double wavelengthToEnergy(double wavelength) {
        if (wavelength <= 0) {
            throw new IllegalArgumentException("Longitud de onda no positiva: " + wavelength);
        }
        return HC / wavelength;
    }

    public static double energyToWavelength(double energy) {
        if (energy <= 0) {
            throw new IllegalArgumentException("Energía no positiva: " + energy);
        }
        return HC / energy;
    }

    private static void checkState(int n) {
        if (n < MIN_STATE || n > MAX_STATE) {
            throw new IllegalArgumentException("n fuera de rango [" + MIN_STATE + ", " + MAX_STATE + "]: " + n);
        }
    }
}
