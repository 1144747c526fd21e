package hydrogenlab.physics.impl;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.particle.QuantumElectron;
import hydrogenlab.physics.i.IElectronStatePolicy;
import hydrogenlab.physics.model.TransitionTable;
import hydrogenlab.physics.model.WeightedChooser;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.random.RandomGenerator;

/**
 * Estados de Bohr y de Broglie: sólo el número principal n. Cualquier n en [1, 6] es alcanzable.
 */
public class BohrStatePolicy implements IElectronStatePolicy {

    private final QuantumElectron electron;
    private final TransitionTable table;

    public BohrStatePolicy(QuantumElectron electron, TransitionTable table) {
        this.electron = electron;
        this.table = table;
    }

    @Override
    public int getN() {
        return electron.getN();
    }

    @Override
    public boolean absorptionIsCertain() {
        return false;
    }

    @Override
    public boolean canTransitionTo(int nTarget) {
        return nTarget != electron.getN()
                && nTarget >= QuantumElectron.GROUND_STATE
                && nTarget <= QuantumElectron.MAX_STATE;
    }

    @Override
    public void transitionTo(int nTarget, RandomGenerator random) {
        if (!canTransitionTo(nTarget)) {
            throw new IllegalStateException("Transición inválida " + electron.getN() + " -> " + nTarget);
        }
        electron.setN(nTarget);
    }

    /**
     * Ponderado por la intensidad de transición; los n con intensidad nula nunca se eligen.
     */
    @Override
    public OptionalInt chooseLowerN(RandomGenerator random) {
        int n = electron.getN();
        List<Integer> candidates = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (int nLower = QuantumElectron.GROUND_STATE; nLower < n; nLower++) {
            candidates.add(nLower);
            weights.add(table.getTransitionStrength(n, nLower));
        }
        return WeightedChooser.choose(candidates, weights, random)
                .map(OptionalInt::of)
                .orElseGet(OptionalInt::empty);
    }

    /**
     * El fotón sale de la posición actual del electrón.
     */
    @Override
    public Vector2 spontaneousEmissionOffset(RandomGenerator random) {
        return electron.getOffset();
    }

    @Override
    public void reset() {
        electron.reset();
    }
}
