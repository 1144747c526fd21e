package hydrogenlab.physics.impl;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.particle.SchrodingerElectron;
import hydrogenlab.domain.quantum.SchrodingerQuantumNumbers;
import hydrogenlab.physics.i.IElectronStatePolicy;
import hydrogenlab.physics.model.SchrodingerTransitionRules;
import hydrogenlab.physics.model.TransitionTable;

import java.util.OptionalInt;
import java.util.random.RandomGenerator;

/**
 * Estados (n, l, m) con reglas de selección dipolar. El estado (2,0,0) es metaestable:
 * no tiene transición descendente válida y absorbe con certeza.
 */
public class SchrodingerStatePolicy implements IElectronStatePolicy {

    private final SchrodingerElectron electron;
    private final TransitionTable table;
    private final double groundOrbitRadius;

    public SchrodingerStatePolicy(SchrodingerElectron electron, TransitionTable table, double groundOrbitRadius) {
        this.electron = electron;
        this.table = table;
        this.groundOrbitRadius = groundOrbitRadius;
    }

    @Override
    public int getN() {
        return electron.getN();
    }

    @Override
    public boolean absorptionIsCertain() {
        return electron.getNLM().isMetastable();
    }

    @Override
    public boolean canTransitionTo(int nTarget) {
        return !SchrodingerTransitionRules.validTargets(electron.getNLM(), nTarget).isEmpty();
    }

    @Override
    public void transitionTo(int nTarget, RandomGenerator random) {
        SchrodingerQuantumNumbers current = electron.getNLM();
        SchrodingerQuantumNumbers next = SchrodingerTransitionRules.chooseTarget(current, nTarget, random)
                .orElseThrow(() -> new IllegalStateException("No existe transición válida " + current + " -> n=" + nTarget));
        electron.setNLM(next);
    }

    @Override
    public OptionalInt chooseLowerN(RandomGenerator random) {
        return SchrodingerTransitionRules.chooseLowerN(electron.getNLM(), table, random)
                .map(OptionalInt::of)
                .orElseGet(OptionalInt::empty);
    }

    /**
     * Punto aleatorio de la órbita del estado fundamental: el fotón nace cerca del núcleo.
     */
    @Override
    public Vector2 spontaneousEmissionOffset(RandomGenerator random) {
        return Vector2.fromPolar(groundOrbitRadius, random.nextDouble() * 2 * Math.PI);
    }

    @Override
    public void reset() {
        electron.reset();
    }
}
