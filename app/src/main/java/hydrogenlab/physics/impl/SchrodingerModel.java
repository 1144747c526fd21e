package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.particle.Photon;
import hydrogenlab.domain.particle.SchrodingerElectron;
import hydrogenlab.domain.quantum.SchrodingerQuantumNumbers;
import hydrogenlab.physics.model.TransitionTable;
import hydrogenlab.physics.solver.OrbitalDensityField;
import hydrogenlab.physics.solver.OrbitalWavefunctionSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Modelo de Schrödinger: el estado es la terna (n, l, m) y las transiciones siguen las reglas
 * de selección dipolar. La colisión usa el anillo de brillo de de Broglie.
 * <p>
 * También respalda el modo {@link AtomicModelKind#EXPERIMENT}, que es la misma física bajo otro nombre.
 */
@Slf4j
public class SchrodingerModel extends AbstractHydrogenAtom {

    private final SchrodingerElectron electron;
    private final QuantumAtomEngine engine;

    public SchrodingerModel(AtomConfig config, RandomGenerator random, StateScope scope) {
        this(AtomicModelKind.SCHRODINGER, config, random, scope);
    }

    public SchrodingerModel(AtomicModelKind kind, AtomConfig config, RandomGenerator random, StateScope parentScope) {
        super(kind, config, random, parentScope);
        if (!kind.isSchrodingerBased()) {
            throw new IllegalArgumentException("SchrodingerModel no puede representar el modelo " + kind);
        }
        this.electron = new SchrodingerElectron(scope, config.groundOrbitRadius(), config.electronRadius());
        this.engine = new QuantumAtomEngine(
                kind, config, electron,
                new SchrodingerStatePolicy(electron, TransitionTable.getInstance(), config.groundOrbitRadius()),
                new RingOrbitGeometry(DeBroglieModel.brightnessCloseness(config)),
                n -> config.electronAngleDelta(),
                random, events, getPosition());
    }

    public SchrodingerElectron getElectron() {
        return electron;
    }

    public int getN() {
        return electron.getN();
    }

    public SchrodingerQuantumNumbers getNLM() {
        return electron.getNLM();
    }

    public boolean isMetastable() {
        return electron.getNLM().isMetastable();
    }

    /**
     * Restaura la terna sin validar la transición (persistencia externa, tests).
     */
    public void restoreState(SchrodingerQuantumNumbers state) {
        electron.restoreState(state, electron.getAngle());
    }

    public double getAmplitude(double angle) {
        return DeBroglieModel.amplitude(electron.getN(), angle, electron.getAngle());
    }

    /**
     * |ψ|² del estado actual en el punto (x, 0, z).
     */
    public double getProbabilityDensity(double x, double z) {
        return OrbitalWavefunctionSolver.probabilityDensityAt(electron.getNLM(), x, 0.0, z, config.groundOrbitRadius());
    }

    /**
     * Campo de densidad normalizado del estado actual, cubriendo la órbita n completa.
     */
    public OrbitalDensityField getDensityField(int gridSize) {
        SchrodingerQuantumNumbers state = electron.getNLM();
        return OrbitalDensityField.compute(state, config.groundOrbitRadius(), gridSize, config.orbitRadius(state.n()));
    }

    @Override
    public void step(double dt) {
        engine.step(dt);
    }

    @Override
    public void processPhoton(Photon photon) {
        engine.processPhoton(photon);
    }

    @Override
    public boolean collides(Photon photon) {
        return engine.collides(photon);
    }

    @Override
    public List<Integer> getTransitionWavelengths(int n) {
        return TransitionTable.getInstance().wavelengthsAbsorbableFrom(n);
    }

    @Override
    public void reset() {
        engine.reset();
        log.debug("[{}] Reset a {}", getKind(), electron.getNLM());
    }

    @Override
    public String getDescription() {
        return "Estados (n, l, m) con reglas de selección |Δl| = 1, |Δm| <= 1";
    }
}
