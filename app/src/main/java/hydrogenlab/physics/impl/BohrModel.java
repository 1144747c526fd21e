package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.particle.Photon;
import hydrogenlab.domain.particle.QuantumElectron;
import hydrogenlab.physics.model.TransitionTable;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Modelo de Bohr: órbitas circulares cuantizadas de radio r(n) = n²·r1.
 * <p>
 * Un fotón colisiona si pasa a menos de (radio del fotón + radio del electrón) de la órbita actual.
 * El electrón gira en sentido horario con velocidad angular δ/n².
 */
@Slf4j
public class BohrModel extends AbstractHydrogenAtom {

    protected final QuantumElectron electron;
    protected final QuantumAtomEngine engine;

    public BohrModel(AtomConfig config, RandomGenerator random, StateScope scope) {
        this(AtomicModelKind.BOHR, config, random, scope);
    }

    protected BohrModel(AtomicModelKind kind, AtomConfig config, RandomGenerator random, StateScope parentScope) {
        super(kind, config, random, parentScope);
        this.electron = new QuantumElectron(scope, config.groundOrbitRadius(), config.electronRadius());
        this.engine = new QuantumAtomEngine(
                kind, config, electron,
                new BohrStatePolicy(electron, TransitionTable.getInstance()),
                new RingOrbitGeometry(config.collisionThreshold()),
                this::angularSpeed,
                random, events, getPosition());
    }

    /**
     * Velocidad angular para el nivel n. En Bohr los niveles externos giran más despacio.
     */
    protected double angularSpeed(int n) {
        return config.electronAngleDelta() / (n * n);
    }

    public QuantumElectron getElectron() {
        return electron;
    }

    public int getN() {
        return electron.getN();
    }

    public double getOrbitRadius(int n) {
        return config.orbitRadius(n);
    }

    /**
     * Restaura el nivel n sin pasar por las reglas de transición (persistencia externa, tests).
     */
    public void restoreState(int n, double angle) {
        electron.restoreState(n, angle);
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
        log.debug("[{}] Reset a n={}", getKind(), electron.getN());
    }

    @Override
    public String getDescription() {
        return "Órbitas circulares cuantizadas r(n) = n²·" + config.groundOrbitRadius();
    }
}
