package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.event.ElectronStateChangedEvent;
import hydrogenlab.domain.event.PhotonAbsorbedEvent;
import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.particle.Photon;
import hydrogenlab.domain.particle.QuantumElectron;
import hydrogenlab.physics.i.IElectronStatePolicy;
import hydrogenlab.physics.i.IOrbitCollisionGeometry;
import hydrogenlab.physics.model.TransitionTable;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.IntToDoubleFunction;
import java.util.random.RandomGenerator;

/**
 * Máquina de estados compartida por los modelos cuantizados (Bohr, de Broglie, Schrödinger).
 * <p>
 * Cada modelo aporta, por composición, su política de estados, su geometría de colisión y
 * su velocidad angular en función de n. El motor decide cuándo hay absorción, emisión
 * estimulada y emisión espontánea:
 * <ul>
 *     <li>Absorción: el fotón choca con la órbita y su longitud de onda corresponde a n → n' &gt; n.</li>
 *     <li>Emisión estimulada: el fotón corresponde a n → n'' &lt; n. El fotón incidente sigue su camino y se emite
 *         otro coherente (misma longitud de onda y dirección) desde el electrón.</li>
 *     <li>Emisión espontánea: con n &gt; 1 y tras el tiempo mínimo en el estado, la probabilidad por paso es
 *         1 - exp(-dt·t/τ²), creciente con el tiempo t en el estado.</li>
 * </ul>
 * En la emisión estimulada el fotón incidente no se destruye ni se publica como absorbido: el resultado
 * son dos fotones coherentes, el original y el emitido.
 */
@Slf4j
public class QuantumAtomEngine {

    private final AtomicModelKind kind;
    private final AtomConfig config;
    @Getter
    private final QuantumElectron electron;
    private final IElectronStatePolicy policy;
    private final IntToDoubleFunction angularSpeed;
    private final RandomGenerator random;
    private final AtomEventPublisher events;
    private final Vector2 atomCenter;
    private final TransitionTable table = TransitionTable.getInstance();

    @Getter
    @Setter
    private IOrbitCollisionGeometry collisionGeometry;

    public QuantumAtomEngine(AtomicModelKind kind, AtomConfig config, QuantumElectron electron,
                             IElectronStatePolicy policy, IOrbitCollisionGeometry collisionGeometry,
                             IntToDoubleFunction angularSpeed, RandomGenerator random,
                             AtomEventPublisher events, Vector2 atomCenter) {
        this.kind = kind;
        this.config = config;
        this.electron = electron;
        this.policy = policy;
        this.collisionGeometry = Objects.requireNonNull(collisionGeometry);
        this.angularSpeed = angularSpeed;
        this.random = random;
        this.events = events;
        this.atomCenter = atomCenter;
    }

    public boolean collides(Photon photon) {
        return collisionGeometry.collides(photon.getPosition().minus(atomCenter), electron.getOrbitRadius());
    }

    /**
     * Los fotones emitidos por el átomo y los que ya colisionaron se ignoran.
     * Un fotón sólo tiene una oportunidad de interactuar.
     */
    public void processPhoton(Photon photon) {
        if (photon.isEmittedByAtom() || photon.isCollided() || !collides(photon)) {
            return;
        }
        photon.markCollided();

        int n = policy.getN();
        int wavelength = photon.getWavelength();

        OptionalInt higher = table.getHigherStateForWavelength(n, wavelength);
        if (higher.isPresent()) {
            tryAbsorb(photon, n, higher.getAsInt());
            return;
        }

        OptionalInt lower = table.getLowerStateForWavelength(n, wavelength);
        if (lower.isPresent()) {
            tryStimulatedEmission(photon, n, lower.getAsInt());
        }
    }

    private void tryAbsorb(Photon photon, int n, int nHigher) {
        if (!policy.canTransitionTo(nHigher)) {
            return;
        }
        boolean absorbed = policy.absorptionIsCertain() || random.nextDouble() < config.absorptionProbability();
        if (!absorbed) {
            return;
        }
        policy.transitionTo(nHigher, random);
        log.debug("[{}] Absorción λ={}nm: n {} -> {}", kind, photon.getWavelength(), n, nHigher);
        events.photonAbsorbed(new PhotonAbsorbedEvent(photon.getId(), photon.getWavelength(), kind));
        events.stateChanged(new ElectronStateChangedEvent(kind, n, nHigher));
    }

    private void tryStimulatedEmission(Photon photon, int n, int nLower) {
        if (!policy.canTransitionTo(nLower)) {
            return;
        }
        if (random.nextDouble() >= config.stimulatedEmissionProbability()) {
            return;
        }
        Vector2 electronPosition = atomCenter.plus(electron.getOffset());
        policy.transitionTo(nLower, random);
        log.debug("[{}] Emisión estimulada λ={}nm: n {} -> {}", kind, photon.getWavelength(), n, nLower);
        events.photonEmitted(new PhotonEmittedEvent(photon.getWavelength(), electronPosition, photon.getDirection(), true));
        events.stateChanged(new ElectronStateChangedEvent(kind, n, nLower));
    }

    /**
     * Reloj interno: tiempo en el estado, ángulo orbital (sentido horario) y emisión espontánea.
     */
    public void step(double dt) {
        electron.advanceTimeInState(dt);
        int n = policy.getN();
        electron.setAngle(electron.getAngle() - dt * angularSpeed.applyAsDouble(n));

        if (n > QuantumElectron.GROUND_STATE && electron.getTimeInState() >= config.minTimeInState()) {
            double t = electron.getTimeInState();
            double tau = config.meanLifetime();
            double probability = 1.0 - Math.exp(-dt * t / (tau * tau));
            if (random.nextDouble() < probability) {
                spontaneousEmission(n);
            }
        }
    }

    private void spontaneousEmission(int n) {
        OptionalInt lower = policy.chooseLowerN(random);
        if (lower.isEmpty()) {
            return;
        }
        int nLower = lower.getAsInt();
        Vector2 position = atomCenter.plus(policy.spontaneousEmissionOffset(random));
        double direction = random.nextDouble() * 2 * Math.PI;
        policy.transitionTo(nLower, random);

        int wavelength = table.getEmissionWavelength(n, nLower);
        log.debug("[{}] Emisión espontánea λ={}nm: n {} -> {}", kind, wavelength, n, nLower);
        events.photonEmitted(new PhotonEmittedEvent(wavelength, position, direction, true));
        events.stateChanged(new ElectronStateChangedEvent(kind, n, nLower));
    }

    public void reset() {
        policy.reset();
    }
}
