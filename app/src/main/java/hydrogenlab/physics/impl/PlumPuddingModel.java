package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.event.PhotonAbsorbedEvent;
import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.particle.Photon;
import hydrogenlab.domain.particle.PlumPuddingElectron;
import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/**
 * Modelo del pudin de pasas: un electrón embebido en una esfera de carga positiva.
 * <p>
 * Sólo absorbe fotones de una longitud de onda concreta que choquen con el electrón. Al absorber,
 * el electrón oscila horizontalmente dentro del pudin y, tras cruzar el centro un número fijo de veces,
 * emite un fotón de la misma longitud de onda en una dirección aleatoria.
 */
@Slf4j
public class PlumPuddingModel extends AbstractHydrogenAtom {

    /**
     * Velocidad de oscilación del electrón (unidades/s).
     */
    public static final double ELECTRON_SPEED = 150.0;

    private final PlumPuddingElectron electron;

    public PlumPuddingModel(AtomConfig config, RandomGenerator random, StateScope scope) {
        super(AtomicModelKind.PLUM_PUDDING, config, random, scope);
        this.electron = new PlumPuddingElectron(this.scope, randomPointInPudding(), config.electronRadius());
    }

    /**
     * Posición inicial aleatoria dentro del pudin, sin tocar el borde.
     */
    private Vector2 randomPointInPudding() {
        double maxDistance = config.plumPuddingRadius() - config.electronRadius();
        double distance = maxDistance * Math.sqrt(random.nextDouble());
        return getPosition().plus(Vector2.fromPolar(distance, nextIsotropicDirection()));
    }

    public PlumPuddingElectron getElectron() {
        return electron;
    }

    @Override
    public void step(double dt) {
        if (!electron.isMoving()) {
            return;
        }
        electron.oscillate(dt, ELECTRON_SPEED, chordHalfWidth());
        if (electron.getNumberOfCrossings() >= config.plumPuddingMaxCrossings()) {
            electron.stopMoving();
            int wavelength = config.plumPuddingWavelength();
            log.debug("[{}] Emisión λ={}nm tras {} cruces", getKind(), wavelength, electron.getNumberOfCrossings());
            events.photonEmitted(new PhotonEmittedEvent(wavelength, electron.getPosition(), nextIsotropicDirection(), true));
        }
    }

    /**
     * Semiancho de la cuerda horizontal del pudin a la altura del electrón.
     */
    private double chordHalfWidth() {
        double radius = config.plumPuddingRadius() - config.electronRadius();
        double y = electron.getPosition().y() - getPosition().y();
        return Math.sqrt(Math.max(0.0, radius * radius - y * y));
    }

    @Override
    public void processPhoton(Photon photon) {
        if (photon.isEmittedByAtom() || photon.isCollided() || electron.isMoving()) {
            return;
        }
        if (photon.getWavelength() != config.plumPuddingWavelength() || !collides(photon)) {
            return;
        }
        photon.markCollided();
        if (random.nextDouble() < config.absorptionProbability()) {
            PlumPuddingElectron.Direction direction = random.nextBoolean()
                    ? PlumPuddingElectron.Direction.RIGHT
                    : PlumPuddingElectron.Direction.LEFT;
            electron.startMoving(direction);
            log.debug("[{}] Absorción λ={}nm", getKind(), photon.getWavelength());
            events.photonAbsorbed(new PhotonAbsorbedEvent(photon.getId(), photon.getWavelength(), getKind()));
        }
    }

    /**
     * Colisión con el electrón (no con el pudin).
     */
    @Override
    public boolean collides(Photon photon) {
        return photon.getPosition().distance(electron.getPosition()) <= config.collisionThreshold();
    }

    @Override
    public void reset() {
        electron.reset();
    }

    @Override
    public String getDescription() {
        return "Electrón embebido en una esfera de carga positiva de radio " + config.plumPuddingRadius();
    }
}
