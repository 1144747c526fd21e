package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.particle.Photon;

import java.util.random.RandomGenerator;

/**
 * Modelo de bola de billar: el átomo es una esfera sólida que rebota los fotones.
 * No absorbe ni emite.
 */
public class BilliardBallModel extends AbstractHydrogenAtom {

    public static final double MIN_DEFLECTION_ANGLE = Math.toRadians(30);
    public static final double MAX_DEFLECTION_ANGLE = Math.toRadians(60);

    public BilliardBallModel(AtomConfig config, RandomGenerator random, StateScope scope) {
        super(AtomicModelKind.BILLIARD_BALL, config, random, scope);
    }

    public double getRadius() {
        return config.billiardBallRadius();
    }

    @Override
    public void step(double dt) {
        // Sin estado interno
    }

    /**
     * Al tocar la bola el fotón se da la vuelta con una desviación aleatoria de 30° a 60°,
     * hacia el lado por el que ha golpeado.
     */
    @Override
    public void movePhoton(Photon photon, double dt) {
        if (!photon.isCollided() && collides(photon)) {
            double sign = photon.getPosition().x() > getPosition().x() ? 1.0 : -1.0;
            double deflection = sign * random.nextDouble(MIN_DEFLECTION_ANGLE, MAX_DEFLECTION_ANGLE);
            photon.setDirection(photon.getDirection() + Math.PI + deflection);
            photon.markCollided();
        }
        photon.move(dt);
    }

    @Override
    public void processPhoton(Photon photon) {
        // La desviación se resuelve al mover el fotón
    }

    @Override
    public boolean collides(Photon photon) {
        return photon.getPosition().distance(getPosition()) <= getRadius();
    }

    @Override
    public void reset() {
        // Sin estado interno
    }

    @Override
    public String getDescription() {
        return "Esfera sólida de radio " + getRadius() + " que desvía los fotones";
    }
}
