package hydrogenlab.physics.impl;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.physics.i.IOrbitCollisionGeometry;
import lombok.Getter;

/**
 * Colisión con un anillo circular: el fotón choca si su distancia al centro está a menos de
 * {@code closeness} del radio de la órbita.
 */
public class RingOrbitGeometry implements IOrbitCollisionGeometry {

    @Getter
    private final double closeness;

    public RingOrbitGeometry(double closeness) {
        if (closeness <= 0) {
            throw new IllegalArgumentException("La distancia de colisión debe ser > 0: " + closeness);
        }
        this.closeness = closeness;
    }

    @Override
    public boolean collides(Vector2 photonOffset, double orbitRadius) {
        return Math.abs(photonOffset.magnitude() - orbitRadius) <= closeness;
    }

    @Override
    public String getName() {
        return "Anillo";
    }

    @Override
    public String getDescription() {
        return "|d - r(n)| <= " + closeness;
    }
}
