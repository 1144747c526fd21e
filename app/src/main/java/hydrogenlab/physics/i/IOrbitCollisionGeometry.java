package hydrogenlab.physics.i;

import hydrogenlab.domain.geometry.Vector2;

/**
 * Geometría de colisión entre un fotón y la órbita del electrón.
 */
public interface IOrbitCollisionGeometry extends ISimulationComponent {

    /**
     * @param photonOffset posición del fotón relativa al centro del átomo.
     * @param orbitRadius  radio de la órbita sin perturbar para el n actual.
     */
    boolean collides(Vector2 photonOffset, double orbitRadius);
}
