package hydrogenlab.domain.particle;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.StateScope;

/**
 * Neutrón. El hidrógeno no tiene; sólo existe para representaciones de otros núcleos.
 */
public class Neutron extends Particle {

    public Neutron(StateScope scope, Vector2 position, double radius) {
        super(scope.child("neutron"), position, radius);
    }
}
