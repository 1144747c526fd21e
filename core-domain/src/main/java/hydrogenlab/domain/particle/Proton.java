package hydrogenlab.domain.particle;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.StateScope;

public class Proton extends Particle {

    public Proton(StateScope scope, Vector2 position, double radius) {
        super(scope.child("proton"), position, radius);
    }
}
