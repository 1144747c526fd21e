package hydrogenlab.domain.particle;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.StateScope;

public class Electron extends Particle {

    public Electron(StateScope scope, Vector2 position, double radius) {
        super(scope.child("electron"), position, radius);
    }
}
