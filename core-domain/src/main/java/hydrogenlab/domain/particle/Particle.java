package hydrogenlab.domain.particle;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import lombok.Getter;

/**
 * Base de todas las partículas de la simulación: posición observable y radio.
 */
public abstract class Particle {

    protected final ObservableValue<Vector2> position;

    @Getter
    private final double radius;

    protected Particle(StateScope scope, Vector2 initialPosition, double radius) {
        this.position = scope.observable("position", initialPosition);
        this.radius = radius;
    }

    public Vector2 getPosition() {
        return position.get();
    }

    public void setPosition(Vector2 newPosition) {
        position.set(newPosition);
    }

    public ObservableValue<Vector2> positionProperty() {
        return position;
    }

    public void reset() {
        position.reset();
    }
}
