package hydrogenlab.domain.particle;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import lombok.Getter;

/**
 * Electrón embebido en el pudin de carga positiva. Tras absorber un fotón oscila horizontalmente.
 */
public class PlumPuddingElectron extends Electron {

    public enum Direction { LEFT, RIGHT }

    private final ObservableValue<Boolean> moving;
    private final ObservableValue<Direction> direction;

    @Getter
    private int numberOfCrossings;

    public PlumPuddingElectron(StateScope scope, Vector2 position, double radius) {
        super(scope, position, radius);
        StateScope electronScope = scope.child("electron");
        this.moving = electronScope.observable("moving", false);
        this.direction = electronScope.observable("direction", Direction.LEFT);
    }

    public boolean isMoving() {
        return moving.get();
    }

    public ObservableValue<Boolean> movingProperty() {
        return moving;
    }

    public Direction getDirection() {
        return direction.get();
    }

    public void startMoving(Direction initialDirection) {
        numberOfCrossings = 0;
        direction.set(initialDirection);
        moving.set(true);
    }

    public void stopMoving() {
        moving.set(false);
    }

    /**
     * Desplaza el electrón en horizontal rebotando en ±halfWidth.
     *
     * @return true si en este paso ha cruzado x = 0.
     */
    public boolean oscillate(double dt, double speed, double halfWidth) {
        if (!isMoving()) {
            return false;
        }
        Vector2 current = getPosition();
        double sign = getDirection() == Direction.RIGHT ? 1.0 : -1.0;
        double x = current.x() + sign * speed * dt;
        if (x > halfWidth) {
            x = 2 * halfWidth - x;
            direction.set(Direction.LEFT);
        } else if (x < -halfWidth) {
            x = -2 * halfWidth - x;
            direction.set(Direction.RIGHT);
        }
        setPosition(new Vector2(x, current.y()));
        boolean crossed = Math.signum(x) != Math.signum(current.x()) && current.x() != 0.0;
        if (crossed) {
            numberOfCrossings++;
        }
        return crossed;
    }

    @Override
    public void reset() {
        moving.reset();
        direction.reset();
        numberOfCrossings = 0;
        super.reset();
    }
}
