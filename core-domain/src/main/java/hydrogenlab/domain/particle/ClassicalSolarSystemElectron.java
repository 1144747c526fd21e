package hydrogenlab.domain.particle;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import lombok.Getter;

/**
 * Electrón clásico que orbita y cae en espiral hacia el protón, acelerando en cada paso.
 */
public class ClassicalSolarSystemElectron extends Electron {

    public static final double INITIAL_DISTANCE = 150.0;
    public static final double DISTANCE_DELTA = 220.0;         // unidades/s
    public static final double MIN_DISTANCE = 5.0;
    public static final double INITIAL_ANGULAR_SPEED = Math.toRadians(600);
    public static final double ANGULAR_SPEED_SCALE = 1.008;

    private final ObservableValue<Boolean> collapsed;

    @Getter
    private double direction;
    @Getter
    private double angularSpeed;
    @Getter
    private double distance;

    public ClassicalSolarSystemElectron(StateScope scope, double initialDirection, double radius) {
        super(scope, Vector2.fromPolar(INITIAL_DISTANCE, initialDirection), radius);
        this.collapsed = scope.child("electron").observable("collapsed", false);
        restart(initialDirection);
    }

    /**
     * Gira en sentido horario, se acerca al protón y acelera. Por debajo de
     * {@link #MIN_DISTANCE} el electrón ha colapsado sobre el núcleo.
     */
    public void step(double dt) {
        if (isCollapsed()) {
            return;
        }
        direction -= angularSpeed * dt;
        distance -= DISTANCE_DELTA * dt;
        if (distance <= MIN_DISTANCE) {
            distance = 0.0;
            setPosition(Vector2.ZERO);
            collapsed.set(true);
        } else {
            setPosition(Vector2.fromPolar(distance, direction));
        }
        angularSpeed *= ANGULAR_SPEED_SCALE;
    }

    public boolean isCollapsed() {
        return collapsed.get();
    }

    public ObservableValue<Boolean> collapsedProperty() {
        return collapsed;
    }

    /**
     * Vuelve a la órbita inicial con una nueva dirección de partida.
     */
    public void restart(double initialDirection) {
        this.direction = initialDirection;
        this.angularSpeed = INITIAL_ANGULAR_SPEED;
        this.distance = INITIAL_DISTANCE;
        setPosition(Vector2.fromPolar(INITIAL_DISTANCE, initialDirection));
        collapsed.set(false);
    }
}
