package hydrogenlab.domain.particle;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import lombok.Getter;

/**
 * Electrón con número cuántico principal n, ángulo orbital y tiempo en el estado actual.
 * <p>
 * La posición del electrón se mantiene sincronizada con (n, ángulo): r(n) = n² · r1 desde el centro del átomo.
 */
public class QuantumElectron extends Electron {

    public static final double E1 = -13.6; // eV
    public static final int GROUND_STATE = 1;
    public static final int MAX_STATE = 6;

    private static final double TWO_PI = 2 * Math.PI;

    private final ObservableValue<Integer> n;
    private final ObservableValue<Double> angle;
    private final double groundOrbitRadius;

    @Getter
    private double timeInState;

    public QuantumElectron(StateScope scope, double groundOrbitRadius, double radius) {
        super(scope, Vector2.fromPolar(groundOrbitRadius, 0.0), radius);
        StateScope electronScope = scope.child("electron");
        this.n = electronScope.observable("n", GROUND_STATE);
        this.angle = electronScope.observable("angle", 0.0);
        this.groundOrbitRadius = groundOrbitRadius;
    }

    /**
     * E(n) = E1 / n².
     */
    public static double energy(int n) {
        checkState(n);
        return E1 / (n * n);
    }

    public static double orbitRadius(int n, double groundOrbitRadius) {
        checkState(n);
        return n * n * groundOrbitRadius;
    }

    public static double normalizeAngle(double angle) {
        double wrapped = angle % TWO_PI;
        return wrapped < 0 ? wrapped + TWO_PI : wrapped;
    }

    protected static void checkState(int n) {
        if (n < GROUND_STATE || n > MAX_STATE) {
            throw new IllegalArgumentException("n fuera de rango [" + GROUND_STATE + ", " + MAX_STATE + "]: " + n);
        }
    }

    public int getN() {
        return n.get();
    }

    /**
     * Cambia el nivel de energía. Si n cambia, el tiempo en el estado vuelve a cero.
     * El ángulo orbital se conserva.
     */
    public void setN(int newN) {
        checkState(newN);
        if (newN != n.get()) {
            timeInState = 0.0;
        }
        n.set(newN);
        syncPosition();
    }

    public double getEnergy() {
        return energy(getN());
    }

    public double getOrbitRadius() {
        return orbitRadius(getN(), groundOrbitRadius);
    }

    public double getAngle() {
        return angle.get();
    }

    public void setAngle(double newAngle) {
        angle.set(normalizeAngle(newAngle));
        syncPosition();
    }

    /**
     * Desplazamiento del electrón respecto al centro del átomo (coordenadas polares a cartesianas).
     */
    public Vector2 getOffset() {
        return Vector2.fromPolar(getOrbitRadius(), getAngle());
    }

    public void advanceTimeInState(double dt) {
        timeInState += dt;
    }

    public ObservableValue<Integer> nProperty() {
        return n;
    }

    public ObservableValue<Double> angleProperty() {
        return angle;
    }

    /**
     * Aplica (n, ángulo) de golpe, sin comprobaciones de transición ni efectos laterales,
     * y notifica a los oyentes una sola vez al final.
     */
    public void restoreState(int restoredN, double restoredAngle) {
        applyState(restoredN, restoredAngle).run();
    }

    /**
     * Asigna el estado en silencio y devuelve la notificación pendiente.
     */
    protected Runnable applyState(int restoredN, double restoredAngle) {
        checkState(restoredN);
        Integer oldN = n.restore(restoredN);
        Double oldAngle = angle.restore(normalizeAngle(restoredAngle));
        Vector2 oldPosition = position.restore(getOffset());
        timeInState = 0.0;
        return () -> {
            n.notifyListeners(oldN);
            angle.notifyListeners(oldAngle);
            position.notifyListeners(oldPosition);
        };
    }

    @Override
    public void reset() {
        restoreState(GROUND_STATE, 0.0);
    }

    private void syncPosition() {
        setPosition(getOffset());
    }
}
