package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.physics.i.IOrbitCollisionGeometry;

import java.util.random.RandomGenerator;

/**
 * Modelo de de Broglie: misma máquina de estados que Bohr, pero el electrón es una onda
 * estacionaria de amplitud A(n, θ) = sin(n·θ)·sin(ángulo del electrón).
 * <p>
 * En las vistas 2D (distancia radial y brillo) el fotón colisiona con el anillo sin perturbar;
 * en la vista 3D colisiona con la elipse que proyecta la órbita inclinada.
 */
public class DeBroglieModel extends BohrModel {

    /**
     * Fracción del radio de la órbita fundamental que se desplaza el anillo con amplitud 1.
     */
    public static final double RADIAL_OFFSET_FACTOR = 0.45;

    private final ObservableValue<DeBroglieRepresentation> representation;
    private final IOrbitCollisionGeometry ringGeometry;
    private final IOrbitCollisionGeometry ellipseGeometry;

    public DeBroglieModel(AtomConfig config, RandomGenerator random, StateScope scope) {
        super(AtomicModelKind.DE_BROGLIE, config, random, scope);
        this.ringGeometry = new RingOrbitGeometry(brightnessCloseness(config));
        this.ellipseGeometry = new EllipticalOrbitGeometry(config.orbitYScale(), config.collisionThreshold());
        this.representation = this.scope.observable("representation", DeBroglieRepresentation.RADIAL_DISTANCE);
        this.representation.addListener((oldValue, newValue) -> engine.setCollisionGeometry(geometryFor(newValue)));
        engine.setCollisionGeometry(geometryFor(representation.get()));
    }

    /**
     * Distancia de colisión con el anillo de brillo: fotón + electrón + grosor del anillo.
     */
    static double brightnessCloseness(AtomConfig config) {
        return config.photonRadius() + config.electronRadius() + config.brightnessRingThickness();
    }

    /**
     * Amplitud de la onda estacionaria, acotada a [-1, 1].
     *
     * @throws IllegalStateException si el resultado sale del intervalo.
     */
    public static double amplitude(int n, double angle, double electronAngle) {
        double amplitude = Math.sin(n * angle) * Math.sin(electronAngle);
        if (amplitude < -1.0 || amplitude > 1.0) {
            throw new IllegalStateException("Amplitud fuera de [-1, 1]: " + amplitude);
        }
        return amplitude;
    }

    /**
     * La onda gira a velocidad constante, sea cual sea n.
     */
    @Override
    protected double angularSpeed(int n) {
        return config.electronAngleDelta();
    }

    public double getAmplitude(double angle) {
        return amplitude(electron.getN(), angle, electron.getAngle());
    }

    /**
     * Desplazamiento radial del anillo en la vista de distancia radial.
     */
    public double getRadialOffset(double angle) {
        return getAmplitude(angle) * RADIAL_OFFSET_FACTOR * config.groundOrbitRadius();
    }

    public DeBroglieRepresentation getRepresentation() {
        return representation.get();
    }

    public void setRepresentation(DeBroglieRepresentation newRepresentation) {
        representation.set(newRepresentation);
    }

    public ObservableValue<DeBroglieRepresentation> representationProperty() {
        return representation;
    }

    private IOrbitCollisionGeometry geometryFor(DeBroglieRepresentation value) {
        return value == DeBroglieRepresentation.THREE_D_HEIGHT ? ellipseGeometry : ringGeometry;
    }

    @Override
    public void reset() {
        representation.reset();
        super.reset();
    }

    @Override
    public String getDescription() {
        return "Onda estacionaria A(n, θ) = sin(n·θ)·sin(φ)";
    }
}
