package hydrogenlab.domain.particle;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.StateScope;
import lombok.Getter;
import lombok.Setter;

/**
 * Fotón libre. Lo crea la fuente de luz o un átomo (emisión) y se destruye al ser absorbido,
 * al salir de la caja o al cambiar el modelo activo.
 */
public class Photon extends Particle {

    @Getter
    private final long id;
    @Getter
    private final int wavelength;
    @Getter
    private final double speed;
    @Getter
    private final boolean emittedByAtom;

    /**
     * Dirección de movimiento en radianes.
     */
    @Getter
    @Setter
    private double direction;

    /**
     * Un fotón sólo se evalúa contra el átomo una vez.
     */
    @Getter
    private boolean collided;

    public Photon(long id, int wavelength, Vector2 position, double direction, double speed, double radius,
                  boolean emittedByAtom) {
        super(StateScope.root("photons").child(Long.toString(id)), position, radius);
        if (wavelength <= 0) {
            throw new IllegalArgumentException("La longitud de onda debe ser positiva: " + wavelength);
        }
        this.id = id;
        this.wavelength = wavelength;
        this.direction = direction;
        this.speed = speed;
        this.emittedByAtom = emittedByAtom;
    }

    public void markCollided() {
        this.collided = true;
    }

    /**
     * Avanza en línea recta según su dirección y velocidad.
     */
    public void move(double dt) {
        double distance = speed * dt;
        setPosition(getPosition().plus(distance * Math.cos(direction), distance * Math.sin(direction)));
    }

    @Override
    public String toString() {
        return "Photon{id=" + id + ", λ=" + wavelength + "nm, pos=" + getPosition() + "}";
    }
}
