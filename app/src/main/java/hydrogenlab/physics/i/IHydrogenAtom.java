package hydrogenlab.physics.i;

import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.event.ElectronStateChangedEvent;
import hydrogenlab.domain.event.PhotonAbsorbedEvent;
import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.particle.Photon;

import java.util.List;
import java.util.function.Consumer;

/**
 * Capacidades comunes de todos los modelos del átomo de hidrógeno.
 * <p>
 * El orquestador mueve cada fotón con {@link #movePhoton}, le pide al átomo que lo procese con
 * {@link #processPhoton} y, una vez procesados todos, avanza el reloj interno con {@link #step}.
 */
public interface IHydrogenAtom extends ISimulationComponent {

    AtomicModelKind getKind();

    /**
     * Centro del átomo en coordenadas de la caja.
     */
    Vector2 getPosition();

    /**
     * Avanza el reloj interno del modelo (ángulo orbital, tiempo en el estado, emisión espontánea).
     */
    void step(double dt);

    /**
     * Mueve un fotón. Algunos modelos (bola de billar) desvían la trayectoria.
     */
    default void movePhoton(Photon photon, double dt) {
        photon.move(dt);
    }

    /**
     * Detección de colisión, absorción y emisión estimulada para un fotón vivo.
     */
    void processPhoton(Photon photon);

    boolean collides(Photon photon);

    /**
     * Vuelve al estado inicial. Llamarlo dos veces equivale a llamarlo una.
     */
    void reset();

    /**
     * Longitudes de onda que pueden excitar el estado n. Vacío en los modelos no cuantizados.
     */
    default List<Integer> getTransitionWavelengths(int n) {
        return List.of();
    }

    default boolean hasTransitionWavelengths() {
        return getKind().isQuantum();
    }

    void addPhotonEmittedListener(Consumer<PhotonEmittedEvent> listener);

    void addPhotonAbsorbedListener(Consumer<PhotonAbsorbedEvent> listener);

    void addStateChangedListener(Consumer<ElectronStateChangedEvent> listener);

    @Override
    default String getName() {
        return getKind().name();
    }
}
