package hydrogenlab.domain.event;

import hydrogenlab.domain.geometry.Vector2;

import java.util.Objects;

/**
 * Evento publicado cada vez que la fuente de luz o un átomo crea un fotón.
 */
public record PhotonEmittedEvent(int wavelength, Vector2 position, double direction, boolean emittedByAtom) {

    public PhotonEmittedEvent {
        Objects.requireNonNull(position, "position");
        if (wavelength <= 0) {
            throw new IllegalArgumentException("Longitud de onda no positiva: " + wavelength);
        }
    }
}
