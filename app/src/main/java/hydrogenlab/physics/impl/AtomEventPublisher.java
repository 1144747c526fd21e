package hydrogenlab.physics.impl;

import hydrogenlab.domain.event.ElectronStateChangedEvent;
import hydrogenlab.domain.event.PhotonAbsorbedEvent;
import hydrogenlab.domain.event.PhotonEmittedEvent;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Oyentes de los eventos que publica un átomo.
 */
public class AtomEventPublisher {

    private final List<Consumer<PhotonEmittedEvent>> emittedListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<PhotonAbsorbedEvent>> absorbedListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ElectronStateChangedEvent>> stateListeners = new CopyOnWriteArrayList<>();

    public void onPhotonEmitted(Consumer<PhotonEmittedEvent> listener) {
        emittedListeners.add(Objects.requireNonNull(listener));
    }

    public void onPhotonAbsorbed(Consumer<PhotonAbsorbedEvent> listener) {
        absorbedListeners.add(Objects.requireNonNull(listener));
    }

    public void onStateChanged(Consumer<ElectronStateChangedEvent> listener) {
        stateListeners.add(Objects.requireNonNull(listener));
    }

    public void photonEmitted(PhotonEmittedEvent event) {
        emittedListeners.forEach(l -> l.accept(event));
    }

    public void photonAbsorbed(PhotonAbsorbedEvent event) {
        absorbedListeners.forEach(l -> l.accept(event));
    }

    public void stateChanged(ElectronStateChangedEvent event) {
        stateListeners.forEach(l -> l.accept(event));
    }
}
