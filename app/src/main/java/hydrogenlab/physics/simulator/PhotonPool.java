package hydrogenlab.physics.simulator;

import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.ZoomedInBox;
import hydrogenlab.domain.particle.Photon;
import hydrogenlab.physics.i.IHydrogenAtom;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fotones vivos de la simulación, indexados por identidad.
 */
public class PhotonPool {

    private final ZoomedInBox box;
    private final double photonSpeed;
    private final double photonRadius;
    private final Map<Long, Photon> photons = new LinkedHashMap<>();
    private final List<Consumer<Photon>> exitListeners = new CopyOnWriteArrayList<>();
    private long nextId = 1;

    public PhotonPool(ZoomedInBox box, double photonSpeed, double photonRadius) {
        this.box = box;
        this.photonSpeed = photonSpeed;
        this.photonRadius = photonRadius;
    }

    /**
     * Oyentes de los fotones que salen de la caja.
     */
    public void addExitListener(Consumer<Photon> listener) {
        exitListeners.add(Objects.requireNonNull(listener));
    }

    public Photon add(PhotonEmittedEvent event) {
        Photon photon = new Photon(nextId++, event.wavelength(), event.position(), event.direction(),
                photonSpeed, photonRadius, event.emittedByAtom());
        photons.put(photon.getId(), photon);
        return photon;
    }

    public boolean remove(long photonId) {
        return photons.remove(photonId) != null;
    }

    public void clear() {
        photons.clear();
    }

    public int size() {
        return photons.size();
    }

    public boolean isEmpty() {
        return photons.isEmpty();
    }

    public Collection<Photon> getPhotons() {
        return Collections.unmodifiableCollection(photons.values());
    }

    /**
     * Mueve cada fotón, elimina los que salen de la caja y entrega el resto al átomo.
     * Itera sobre una copia: el átomo puede añadir o eliminar fotones mientras tanto.
     */
    public void step(double dt, IHydrogenAtom atom) {
        for (Photon photon : new ArrayList<>(photons.values())) {
            if (!photons.containsKey(photon.getId())) {
                continue;
            }
            atom.movePhoton(photon, dt);
            if (!box.contains(photon.getPosition())) {
                photons.remove(photon.getId());
                exitListeners.forEach(l -> l.accept(photon));
            } else {
                atom.processPhoton(photon);
            }
        }
    }
}
