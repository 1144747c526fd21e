package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.event.ElectronStateChangedEvent;
import hydrogenlab.domain.event.PhotonAbsorbedEvent;
import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.particle.Proton;
import hydrogenlab.physics.i.IHydrogenAtom;
import lombok.Getter;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.random.RandomGenerator;

/**
 * Estado y eventos comunes a todos los modelos: tipo, configuración, protón en el centro y generador aleatorio.
 */
public abstract class AbstractHydrogenAtom implements IHydrogenAtom {

    @Getter
    private final AtomicModelKind kind;
    @Getter
    protected final AtomConfig config;
    @Getter
    protected final Proton proton;
    @Getter
    protected final StateScope scope;

    protected final RandomGenerator random;
    protected final AtomEventPublisher events = new AtomEventPublisher();

    protected AbstractHydrogenAtom(AtomicModelKind kind, AtomConfig config, RandomGenerator random, StateScope parentScope) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
        this.scope = parentScope.child(kind.name().toLowerCase());
        this.proton = new Proton(scope, Vector2.ZERO, config.protonRadius());
    }

    @Override
    public Vector2 getPosition() {
        return Vector2.ZERO;
    }

    @Override
    public void addPhotonEmittedListener(Consumer<PhotonEmittedEvent> listener) {
        events.onPhotonEmitted(listener);
    }

    @Override
    public void addPhotonAbsorbedListener(Consumer<PhotonAbsorbedEvent> listener) {
        events.onPhotonAbsorbed(listener);
    }

    @Override
    public void addStateChangedListener(Consumer<ElectronStateChangedEvent> listener) {
        events.onStateChanged(listener);
    }

    /**
     * Dirección uniforme en [0, 2π): emisión isótropa.
     */
    protected double nextIsotropicDirection() {
        return random.nextDouble() * 2 * Math.PI;
    }

    @Override
    public String toString() {
        return getName();
    }
}
