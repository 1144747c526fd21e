package hydrogenlab.physics.impl;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.particle.ClassicalSolarSystemElectron;
import hydrogenlab.domain.particle.Photon;
import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/**
 * Modelo clásico de sistema solar: el electrón orbita como un planeta, pero al radiar pierde energía
 * y cae en espiral sobre el protón. Los fotones atraviesan el átomo sin interactuar.
 */
@Slf4j
public class ClassicalSolarSystemModel extends AbstractHydrogenAtom {

    private final ClassicalSolarSystemElectron electron;
    private final double initialDirection;

    public ClassicalSolarSystemModel(AtomConfig config, RandomGenerator random, StateScope scope) {
        super(AtomicModelKind.CLASSICAL_SOLAR_SYSTEM, config, random, scope);
        this.initialDirection = nextIsotropicDirection();
        this.electron = new ClassicalSolarSystemElectron(this.scope, initialDirection, config.electronRadius());
        this.electron.collapsedProperty().addListener((oldValue, collapsed) -> {
            if (collapsed) {
                log.debug("[{}] El electrón ha colapsado sobre el protón", getKind());
            }
        });
    }

    public ClassicalSolarSystemElectron getElectron() {
        return electron;
    }

    /**
     * Un átomo clásico es inestable: tras el colapso ya no hay átomo.
     */
    public boolean isDestroyed() {
        return electron.isCollapsed();
    }

    @Override
    public void step(double dt) {
        electron.step(dt);
    }

    @Override
    public void processPhoton(Photon photon) {
        // Los fotones no interactúan con el átomo clásico
    }

    @Override
    public boolean collides(Photon photon) {
        return false;
    }

    @Override
    public void reset() {
        electron.restart(initialDirection);
    }

    @Override
    public String getDescription() {
        return "Electrón en órbita clásica que cae en espiral hacia el núcleo";
    }
}
