package hydrogenlab.factory;

import hydrogenlab.config.AtomConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.physics.i.IHydrogenAtom;
import hydrogenlab.physics.impl.BilliardBallModel;
import hydrogenlab.physics.impl.BohrModel;
import hydrogenlab.physics.impl.ClassicalSolarSystemModel;
import hydrogenlab.physics.impl.DeBroglieModel;
import hydrogenlab.physics.impl.PlumPuddingModel;
import hydrogenlab.physics.impl.SchrodingerModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Crea los modelos atómicos. Todos comparten el mismo generador aleatorio para que
 * una semilla fija reproduzca la simulación completa.
 */
@Slf4j
@RequiredArgsConstructor
public class HydrogenAtomFactory {

    private final AtomConfig config;
    private final RandomGenerator random;
    private final StateScope scope;

    public IHydrogenAtom create(AtomicModelKind kind) {
        switch (kind) {
            case BILLIARD_BALL:
                return new BilliardBallModel(config, random, scope);
            case PLUM_PUDDING:
                return new PlumPuddingModel(config, random, scope);
            case CLASSICAL_SOLAR_SYSTEM:
                return new ClassicalSolarSystemModel(config, random, scope);
            case BOHR:
                return new BohrModel(config, random, scope);
            case DE_BROGLIE:
                return new DeBroglieModel(config, random, scope);
            case SCHRODINGER:
            case EXPERIMENT:
                return new SchrodingerModel(kind, config, random, scope);
            default:
                throw new IllegalArgumentException("Modelo atómico desconocido: " + kind);
        }
    }

    /**
     * Un modelo por cada tipo, en el orden del enum.
     */
    public Map<AtomicModelKind, IHydrogenAtom> createAll() {
        Map<AtomicModelKind, IHydrogenAtom> atoms = new EnumMap<>(AtomicModelKind.class);
        for (AtomicModelKind kind : AtomicModelKind.values()) {
            atoms.put(kind, create(kind));
        }
        log.debug("Creados {} modelos atómicos", atoms.size());
        return atoms;
    }
}
