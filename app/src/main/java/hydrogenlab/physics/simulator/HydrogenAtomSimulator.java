package hydrogenlab.physics.simulator;

import hydrogenlab.config.SimulationConfig;
import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.geometry.ZoomedInBox;
import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.particle.Photon;
import hydrogenlab.domain.spectrometer.SpectrometerSnapshot;
import hydrogenlab.factory.HydrogenAtomFactory;
import hydrogenlab.io.SimulationJsonStore;
import hydrogenlab.physics.i.IHydrogenAtom;
import hydrogenlab.physics.impl.SchrodingerModel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Orquesta la simulación del átomo de hidrógeno.
 * <p>
 * Orden dentro de cada {@link #step(double)}:
 * <ol>
 *     <li>La fuente de luz puede emitir un fotón.</li>
 *     <li>El modelo activo mueve los fotones y resuelve colisiones, absorción y emisión estimulada.</li>
 *     <li>El reloj interno del modelo activo avanza (ángulo, tiempo en el estado, emisión espontánea)
 *         y, con un modelo de Schrödinger, el gestor del estado metaestable.</li>
 * </ol>
 * Al cambiar de modelo se eliminan todos los fotones y se reinicia el modelo que se abandona.
 */
@Slf4j
public class HydrogenAtomSimulator {

    private final SimulationConfig config;
    @Getter
    private final ZoomedInBox box;
    @Getter
    private final LightSource light;
    @Getter
    private final PhotonPool photonPool;
    @Getter
    private final MetastableHandler metastableHandler;
    @Getter
    private final Spectrometer spectrometer;

    private final Map<AtomicModelKind, IHydrogenAtom> atoms;
    private final ObservableValue<AtomicModelKind> activeModel;

    public HydrogenAtomSimulator(SimulationConfig config) {
        this(config, new Random(config.getSeed()));
    }

    public HydrogenAtomSimulator(SimulationConfig config, RandomGenerator random) {
        this.config = Objects.requireNonNull(config, "config").validate();
        Objects.requireNonNull(random, "random");
        StateScope scope = StateScope.root("simulation");

        this.box = new ZoomedInBox(config.getBoxSize());
        this.light = new LightSource(config, box, random, scope);
        this.photonPool = new PhotonPool(box, config.getPhotonSpeed(), config.getAtomConfig().photonRadius());
        this.metastableHandler = new MetastableHandler(light, random, config.getExciteAtomInterval(), scope);
        this.spectrometer = new Spectrometer(config.getMaxSpectrometerSnapshots(), scope);
        this.atoms = new HydrogenAtomFactory(config.getAtomConfig(), random, scope).createAll();
        this.activeModel = scope.observable("activeModel", config.getInitialModel());

        light.addPhotonEmittedListener(photonPool::add);
        for (IHydrogenAtom atom : atoms.values()) {
            atom.addPhotonEmittedListener(photonPool::add);
            atom.addPhotonAbsorbedListener(event -> photonPool.remove(event.photonId()));
        }
        photonPool.addExitListener(this::onPhotonExit);
        metastableHandler.setAtom(schrodingerAtomOrNull(getActiveAtom()));

        log.info("HydrogenAtomSimulator inicializado. Modelo={}, caja={}, semilla={}",
                activeModel.get(), config.getBoxSize(), config.getSeed());
    }

    /**
     * Crea un simulador con la configuración empaquetada en el classpath.
     *
     * @throws IOException si la configuración por defecto no se puede leer.
     */
    public static HydrogenAtomSimulator fromDefaultConfig() throws IOException {
        return new HydrogenAtomSimulator(new SimulationJsonStore().loadDefaultConfig());
    }

    private void onPhotonExit(Photon photon) {
        if (photon.isEmittedByAtom()) {
            spectrometer.recordEmission(photon.getWavelength());
        }
    }

    /**
     * Avanza la simulación un paso de tiempo.
     *
     * @throws IllegalArgumentException si dt no es positivo y finito.
     */
    public void step(double dt) {
        if (!(dt > 0) || Double.isInfinite(dt)) {
            throw new IllegalArgumentException("dt debe ser positivo y finito: " + dt);
        }
        IHydrogenAtom atom = getActiveAtom();
        light.step(dt);
        photonPool.step(dt, atom);
        atom.step(dt);
        if (atom instanceof SchrodingerModel) {
            metastableHandler.step(dt);
        }
    }

    /**
     * Cambia el modelo activo. Sin efecto si ya es el activo.
     */
    public void setActiveModel(AtomicModelKind kind) {
        Objects.requireNonNull(kind, "kind");
        AtomicModelKind previous = activeModel.get();
        if (previous == kind) {
            return;
        }
        photonPool.clear();
        atoms.get(previous).reset();
        activeModel.set(kind);
        metastableHandler.setAtom(schrodingerAtomOrNull(getActiveAtom()));
        log.info("Modelo activo: {} -> {}", previous, kind);
    }

    public AtomicModelKind getActiveModel() {
        return activeModel.get();
    }

    public ObservableValue<AtomicModelKind> activeModelProperty() {
        return activeModel;
    }

    public IHydrogenAtom getActiveAtom() {
        return atoms.get(activeModel.get());
    }

    public IHydrogenAtom getAtom(AtomicModelKind kind) {
        return atoms.get(kind);
    }

    public Map<AtomicModelKind, IHydrogenAtom> getAtoms() {
        return Collections.unmodifiableMap(atoms);
    }

    public Optional<SpectrometerSnapshot> takeSnapshot() {
        return spectrometer.takeSnapshot(getActiveModel());
    }

    public boolean deleteSnapshot(SpectrometerSnapshot snapshot) {
        return spectrometer.deleteSnapshot(snapshot);
    }

    /**
     * Escribe cada instantánea viva del espectrómetro como JSON en el directorio indicado.
     *
     * @return las rutas escritas, en el orden de las instantáneas.
     */
    public List<Path> exportSnapshots(Path directory) throws IOException {
        SimulationJsonStore store = new SimulationJsonStore();
        List<Path> files = new ArrayList<>();
        for (SpectrometerSnapshot snapshot : spectrometer.getSnapshots()) {
            files.add(store.exportSnapshot(snapshot, directory));
        }
        log.info("Exportadas {} instantáneas a {}", files.size(), directory);
        return files;
    }

    public void clearSpectrometer() {
        spectrometer.clear();
    }

    /**
     * Vuelve al estado inicial completo. Idempotente.
     */
    public void reset() {
        light.reset();
        photonPool.clear();
        atoms.values().forEach(IHydrogenAtom::reset);
        spectrometer.reset();
        activeModel.set(config.getInitialModel());
        metastableHandler.setAtom(schrodingerAtomOrNull(getActiveAtom()));
        log.info("Simulación reiniciada");
    }

    private static SchrodingerModel schrodingerAtomOrNull(IHydrogenAtom atom) {
        return atom instanceof SchrodingerModel ? (SchrodingerModel) atom : null;
    }
}
