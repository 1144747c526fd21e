package hydrogenlab.physics.simulator;

import hydrogenlab.config.SimulationConfig;
import hydrogenlab.domain.event.PhotonEmittedEvent;
import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.domain.geometry.ZoomedInBox;
import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.physics.model.TransitionTable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.random.RandomGenerator;

/**
 * Fuente de luz situada bajo la caja de observación. Emite fotones hacia arriba a ritmo constante,
 * de modo que nunca haya más de N fotones suyos en la caja a la vez.
 * <p>
 * No sabe nada de los modelos atómicos: sólo publica eventos de emisión.
 */
@Slf4j
public class LightSource {

    /**
     * Dirección de emisión: hacia arriba.
     */
    public static final double DIRECTION = Math.PI / 2;

    private final ZoomedInBox box;
    private final RandomGenerator random;
    private final int minWavelength;
    private final int maxWavelength;
    private final double whiteLightTransitionWeight;
    private final List<Integer> groundStateWavelengths;
    private final List<Consumer<PhotonEmittedEvent>> listeners = new CopyOnWriteArrayList<>();

    private final ObservableValue<Boolean> on;
    private final ObservableValue<LightMode> mode;
    private final ObservableValue<Integer> monochromaticWavelength;

    /**
     * Tiempo entre emisiones: (alto de la caja / velocidad) / N.
     */
    @Getter
    private final double dtBetweenEmissions;
    @Getter
    private double dtSinceLastEmission;

    public LightSource(SimulationConfig config, ZoomedInBox box, RandomGenerator random, StateScope parentScope) {
        this.box = box;
        this.random = random;
        this.minWavelength = config.getMinWavelength();
        this.maxWavelength = config.getMaxWavelength();
        this.whiteLightTransitionWeight = config.getWhiteLightTransitionWeight();
        this.groundStateWavelengths = TransitionTable.getInstance().wavelengthsAbsorbableFrom(1);
        this.dtBetweenEmissions = (box.height() / config.getPhotonSpeed()) / config.getMaxLightPhotons();

        StateScope scope = parentScope.child("light");
        this.on = scope.observable("on", false);
        this.mode = scope.observable("mode", LightMode.WHITE);
        this.monochromaticWavelength = scope.observable("monochromaticWavelength", config.getDefaultMonochromaticWavelength());
    }

    public void addPhotonEmittedListener(Consumer<PhotonEmittedEvent> listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    /**
     * Acumula tiempo y emite un fotón cada {@link #getDtBetweenEmissions()}. El exceso se conserva.
     */
    public void step(double dt) {
        if (!isOn()) {
            return;
        }
        dtSinceLastEmission += dt;
        if (dtSinceLastEmission >= dtBetweenEmissions) {
            dtSinceLastEmission = dtSinceLastEmission % dtBetweenEmissions;
            emitPhoton();
        }
    }

    private void emitPhoton() {
        double x = box.minX() + random.nextDouble() * (box.maxX() - box.minX());
        publish(new PhotonEmittedEvent(chooseWavelength(), new Vector2(x, box.minY()), DIRECTION, false));
    }

    /**
     * Emite un fotón en el centro del borde inferior, apuntando al átomo.
     */
    public void emitPhotonAtBottomCenter(int wavelength) {
        publish(new PhotonEmittedEvent(wavelength, new Vector2(box.centerX(), box.minY()), DIRECTION, false));
    }

    /**
     * Luz blanca: con probabilidad {@code whiteLightTransitionWeight} una longitud de onda que excite
     * el estado fundamental; si no, cualquiera del rango. Monocromática: la configurada.
     */
    int chooseWavelength() {
        if (getMode() == LightMode.MONOCHROMATIC) {
            return getMonochromaticWavelength();
        }
        if (random.nextDouble() < whiteLightTransitionWeight) {
            return groundStateWavelengths.get(random.nextInt(groundStateWavelengths.size()));
        }
        return random.nextInt(minWavelength, maxWavelength + 1);
    }

    private void publish(PhotonEmittedEvent event) {
        listeners.forEach(l -> l.accept(event));
    }

    public boolean isOn() {
        return on.get();
    }

    public void setOn(boolean value) {
        on.set(value);
    }

    public LightMode getMode() {
        return mode.get();
    }

    public void setMode(LightMode value) {
        mode.set(Objects.requireNonNull(value, "mode"));
    }

    public int getMonochromaticWavelength() {
        return monochromaticWavelength.get();
    }

    public void setMonochromaticWavelength(int wavelength) {
        if (wavelength < minWavelength || wavelength > maxWavelength) {
            throw new IllegalArgumentException(String.format(
                    "Longitud de onda %d fuera del rango [%d, %d]", wavelength, minWavelength, maxWavelength));
        }
        monochromaticWavelength.set(wavelength);
    }

    public ObservableValue<Boolean> onProperty() {
        return on;
    }

    public ObservableValue<LightMode> modeProperty() {
        return mode;
    }

    public ObservableValue<Integer> monochromaticWavelengthProperty() {
        return monochromaticWavelength;
    }

    public void reset() {
        on.reset();
        mode.reset();
        monochromaticWavelength.reset();
        dtSinceLastEmission = 0.0;
    }
}
