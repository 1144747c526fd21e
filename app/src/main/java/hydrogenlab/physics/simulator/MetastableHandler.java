package hydrogenlab.physics.simulator;

import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.quantum.SchrodingerQuantumNumbers;
import hydrogenlab.physics.impl.SchrodingerModel;
import hydrogenlab.physics.model.TransitionTable;
import hydrogenlab.physics.model.WeightedChooser;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.random.RandomGenerator;

/**
 * Saca al átomo de Schrödinger del estado metaestable (2,0,0), del que no puede decaer solo.
 * <ul>
 *     <li>Con luz blanca encendida, dispara cada {@code exciteAtomInterval} segundos un fotón absorbible
 *         desde el centro inferior de la caja.</li>
 *     <li>Con luz monocromática, ofrece la acción manual {@link #exciteAtom()}.</li>
 * </ul>
 * El acumulador de tiempo se reinicia cada vez que el gestor deja de estar activo.
 */
@Slf4j
public class MetastableHandler {

    private final LightSource light;
    private final RandomGenerator random;
    private final double exciteAtomInterval;
    private final ObservableValue<Boolean> metastableState;
    private final BiConsumer<SchrodingerQuantumNumbers, SchrodingerQuantumNumbers> stateListener = this::onStateChanged;

    private SchrodingerModel atom;

    @Getter
    private double elapsedTime;

    public MetastableHandler(LightSource light, RandomGenerator random, double exciteAtomInterval, StateScope parentScope) {
        this.light = light;
        this.random = random;
        this.exciteAtomInterval = exciteAtomInterval;
        this.metastableState = parentScope.child("metastableHandler").observable("isMetastableState", false);
    }

    /**
     * Observa un nuevo átomo (o ninguno, si el modelo activo no es de Schrödinger).
     */
    public void setAtom(SchrodingerModel newAtom) {
        if (atom != null) {
            atom.getElectron().nlmProperty().removeListener(stateListener);
        }
        atom = newAtom;
        elapsedTime = 0.0;
        if (atom != null) {
            atom.getElectron().nlmProperty().addListener(stateListener);
            metastableState.set(atom.isMetastable());
        } else {
            metastableState.set(false);
        }
    }

    private void onStateChanged(SchrodingerQuantumNumbers oldState, SchrodingerQuantumNumbers newState) {
        boolean metastable = newState.isMetastable();
        if (!metastable) {
            elapsedTime = 0.0;
        }
        metastableState.set(metastable);
    }

    public boolean isMetastableState() {
        return metastableState.get();
    }

    public ObservableValue<Boolean> metastableStateProperty() {
        return metastableState;
    }

    /**
     * Activo con el átomo metaestable y la luz blanca encendida.
     */
    public boolean isActive() {
        return isMetastableState() && light.isOn() && light.getMode() == LightMode.WHITE;
    }

    /**
     * La acción manual sólo está disponible en modo monocromático.
     */
    public boolean isExciteActionAvailable() {
        return isMetastableState() && light.getMode() == LightMode.MONOCHROMATIC;
    }

    public void step(double dt) {
        if (!isActive()) {
            elapsedTime = 0.0;
            return;
        }
        elapsedTime += dt;
        if (elapsedTime >= exciteAtomInterval) {
            exciteAtom();
            elapsedTime = 0.0;
        }
    }

    /**
     * Dispara un fotón absorbible desde n=2 hacia el átomo.
     *
     * @throws IllegalStateException si el átomo no está en el estado metaestable.
     */
    public void exciteAtom() {
        if (!isMetastableState()) {
            throw new IllegalStateException("El átomo no está en el estado metaestable");
        }
        List<Integer> wavelengths = TransitionTable.getInstance()
                .wavelengthsAbsorbableFrom(SchrodingerQuantumNumbers.METASTABLE_STATE.n());
        int wavelength = WeightedChooser.chooseUniform(wavelengths, random)
                .orElseThrow(() -> new IllegalStateException("No hay longitudes de onda absorbibles desde n=2"));
        log.debug("Excitando átomo metaestable con λ={}nm", wavelength);
        light.emitPhotonAtBottomCenter(wavelength);
    }

    public void reset() {
        elapsedTime = 0.0;
        metastableState.set(atom != null && atom.isMetastable());
    }
}
