package hydrogenlab.domain.particle;

import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.quantum.SchrodingerQuantumNumbers;
import hydrogenlab.physics.model.SchrodingerTransitionRules;

/**
 * Electrón cuyo estado es la terna (n, l, m). Las transiciones sustituyen la terna completa.
 */
public class SchrodingerElectron extends QuantumElectron {

    private final ObservableValue<SchrodingerQuantumNumbers> nlm;

    public SchrodingerElectron(StateScope scope, double groundOrbitRadius, double radius) {
        super(scope, groundOrbitRadius, radius);
        this.nlm = scope.child("electron").observable("nlm", SchrodingerQuantumNumbers.GROUND_STATE);
    }

    public SchrodingerQuantumNumbers getNLM() {
        return nlm.get();
    }

    public ObservableValue<SchrodingerQuantumNumbers> nlmProperty() {
        return nlm;
    }

    /**
     * Sustituye la terna actual.
     *
     * @throws IllegalStateException si la transición viola las reglas de selección.
     */
    public void setNLM(SchrodingerQuantumNumbers next) {
        SchrodingerQuantumNumbers current = nlm.get();
        if (!SchrodingerTransitionRules.isValidTransition(current, next)) {
            throw new IllegalStateException("Transición inválida " + current + " -> " + next);
        }
        nlm.set(next);
        super.setN(next.n());
    }

    /**
     * n sólo cambia junto con (l, m).
     */
    @Override
    public void setN(int newN) {
        throw new IllegalStateException("El estado del electrón de Schrödinger se cambia con setNLM");
    }

    @Override
    public void restoreState(int restoredN, double restoredAngle) {
        throw new IllegalStateException("El estado del electrón de Schrödinger se restaura con la terna (n,l,m)");
    }

    /**
     * Restaura la terna sin validar la transición (la restauración no es una transición física).
     */
    public void restoreState(SchrodingerQuantumNumbers state, double restoredAngle) {
        SchrodingerQuantumNumbers oldState = nlm.restore(state);
        Runnable notification = applyState(state.n(), restoredAngle);
        notification.run();
        nlm.notifyListeners(oldState);
    }

    @Override
    public void reset() {
        restoreState(SchrodingerQuantumNumbers.GROUND_STATE, 0.0);
    }
}
