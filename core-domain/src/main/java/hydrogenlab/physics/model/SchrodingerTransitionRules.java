package hydrogenlab.physics.model;

import hydrogenlab.domain.quantum.SchrodingerQuantumNumbers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Reglas de selección dipolar para las transiciones (n,l,m) -> (n',l',m'):
 * <ul>
 *     <li>n' ≠ n, con n' en [1, 6], l' en [0, n'-1] y m' en [-l', l'].</li>
 *     <li>|l - l'| = 1.</li>
 *     <li>|m - m'| ≤ 1.</li>
 * </ul>
 */
public final class SchrodingerTransitionRules {

    /**
     * Prohibido construir esta clase utilidad
     */
    private SchrodingerTransitionRules() {
    }

    public static boolean isValidTransition(SchrodingerQuantumNumbers from, SchrodingerQuantumNumbers to) {
        return from.n() != to.n()
                && Math.abs(from.l() - to.l()) == 1
                && Math.abs(from.m() - to.m()) <= 1;
    }

    /**
     * Todos los estados (nTarget, l', m') alcanzables desde {@code from}.
     */
    public static List<SchrodingerQuantumNumbers> validTargets(SchrodingerQuantumNumbers from, int nTarget) {
        List<SchrodingerQuantumNumbers> targets = new ArrayList<>();
        if (nTarget == from.n() || nTarget < SchrodingerQuantumNumbers.MIN_N || nTarget > SchrodingerQuantumNumbers.MAX_N) {
            return targets;
        }
        for (int l = from.l() - 1; l <= from.l() + 1; l += 2) {
            if (l < 0 || l > nTarget - 1) {
                continue;
            }
            for (int m = from.m() - 1; m <= from.m() + 1; m++) {
                if (m >= -l && m <= l) {
                    targets.add(new SchrodingerQuantumNumbers(nTarget, l, m));
                }
            }
        }
        return targets;
    }

    /**
     * Elige uniformemente entre los (l', m') válidos para nTarget.
     */
    public static Optional<SchrodingerQuantumNumbers> chooseTarget(SchrodingerQuantumNumbers from, int nTarget,
                                                                   RandomGenerator random) {
        return WeightedChooser.chooseUniform(validTargets(from, nTarget), random);
    }

    /**
     * Elige el n inferior para una emisión espontánea, ponderando por la intensidad de transición
     * y descartando los n que no tienen ningún (l', m') válido.
     *
     * @return vacío si no hay transición posible (estado fundamental o metaestable).
     */
    public static Optional<Integer> chooseLowerN(SchrodingerQuantumNumbers from, TransitionTable table,
                                                 RandomGenerator random) {
        List<Integer> candidates = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (int nLower = SchrodingerQuantumNumbers.MIN_N; nLower < from.n(); nLower++) {
            if (!validTargets(from, nLower).isEmpty()) {
                candidates.add(nLower);
                weights.add(table.getTransitionStrength(from.n(), nLower));
            }
        }
        return WeightedChooser.choose(candidates, weights, random);
    }
}
