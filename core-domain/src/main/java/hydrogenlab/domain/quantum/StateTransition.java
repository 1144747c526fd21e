package hydrogenlab.domain.quantum;

/**
 * Transición entre dos niveles de energía, siempre con lower &lt; upper.
 */
public record StateTransition(int lower, int upper) {

    public StateTransition {
        if (lower < SchrodingerQuantumNumbers.MIN_N || upper > SchrodingerQuantumNumbers.MAX_N || lower >= upper) {
            throw new IllegalArgumentException(String.format("Transición inválida (%d -> %d)", lower, upper));
        }
    }

    /**
     * Devuelve el otro extremo de la transición respecto a {@code n}.
     */
    public int otherState(int n) {
        if (n == lower) {
            return upper;
        }
        if (n == upper) {
            return lower;
        }
        throw new IllegalArgumentException("El estado " + n + " no pertenece a la transición " + this);
    }
}
