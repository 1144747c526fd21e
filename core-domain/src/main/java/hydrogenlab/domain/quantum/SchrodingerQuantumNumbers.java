package hydrogenlab.domain.quantum;

/**
 * Terna de números cuánticos (n, l, m) del electrón de Schrödinger.
 * <p>
 * Invariantes: 1 ≤ n ≤ 6, 0 ≤ l ≤ n-1, -l ≤ m ≤ l.
 */
public record SchrodingerQuantumNumbers(int n, int l, int m) {

    public static final int MIN_N = 1;
    public static final int MAX_N = 6;

    public static final SchrodingerQuantumNumbers GROUND_STATE = new SchrodingerQuantumNumbers(1, 0, 0);

    /**
     * Estado del que no se puede decaer espontáneamente: pasar a n=1 exige l'=0, pero desde l=0 la regla |Δl|=1 lo impide.
     */
    public static final SchrodingerQuantumNumbers METASTABLE_STATE = new SchrodingerQuantumNumbers(2, 0, 0);

    public SchrodingerQuantumNumbers {
        if (!isValid(n, l, m)) {
            throw new IllegalArgumentException(String.format("Estado cuántico inválido (n=%d, l=%d, m=%d)", n, l, m));
        }
    }

    public static boolean isValid(int n, int l, int m) {
        return n >= MIN_N && n <= MAX_N
                && l >= 0 && l <= n - 1
                && m >= -l && m <= l;
    }

    public boolean isMetastable() {
        return equals(METASTABLE_STATE);
    }

    @Override
    public String toString() {
        return "(" + n + "," + l + "," + m + ")";
    }
}
