package hydrogenlab.domain.atom;

/**
 * Conjunto cerrado de modelos del átomo de hidrógeno.
 * <p>
 * {@link #EXPERIMENT} representa el comportamiento estadísticamente correcto del átomo
 * (física de Schrödinger) frente a los modelos predictivos.
 */
public enum AtomicModelKind {
    BILLIARD_BALL(false),
    PLUM_PUDDING(false),
    CLASSICAL_SOLAR_SYSTEM(false),
    BOHR(true),
    DE_BROGLIE(true),
    SCHRODINGER(true),
    EXPERIMENT(true);

    private final boolean quantum;

    AtomicModelKind(boolean quantum) {
        this.quantum = quantum;
    }

    /**
     * Indica si el modelo tiene niveles de energía cuantizados (y por tanto longitudes de onda de transición).
     */
    public boolean isQuantum() {
        return quantum;
    }

    public boolean isPredictive() {
        return this != EXPERIMENT;
    }

    /**
     * Modelos cuyo estado es la terna (n, l, m).
     */
    public boolean isSchrodingerBased() {
        return this == SCHRODINGER || this == EXPERIMENT;
    }
}
