package hydrogenlab.physics.solver;

/**
 * Término de un polinomio: coefficient · x^power.
 */
public record PolynomialTerm(int power, double coefficient) {

    public static final PolynomialTerm ZERO = new PolynomialTerm(0, 0.0);

    public PolynomialTerm {
        if (power < 0) {
            throw new IllegalArgumentException("Potencia negativa: " + power);
        }
    }

    /**
     * Primera derivada: d/dx (c·x^p) = (c·p)·x^(p-1).
     */
    public PolynomialTerm derive() {
        if (power == 0) {
            return ZERO;
        }
        return new PolynomialTerm(power - 1, coefficient * power);
    }

    /**
     * Derivada k-ésima. Con k = 0 devuelve el propio término.
     */
    public PolynomialTerm derive(int times) {
        if (times < 0) {
            throw new IllegalArgumentException("Número de derivadas negativo: " + times);
        }
        PolynomialTerm result = this;
        for (int i = 0; i < times && result.coefficient != 0.0; i++) {
            result = result.derive();
        }
        return result;
    }

    public PolynomialTerm times(PolynomialTerm other) {
        return new PolynomialTerm(power + other.power, coefficient * other.coefficient);
    }

    public double evaluate(double x) {
        return coefficient * Math.pow(x, power);
    }
}
