package hydrogenlab.physics.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Polinomios asociados de Legendre P_l^m(x) por la fórmula de Rodrigues:
 * <pre>
 *   P_l^m(x) = (-1)^m / (2^l · l!) · (1 - x²)^(m/2) · d^(l+m)/dx^(l+m) (x² - 1)^l
 * </pre>
 * El factor (-1)^m es la fase de Condon-Shortley.
 * <p>
 * Sólo es numéricamente fiable para l ≤ 6; valores mayores se rechazan.
 */
public final class AssociatedLegendreSolver {

    public static final int MAX_L = 6;

    private static final List<PolynomialTerm> X_SQUARED_MINUS_ONE = List.of(
            new PolynomialTerm(2, 1.0),
            new PolynomialTerm(0, -1.0)
    );

    /**
     * Prohibido construir esta clase utilidad
     */
    private AssociatedLegendreSolver() {
    }

    /**
     * @param l orden, 0 ≤ l ≤ 6.
     * @param m grado, 0 ≤ m ≤ l.
     * @param x argumento en [-1, 1] (normalmente cos θ).
     */
    public static double solve(int l, int m, double x) {
        if (l < 0 || l > MAX_L) {
            throw new IllegalArgumentException("l fuera del rango soportado [0, " + MAX_L + "]: " + l);
        }
        if (m < 0 || m > l) {
            throw new IllegalArgumentException(String.format("m debe estar en [0, l] (l=%d, m=%d)", l, m));
        }
        if (Math.abs(x) > 1.0) {
            throw new IllegalArgumentException("x debe estar en [-1, 1]: " + x);
        }

        // (x² - 1)^l
        List<PolynomialTerm> product = List.of(new PolynomialTerm(0, 1.0));
        for (int i = 0; i < l; i++) {
            product = multiply(product, X_SQUARED_MINUS_ONE);
        }

        // d^(l+m)/dx^(l+m)
        double sum = 0.0;
        for (PolynomialTerm term : product) {
            sum += term.derive(l + m).evaluate(x);
        }

        double condonShortley = (m % 2 == 0) ? 1.0 : -1.0;
        return condonShortley / (Math.pow(2, l) * factorial(l))
                * Math.pow(1.0 - x * x, m / 2.0)
                * sum;
    }

    static List<PolynomialTerm> multiply(List<PolynomialTerm> left, List<PolynomialTerm> right) {
        TreeMap<Integer, Double> byPower = new TreeMap<>();
        for (PolynomialTerm a : left) {
            for (PolynomialTerm b : right) {
                PolynomialTerm term = a.times(b);
                byPower.merge(term.power(), term.coefficient(), Double::sum);
            }
        }
        List<PolynomialTerm> result = new ArrayList<>(byPower.size());
        byPower.descendingMap().forEach((power, coefficient) -> result.add(new PolynomialTerm(power, coefficient)));
        return result;
    }

    static double factorial(int n) {
        double result = 1.0;
        for (int i = 2; i <= n; i++) {
            result *= i;
        }
        return result;
    }
}
