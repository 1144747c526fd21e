package hydrogenlab.physics.solver;

/**
 * Parte radial de la función de onda: polinomio generalizado de Laguerre evaluado por recurrencia
 * sobre el índice de término j = 0..(n-l-1), escalado por r^l · e^(-r / (n·a)).
 */
public final class GeneralizedLaguerreSolver {

    /**
     * Prohibido construir esta clase utilidad
     */
    private GeneralizedLaguerreSolver() {
    }

    /**
     * @param n número cuántico principal (1..6).
     * @param l número cuántico azimutal (0..n-1).
     * @param r distancia al núcleo (≥ 0).
     * @param a longitud de escala, r(n) / n² (el radio de la órbita fundamental).
     */
    public static double solve(int n, int l, double r, double a) {
        if (n < 1 || l < 0 || l > n - 1) {
            throw new IllegalArgumentException(String.format("Números cuánticos inválidos (n=%d, l=%d)", n, l));
        }
        if (r < 0 || a <= 0) {
            throw new IllegalArgumentException(String.format("Se requiere r >= 0 y a > 0 (r=%s, a=%s)", r, a));
        }

        final double na = n * a;
        final double multiplier = Math.pow(r, l) * Math.exp(-r / na);

        double b = 2.0 * Math.pow(na, -1.5); // b0
        double sum = b;
        for (int j = 1; j <= n - l - 1; j++) {
            b = (2.0 / na) * ((j + l - n) / (double) (j * (j + 2 * l + 1))) * b;
            sum += b * Math.pow(r, j);
        }
        return multiplier * sum;
    }
}
