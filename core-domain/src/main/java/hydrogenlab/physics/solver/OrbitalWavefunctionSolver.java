package hydrogenlab.physics.solver;

import hydrogenlab.domain.quantum.SchrodingerQuantumNumbers;

/**
 * Función de onda orbital del hidrógeno: parte radial (Laguerre) por parte angular (Legendre).
 * <p>
 * Funciones puras: para los mismos argumentos el resultado es idéntico bit a bit.
 */
public final class OrbitalWavefunctionSolver {

    /**
     * Prohibido construir esta clase utilidad
     */
    private OrbitalWavefunctionSolver() {
    }

    /**
     * density(n, l, m, r, cosθ) = Laguerre(n, l, r) × Legendre(l, |m|, cosθ).
     */
    public static double density(int n, int l, int m, double r, double cosTheta, double a) {
        return GeneralizedLaguerreSolver.solve(n, l, r, a)
                * AssociatedLegendreSolver.solve(l, Math.abs(m), cosTheta);
    }

    public static double density(SchrodingerQuantumNumbers state, double r, double cosTheta, double a) {
        return density(state.n(), state.l(), state.m(), r, cosTheta, a);
    }

    /**
     * |ψ|², sin normalizar.
     */
    public static double probabilityDensity(SchrodingerQuantumNumbers state, double r, double cosTheta, double a) {
        double psi = density(state, r, cosTheta, a);
        return psi * psi;
    }

    /**
     * Densidad de probabilidad en un punto cartesiano. El eje z es el eje de cuantización;
     * en el origen se toma cosθ = 1.
     */
    public static double probabilityDensityAt(SchrodingerQuantumNumbers state, double x, double y, double z, double a) {
        double r = Math.sqrt(x * x + y * y + z * z);
        double cosTheta = (r == 0.0) ? 1.0 : Math.min(1.0, Math.abs(z) / r);
        return probabilityDensity(state, r, cosTheta, a);
    }
}
