package hydrogenlab.physics.solver;

import hydrogenlab.domain.quantum.SchrodingerQuantumNumbers;

/**
 * Campo 2D de densidad de probabilidad en el plano x-z, muestreado en los centros de una rejilla cuadrada.
 * Es el dato que consume la capa de representación.
 *
 * @param values  densidades indexadas [fila z][columna x], normalizadas a [0, 1].
 * @param extent  semiancho del plano muestreado.
 */
public record OrbitalDensityField(double[][] values, double extent) {

    public int gridSize() {
        return values.length;
    }

    public double valueAt(int row, int column) {
        return values[row][column];
    }

    /**
     * Calcula un cuadrante y lo refleja en los otros tres: la densidad sólo depende de |x| y |z|.
     */
    public static OrbitalDensityField compute(SchrodingerQuantumNumbers state, double a, int gridSize, double extent) {
        if (gridSize <= 0 || gridSize % 2 != 0) {
            throw new IllegalArgumentException("gridSize debe ser par y positivo: " + gridSize);
        }
        if (extent <= 0) {
            throw new IllegalArgumentException("extent debe ser > 0: " + extent);
        }

        double cell = 2 * extent / gridSize;
        int half = gridSize / 2;
        double[][] values = new double[gridSize][gridSize];
        double max = 0.0;

        for (int row = 0; row < half; row++) {
            double z = (row + 0.5) * cell;
            for (int column = 0; column < half; column++) {
                double x = (column + 0.5) * cell;
                double density = OrbitalWavefunctionSolver.probabilityDensityAt(state, x, 0.0, z, a);
                values[half + row][half + column] = density;
                values[half - 1 - row][half + column] = density;
                values[half + row][half - 1 - column] = density;
                values[half - 1 - row][half - 1 - column] = density;
                max = Math.max(max, density);
            }
        }

        if (max > 0.0) {
            for (double[] line : values) {
                for (int i = 0; i < line.length; i++) {
                    line[i] /= max;
                }
            }
        }
        return new OrbitalDensityField(values, extent);
    }
}
