package hydrogenlab.physics.model;

import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Elección aleatoria ponderada. Los pesos no necesitan estar normalizados.
 */
public final class WeightedChooser {

    /**
     * Prohibido construir esta clase utilidad
     */
    private WeightedChooser() {
    }

    /**
     * @return el valor elegido, o vacío si no hay ningún peso positivo.
     */
    public static <T> Optional<T> choose(List<T> values, List<Double> weights, RandomGenerator random) {
        if (values.size() != weights.size()) {
            throw new IllegalArgumentException("values y weights deben tener el mismo tamaño");
        }
        double total = 0.0;
        for (double weight : weights) {
            if (weight < 0) {
                throw new IllegalArgumentException("Peso negativo: " + weight);
            }
            total += weight;
        }
        if (total <= 0.0) {
            return Optional.empty();
        }

        double target = random.nextDouble() * total;
        double cumulative = 0.0;
        T lastPositive = null;
        for (int i = 0; i < values.size(); i++) {
            double weight = weights.get(i);
            if (weight == 0.0) {
                continue;
            }
            cumulative += weight;
            lastPositive = values.get(i);
            if (target < cumulative) {
                return Optional.of(values.get(i));
            }
        }
        // Redondeo en el último intervalo
        return Optional.ofNullable(lastPositive);
    }

    /**
     * Elección uniforme. Vacío si la lista está vacía.
     */
    public static <T> Optional<T> chooseUniform(List<T> values, RandomGenerator random) {
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(random.nextInt(values.size())));
    }
}
