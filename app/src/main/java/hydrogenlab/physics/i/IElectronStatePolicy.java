package hydrogenlab.physics.i;

import hydrogenlab.domain.geometry.Vector2;

import java.util.OptionalInt;
import java.util.random.RandomGenerator;

/**
 * Política de estados del electrón en un modelo cuantizado. Decide qué transiciones son válidas
 * y cómo se aplican; el motor cuántico decide cuándo ocurren.
 */
public interface IElectronStatePolicy {

    int getN();

    /**
     * Si es true, la absorción de un fotón con la longitud de onda adecuada es segura (probabilidad 1).
     */
    boolean absorptionIsCertain();

    /**
     * Indica si existe algún estado válido con número principal nTarget desde el estado actual.
     */
    boolean canTransitionTo(int nTarget);

    /**
     * Aplica la transición a nTarget.
     *
     * @throws IllegalStateException si no es una transición válida.
     */
    void transitionTo(int nTarget, RandomGenerator random);

    /**
     * Estado inferior para una emisión espontánea. Vacío si no hay transición posible.
     */
    OptionalInt chooseLowerN(RandomGenerator random);

    /**
     * Punto (relativo al centro del átomo) desde el que sale un fotón emitido espontáneamente.
     */
    Vector2 spontaneousEmissionOffset(RandomGenerator random);

    void reset();
}
