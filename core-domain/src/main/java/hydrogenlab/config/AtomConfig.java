package hydrogenlab.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con los parámetros físicos y geométricos de un átomo de hidrógeno.
 * <p>
 * Todas las distancias están en unidades del modelo (las mismas que la caja de observación),
 * los ángulos en radianes y los tiempos en segundos.
 *
 * @param groundOrbitRadius             Radio de la órbita del estado fundamental (n=1). Las órbitas escalan como n².
 * @param electronAngleDelta            Velocidad angular base del electrón (rad/s).
 * @param photonRadius                  Radio de un fotón.
 * @param electronRadius                Radio de un electrón.
 * @param protonRadius                  Radio del protón.
 * @param brightnessRingThickness       Grosor del anillo de brillo (de Broglie / Schrödinger).
 * @param orbitYScale                   Factor de escala en Y para la proyección pseudo-3D de la órbita.
 * @param absorptionProbability         Probabilidad de absorber un fotón con la longitud de onda adecuada.
 * @param stimulatedEmissionProbability Probabilidad de emisión estimulada ante un fotón de la transición descendente.
 * @param minTimeInState                Tiempo mínimo en un estado antes de poder emitir espontáneamente.
 * @param meanLifetime                  Escala temporal (tau) del decaimiento espontáneo.
 * @param billiardBallRadius            Radio de la bola del modelo de bola de billar.
 * @param plumPuddingRadius             Radio del "pudin" de carga positiva.
 * @param plumPuddingWavelength         Única longitud de onda que absorbe y emite el modelo del pudin de pasas.
 * @param plumPuddingMaxCrossings       Veces que el electrón cruza el centro del pudin antes de emitir.
 */
@Builder
@With
public record AtomConfig(
        // --- Geometría ---
        double groundOrbitRadius,
        double electronAngleDelta,
        double photonRadius,
        double electronRadius,
        double protonRadius,
        double brightnessRingThickness,
        double orbitYScale,

        // --- Probabilidades y tiempos ---
        double absorptionProbability,
        double stimulatedEmissionProbability,
        double minTimeInState,
        double meanLifetime,

        // --- Modelos clásicos ---
        double billiardBallRadius,
        double plumPuddingRadius,
        int plumPuddingWavelength,
        int plumPuddingMaxCrossings
) {

    public AtomConfig {
        if (groundOrbitRadius <= 0) {
            throw new IllegalArgumentException("El radio de la órbita fundamental debe ser > 0: " + groundOrbitRadius);
        }
        checkProbability("absorptionProbability", absorptionProbability);
        checkProbability("stimulatedEmissionProbability", stimulatedEmissionProbability);
        if (meanLifetime <= 0) {
            throw new IllegalArgumentException("La vida media debe ser > 0: " + meanLifetime);
        }
    }

    private static void checkProbability(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " debe estar en [0, 1]: " + value);
        }
    }

    /**
     * Distancia máxima entre el centro de un fotón y el del electrón para considerar que colisionan.
     */
    public double collisionThreshold() {
        return photonRadius + electronRadius;
    }

    /**
     * Radio de la órbita para el número cuántico principal n: r(n) = n² · r1.
     */
    public double orbitRadius(int n) {
        return n * n * groundOrbitRadius;
    }

    public static AtomConfig getDefaultAtom() {
        return AtomConfig.builder()
                .groundOrbitRadius(6.0)
                .electronAngleDelta(Math.toRadians(480))
                .photonRadius(15.0)
                .electronRadius(4.5)
                .protonRadius(7.5)
                .brightnessRingThickness(3.0)
                .orbitYScale(0.35)
                .absorptionProbability(0.8)
                .stimulatedEmissionProbability(0.8)
                .minTimeInState(1.0)
                .meanLifetime(1.0)
                .billiardBallRadius(50.0)
                .plumPuddingRadius(50.0)
                .plumPuddingWavelength(150)
                .plumPuddingMaxCrossings(5)
                .build();
    }
}
