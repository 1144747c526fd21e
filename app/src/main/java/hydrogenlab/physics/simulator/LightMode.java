package hydrogenlab.physics.simulator;

public enum LightMode {
    /**
     * Espectro completo, sesgado hacia las longitudes de onda que excitan el estado fundamental.
     */
    WHITE,
    /**
     * Una única longitud de onda elegida por el usuario.
     */
    MONOCHROMATIC
}
