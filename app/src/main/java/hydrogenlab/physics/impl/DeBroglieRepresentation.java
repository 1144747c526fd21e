package hydrogenlab.physics.impl;

/**
 * Formas de representar la onda estacionaria del electrón de de Broglie.
 * Todas comparten la función de amplitud; difieren en la geometría de colisión.
 */
public enum DeBroglieRepresentation {
    /**
     * Desplazamiento radial del anillo proporcional a la amplitud.
     */
    RADIAL_DISTANCE,
    /**
     * Brillo del anillo proporcional a la amplitud.
     */
    BRIGHTNESS,
    /**
     * Altura sobre el plano de la órbita, vista con inclinación pseudo-3D.
     */
    THREE_D_HEIGHT
}
