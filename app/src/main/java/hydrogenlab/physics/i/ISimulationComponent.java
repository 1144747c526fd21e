package hydrogenlab.physics.i;

/**
 * Contrato base para cualquier componente de la simulación.
 * Permite tratar a todos los modelos de forma polimórfica para tareas
 * de logging, identificación y depuración, sin importar su física.
 */
public interface ISimulationComponent {
    /**
     * Nombre corto del componente (ej: "Bohr", "Schrödinger").
     */
    String getName();

    /**
     * Descripción del modelo físico (ej: "Órbitas circulares cuantizadas r = n²·r1").
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
