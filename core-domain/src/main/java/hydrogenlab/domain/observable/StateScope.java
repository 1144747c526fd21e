package hydrogenlab.domain.observable;

import java.util.Objects;

/**
 * Ámbito jerárquico de nombres para los campos observables (ej: "simulation.bohr.electron.n").
 */
public record StateScope(String path) {

    public StateScope {
        Objects.requireNonNull(path, "path");
        if (path.isBlank()) {
            throw new IllegalArgumentException("El ámbito no puede estar vacío");
        }
    }

    public static StateScope root(String name) {
        return new StateScope(name);
    }

    public StateScope child(String name) {
        return new StateScope(path + "." + name);
    }

    public <T> ObservableValue<T> observable(String name, T initialValue) {
        return new ObservableValue<>(child(name).path(), initialValue);
    }
}
