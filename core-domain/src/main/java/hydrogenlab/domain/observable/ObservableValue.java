package hydrogenlab.domain.observable;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

/**
 * Valor observable con nombre jerárquico.
 * <p>
 * Los oyentes reciben (valorAnterior, valorNuevo) sólo cuando el valor cambia.
 * La capa externa de persistencia identifica cada campo por {@link #getName()}.
 *
 * @param <T> tipo del valor.
 */
public class ObservableValue<T> {

    @Getter
    private final String name;
    private final T initialValue;
    private final List<BiConsumer<T, T>> listeners = new CopyOnWriteArrayList<>();
    private T value;

    public ObservableValue(String name, T initialValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.initialValue = initialValue;
        this.value = initialValue;
    }

    public T get() {
        return value;
    }

    public void set(T newValue) {
        T oldValue = value;
        value = newValue;
        if (!Objects.equals(oldValue, newValue)) {
            notifyListeners(oldValue);
        }
    }

    /**
     * Asigna el valor sin notificar. Pensado para aplicar un lote de estado y
     * notificar después con {@link #notifyListeners(Object)}.
     *
     * @return el valor anterior.
     */
    public T restore(T newValue) {
        T oldValue = value;
        value = newValue;
        return oldValue;
    }

    /**
     * Notifica a los oyentes si el valor actual difiere de {@code oldValue}.
     */
    public void notifyListeners(T oldValue) {
        if (Objects.equals(oldValue, value)) {
            return;
        }
        for (BiConsumer<T, T> listener : listeners) {
            listener.accept(oldValue, value);
        }
    }

    public void reset() {
        set(initialValue);
    }

    public T getInitialValue() {
        return initialValue;
    }

    public void addListener(BiConsumer<T, T> listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(BiConsumer<T, T> listener) {
        listeners.remove(listener);
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
