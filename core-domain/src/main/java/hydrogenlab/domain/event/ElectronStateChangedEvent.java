package hydrogenlab.domain.event;

import hydrogenlab.domain.atom.AtomicModelKind;

/**
 * Cambio del número cuántico principal de un modelo cuantizado.
 */
public record ElectronStateChangedEvent(AtomicModelKind atomicModel, int previousN, int currentN) {

    public boolean isExcitation() {
        return currentN > previousN;
    }
}
