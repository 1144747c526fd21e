package hydrogenlab.domain.event;

import hydrogenlab.domain.atom.AtomicModelKind;

public record PhotonAbsorbedEvent(long photonId, int wavelength, AtomicModelKind atomicModel) {
}
