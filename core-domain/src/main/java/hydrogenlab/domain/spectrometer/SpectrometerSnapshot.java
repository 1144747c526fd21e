package hydrogenlab.domain.spectrometer;

import hydrogenlab.domain.atom.AtomicModelKind;

import java.util.List;
import java.util.Objects;

/**
 * Copia inmutable de los datos del espectrómetro, numerada y etiquetada con el modelo que la produjo.
 */
public record SpectrometerSnapshot(int snapshotNumber, AtomicModelKind atomicModel, List<SpectrometerDataPoint> dataPoints) {

    public SpectrometerSnapshot {
        Objects.requireNonNull(atomicModel, "atomicModel");
        dataPoints = List.copyOf(dataPoints);
    }

    public int totalPhotons() {
        return dataPoints.stream().mapToInt(SpectrometerDataPoint::numberOfPhotonsEmitted).sum();
    }
}
