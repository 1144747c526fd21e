package hydrogenlab.physics.simulator;

import hydrogenlab.domain.atom.AtomicModelKind;
import hydrogenlab.domain.observable.ObservableValue;
import hydrogenlab.domain.observable.StateScope;
import hydrogenlab.domain.spectrometer.SpectrometerDataPoint;
import hydrogenlab.domain.spectrometer.SpectrometerSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Cuenta los fotones emitidos por el átomo que salen de la caja, agrupados por longitud de onda.
 * <p>
 * Las instantáneas son copias inmutables. Su número está acotado: al llegar al máximo se rechazan
 * nuevas instantáneas (no se descarta ninguna antigua).
 */
@Slf4j
public class Spectrometer {

    private final int maxSnapshots;
    private final SortedMap<Integer, Integer> counts = new TreeMap<>();
    private final List<SpectrometerSnapshot> snapshots = new ArrayList<>();
    private final ObservableValue<Boolean> recording;
    private final ObservableValue<Integer> numberOfSnapshots;
    private int nextSnapshotNumber = 1;

    public Spectrometer(int maxSnapshots, StateScope parentScope) {
        this.maxSnapshots = maxSnapshots;
        StateScope scope = parentScope.child("spectrometer");
        this.recording = scope.observable("recording", true);
        this.numberOfSnapshots = scope.observable("numberOfSnapshots", 0);
    }

    public void recordEmission(int wavelength) {
        if (!isRecording()) {
            return;
        }
        counts.merge(wavelength, 1, Integer::sum);
    }

    public List<SpectrometerDataPoint> getDataPoints() {
        List<SpectrometerDataPoint> points = new ArrayList<>(counts.size());
        counts.forEach((wavelength, count) -> points.add(new SpectrometerDataPoint(wavelength, count)));
        return points;
    }

    public int getCount(int wavelength) {
        return counts.getOrDefault(wavelength, 0);
    }

    public boolean hasData() {
        return !counts.isEmpty();
    }

    public void clear() {
        counts.clear();
    }

    /**
     * @return la instantánea creada, o vacío si ya hay {@code maxSnapshots}.
     */
    public Optional<SpectrometerSnapshot> takeSnapshot(AtomicModelKind atomicModel) {
        if (snapshots.size() >= maxSnapshots) {
            log.warn("Máximo de instantáneas alcanzado ({}). Borre alguna antes de tomar otra.", maxSnapshots);
            return Optional.empty();
        }
        SpectrometerSnapshot snapshot = new SpectrometerSnapshot(nextSnapshotNumber++, atomicModel, getDataPoints());
        snapshots.add(snapshot);
        numberOfSnapshots.set(snapshots.size());
        log.info("Instantánea #{} tomada ({} fotones, modelo {})", snapshot.snapshotNumber(), snapshot.totalPhotons(), atomicModel);
        return Optional.of(snapshot);
    }

    public boolean deleteSnapshot(SpectrometerSnapshot snapshot) {
        boolean removed = snapshots.remove(snapshot);
        if (removed) {
            numberOfSnapshots.set(snapshots.size());
            log.info("Instantánea #{} borrada", snapshot.snapshotNumber());
        }
        return removed;
    }

    public List<SpectrometerSnapshot> getSnapshots() {
        return Collections.unmodifiableList(snapshots);
    }

    public int getNumberOfSnapshots() {
        return numberOfSnapshots.get();
    }

    public int getMaxSnapshots() {
        return maxSnapshots;
    }

    public boolean isRecording() {
        return recording.get();
    }

    public void setRecording(boolean value) {
        recording.set(value);
    }

    public ObservableValue<Boolean> recordingProperty() {
        return recording;
    }

    public ObservableValue<Integer> numberOfSnapshotsProperty() {
        return numberOfSnapshots;
    }

    public void reset() {
        counts.clear();
        snapshots.clear();
        nextSnapshotNumber = 1;
        numberOfSnapshots.set(0);
        recording.reset();
    }
}
