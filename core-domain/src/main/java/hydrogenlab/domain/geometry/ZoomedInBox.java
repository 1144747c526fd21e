package hydrogenlab.domain.geometry;

/**
 * Región cuadrada de observación centrada en el átomo (0,0).
 * Los fotones que la abandonan dejan de existir.
 *
 * @param size Lado de la caja.
 */
public record ZoomedInBox(double size) {

    public ZoomedInBox {
        if (size <= 0) {
            throw new IllegalArgumentException("El lado de la caja debe ser > 0: " + size);
        }
    }

    public double minX() {
        return -size / 2;
    }

    public double maxX() {
        return size / 2;
    }

    public double minY() {
        return -size / 2;
    }

    public double maxY() {
        return size / 2;
    }

    public double centerX() {
        return 0.0;
    }

    public double height() {
        return size;
    }

    public Vector2 center() {
        return Vector2.ZERO;
    }

    public boolean contains(Vector2 point) {
        return point.x() >= minX() && point.x() <= maxX()
                && point.y() >= minY() && point.y() <= maxY();
    }
}
