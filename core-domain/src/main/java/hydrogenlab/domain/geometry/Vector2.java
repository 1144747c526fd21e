package hydrogenlab.domain.geometry;

/**
 * Punto o vector 2D inmutable en coordenadas del modelo (eje Y hacia arriba).
 */
public record Vector2(double x, double y) {

    public static final Vector2 ZERO = new Vector2(0.0, 0.0);

    public static Vector2 fromPolar(double magnitude, double angle) {
        return new Vector2(magnitude * Math.cos(angle), magnitude * Math.sin(angle));
    }

    public Vector2 plus(Vector2 other) {
        return new Vector2(x + other.x, y + other.y);
    }

    public Vector2 plus(double dx, double dy) {
        return new Vector2(x + dx, y + dy);
    }

    public Vector2 minus(Vector2 other) {
        return new Vector2(x - other.x, y - other.y);
    }

    public Vector2 times(double scalar) {
        return new Vector2(x * scalar, y * scalar);
    }

    public double magnitude() {
        return Math.hypot(x, y);
    }

    public double distance(Vector2 other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    /**
     * Ángulo polar en radianes, en (-π, π].
     */
    public double angle() {
        return Math.atan2(y, x);
    }
}
