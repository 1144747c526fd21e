package hydrogenlab.physics.impl;

import hydrogenlab.domain.geometry.Vector2;
import hydrogenlab.physics.i.IOrbitCollisionGeometry;

/**
 * Colisión con la proyección 2D de una órbita inclinada: una elipse de semiejes r y r·yScale.
 * El fotón choca si la distancia al punto más cercano de la elipse es menor que {@code closeness}.
 */
public class EllipticalOrbitGeometry implements IOrbitCollisionGeometry {

    private static final int ITERATIONS = 6;
    private static final double INITIAL_GUESS = Math.sqrt(0.5);

    private final double yScale;
    private final double closeness;

    public EllipticalOrbitGeometry(double yScale, double closeness) {
        if (yScale <= 0 || yScale > 1) {
            throw new IllegalArgumentException("yScale debe estar en (0, 1]: " + yScale);
        }
        this.yScale = yScale;
        this.closeness = closeness;
    }

    @Override
    public boolean collides(Vector2 photonOffset, double orbitRadius) {
        return distanceToEllipse(photonOffset, orbitRadius, orbitRadius * yScale) <= closeness;
    }

    /**
     * Distancia de un punto a la elipse x²/a² + y²/b² = 1 (a ≥ b), por iteración sobre la evoluta.
     * Trabaja en el primer cuadrante; la elipse es simétrica.
     */
    static double distanceToEllipse(Vector2 point, double a, double b) {
        double px = Math.abs(point.x());
        double py = Math.abs(point.y());

        double tx = INITIAL_GUESS;
        double ty = INITIAL_GUESS;
        for (int i = 0; i < ITERATIONS; i++) {
            double x = a * tx;
            double y = b * ty;

            // Centro de curvatura (evoluta)
            double ex = (a * a - b * b) * tx * tx * tx / a;
            double ey = (b * b - a * a) * ty * ty * ty / b;

            double rx = x - ex;
            double ry = y - ey;
            double qx = px - ex;
            double qy = py - ey;

            double r = Math.hypot(rx, ry);
            double q = Math.hypot(qx, qy);
            if (q == 0.0) {
                break;
            }

            tx = Math.min(1.0, Math.max(0.0, (qx * r / q + ex) / a));
            ty = Math.min(1.0, Math.max(0.0, (qy * r / q + ey) / b));
            double t = Math.hypot(tx, ty);
            tx /= t;
            ty /= t;
        }
        return Math.hypot(px - a * tx, py - b * ty);
    }

    @Override
    public String getName() {
        return "Elipse";
    }

    @Override
    public String getDescription() {
        return "Distancia al punto más cercano de la órbita proyectada (yScale=" + yScale + ")";
    }
}
