package org.tesis.solar;

import org.locationtech.jts.geom.Polygon;

/**
 * Polígono del techo (posiblemente cóncavo) y datos del rectángulo mínimo que lo envuelve.
 */
public class RoofGeometry {
    final Polygon polygon;
    final double  orientationDeg;  // eje largo del rectángulo mínimo, en [0, 180)
    final double  rectLongPx;
    final double  rectShortPx;

    RoofGeometry(Polygon polygon, double orientationDeg, double rectLongPx, double rectShortPx) {
        this.polygon = polygon;
        this.orientationDeg = orientationDeg;
        this.rectLongPx = rectLongPx;
        this.rectShortPx = rectShortPx;
    }

    public Polygon polygon()        { return polygon; }
    public double orientationDeg()  { return orientationDeg; }

    // relación lado largo / lado corto del rectángulo mínimo (1 si es degenerado)
    public double aspectRatio() {
        if (rectLongPx <= 0 || rectShortPx <= 0) return 1.0;
        return rectLongPx / Math.max(1e-6, rectShortPx);
    }

    /**
     * Estima largo y ancho reales a partir del área y la proporción del rectángulo mínimo:
     * L = sqrt(area * r), W = area / L. Devuelve {L, W}.
     */
    public double[] estimateLengthWidth(double areaM2) {
        double r = aspectRatio();
        double l = Math.sqrt(areaM2 * r);
        return new double[]{l, areaM2 / l};
    }
}
