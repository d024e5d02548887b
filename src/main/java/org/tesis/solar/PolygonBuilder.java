package org.tesis.solar;

import org.locationtech.jts.algorithm.MinimumDiameter;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

public class PolygonBuilder {

    // tolerancia de simplificación: 1% del perímetro del contorno
    static final double SIMPLIFY_PERIMETER_FRAC = 0.01;

    // simplifica el contorno y calcula la orientación principal del techo
    public RoofGeometry build(Polygon contour) {
        Polygon poly = GeomUtils.simplify(contour, SIMPLIFY_PERIMETER_FRAC);

        Geometry rect = new MinimumDiameter(contour).getMinimumRectangle();
        Coordinate[] c = rect.getCoordinates();
        if (!(rect instanceof Polygon) || c.length < 4) {
            // contorno degenerado (segmento o punto): eje según el segmento si existe
            double angle = c.length >= 2 ? Math.toDegrees(Math.atan2(c[1].y - c[0].y, c[1].x - c[0].x)) : 0.0;
            double len = c.length >= 2 ? c[0].distance(c[1]) : 0.0;
            return new RoofGeometry(poly, GeomUtils.normalizeAngle(angle), len, 0.0);
        }

        double s1 = c[0].distance(c[1]);
        double s2 = c[1].distance(c[2]);
        Coordinate a = s1 >= s2 ? c[0] : c[1];
        Coordinate b = s1 >= s2 ? c[1] : c[2];
        double angle = Math.toDegrees(Math.atan2(b.y - a.y, b.x - a.x));
        return new RoofGeometry(poly, round6(GeomUtils.normalizeAngle(angle)), Math.max(s1, s2), Math.min(s1, s2));
    }

    // evita que 179.9999999 y 0 cuenten como ejes distintos por ruido numérico
    private static double round6(double deg) {
        double r = Math.round(deg * 1e6) / 1e6;
        return r >= 180 ? 0 : r;
    }
}
