package org.tesis.solar;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.Collections;
import java.util.List;

/**
 * Región empaquetable de un ángulo: uno o más polígonos disjuntos
 * (techo - anillo perimetral - obstáculos). Nunca se asume un único polígono.
 */
public class UsableRegion {

    final List<Polygon> parts;
    final double area;

    UsableRegion(List<Polygon> parts) {
        this.parts = Collections.unmodifiableList(parts);
        double a = 0;
        for (Polygon p : parts) a += p.getArea();
        this.area = a;
    }

    static UsableRegion of(Geometry g) {
        return new UsableRegion(GeomUtils.polygons(g));
    }

    public List<Polygon> parts() { return parts; }
    public double area()         { return area; }
    public boolean isEmpty()     { return parts.isEmpty() || area <= 0; }

    public Geometry toGeometry() {
        return GeomUtils.GF.buildGeometry(parts);
    }
}
