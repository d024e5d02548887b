package org.tesis.solar;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;

import java.util.Arrays;

public class PlacedPanel {
    final Polygon          polygon;      // 4 esquinas en el marco original de la imagen
    final PanelOrientation orientation;
    final double           angleDeg;     // ángulo de la grilla que lo colocó

    PlacedPanel(Polygon polygon, PanelOrientation orientation, double angleDeg) {
        this.polygon = polygon;
        this.orientation = orientation;
        this.angleDeg = angleDeg;
    }

    public Polygon polygon()               { return polygon; }
    public PanelOrientation orientation()  { return orientation; }
    public double angleDeg()               { return angleDeg; }

    // las 4 esquinas (sin repetir la de cierre)
    public Coordinate[] corners() {
        return Arrays.copyOf(polygon.getExteriorRing().getCoordinates(), 4);
    }

    // esquinas redondeadas a píxeles enteros, como {x, y} por fila
    public int[][] cornersPx() {
        Coordinate[] c = corners();
        int[][] out = new int[c.length][2];
        for (int i = 0; i < c.length; i++) {
            out[i][0] = (int) Math.round(c[i].x);
            out[i][1] = (int) Math.round(c[i].y);
        }
        return out;
    }
}
