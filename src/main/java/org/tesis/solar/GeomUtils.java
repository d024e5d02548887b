package org.tesis.solar;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.locationtech.jts.simplify.DouglasPeuckerSimplifier;
import org.opencv.core.Point;

import java.util.*;

public class GeomUtils {

    static final GeometryFactory GF = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    // segmentos por cuadrante usados en los buffers (erosión/dilatación de polígonos)
    static final int BUFFER_SEGMENTS = 8;

    private GeomUtils() {
    }

    // rectángulo alineado a los ejes con esquina (x, y)
    static Polygon rectangle(double x, double y, double w, double h) {
        return GF.createPolygon(new Coordinate[]{
                new Coordinate(x, y),
                new Coordinate(x + w, y),
                new Coordinate(x + w, y + h),
                new Coordinate(x, y + h),
                new Coordinate(x, y)
        });
    }

    /**
     * Polígono a partir de un contorno de OpenCV (vértices en centros de píxel). Devuelve null
     * si quedan menos de 3 vértices distintos o el área es nula; un anillo que se toca a sí mismo
     * se corrige con buffer(0) y se conserva el pedazo mayor.
     */
    static Polygon fromContour(Point[] pts) {
        CoordinateList coords = new CoordinateList();
        for (Point p : pts) coords.add(new Coordinate(p.x, p.y), false);
        if (coords.size() < 3) return null;
        coords.closeRing();
        Polygon poly = GF.createPolygon(coords.toCoordinateArray());
        if (!poly.isValid()) poly = largestPolygon(poly.buffer(0));
        return poly == null || poly.getArea() <= 0 ? null : poly;
    }

    // lista de polígonos contenidos en una geometría (Polygon, MultiPolygon o colección)
    static List<Polygon> polygons(Geometry g) {
        List<Polygon> out = new ArrayList<>();
        if (g == null || g.isEmpty()) return out;
        if (g instanceof Polygon p) {
            out.add(p);
        } else {
            for (int i = 0; i < g.getNumGeometries(); i++) {
                Geometry gi = g.getGeometryN(i);
                if (gi != g) out.addAll(polygons(gi));
            }
        }
        return out;
    }

    // polígono de mayor área, o null si no hay ninguno
    static Polygon largestPolygon(Geometry g) {
        Polygon best = null;
        double area = -1;
        for (Polygon p : polygons(g)) {
            if (p.getArea() > area) { area = p.getArea(); best = p; }
        }
        return best;
    }

    /**
     * Simplificación Douglas-Peucker con tolerancia proporcional al perímetro. Si el resultado
     * colapsa por debajo de 3 vértices se devuelve el polígono original.
     */
    static Polygon simplify(Polygon p, double perimeterFrac) {
        double tol = perimeterFrac * p.getExteriorRing().getLength();
        Geometry s = DouglasPeuckerSimplifier.simplify(p, tol);
        Polygon best = largestPolygon(s);
        // un anillo cerrado de 3 vértices distintos tiene 4 coordenadas
        if (best == null || best.isEmpty() || best.getExteriorRing().getNumPoints() < 4) return p;
        return best;
    }

    // erosión (d > 0) de un polígono; puede devolver varios pedazos o vacío
    static Geometry inset(Geometry g, double d) {
        if (d <= 0) return g;
        return g.buffer(-d, BUFFER_SEGMENTS);
    }

    // rota una geometría angleDeg grados alrededor de (cx, cy)
    static Geometry rotate(Geometry g, double angleDeg, double cx, double cy) {
        if (angleDeg % 360 == 0) return g.copy();
        return AffineTransformation.rotationInstance(Math.toRadians(angleDeg), cx, cy).transform(g);
    }

    // normaliza un ángulo a [0, 180)
    static double normalizeAngle(double deg) {
        double a = ((deg % 180) + 180) % 180;
        return a >= 180 ? 0 : a;
    }

    // unión de polígonos corrigiendo los inválidos con buffer(0)
    static Geometry union(Collection<? extends Geometry> geoms) {
        List<Geometry> clean = new ArrayList<>();
        for (Geometry g : geoms) {
            Geometry c = g.isValid() ? g : g.buffer(0);
            if (!c.isEmpty()) clean.add(c);
        }
        if (clean.isEmpty()) return GF.createPolygon();
        return UnaryUnionOp.union(clean);
    }
}
