package org.tesis.solar;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Empaquetado en grilla regular de rectángulos iguales, en el marco ya rotado.
 * La grilla se centra en la caja envolvente de cada parte y se prueban cuatro desfases;
 * un rectángulo sólo se acepta si queda contenido en la parte (con un margen numérico).
 */
public final class GridPacker {

    // margen de erosión numérica para la prueba de contención
    static final double CONTAINMENT_EPS = 1e-6;

    private GridPacker() {
    }

    /**
     * Empaqueta todas las partes de la región en orden, arrastrando el presupuesto de área
     * restante de una parte a la siguiente.
     *
     * @param sizeX         lado del panel en X (px)
     * @param sizeY         lado del panel en Y (px)
     * @param spacing       separación entre paneles (px)
     * @param targetArea    área objetivo total (px²); {@code <= 0} = sin tope
     * @param overshootFrac tolerancia de exceso como fracción del área de un panel
     */
    public static List<Polygon> packRegion(UsableRegion region, double sizeX, double sizeY, double spacing,
                                           double targetArea, double overshootFrac) {
        double[][] offsets = {
                {0.0, 0.0},
                {0.5 * (sizeX + spacing), 0.0},
                {0.0, 0.5 * (sizeY + spacing)},
                {0.5 * (sizeX + spacing), 0.5 * (sizeY + spacing)},
        };
        double tolArea = sizeX * sizeY * overshootFrac;
        List<Polygon> placedAll = new ArrayList<>();
        double remaining = targetArea;
        for (Polygon part : region.parts) {
            List<Polygon> placed = packGrid(part, sizeX, sizeY, spacing, remaining, offsets, tolArea);
            placedAll.addAll(placed);
            remaining -= area(placed);
            if (remaining <= 0) break;
        }
        return placedAll;
    }

    /**
     * Grilla centrada dentro de una parte, probando los desfases dados y quedándose con el que
     * más área coloca (el primero gana en empate). Recorre filas y columnas en orden; se detiene
     * al alcanzar el objetivo y salta (sin cortar la fila) las celdas que lo excederían por más
     * de {@code tolArea}.
     */
    static List<Polygon> packGrid(Polygon part, double sizeX, double sizeY, double spacing,
                                  double targetArea, double[][] offsets, double tolArea) {
        Envelope env = part.getEnvelopeInternal();
        double stepX = sizeX + spacing;
        double stepY = sizeY + spacing;
        double availW = Math.max(0.0, env.getWidth());
        double availH = Math.max(0.0, env.getHeight());

        int cols = availW >= sizeX ? 1 + (int) Math.floor((availW - sizeX) / stepX) : 0;
        int rows = availH >= sizeY ? 1 + (int) Math.floor((availH - sizeY) / stepY) : 0;
        if (cols <= 0 || rows <= 0) return Collections.emptyList();

        double usedW = cols * sizeX + (cols - 1) * spacing;
        double usedH = rows * sizeY + (rows - 1) * spacing;
        double baseX = env.getMinX() + (availW - usedW) / 2.0;
        double baseY = env.getMinY() + (availH - usedH) / 2.0;

        PreparedGeometry inside = PreparedGeometryFactory.prepare(part.buffer(-CONTAINMENT_EPS));
        double panelArea = sizeX * sizeY;
        boolean capped = targetArea > 0;

        List<Polygon> best = Collections.emptyList();
        double bestArea = 0.0;
        for (double[] off : offsets) {
            List<Polygon> placed = new ArrayList<>();
            double covered = 0.0;
            double y = baseY + off[1];
            rowsLoop:
            for (int r = 0; r < rows; r++) {
                double x = baseX + off[0];
                for (int c = 0; c < cols; c++, x += stepX) {
                    if (capped) {
                        double next = covered + panelArea;
                        if (next > targetArea && next - targetArea > tolArea) continue;
                    }
                    Polygon rect = GeomUtils.rectangle(x, y, sizeX, sizeY);
                    if (inside.contains(rect)) {
                        placed.add(rect);
                        covered += panelArea;
                        if (capped && covered >= targetArea) break rowsLoop;
                    }
                }
                y += stepY;
            }
            double a = area(placed);
            if (a > bestArea) {
                best = placed;
                bestArea = a;
            }
        }
        return best;
    }

    static double area(List<Polygon> rects) {
        double a = 0;
        for (Polygon p : rects) a += p.getArea();
        return a;
    }
}
