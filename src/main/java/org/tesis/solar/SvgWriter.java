package org.tesis.solar;

import org.locationtech.jts.geom.*;
import java.util.Locale;

class SvgWriter {

    // exporta techo, región utilizable, obstáculos y paneles en píxeles de la imagen procesada
    static String toSVG(LayoutResult result) {
        int w = result.roofMask.width();
        int h = result.roofMask.height();

        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(w)
          .append("\" height=\"").append(h).append("\" viewBox=\"0 0 ")
          .append(w).append(" ").append(h).append("\">\n");

        // Fondo
        sb.append("  <rect x=\"0\" y=\"0\" width=\"").append(w).append("\" height=\"").append(h)
          .append("\" fill=\"white\"/>\n");

        // El marco de la imagen ya tiene Y hacia abajo, igual que SVG: no se invierte
        sb.append("  <g>\n");

        // Techo
        sb.append("    <path d=\"").append(pathFor(result.roofPolygon))
          .append("\" fill=\"#f0f0f0\" stroke=\"#333\" stroke-width=\"1\"/>\n");

        // Región utilizable del ángulo ganador
        emitGeometryAsSvgPaths(sb, result.usableRegion, "#d9f0d3", "0.6", null);

        // Obstáculos
        for (Polygon o : result.obstacles) {
            emitPolygon(sb, o, "#fb6a4a", "0.5", null);
        }

        // Paneles
        int idx = 0;
        for (PlacedPanel p : result.panels) {
            emitPolygon(sb, p.polygon, "#3182bd", "0.85", "panel " + (++idx) + " | " + p.orientation
                    + " | θ=" + fmt(p.angleDeg) + "°");
        }

        sb.append("  </g>\n</svg>\n");
        return sb.toString();
    }

    // ---------- helpers de dibujo ----------

    static void emitGeometryAsSvgPaths(StringBuilder sb, Geometry g, String fill, String opacity, String title) {
        if (g == null || g.isEmpty()) return;
        if (g instanceof Polygon) {
            emitPolygon(sb, (Polygon) g, fill, opacity, title);
        } else if (g instanceof GeometryCollection) {
            GeometryCollection gc = (GeometryCollection) g;
            for (int i = 0; i < gc.getNumGeometries(); i++) {
                emitGeometryAsSvgPaths(sb, gc.getGeometryN(i), fill, opacity, title);
            }
        }
    }

    static void emitPolygon(StringBuilder sb, Polygon poly, String fill, String opacity, String title) {
        sb.append("    <path d=\"").append(pathFor(poly))
          .append("\" fill=\"").append(fill)
          .append("\" fill-opacity=\"").append(opacity)
          .append("\" fill-rule=\"evenodd\" stroke=\"#111\" stroke-width=\"0.8\"");
        if (title != null) {
            sb.append(">\n      <title>").append(title).append("</title>\n    </path>\n");
        } else {
            sb.append("/>\n");
        }
    }

    // atributo "d" de un path SVG: anillo exterior y huecos, en píxeles con 2 decimales
    static String pathFor(Polygon poly) {
        StringBuilder d = new StringBuilder();
        appendRing(d, poly.getExteriorRing());
        for (int i = 0; i < poly.getNumInteriorRing(); i++) {
            appendRing(d, poly.getInteriorRingN(i));
        }
        return d.toString().trim();
    }

    // M/L/Z de un anillo; la coordenada de cierre repetida se omite porque Z ya cierra
    static void appendRing(StringBuilder d, LinearRing ring) {
        Coordinate[] c = ring.getCoordinates();
        int n = (c.length > 1 && c[0].equals2D(c[c.length - 1])) ? c.length - 1 : c.length;
        for (int i = 0; i < n; i++) {
            d.append(i == 0 ? "M" : "L").append(fmt(c[i].x)).append(',').append(fmt(c[i].y)).append(' ');
        }
        if (n > 0) d.append("Z ");
    }

    static String fmt(double v) {
        return String.format(Locale.US, "%.2f", v);
    }
}
