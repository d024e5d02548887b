package org.tesis.solar;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.List;

/**
 * Salida de una invocación del motor. Todas las coordenadas están en píxeles de la imagen
 * procesada (lado mayor ≤ 1024).
 */
public class LayoutResult {
    final List<PlacedPanel> panels;
    final BufferedImage     overlay;
    final BinaryMask        roofMask;
    final Polygon           roofPolygon;
    final Geometry          usableRegion;
    final List<Polygon>     obstacles;
    final LayoutStats       stats;

    LayoutResult(List<PlacedPanel> panels, BufferedImage overlay, BinaryMask roofMask, Polygon roofPolygon,
                 Geometry usableRegion, List<Polygon> obstacles, LayoutStats stats) {
        this.panels = Collections.unmodifiableList(panels);
        this.overlay = overlay;
        this.roofMask = roofMask;
        this.roofPolygon = roofPolygon;
        this.usableRegion = usableRegion;
        this.obstacles = Collections.unmodifiableList(obstacles);
        this.stats = stats;
    }

    public List<PlacedPanel> panels()  { return panels; }
    public BufferedImage overlay()     { return overlay; }
    public BinaryMask roofMask()       { return roofMask; }
    public Polygon roofPolygon()       { return roofPolygon; }
    // región utilizable del ángulo ganador (marco de la imagen)
    public Geometry usableRegion()     { return usableRegion; }
    public List<Polygon> obstacles()   { return obstacles; }
    public LayoutStats stats()         { return stats; }
    public List<String> warnings()     { return stats.warnings; }
}
