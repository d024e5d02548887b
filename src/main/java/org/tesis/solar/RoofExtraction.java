package org.tesis.solar;

import org.locationtech.jts.geom.Polygon;

// resultado del extractor: máscara rellena del techo y su contorno externo (sin simplificar)
public class RoofExtraction {
    final BinaryMask mask;
    final Polygon    contour;

    RoofExtraction(BinaryMask mask, Polygon contour) {
        this.mask = mask;
        this.contour = contour;
    }

    public BinaryMask mask()  { return mask; }
    public Polygon contour()  { return contour; }
}
