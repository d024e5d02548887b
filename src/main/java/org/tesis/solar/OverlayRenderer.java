package org.tesis.solar;

import org.locationtech.jts.geom.Coordinate;

import java.awt.*;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Dibuja los paneles (relleno + contorno) sobre una copia de la imagen y la compone con la
 * original al 32% de opacidad.
 */
public class OverlayRenderer {

    static final float  OVERLAY_ALPHA = 0.32f;
    static final Color  PANEL_FILL    = new Color(0, 0, 255);
    static final Color  PANEL_OUTLINE = new Color(40, 40, 40);
    static final float  OUTLINE_WIDTH = 2f;

    public BufferedImage render(BufferedImage base, List<PlacedPanel> panels) {
        int w = base.getWidth(), h = base.getHeight();

        BufferedImage layer = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = layer.createGraphics();
        try {
            g.drawImage(base, 0, 0, null);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setStroke(new BasicStroke(OUTLINE_WIDTH));
            for (PlacedPanel p : panels) {
                Path2D path = toPath(p);
                g.setColor(PANEL_FILL);
                g.fill(path);
                g.setColor(PANEL_OUTLINE);
                g.draw(path);
            }
        } finally {
            g.dispose();
        }

        // resultado = 0.68 * base + 0.32 * capa
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = out.createGraphics();
        try {
            g2.drawImage(base, 0, 0, null);
            g2.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, OVERLAY_ALPHA));
            g2.drawImage(layer, 0, 0, null);
        } finally {
            g2.dispose();
        }
        return out;
    }

    static Path2D toPath(PlacedPanel p) {
        Coordinate[] c = p.corners();
        Path2D.Double path = new Path2D.Double();
        path.moveTo(c[0].x, c[0].y);
        for (int i = 1; i < c.length; i++) path.lineTo(c[i].x, c[i].y);
        path.closePath();
        return path;
    }
}
