package org.tesis.solar;

import java.awt.*;
import java.awt.image.BufferedImage;

/**
 * Imágenes sintéticas de techos para los tests: techo claro sobre fondo oscuro.
 */
final class RoofImages {

    static final Color ROOF       = new Color(200, 200, 200);
    static final Color BACKGROUND = new Color(30, 30, 30);
    static final Color SHADOW     = new Color(40, 40, 40);

    private RoofImages() {
    }

    // techo rectangular de roofW x roofH px con un margen uniforme de fondo
    static BufferedImage rectangularRoof(int roofW, int roofH, int margin) {
        BufferedImage img = new BufferedImage(roofW + 2 * margin, roofH + 2 * margin, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            g.setColor(ROOF);
            g.fillRect(margin, margin, roofW, roofH);
        } finally {
            g.dispose();
        }
        return img;
    }

    // 200 x 240 px de techo en una imagen de 240 x 280: con 120 m2 la escala es 0.05 m/px
    static BufferedImage tenByTwelveRoof() {
        return rectangularRoof(200, 240, 20);
    }

    // techo que ocupa toda la imagen con una mancha oscura cuadrada en el centro
    static BufferedImage roofWithShadow(int w, int h, int shadowSide) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setColor(ROOF);
            g.fillRect(0, 0, w, h);
            g.setColor(SHADOW);
            g.fillRect((w - shadowSide) / 2, (h - shadowSide) / 2, shadowSide, shadowSide);
        } finally {
            g.dispose();
        }
        return img;
    }

    static BufferedImage solid(int w, int h, Color color) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setColor(color);
            g.fillRect(0, 0, w, h);
        } finally {
            g.dispose();
        }
        return img;
    }
}
