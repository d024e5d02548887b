package org.tesis.solar;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.opencv.core.Mat;

import java.awt.*;
import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class MaskExtractorTest {

    private final MaskExtractor extractor = new MaskExtractor();

    private static Mat gray(BufferedImage img) {
        return ImageOps.gray(ImageOps.toBgr(img));
    }

    @Test
    void brightRoof_maskCoversTheRoofRectangle() {
        BufferedImage img = RoofImages.tenByTwelveRoof();
        RoofExtraction ext = extractor.extract(gray(img));

        assertEquals(48000, ext.mask().count(), 48000 * 0.02);
        assertTrue(ext.mask().get(120, 140), "el centro del techo es parte de la máscara");
        assertFalse(ext.mask().get(5, 5), "el fondo no es parte de la máscara");

        Envelope env = ext.contour().getEnvelopeInternal();
        assertEquals(20, env.getMinX(), 1.0);
        assertEquals(20, env.getMinY(), 1.0);
        assertEquals(219, env.getMaxX(), 1.0);
        assertEquals(259, env.getMaxY(), 1.0);
        assertEquals(0, ext.contour().getNumInteriorRing());
        assertEquals(5, ext.contour().getNumPoints(), "un rectángulo da cuatro esquinas");
    }

    @Test
    void darkRoofOnBrightBackground_isInverted() {
        BufferedImage img = new BufferedImage(240, 280, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(new Color(230, 230, 230));
        g.fillRect(0, 0, 240, 280);
        g.setColor(new Color(60, 60, 60));
        g.fillRect(20, 20, 200, 240);
        g.dispose();

        RoofExtraction ext = extractor.extract(gray(img));
        assertTrue(ext.mask().get(120, 140));
        assertFalse(ext.mask().get(5, 5));
        assertEquals(48000, ext.mask().count(), 48000 * 0.02);
    }

    @Test
    void shadowInsideRoof_isFilled() {
        BufferedImage img = RoofImages.roofWithShadow(240, 280, 30);
        RoofExtraction ext = extractor.extract(gray(img));

        assertTrue(ext.mask().get(120, 140), "el hueco de la sombra se rellena");
        assertEquals(240 * 280, ext.mask().count());
    }

    @Test
    void uniformImage_noRoofDetected() {
        BufferedImage img = RoofImages.solid(100, 80, RoofImages.ROOF);
        assertThrows(NoRoofDetectedException.class, () -> extractor.extract(gray(img)));
    }

    @Test
    void smallBrightBlob_largestComponentWins() {
        BufferedImage img = RoofImages.tenByTwelveRoof();
        Graphics2D g = img.createGraphics();
        g.setColor(RoofImages.ROOF);
        g.fillRect(2, 2, 8, 8);
        g.dispose();

        RoofExtraction ext = extractor.extract(gray(img));
        assertFalse(ext.mask().get(5, 5), "la mancha aislada no es techo");
        assertEquals(48000, ext.mask().count(), 48000 * 0.02);
    }
}
