package org.tesis.solar;

import org.junit.jupiter.api.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

class ImageOpsTest {

    @Test
    void quantile_interpolatesLinearly() {
        float[] v = {4, 1, 3, 2};
        assertEquals(2.5, ImageOps.quantile(v, 0.5), 1e-9);
        assertEquals(1.0, ImageOps.quantile(v, 0.0), 1e-9);
        assertEquals(4.0, ImageOps.quantile(v, 1.0), 1e-9);
        assertEquals(1.9, ImageOps.quantile(v, 0.3), 1e-6);
    }

    @Test
    void quantile_ofNothingIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ImageOps.quantile(new float[0], 0.5));
    }

    @Test
    void resizeLongSide_keepsSmallImagesAndCapsLargeOnes() {
        Mat small = ImageOps.toBgr(RoofImages.solid(300, 200, RoofImages.ROOF));
        Mat same = ImageOps.resizeLongSide(small, 1024);
        assertEquals(300, same.cols());
        assertEquals(200, same.rows());

        Mat big = ImageOps.toBgr(RoofImages.solid(2048, 1536, RoofImages.ROOF));
        Mat out = ImageOps.resizeLongSide(big, 1024);
        assertEquals(1024, out.cols());
        assertEquals(768, out.rows());

        Mat tall = ImageOps.toBgr(RoofImages.solid(700, 3000, RoofImages.ROOF));
        assertEquals(1024, ImageOps.resizeLongSide(tall, 1024).rows());
    }

    @Test
    void channels_grayUsesLumaWeightsAndValueIsTheMaximum() {
        Mat red = ImageOps.toBgr(RoofImages.solid(2, 2, new Color(255, 0, 0)));
        assertEquals(76.0, ImageOps.gray(red).get(0, 0)[0], 1.0);
        assertEquals(255.0, ImageOps.value(red).get(1, 1)[0]);
    }

    @Test
    void bufferedImage_survivesTheTripThroughOpenCv() {
        BufferedImage img = RoofImages.tenByTwelveRoof();
        BufferedImage back = ImageOps.toBufferedImage(ImageOps.toBgr(img));
        assertEquals(img.getWidth(), back.getWidth());
        assertEquals(img.getRGB(5, 5), back.getRGB(5, 5));
        assertEquals(img.getRGB(120, 140), back.getRGB(120, 140));
    }

    @Test
    void valuesUnder_onlyReadsMaskedPixels() {
        Mat gray = ImageOps.gray(ImageOps.toBgr(RoofImages.tenByTwelveRoof()));
        BinaryMask corner = new BinaryMask(gray.cols(), gray.rows());
        corner.set(0, 0, true);
        corner.set(100, 100, true);

        Mat mask = ImageOps.toMat(corner);
        assertEquals(2, Core.countNonZero(mask));
        float[] vals = ImageOps.valuesUnder(gray, mask);
        assertArrayEquals(new float[]{30f, 200f}, vals);
        assertEquals(2, ImageOps.toMask(mask).count());
    }
}
