package org.tesis.solar;

import org.locationtech.jts.geom.Polygon;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Segmenta la región dominante del techo: gaussiano 3x3, umbral de Otsu, inversión si el
 * primer plano es minoría, cierre 5x5 (2 iteraciones), mayor componente conexa y relleno
 * de su contorno externo.
 */
public class MaskExtractor {

    private static final Logger log = LoggerFactory.getLogger(MaskExtractor.class);

    static final int CLOSE_KERNEL     = 5;
    static final int CLOSE_ITERATIONS = 2;

    // extrae máscara y contorno a partir del gris (CV_8U) de la imagen ya reducida
    public RoofExtraction extract(Mat gray) {
        Mat blur = new Mat();
        Mat th = new Mat();
        Mat kernel = Mat.ones(CLOSE_KERNEL, CLOSE_KERNEL, CvType.CV_8U);
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        Mat largest = new Mat();
        Mat hierarchy = new Mat();
        Mat filled = Mat.zeros(gray.size(), CvType.CV_8U);
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            Imgproc.GaussianBlur(gray, blur, new Size(3, 3), 0);
            Core.MinMaxLocResult range = Core.minMaxLoc(blur);
            if (range.minVal == range.maxVal) {
                throw new NoRoofDetectedException("No roof contour found: image has no intensity variation");
            }
            double t = Imgproc.threshold(blur, th, 0, 255, Imgproc.THRESH_BINARY + Imgproc.THRESH_OTSU);
            // primer plano minoritario: el techo es lo oscuro
            if (Core.mean(th).val[0] < 127) {
                Core.bitwise_not(th, th);
            }
            Imgproc.morphologyEx(th, th, Imgproc.MORPH_CLOSE, kernel, new Point(-1, -1), CLOSE_ITERATIONS);

            int n = Imgproc.connectedComponentsWithStats(th, labels, stats, centroids, 8);
            int best = -1;
            double bestArea = 0;
            for (int i = 1; i < n; i++) {
                double area = stats.get(i, Imgproc.CC_STAT_AREA)[0];
                if (area > bestArea) {
                    bestArea = area;
                    best = i;
                }
            }
            if (best < 0) {
                throw new NoRoofDetectedException("No roof contour found");
            }
            Core.compare(labels, new Scalar(best), largest, Core.CMP_EQ);

            Imgproc.findContours(largest, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
            MatOfPoint outer = null;
            double outerArea = -1;
            for (MatOfPoint c : contours) {
                double a = Imgproc.contourArea(c);
                if (a > outerArea) {
                    outerArea = a;
                    outer = c;
                }
            }
            if (outer == null) {
                throw new NoRoofDetectedException("No roof contour found");
            }
            Imgproc.drawContours(filled, List.of(outer), -1, new Scalar(255), Imgproc.FILLED);
            Polygon contour = GeomUtils.fromContour(outer.toArray());
            if (contour == null) {
                throw new NoRoofDetectedException("Roof contour is degenerate");
            }
            BinaryMask mask = ImageOps.toMask(filled);
            log.debug("Otsu t={} | componentes={} | píxeles techo={} | vértices contorno={}",
                    t, n - 1, mask.count(), contour.getNumPoints());
            return new RoofExtraction(mask, contour);
        } finally {
            for (MatOfPoint c : contours) c.release();
            blur.release();
            th.release();
            kernel.release();
            labels.release();
            stats.release();
            centroids.release();
            largest.release();
            hierarchy.release();
            filled.release();
        }
    }
}
