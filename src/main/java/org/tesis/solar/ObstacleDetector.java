package org.tesis.solar;

import org.locationtech.jts.geom.Polygon;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Obstáculos dentro del techo a partir de tres señales independientes:
 * <ul>
 *   <li>zonas oscuras / sombras (cuantil bajo del canal V),</li>
 *   <li>densidad de bordes (Canny + media de caja),</li>
 *   <li>magnitud de gradiente (Sobel), que capta cambios de nivel o de material.</li>
 * </ul>
 * Las regiones sobrevivientes se dilatan por la holgura de obstáculo y se vectorizan.
 */
public class ObstacleDetector {

    private static final Logger log = LoggerFactory.getLogger(ObstacleDetector.class);

    static final double CANNY_LOW         = 80.0;
    static final double CANNY_HIGH        = 160.0;
    static final double MIN_OBSTACLE_SIDE_M = 0.25;  // se descartan manchas menores a 25 x 25 cm
    static final double SIMPLIFY_PERIMETER_FRAC = 0.01;
    static final double MIN_GRADIENT      = 1e-3;

    /**
     * Detecta obstáculos probando las variantes del modo en orden (AUTO cae a LIGHT).
     *
     * @param bgr imagen procesada, BGR de 8 bits
     * @return polígonos en el marco de la imagen, ya expandidos por la holgura; vacío si el modo es OFF
     */
    public List<Polygon> detect(Mat bgr, BinaryMask roofMask, double pxPerM,
                                double obstacleClearanceM, ObstacleMode mode) {
        for (ObstacleMode attempt : mode.attempts()) {
            List<Polygon> polys = detectWith(bgr, roofMask, pxPerM, obstacleClearanceM, attempt);
            log.debug("Obstáculos modo {}: {}", attempt, polys.size());
            if (!polys.isEmpty()) return polys;
        }
        return Collections.emptyList();
    }

    // una pasada con los umbrales de una variante concreta
    List<Polygon> detectWith(Mat bgr, BinaryMask roofMask, double pxPerM,
                             double obstacleClearanceM, ObstacleMode mode) {
        if (!mode.detects()) return Collections.emptyList();

        Mat roof = ImageOps.toMat(roofMask);
        Mat obst = null;
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        Mat keep = new Mat();
        Mat kernel = null;
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            if (Core.countNonZero(roof) == 0) return Collections.emptyList();
            obst = flag(bgr, roof, mode);

            // descartar manchas pequeñas
            int minAreaPx = (int) Math.pow(MIN_OBSTACLE_SIDE_M * pxPerM, 2);
            int n = Imgproc.connectedComponentsWithStats(obst, labels, stats, centroids, 8);
            boolean[] kept = new boolean[n];
            int keptCount = 0;
            for (int i = 1; i < n; i++) {
                if (stats.get(i, Imgproc.CC_STAT_AREA)[0] >= minAreaPx) {
                    kept[i] = true;
                    keptCount++;
                }
            }
            if (keptCount == 0) return Collections.emptyList();

            int[] lab = new int[(int) labels.total()];
            labels.get(0, 0, lab);
            byte[] raw = new byte[lab.length];
            for (int i = 0; i < lab.length; i++) raw[i] = kept[lab[i]] ? (byte) 255 : 0;
            keep.create(obst.size(), CvType.CV_8U);
            keep.put(0, 0, raw);

            // dilatar por la holgura (al menos 1 px)
            int clearPx = Math.max(1, (int) Math.round(obstacleClearanceM * pxPerM));
            kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(2 * clearPx + 1, 2 * clearPx + 1));
            Imgproc.dilate(keep, keep, kernel);

            Imgproc.findContours(keep, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
            List<Polygon> out = new ArrayList<>();
            for (MatOfPoint c : contours) {
                if (Imgproc.contourArea(c) < minAreaPx) continue;
                Polygon p = GeomUtils.fromContour(approximate(c));
                if (p != null) out.add(p);
            }
            log.debug("Modo {}: componentes={} conservadas={} | regiones={} | clearPx={}",
                    mode, n - 1, keptCount, out.size(), clearPx);
            return out;
        } finally {
            for (MatOfPoint c : contours) c.release();
            roof.release();
            if (obst != null) obst.release();
            labels.release();
            stats.release();
            centroids.release();
            keep.release();
            if (kernel != null) kernel.release();
            hierarchy.release();
        }
    }

    /**
     * Unión de las tres señales recortada al techo (CV_8U, 0/255), antes de filtrar manchas y dilatar.
     */
    Mat flag(Mat bgr, Mat roof, ObstacleMode mode) {
        Mat v = ImageOps.value(bgr);
        Mat gray = ImageOps.gray(bgr);
        Mat dark = new Mat();
        Mat edges = new Mat();
        Mat edgeFrac = new Mat();
        Mat edgeDense = new Mat();
        Mat gx = new Mat();
        Mat gy = new Mat();
        Mat mag = new Mat();
        Mat steep = new Mat();
        Mat obst = new Mat();
        try {
            Imgproc.GaussianBlur(v, v, new Size(5, 5), 0);
            Imgproc.GaussianBlur(gray, gray, new Size(3, 3), 0);

            // 1) sombras
            double darkThr = ImageOps.quantile(ImageOps.valuesUnder(v, roof), mode.darkQuantile());
            Core.compare(v, new Scalar(darkThr), dark, Core.CMP_LT);

            // 2) densidad de bordes
            Imgproc.Canny(v, edges, CANNY_LOW, CANNY_HIGH);
            Core.bitwise_and(edges, roof, edges);
            edges.convertTo(edgeFrac, CvType.CV_32F, 1.0 / 255.0);
            Imgproc.boxFilter(edgeFrac, edgeFrac, -1, new Size(mode.edgeBox(), mode.edgeBox()));
            Core.compare(edgeFrac, new Scalar(mode.edgeCutoff()), edgeDense, Core.CMP_GT);

            // 3) gradiente fuerte (bordes de elevación interiores)
            Imgproc.Sobel(gray, gx, CvType.CV_32F, 1, 0, 3);
            Imgproc.Sobel(gray, gy, CvType.CV_32F, 0, 1, 3);
            Core.magnitude(gx, gy, mag);
            double gradThr = ImageOps.quantile(ImageOps.valuesUnder(mag, roof), mode.gradientQuantile());
            // en un techo plano el cuantil puede ser 0: gradiente nulo nunca es obstáculo
            Core.compare(mag, new Scalar(Math.max(gradThr, MIN_GRADIENT)), steep, Core.CMP_GE);

            Core.bitwise_or(dark, edgeDense, obst);
            Core.bitwise_or(obst, steep, obst);
            Core.bitwise_and(obst, roof, obst);
            log.debug("Modo {}: oscuro<{} gradiente>={}", mode, fmt(darkThr), fmt(gradThr));
            return obst;
        } finally {
            v.release();
            gray.release();
            dark.release();
            edges.release();
            edgeFrac.release();
            edgeDense.release();
            gx.release();
            gy.release();
            mag.release();
            steep.release();
        }
    }

    // Douglas-Peucker al 1% del perímetro del contorno
    private static Point[] approximate(MatOfPoint contour) {
        MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
        MatOfPoint2f approx = new MatOfPoint2f();
        try {
            double eps = SIMPLIFY_PERIMETER_FRAC * Imgproc.arcLength(curve, true);
            Imgproc.approxPolyDP(curve, approx, eps, true);
            return approx.total() >= 3 ? approx.toArray() : contour.toArray();
        } finally {
            curve.release();
            approx.release();
        }
    }

    private static String fmt(double d) {
        return String.format(Locale.US, "%.1f", d);
    }
}
