package org.tesis.solar;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Arrays;

/**
 * Puente entre {@link BufferedImage} y las matrices de OpenCV, más los pocos pasos raster
 * compartidos por el pipeline (reducción, canales, valores bajo una máscara y cuantiles).
 * Las imágenes en color son BGR de 8 bits y las máscaras CV_8U con 0/255.
 */
final class ImageOps {

    private static final Logger log = LoggerFactory.getLogger(ImageOps.class);

    static {
        // nativos empaquetados en el jar de openpnp
        OpenCV.loadLocally();
        log.debug("OpenCV {} cargado", Core.VERSION);
    }

    private ImageOps() {
    }

    // copia la imagen a una matriz BGR de 8 bits (la transparencia se descarta)
    static Mat toBgr(BufferedImage img) {
        int w = img.getWidth(), h = img.getHeight();
        BufferedImage bgr = new BufferedImage(w, h, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g = bgr.createGraphics();
        try {
            g.drawImage(img, 0, 0, null);
        } finally {
            g.dispose();
        }
        byte[] data = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(h, w, CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    static BufferedImage toBufferedImage(Mat bgr) {
        BufferedImage out = new BufferedImage(bgr.cols(), bgr.rows(), BufferedImage.TYPE_3BYTE_BGR);
        byte[] data = ((DataBufferByte) out.getRaster().getDataBuffer()).getData();
        bgr.get(0, 0, data);
        return out;
    }

    // reduce la imagen para que el lado mayor no supere maxSide (INTER_AREA, mantiene proporción)
    static Mat resizeLongSide(Mat src, int maxSide) {
        int w = src.cols(), h = src.rows();
        if (Math.max(w, h) <= maxSide) return src.clone();
        double s = (double) maxSide / Math.max(w, h);
        // el lado mayor queda exactamente en maxSide
        int nw = w >= h ? maxSide : Math.max(1, (int) (w * s));
        int nh = h >= w ? maxSide : Math.max(1, (int) (h * s));
        Mat dst = new Mat();
        Imgproc.resize(src, dst, new Size(nw, nh), 0, 0, Imgproc.INTER_AREA);
        return dst;
    }

    // luminancia BT.601
    static Mat gray(Mat bgr) {
        Mat gray = new Mat();
        Imgproc.cvtColor(bgr, gray, Imgproc.COLOR_BGR2GRAY);
        return gray;
    }

    // canal V de HSV (máximo de B, G, R)
    static Mat value(Mat bgr) {
        Mat hsv = new Mat();
        Mat v = new Mat();
        try {
            Imgproc.cvtColor(bgr, hsv, Imgproc.COLOR_BGR2HSV);
            Core.extractChannel(hsv, v, 2);
        } finally {
            hsv.release();
        }
        return v;
    }

    // valores de un canal de un solo plano bajo la máscara, en orden de barrido
    static float[] valuesUnder(Mat channel, Mat mask) {
        Mat f = new Mat();
        try {
            channel.convertTo(f, CvType.CV_32F);
            float[] all = new float[(int) f.total()];
            f.get(0, 0, all);
            byte[] m = new byte[(int) mask.total()];
            mask.get(0, 0, m);

            float[] out = new float[Core.countNonZero(mask)];
            int k = 0;
            for (int i = 0; i < m.length; i++) {
                if (m[i] != 0) out[k++] = all[i];
            }
            return out;
        } finally {
            f.release();
        }
    }

    // cuantil con interpolación lineal entre órdenes (q en [0, 1])
    static double quantile(float[] values, double q) {
        if (values.length == 0) throw new IllegalArgumentException("Cuantil de un conjunto vacío");
        float[] s = values.clone();
        Arrays.sort(s);
        double pos = q * (s.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(s.length - 1, lo + 1);
        double frac = pos - lo;
        return s[lo] + (s[hi] - s[lo]) * frac;
    }

    static BinaryMask toMask(Mat mask) {
        byte[] raw = new byte[(int) mask.total()];
        mask.get(0, 0, raw);
        boolean[] data = new boolean[raw.length];
        for (int i = 0; i < raw.length; i++) data[i] = raw[i] != 0;
        return new BinaryMask(mask.cols(), mask.rows(), data);
    }

    static Mat toMat(BinaryMask mask) {
        byte[] raw = new byte[mask.data.length];
        for (int i = 0; i < raw.length; i++) raw[i] = mask.data[i] ? (byte) 255 : 0;
        Mat mat = new Mat(mask.height, mask.width, CvType.CV_8UC1);
        mat.put(0, 0, raw);
        return mat;
    }
}
