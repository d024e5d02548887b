package org.tesis.solar;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.*;

/**
 * Punto de entrada del motor: (imagen, área real del techo, parámetros) → {@link LayoutResult}.
 * Secuencia determinista y sin estado compartido entre invocaciones.
 */
public class SolarLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(SolarLayoutEngine.class);

    // lado mayor máximo de la imagen procesada
    static final int MAX_IMAGE_SIDE = 1024;

    private final MaskExtractor    maskExtractor;
    private final PolygonBuilder   polygonBuilder;
    private final ScaleCalibrator  scaleCalibrator;
    private final ObstacleDetector obstacleDetector;
    private final OverlayRenderer  renderer;

    public SolarLayoutEngine() {
        this(new MaskExtractor(), new PolygonBuilder(), new ScaleCalibrator(), new ObstacleDetector(),
                new OverlayRenderer());
    }

    SolarLayoutEngine(MaskExtractor maskExtractor, PolygonBuilder polygonBuilder, ScaleCalibrator scaleCalibrator,
                      ObstacleDetector obstacleDetector, OverlayRenderer renderer) {
        this.maskExtractor = maskExtractor;
        this.polygonBuilder = polygonBuilder;
        this.scaleCalibrator = scaleCalibrator;
        this.obstacleDetector = obstacleDetector;
        this.renderer = renderer;
    }

    /**
     * Calcula el layout de paneles.
     *
     * @param image       foto del techo (cualquier resolución)
     * @param roofAreaM2  área real del techo en m² (estimador externo)
     * @param roofLengthM largo real del techo, o null para estimarlo
     * @param roofWidthM  ancho real del techo, o null para estimarlo
     * @throws InvalidFillPercentageException si fillPct está fuera de [30, 90], antes de tocar la imagen
     * @throws UnknownPanelSizeException si el panel no está en el catálogo, antes de tocar la imagen
     * @throws InvalidRoofAreaException si el área no es positiva y finita
     * @throws NoRoofDetectedException si no se encuentra contorno de techo
     * @throws ZeroAreaMaskException si la máscara del techo queda vacía
     */
    public LayoutResult layout(BufferedImage image, double roofAreaM2, Double roofLengthM, Double roofWidthM,
                               LayoutParams params) {
        Objects.requireNonNull(image, "image no puede ser null");
        Objects.requireNonNull(params, "params no puede ser null");
        PanelSpec panel = params.validate();
        if (!(roofAreaM2 > 0) || Double.isInfinite(roofAreaM2)) {
            throw new InvalidRoofAreaException(roofAreaM2);
        }
        long t0 = System.currentTimeMillis();
        log.info("==== Layout solar | START | {}x{} px | área={} m2 ====", image.getWidth(), image.getHeight(), roofAreaM2);
        log.debug("CFG | {}", params);

        // 0) imagen reducida
        Mat src = ImageOps.toBgr(image);
        Mat bgr = ImageOps.resizeLongSide(src, MAX_IMAGE_SIDE);
        src.release();
        Mat gray = ImageOps.gray(bgr);
        try {
            int w = bgr.cols(), h = bgr.rows();

            // 1) máscara y polígono del techo
            RoofExtraction ext = maskExtractor.extract(gray);
            RoofGeometry roof = polygonBuilder.build(ext.contour);

            // 2) largo/ancho si faltan
            double[] lw = roof.estimateLengthWidth(roofAreaM2);
            double lengthM = roofLengthM != null ? roofLengthM : lw[0];
            double widthM = roofWidthM != null ? roofWidthM : lw[1];

            // 3) escala
            long roofPx = ext.mask.count();
            double mPerPx = scaleCalibrator.metersPerPixel(roofAreaM2, roofPx);
            double pxPerM = 1.0 / mPerPx;
            log.debug("Techo: {} px | eje={}° | escala={} m/px | vértices={}",
                    roofPx, roof.orientationDeg, mPerPx, roof.polygon.getNumPoints());

            // 4) obstáculos, una sola vez en el marco de la imagen
            List<Polygon> obstacles = obstacleDetector.detect(bgr, ext.mask, pxPerM,
                    params.obstacleClearanceM, params.obstacleMode);
            Geometry obstacleUnion = obstacles.isEmpty() ? null : GeomUtils.union(obstacles);

            // 5) búsqueda de ángulo + empaquetado
            AngleSearch search = new AngleSearch(roof, w / 2.0, h / 2.0, pxPerM, roofPx, panel, params, obstacleUnion);
            AngleSearch.Outcome outcome = search.search();
            AngleEvaluation best = outcome.best;
            for (String warning : outcome.warnings) log.warn("Aviso: {}", warning);

            List<PlacedPanel> panels = new ArrayList<>(best.panels.size());
            for (Polygon p : best.panels) panels.add(new PlacedPanel(p, best.orientation, best.angleDeg));

            // 6) render + estadísticas
            BufferedImage overlay = renderer.render(ImageOps.toBufferedImage(bgr), panels);
            LayoutStats stats = buildStats(panel, params, best, outcome, roofAreaM2, roofPx, mPerPx,
                    lengthM, widthM, obstacles.size());

            log.info("Layout listo en {} ms ({} ángulos evaluados)\n{}",
                    System.currentTimeMillis() - t0, outcome.anglesEvaluated, stats.formatSummary());
            return new LayoutResult(panels, overlay, ext.mask, roof.polygon, best.usableRegion, obstacles, stats);
        } finally {
            bgr.release();
            gray.release();
        }
    }

    static LayoutStats buildStats(PanelSpec panel, LayoutParams params, AngleEvaluation best,
                                  AngleSearch.Outcome outcome, double roofAreaM2, long roofPx, double mPerPx,
                                  double lengthM, double widthM, int obstacleCount) {
        double m2PerPx = mPerPx * mPerPx;
        int n = best.panels.size();

        LayoutStats s = new LayoutStats();
        s.panelSize = panel.key();
        s.panelLengthUsedM = best.usedLengthM;
        s.panelWidthUsedM = best.usedWidthM;
        s.wattsPerPanel = panel.ratedWatts();
        s.panelCount = n;
        s.panelAreaM2 = best.usedLengthM * best.usedWidthM * n;
        s.roofAreaInputM2 = roofAreaM2;
        s.roofAreaFromMaskM2 = roofPx * m2PerPx;
        s.usableAreaM2 = best.usableAreaPx * m2PerPx;
        s.fillRelativeTo = params.fillRelativeTo.key();
        s.fillTargetPct = params.fillPct;
        s.targetAreaM2 = best.targetAreaPx * m2PerPx;
        s.achievedPctOfRoof = 100.0 * s.panelAreaM2 / Math.max(1e-9, s.roofAreaFromMaskM2);
        s.achievedPctOfUsable = 100.0 * s.panelAreaM2 / Math.max(1e-9, s.usableAreaM2);
        s.capacityKWp = panel.ratedWatts() * n / 1000.0;
        s.metersPerPixel = mPerPx;
        s.roofLengthM = lengthM;
        s.roofWidthM = widthM;
        s.angleUsedDeg = best.angleDeg;
        s.spacingM = params.spacingM;
        s.edgeClearanceM = params.edgeClearanceM;
        s.minBoundaryClearanceM = params.minBoundaryClearanceM;
        s.effectiveBoundaryClearanceM = best.boundaryClearanceM;
        s.obstacleClearanceM = params.obstacleClearanceM;
        s.overshootToleranceFrac = params.overshootToleranceFrac;
        s.obstacleCount = obstacleCount;
        s.fallbackUsed = outcome.fallbackUsed;
        s.warnings = outcome.warnings;
        return s;
    }

    /**
     * Envoltorio de conveniencia con los parámetros sueltos. Devuelve un mapa con
     * {@code image_with_panels}, {@code roof_mask}, {@code panels_xy} (esquinas enteras) y {@code stats}.
     */
    public Map<String, Object> solarLayout(BufferedImage image, double areaM2, Double lengthM, Double widthM,
                                           String sizeLabel, double fillPct, double spacingM,
                                           double edgeClearanceM, double minBoundaryClearanceM,
                                           double obstacleClearanceM, String obstacleMode, Double angleDeg) {
        LayoutParams params = new LayoutParams()
                .panelSize(sizeLabel)
                .fillPct(fillPct)
                .spacingM(spacingM)
                .edgeClearanceM(edgeClearanceM)
                .minBoundaryClearanceM(minBoundaryClearanceM)
                .obstacleClearanceM(obstacleClearanceM)
                .obstacleMode(ObstacleMode.fromKey(obstacleMode))
                .angleDeg(angleDeg);
        LayoutResult result = layout(image, areaM2, lengthM, widthM, params);

        List<int[][]> panelsXy = new ArrayList<>();
        for (PlacedPanel p : result.panels) panelsXy.add(p.cornersPx());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("image_with_panels", result.overlay);
        out.put("roof_mask", result.roofMask);
        out.put("panels_xy", panelsXy);
        out.put("stats", result.stats.toMap());
        return out;
    }
}
