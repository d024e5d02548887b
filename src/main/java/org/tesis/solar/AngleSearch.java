package org.tesis.solar;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Búsqueda del mejor ángulo de grilla. Cada ángulo candidato se evalúa de forma independiente
 * (rotar, erosionar, restar obstáculos, empaquetar en ambas orientaciones) y el mejor se elige
 * después con un pliegue en el orden de la lista de candidatos: menor |colocada - objetivo|,
 * el primero gana en empate. Si ningún ángulo coloca paneles se hace un único intento de rescate.
 */
public class AngleSearch {

    private static final Logger log = LoggerFactory.getLogger(AngleSearch.class);

    static final String WARN_FALLBACK = "Packing fallback: reduced spacing and boundary ring for a minimal fit.";
    static final String WARN_NO_FIT   = "No panel fits the roof even after the packing fallback.";

    // límites del intento de rescate
    static final double FALLBACK_MIN_RING_M    = 0.30;
    static final double FALLBACK_RING_FACTOR   = 0.8;
    static final double FALLBACK_MIN_SPACING_M = 0.02;
    static final double FALLBACK_SPACING_FACTOR = 0.75;

    private final Polygon      roof;          // marco de la imagen
    private final double       roofAxisDeg;
    private final double       cx, cy;        // centro de rotación (centro de la imagen)
    private final double       pxPerM;
    private final double       roofAreaPx;
    private final PanelSpec    panel;
    private final LayoutParams params;
    private final Geometry     obstacles;     // unión en el marco de la imagen, o null

    public AngleSearch(RoofGeometry roof, double cx, double cy, double pxPerM, double roofAreaPx,
                       PanelSpec panel, LayoutParams params, Geometry obstacles) {
        this.roof = roof.polygon;
        this.roofAxisDeg = roof.orientationDeg;
        this.cx = cx;
        this.cy = cy;
        this.pxPerM = pxPerM;
        this.roofAreaPx = roofAreaPx;
        this.panel = panel;
        this.params = params;
        this.obstacles = (obstacles == null || obstacles.isEmpty()) ? null : obstacles;
    }

    /** Resultado de la búsqueda completa. */
    public static final class Outcome {
        final AngleEvaluation best;
        final List<String>    warnings;
        final boolean         fallbackUsed;
        final int             anglesEvaluated;

        Outcome(AngleEvaluation best, List<String> warnings, boolean fallbackUsed, int anglesEvaluated) {
            this.best = best;
            this.warnings = Collections.unmodifiableList(warnings);
            this.fallbackUsed = fallbackUsed;
            this.anglesEvaluated = anglesEvaluated;
        }

        public AngleEvaluation best()   { return best; }
        public List<String> warnings()  { return warnings; }
        public boolean fallbackUsed()   { return fallbackUsed; }
        public int anglesEvaluated()    { return anglesEvaluated; }
    }

    /**
     * Ángulos a probar: el del usuario y sus variantes (+90, +5, -5) si lo hay, luego el eje del
     * techo y sus variantes; todo normalizado a [0, 180) y sin repetidos (se conserva el orden).
     */
    static List<Double> candidateAngles(Double userAngleDeg, double roofAxisDeg) {
        List<Double> raw = new ArrayList<>();
        if (userAngleDeg != null) {
            double a = userAngleDeg;
            raw.addAll(List.of(a, a + 90, a + 5, a - 5));
        }
        double r = roofAxisDeg;
        raw.addAll(List.of(r, r + 90, r + 5, r - 5));
        LinkedHashSet<Double> out = new LinkedHashSet<>();
        for (double d : raw) out.add(GeomUtils.normalizeAngle(d));
        return new ArrayList<>(out);
    }

    // búsqueda completa: mapa sobre ángulos, pliegue y rescate
    public Outcome search() {
        double ringM = params.effectiveBoundaryClearanceM();
        double spacingPx = params.spacingM * pxPerM;
        List<Double> angles = candidateAngles(params.angleDeg, roofAxisDeg);

        List<AngleEvaluation> evals = evaluateAll(angles, ringM, spacingPx);

        AngleEvaluation best = null;
        LinkedHashSet<String> warnings = new LinkedHashSet<>();
        for (AngleEvaluation e : evals) {
            log.debug("Ángulo {}° | paneles={} | colocada={} | objetivo={} | score={}",
                    fmt(e.angleDeg), e.panels.size(), fmt(e.placedAreaPx), fmt(e.targetAreaPx), fmt(e.score()));
            if (best == null || e.score() < best.score()) best = e;
            warnings.addAll(e.warnings);
        }

        boolean fallback = false;
        if (best == null || best.panels.isEmpty()) {
            fallback = true;
            warnings.add(WARN_FALLBACK);
            double ringFb = Math.max(FALLBACK_MIN_RING_M, ringM * FALLBACK_RING_FACTOR);
            double spacingFb = Math.max(FALLBACK_MIN_SPACING_M * pxPerM, spacingPx * FALLBACK_SPACING_FACTOR);
            log.warn("Ningún ángulo colocó paneles; rescate en eje {}° con anillo {} m y separación {} px",
                    fmt(roofAxisDeg), fmt(ringFb), fmt(spacingFb));
            best = evaluate(roofAxisDeg, ringFb, spacingFb, false);
            warnings.addAll(best.warnings);
            if (best.panels.isEmpty()) {
                warnings.add(WARN_NO_FIT);
                log.warn("El rescate tampoco colocó paneles");
            }
        }
        return new Outcome(best, new ArrayList<>(warnings), fallback, evals.size() + (fallback ? 1 : 0));
    }

    // evalúa todos los ángulos, en paralelo si params.parallelism > 1; el orden de salida es el de entrada
    List<AngleEvaluation> evaluateAll(List<Double> angles, double ringM, double spacingPx) {
        boolean useObstacles = obstacles != null;
        if (params.parallelism <= 1 || angles.size() <= 1) {
            List<AngleEvaluation> out = new ArrayList<>();
            for (double a : angles) out.add(evaluate(a, ringM, spacingPx, useObstacles));
            return out;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(params.parallelism, angles.size()));
        try {
            List<Future<AngleEvaluation>> futures = new ArrayList<>();
            for (double a : angles) {
                futures.add(pool.submit(() -> evaluate(a, ringM, spacingPx, useObstacles)));
            }
            List<AngleEvaluation> out = new ArrayList<>();
            for (Future<AngleEvaluation> f : futures) out.add(f.get());
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Evaluación de ángulos interrumpida", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Falló la evaluación de un ángulo", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Evalúa un ángulo: función pura de sus argumentos y del estado inmutable de la búsqueda.
     *
     * @param ringM        anillo perimetral en metros
     * @param spacingPx    separación entre paneles en píxeles
     * @param useObstacles false desactiva la resta de obstáculos (rescate)
     */
    AngleEvaluation evaluate(double angleDeg, double ringM, double spacingPx, boolean useObstacles) {
        List<String> warnings = new ArrayList<>();
        Geometry rotated = GeomUtils.rotate(roof, -angleDeg, cx, cy);
        Geometry eroded = GeomUtils.inset(rotated, ringM * pxPerM);
        if (eroded.isEmpty()) {
            return emptyEvaluation(angleDeg, ringM, warnings);
        }

        Geometry obsRot = (useObstacles && obstacles != null) ? GeomUtils.rotate(obstacles, -angleDeg, cx, cy) : null;
        ObstacleSubtractor.Outcome sub =
                ObstacleSubtractor.subtract(eroded, obsRot, params.obstacleClearanceM * pxPerM);
        if (sub.note.warning() != null) {
            warnings.add(sub.note.warning());
            log.debug("Ángulo {}°: {}", fmt(angleDeg), sub.note);
        }
        UsableRegion region = sub.region;
        if (region.isEmpty()) {
            return emptyEvaluation(angleDeg, ringM, warnings);
        }

        double usableAreaPx = region.area;
        double base = (params.fillRelativeTo == FillReference.ROOF && roofAreaPx > 0) ? roofAreaPx : usableAreaPx;
        double targetAreaPx = base * params.fillPct / 100.0;

        double lPx = panel.lengthM() * pxPerM;
        double wPx = panel.widthM() * pxPerM;
        double tol = params.overshootToleranceFrac;
        List<Polygon> portrait = GridPacker.packRegion(region, wPx, lPx, spacingPx, targetAreaPx, tol);
        List<Polygon> landscape = GridPacker.packRegion(region, lPx, wPx, spacingPx, targetAreaPx, tol);

        List<Polygon> placed;
        PanelOrientation orientation;
        double usedL, usedW;
        if (GridPacker.area(landscape) > GridPacker.area(portrait)) {
            placed = landscape;
            orientation = PanelOrientation.LANDSCAPE;
            usedL = panel.widthM();
            usedW = panel.lengthM();
        } else {
            placed = portrait;
            orientation = PanelOrientation.PORTRAIT;
            usedL = panel.lengthM();
            usedW = panel.widthM();
        }

        List<Polygon> back = new ArrayList<>(placed.size());
        for (Polygon p : placed) back.add((Polygon) GeomUtils.rotate(p, angleDeg, cx, cy));
        Geometry usableImage = GeomUtils.rotate(region.toGeometry(), angleDeg, cx, cy);

        return new AngleEvaluation(angleDeg, back, orientation, usedL, usedW,
                usableAreaPx, GridPacker.area(placed), targetAreaPx, ringM, usableImage, sub.note, warnings);
    }

    private AngleEvaluation emptyEvaluation(double angleDeg, double ringM, List<String> warnings) {
        return new AngleEvaluation(angleDeg, Collections.emptyList(), PanelOrientation.PORTRAIT,
                panel.lengthM(), panel.widthM(), 0.0, 0.0, 0.0, ringM,
                GeomUtils.GF.createPolygon(), ObstacleSubtractor.Note.NONE, warnings);
    }

    private static String fmt(double d) {
        return String.format(Locale.US, "%.2f", d);
    }
}
