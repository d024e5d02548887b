package org.tesis.solar;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;

/**
 * Resta los obstáculos al polígono erosionado de un ángulo. Si lo que queda es vacío o menor
 * al 12% del área previa, recorre una escalera fija de relajación que encoge la holgura de
 * los obstáculos; si ni la relajación total alcanza, los obstáculos se desactivan para ese ángulo.
 * Sin estado: cada llamada devuelve la región y la nota correspondiente.
 */
public final class ObstacleSubtractor {

    static final double   MIN_USABLE_FRAC = 0.12;
    // fracción de la holgura que se conserva en cada escalón
    static final double[] RELAX_LADDER    = {0.75, 0.5, 0.25, 0.0};

    public enum Note {
        NONE(null),
        RELAXED("Obstacle mask relaxed to retain sufficient usable area."),
        DISABLED("Obstacle mask disabled after full relaxation (obstacles covered nearly whole roof).");

        private final String warning;

        Note(String warning) {
            this.warning = warning;
        }

        public String warning() {
            return warning;
        }
    }

    // región resultante y la nota que la acompaña
    public static final class Outcome {
        final UsableRegion region;
        final Note note;
        final double bufferFraction;   // fracción de holgura en vigor (1 = sin relajar)

        Outcome(UsableRegion region, Note note, double bufferFraction) {
            this.region = region;
            this.note = note;
            this.bufferFraction = bufferFraction;
        }

        public UsableRegion region()   { return region; }
        public Note note()             { return note; }
        public double bufferFraction() { return bufferFraction; }
    }

    private ObstacleSubtractor() {
    }

    /**
     * @param eroded      polígono del techo ya rotado y erosionado por el anillo perimetral
     * @param obstacles   unión de obstáculos en el mismo marco (null o vacía = sin obstáculos)
     * @param clearancePx holgura de obstáculo en píxeles con la que se dilataron
     */
    public static Outcome subtract(Geometry eroded, Geometry obstacles, double clearancePx) {
        if (obstacles == null || obstacles.isEmpty()) {
            return new Outcome(UsableRegion.of(eroded), Note.NONE, 1.0);
        }
        double minArea = MIN_USABLE_FRAC * eroded.getArea();

        Geometry usable = attempt(eroded, obstacles, clearancePx, 1.0);
        if (sufficient(usable, minArea)) {
            return new Outcome(UsableRegion.of(usable), Note.NONE, 1.0);
        }
        for (double frac : RELAX_LADDER) {
            Geometry relaxed = attempt(eroded, obstacles, clearancePx, frac);
            if (sufficient(relaxed, minArea)) {
                return new Outcome(UsableRegion.of(relaxed), Note.RELAXED, frac);
            }
        }
        return new Outcome(UsableRegion.of(eroded), Note.DISABLED, 0.0);
    }

    /**
     * Un escalón: resta los obstáculos encogidos hacia adentro en (1 - bufferFraction) * clearancePx.
     */
    static Geometry attempt(Geometry eroded, Geometry obstacles, double clearancePx, double bufferFraction) {
        double shrink = clearancePx * (1.0 - bufferFraction);
        Geometry obs = shrink > 0 ? obstacles.buffer(-shrink, GeomUtils.BUFFER_SEGMENTS) : obstacles;
        if (obs.isEmpty()) return eroded;
        return OverlayNGRobust.overlay(eroded, obs, OverlayNG.DIFFERENCE);
    }

    private static boolean sufficient(Geometry g, double minArea) {
        return !g.isEmpty() && g.getArea() >= minArea;
    }
}
