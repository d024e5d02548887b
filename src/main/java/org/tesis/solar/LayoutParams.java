package org.tesis.solar;

import java.util.Locale;
import java.util.Properties;

/**
 * Configuración de una corrida de layout. Los valores por defecto son los de producción;
 * {@link #validate()} se llama antes de cualquier trabajo sobre la imagen.
 */
public class LayoutParams {

    public static final double MIN_FILL_PCT = 30.0;
    public static final double MAX_FILL_PCT = 90.0;

    String        panelSize              = PanelSpec.MEDIUM.key();
    double        fillPct                = 50.0;
    double        spacingM               = 0.12;
    double        edgeClearanceM         = 0.25;
    double        minBoundaryClearanceM  = 0.50;  // anillo de pretil / retiro perimetral
    double        obstacleClearanceM     = 0.25;
    ObstacleMode  obstacleMode           = ObstacleMode.AUTO;
    Double        angleDeg               = null;  // null = sólo el eje del techo
    FillReference fillRelativeTo         = FillReference.USABLE;
    double        overshootToleranceFrac = 0.20;  // fracción del área de UN panel
    int           parallelism            = 1;     // hilos para evaluar ángulos

    public LayoutParams() {
    }

    // ---------- setters encadenables ----------

    public LayoutParams panelSize(String v)              { this.panelSize = v; return this; }
    public LayoutParams fillPct(double v)                { this.fillPct = v; return this; }
    public LayoutParams spacingM(double v)               { this.spacingM = v; return this; }
    public LayoutParams edgeClearanceM(double v)         { this.edgeClearanceM = v; return this; }
    public LayoutParams minBoundaryClearanceM(double v)  { this.minBoundaryClearanceM = v; return this; }
    public LayoutParams obstacleClearanceM(double v)     { this.obstacleClearanceM = v; return this; }
    public LayoutParams obstacleMode(ObstacleMode v)     { this.obstacleMode = v; return this; }
    public LayoutParams angleDeg(Double v)               { this.angleDeg = v; return this; }
    public LayoutParams fillRelativeTo(FillReference v)  { this.fillRelativeTo = v; return this; }
    public LayoutParams overshootToleranceFrac(double v) { this.overshootToleranceFrac = v; return this; }
    public LayoutParams parallelism(int v)               { this.parallelism = v; return this; }

    // ---------- getters ----------

    public String        getPanelSize()              { return panelSize; }
    public double        getFillPct()                { return fillPct; }
    public double        getSpacingM()               { return spacingM; }
    public double        getEdgeClearanceM()         { return edgeClearanceM; }
    public double        getMinBoundaryClearanceM()  { return minBoundaryClearanceM; }
    public double        getObstacleClearanceM()     { return obstacleClearanceM; }
    public ObstacleMode  getObstacleMode()           { return obstacleMode; }
    public Double        getAngleDeg()               { return angleDeg; }
    public FillReference getFillRelativeTo()         { return fillRelativeTo; }
    public double        getOvershootToleranceFrac() { return overshootToleranceFrac; }
    public int           getParallelism()            { return parallelism; }

    // anillo perimetral efectivo: el mayor entre el borde y el retiro mínimo
    public double effectiveBoundaryClearanceM() {
        return Math.max(edgeClearanceM, minBoundaryClearanceM);
    }

    /**
     * Valida la configuración y devuelve el panel del catálogo.
     *
     * @throws InvalidFillPercentageException si fillPct está fuera de [30, 90]
     * @throws UnknownPanelSizeException si panelSize no es una clave del catálogo
     */
    public PanelSpec validate() {
        if (Double.isNaN(fillPct) || fillPct < MIN_FILL_PCT || fillPct > MAX_FILL_PCT) {
            throw new InvalidFillPercentageException(fillPct);
        }
        PanelSpec spec = PanelSpec.fromKey(panelSize);
        requireNonNegative("spacingM", spacingM);
        requireNonNegative("edgeClearanceM", edgeClearanceM);
        requireNonNegative("minBoundaryClearanceM", minBoundaryClearanceM);
        requireNonNegative("obstacleClearanceM", obstacleClearanceM);
        requireNonNegative("overshootToleranceFrac", overshootToleranceFrac);
        if (obstacleMode == null) throw new InvalidLayoutParamsException("obstacleMode is required");
        if (fillRelativeTo == null) throw new InvalidLayoutParamsException("fillRelativeTo is required");
        if (angleDeg != null && !Double.isFinite(angleDeg)) {
            throw new InvalidLayoutParamsException("angleDeg must be finite, got " + angleDeg);
        }
        if (parallelism < 1) throw new InvalidLayoutParamsException("parallelism must be >= 1, got " + parallelism);
        return spec;
    }

    private static void requireNonNegative(String name, double v) {
        if (!(v >= 0) || Double.isInfinite(v)) {
            throw new InvalidLayoutParamsException(name + " must be a finite value >= 0, got " + v);
        }
    }

    /**
     * Construye parámetros a partir de propiedades (claves iguales a los nombres de campo).
     * Las claves ausentes conservan el valor por defecto.
     */
    public static LayoutParams fromProperties(Properties props) {
        LayoutParams p = new LayoutParams();
        String v;
        if ((v = prop(props, "panelSize")) != null)              p.panelSize = v;
        if ((v = prop(props, "fillPct")) != null)                p.fillPct = parseDouble("fillPct", v);
        if ((v = prop(props, "spacingM")) != null)               p.spacingM = parseDouble("spacingM", v);
        if ((v = prop(props, "edgeClearanceM")) != null)         p.edgeClearanceM = parseDouble("edgeClearanceM", v);
        if ((v = prop(props, "minBoundaryClearanceM")) != null)  p.minBoundaryClearanceM = parseDouble("minBoundaryClearanceM", v);
        if ((v = prop(props, "obstacleClearanceM")) != null)     p.obstacleClearanceM = parseDouble("obstacleClearanceM", v);
        if ((v = prop(props, "obstacleMode")) != null)           p.obstacleMode = ObstacleMode.fromKey(v);
        if ((v = prop(props, "angleDeg")) != null)               p.angleDeg = parseDouble("angleDeg", v);
        if ((v = prop(props, "fillRelativeTo")) != null)         p.fillRelativeTo = FillReference.fromKey(v);
        if ((v = prop(props, "overshootToleranceFrac")) != null) p.overshootToleranceFrac = parseDouble("overshootToleranceFrac", v);
        if ((v = prop(props, "parallelism")) != null)            p.parallelism = parseInt("parallelism", v);
        return p;
    }

    private static String prop(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static double parseDouble(String key, String v) {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new InvalidLayoutParamsException(key + " is not a number: '" + v + "'");
        }
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new InvalidLayoutParamsException(key + " is not an integer: '" + v + "'");
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.US,
                "panelSize=%s fillPct=%.1f spacingM=%.3f edgeClearanceM=%.3f minBoundaryClearanceM=%.3f "
                        + "obstacleClearanceM=%.3f obstacleMode=%s angleDeg=%s fillRelativeTo=%s "
                        + "overshootToleranceFrac=%.3f parallelism=%d",
                panelSize, fillPct, spacingM, edgeClearanceM, minBoundaryClearanceM, obstacleClearanceM,
                obstacleMode, angleDeg, fillRelativeTo == null ? null : fillRelativeTo.key(),
                overshootToleranceFrac, parallelism);
    }
}
