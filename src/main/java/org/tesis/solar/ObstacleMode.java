package org.tesis.solar;

import java.util.List;
import java.util.Locale;

/**
 * Estrategia de detección de obstáculos. AUTO y LIGHT traen sus propios umbrales (LIGHT es más
 * conservador y marca menos píxeles); OFF no detecta nada y no tiene umbrales.
 */
public enum ObstacleMode {
    AUTO(new Thresholds(0.35, 7, 0.12, 0.82)),
    LIGHT(new Thresholds(0.30, 5, 0.18, 0.88)),
    OFF(null);

    // umbrales de una pasada del detector
    static final class Thresholds {
        final double darkQuantile;
        final int    edgeBox;
        final double edgeCutoff;
        final double gradientQuantile;

        Thresholds(double darkQuantile, int edgeBox, double edgeCutoff, double gradientQuantile) {
            this.darkQuantile = darkQuantile;
            this.edgeBox = edgeBox;
            this.edgeCutoff = edgeCutoff;
            this.gradientQuantile = gradientQuantile;
        }
    }

    private final Thresholds thresholds;

    ObstacleMode(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public boolean detects() {
        return thresholds != null;
    }

    public double darkQuantile()     { return thresholds().darkQuantile; }
    public int    edgeBox()          { return thresholds().edgeBox; }
    public double edgeCutoff()       { return thresholds().edgeCutoff; }
    public double gradientQuantile() { return thresholds().gradientQuantile; }

    private Thresholds thresholds() {
        if (thresholds == null) {
            throw new IllegalStateException("Obstacle mode " + this + " has no detection thresholds");
        }
        return thresholds;
    }

    // orden de intentos: AUTO cae a LIGHT si no encontró nada
    public List<ObstacleMode> attempts() {
        switch (this) {
            case AUTO:  return List.of(AUTO, LIGHT);
            case LIGHT: return List.of(LIGHT);
            default:    return List.of();
        }
    }

    public static ObstacleMode fromKey(String key) {
        if (key != null) {
            String k = key.trim().toUpperCase(Locale.ROOT);
            for (ObstacleMode m : values()) {
                if (m.name().equals(k)) return m;
            }
        }
        throw new InvalidLayoutParamsException("obstacleMode must be one of auto, light, off, got '" + key + "'");
    }
}
