package org.tesis.solar;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.Collections;
import java.util.List;

/**
 * Resultado de evaluar un ángulo candidato. Inmutable; el mejor se elige después comparando
 * {@link #score()} (menor es mejor).
 */
public class AngleEvaluation {
    final double           angleDeg;
    final List<Polygon>    panels;          // ya devueltos al marco de la imagen
    final PanelOrientation orientation;
    final double           usedLengthM;
    final double           usedWidthM;
    final double           usableAreaPx;
    final double           placedAreaPx;
    final double           targetAreaPx;
    final double           boundaryClearanceM;
    final Geometry         usableRegion;    // marco de la imagen; vacío si el anillo se comió el techo
    final ObstacleSubtractor.Note obstacleNote;
    final List<String>     warnings;

    AngleEvaluation(double angleDeg, List<Polygon> panels, PanelOrientation orientation,
                    double usedLengthM, double usedWidthM,
                    double usableAreaPx, double placedAreaPx, double targetAreaPx,
                    double boundaryClearanceM, Geometry usableRegion, ObstacleSubtractor.Note obstacleNote,
                    List<String> warnings) {
        this.angleDeg = angleDeg;
        this.panels = Collections.unmodifiableList(panels);
        this.orientation = orientation;
        this.usedLengthM = usedLengthM;
        this.usedWidthM = usedWidthM;
        this.usableAreaPx = usableAreaPx;
        this.placedAreaPx = placedAreaPx;
        this.targetAreaPx = targetAreaPx;
        this.boundaryClearanceM = boundaryClearanceM;
        this.usableRegion = usableRegion;
        this.obstacleNote = obstacleNote;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    // distancia absoluta entre área colocada y objetivo
    public double score() {
        return Math.abs(placedAreaPx - targetAreaPx);
    }

    public double angleDeg()          { return angleDeg; }
    public List<Polygon> panels()     { return panels; }
    public PanelOrientation orientation() { return orientation; }
    public double usedLengthM()       { return usedLengthM; }
    public double usedWidthM()        { return usedWidthM; }
    public double usableAreaPx()      { return usableAreaPx; }
    public double placedAreaPx()      { return placedAreaPx; }
    public double targetAreaPx()      { return targetAreaPx; }
    public double boundaryClearanceM() { return boundaryClearanceM; }
    public Geometry usableRegion()    { return usableRegion; }
    public ObstacleSubtractor.Note obstacleNote() { return obstacleNote; }
    public List<String> warnings()    { return warnings; }
}
