package org.tesis.solar;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.*;

/**
 * Estadísticas del layout ganador. Áreas en m², distancias en m.
 */
public class LayoutStats {
    String       panelSize;
    double       panelLengthUsedM;
    double       panelWidthUsedM;
    int          wattsPerPanel;
    int          panelCount;
    double       panelAreaM2;           // total de paneles colocados
    double       roofAreaInputM2;
    double       roofAreaFromMaskM2;
    double       usableAreaM2;
    String       fillRelativeTo;
    double       fillTargetPct;
    double       targetAreaM2;
    double       achievedPctOfRoof;
    double       achievedPctOfUsable;
    double       capacityKWp;
    double       metersPerPixel;
    double       roofLengthM;
    double       roofWidthM;
    double       angleUsedDeg;
    double       spacingM;
    double       edgeClearanceM;
    double       minBoundaryClearanceM;
    double       effectiveBoundaryClearanceM;
    double       obstacleClearanceM;
    double       overshootToleranceFrac;
    int          obstacleCount;
    boolean      fallbackUsed;
    List<String> warnings = Collections.emptyList();

    public String panelSize()               { return panelSize; }
    public double panelLengthUsedM()        { return panelLengthUsedM; }
    public double panelWidthUsedM()         { return panelWidthUsedM; }
    public int wattsPerPanel()              { return wattsPerPanel; }
    public int panelCount()                 { return panelCount; }
    public double panelAreaM2()             { return panelAreaM2; }
    public double perPanelAreaM2()          { return panelLengthUsedM * panelWidthUsedM; }
    public double roofAreaInputM2()         { return roofAreaInputM2; }
    public double roofAreaFromMaskM2()      { return roofAreaFromMaskM2; }
    public double usableAreaM2()            { return usableAreaM2; }
    public String fillRelativeTo()          { return fillRelativeTo; }
    public double fillTargetPct()           { return fillTargetPct; }
    public double targetAreaM2()            { return targetAreaM2; }
    public double achievedPctOfRoof()       { return achievedPctOfRoof; }
    public double achievedPctOfUsable()     { return achievedPctOfUsable; }
    public double capacityKWp()             { return capacityKWp; }
    public double metersPerPixel()          { return metersPerPixel; }
    public double roofLengthM()             { return roofLengthM; }
    public double roofWidthM()              { return roofWidthM; }
    public double angleUsedDeg()            { return angleUsedDeg; }
    public double spacingM()                { return spacingM; }
    public double edgeClearanceM()          { return edgeClearanceM; }
    public double minBoundaryClearanceM()   { return minBoundaryClearanceM; }
    public double effectiveBoundaryClearanceM() { return effectiveBoundaryClearanceM; }
    public double obstacleClearanceM()      { return obstacleClearanceM; }
    public double overshootToleranceFrac()  { return overshootToleranceFrac; }
    public int obstacleCount()              { return obstacleCount; }
    public boolean fallbackUsed()           { return fallbackUsed; }
    public List<String> warnings()          { return warnings; }

    /**
     * Mapa de estadísticas con las claves snake_case del servicio, redondeado igual que éste.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("panel_size", panelSize);
        m.put("panel_dims_m", List.of(round(panelLengthUsedM, 3), round(panelWidthUsedM, 3)));
        m.put("watt_nom_per_panel", wattsPerPanel);
        m.put("panels_count", panelCount);
        m.put("panel_area_m2", round(panelAreaM2, 3));

        m.put("roof_area_m2_input", round(roofAreaInputM2, 3));
        m.put("roof_area_m2_from_mask", round(roofAreaFromMaskM2, 3));
        m.put("usable_area_m2", round(usableAreaM2, 3));

        m.put("fill_relative_to", fillRelativeTo);
        m.put("fill_target_pct", fillTargetPct);
        m.put("target_area_m2_effective", round(targetAreaM2, 3));

        m.put("fill_achieved_pct_of_roof", round(achievedPctOfRoof, 2));
        m.put("fill_achieved_pct_of_usable", round(achievedPctOfUsable, 2));

        m.put("capacity_estimated_kWp", round(capacityKWp, 3));
        m.put("m_per_px", metersPerPixel);
        m.put("estimated_roof_LW_m", List.of(round(roofLengthM, 3), round(roofWidthM, 3)));
        m.put("angle_used_deg", round(angleUsedDeg, 2));
        m.put("spacing_m", spacingM);
        m.put("edge_clearance_m", edgeClearanceM);
        m.put("min_boundary_clearance_m", minBoundaryClearanceM);
        m.put("effective_boundary_clearance_m", effectiveBoundaryClearanceM);
        m.put("obstacle_clearance_m", obstacleClearanceM);
        m.put("overshoot_tolerance_frac", overshootToleranceFrac);
        m.put("obstacle_count", obstacleCount);
        m.put("fallback_used", fallbackUsed);
        m.put("warnings", warnings);
        return m;
    }

    static double round(double v, int decimals) {
        double f = Math.pow(10, decimals);
        return Math.round(v * f) / f;
    }

    // resumen legible para el log
    String formatSummary() {
        DecimalFormatSymbols sym = new DecimalFormatSymbols(Locale.US);
        DecimalFormat f3 = new DecimalFormat("#,##0.000", sym);
        DecimalFormat f2 = new DecimalFormat("#,##0.00", sym);

        StringBuilder sb = new StringBuilder();
        sb.append("------------------------------\n");
        sb.append("RESUMEN LAYOUT SOLAR\n");
        sb.append("Panel               : ").append(panelSize).append(" (")
          .append(f3.format(panelLengthUsedM)).append(" x ").append(f3.format(panelWidthUsedM)).append(" m, ")
          .append(wattsPerPanel).append(" W)\n");
        sb.append("Paneles colocados   : ").append(panelCount).append("\n");
        sb.append("Área paneles        : ").append(f3.format(panelAreaM2)).append(" m2\n");
        sb.append("Área techo          : ").append(f3.format(roofAreaFromMaskM2)).append(" m2\n");
        sb.append("Área utilizable     : ").append(f3.format(usableAreaM2)).append(" m2\n");
        sb.append("Área objetivo       : ").append(f3.format(targetAreaM2)).append(" m2 (")
          .append(f2.format(fillTargetPct)).append("% de ").append(fillRelativeTo).append(")\n");
        sb.append("% del techo         : ").append(f2.format(achievedPctOfRoof)).append(" %\n");
        sb.append("% de lo utilizable  : ").append(f2.format(achievedPctOfUsable)).append(" %\n");
        sb.append("Capacidad estimada  : ").append(f3.format(capacityKWp)).append(" kWp\n");
        sb.append("Ángulo usado        : ").append(f2.format(angleUsedDeg)).append("°\n");
        sb.append("Escala              : ").append(f3.format(metersPerPixel * 100)).append(" cm/px\n");
        sb.append("Obstáculos          : ").append(obstacleCount).append("\n");
        sb.append("Avisos              : ").append(warnings.size()).append("\n");
        sb.append("------------------------------");
        return sb.toString();
    }
}
