package org.tesis.solar;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AngleSearchTest {

    // techo de 10 x 12 m a 20 px/m
    private static final Polygon ROOF = GeomUtils.rectangle(0, 0, 200, 240);

    private static AngleSearch search(Polygon roof, double axis, double pxPerM, LayoutParams params, Geometry obstacles) {
        Envelope env = roof.getEnvelopeInternal();
        RoofGeometry rg = new RoofGeometry(roof, axis, Math.max(env.getWidth(), env.getHeight()),
                Math.min(env.getWidth(), env.getHeight()));
        return new AngleSearch(rg, env.centre().x, env.centre().y, pxPerM, roof.getArea(),
                params.validate(), params, obstacles);
    }

    @Test
    void candidateAngles_roofAxisOnly() {
        assertEquals(List.of(90.0, 0.0, 95.0, 85.0), AngleSearch.candidateAngles(null, 90.0));
    }

    @Test
    void candidateAngles_userAngleFirstAndDeduplicated() {
        assertEquals(List.of(0.0, 90.0, 5.0, 175.0, 95.0, 85.0), AngleSearch.candidateAngles(0.0, 90.0));
        assertEquals(List.of(30.0, 120.0, 35.0, 25.0), AngleSearch.candidateAngles(30.0, 30.0));
        assertEquals(List.of(10.0, 100.0, 15.0, 5.0), AngleSearch.candidateAngles(190.0, 10.0));
    }

    @Test
    void search_placesPanelsInsideTheRoof() {
        LayoutParams params = new LayoutParams().angleDeg(0.0).obstacleMode(ObstacleMode.OFF);
        AngleSearch.Outcome out = search(ROOF, 90.0, 20.0, params, null).search();

        assertFalse(out.fallbackUsed());
        assertTrue(out.warnings().isEmpty());
        assertEquals(6, out.anglesEvaluated());
        AngleEvaluation best = out.best();
        assertFalse(best.panels().isEmpty());
        assertEquals(0.5, best.boundaryClearanceM());
        Geometry inner = ROOF.buffer(-10 + 1e-6);
        for (Polygon p : best.panels()) {
            assertTrue(inner.covers(p), "panel dentro del anillo perimetral");
        }
        assertTrue(best.placedAreaPx() <= best.targetAreaPx() + 0.2 * 2.278 * 1.134 * 400 + 1e-6);
    }

    @Test
    void search_isTheSameWithParallelEvaluation() {
        LayoutParams seq = new LayoutParams().angleDeg(0.0).obstacleMode(ObstacleMode.OFF);
        LayoutParams par = new LayoutParams().angleDeg(0.0).obstacleMode(ObstacleMode.OFF).parallelism(4);

        AngleEvaluation a = search(ROOF, 90.0, 20.0, seq, null).search().best();
        AngleEvaluation b = search(ROOF, 90.0, 20.0, par, null).search().best();

        assertEquals(a.angleDeg(), b.angleDeg());
        assertEquals(a.orientation(), b.orientation());
        assertEquals(a.panels().size(), b.panels().size());
        for (int i = 0; i < a.panels().size(); i++) {
            assertTrue(a.panels().get(i).equalsExact(b.panels().get(i)));
        }
    }

    @Test
    void roofReference_targetsTheRoofArea() {
        LayoutParams params = new LayoutParams().angleDeg(0.0).obstacleMode(ObstacleMode.OFF)
                .fillRelativeTo(FillReference.ROOF).fillPct(40);
        AngleEvaluation best = search(ROOF, 90.0, 20.0, params, null).search().best();
        assertEquals(0.40 * 200 * 240, best.targetAreaPx(), 1e-6);
    }

    @Test
    void obstaclesCoveringWholeRoof_disabledWithWarningButStillPacked() {
        Polygon everything = GeomUtils.rectangle(-100, -100, 400, 440);
        LayoutParams params = new LayoutParams().angleDeg(0.0);
        AngleSearch.Outcome out = search(ROOF, 90.0, 20.0, params, everything).search();

        assertEquals(ObstacleSubtractor.Note.DISABLED, out.best().obstacleNote());
        assertTrue(out.warnings().contains(ObstacleSubtractor.Note.DISABLED.warning()));
        assertEquals(1, out.warnings().size(), "los avisos repetidos por ángulo se informan una vez");
        assertFalse(out.best().panels().isEmpty());
        assertFalse(out.fallbackUsed());
    }

    @Test
    void obstaclesLeavingTooLittleRoof_relaxedAndPanelsAvoidTheShrunkUnion() {
        // anillo de 10 px: quedan 180 x 220; el obstáculo llega hasta x = 170 con 5 px de holgura.
        // Con la holgura completa la franja libre mide 20 px (< 12%); al conservar la mitad, 22.5 px
        Polygon obstacle = GeomUtils.rectangle(-100, -100, 270, 440);
        LayoutParams params = new LayoutParams().panelSize("tiny").angleDeg(0.0);
        AngleSearch search = search(ROOF, 90.0, 20.0, params, obstacle);

        AngleEvaluation e = search.evaluate(0.0, 0.5, 0.12 * 20, true);

        assertEquals(ObstacleSubtractor.Note.RELAXED, e.obstacleNote());
        assertEquals(List.of(ObstacleSubtractor.Note.RELAXED.warning()), e.warnings());
        assertEquals(22.5 * 220, e.usableAreaPx(), 1e-6);
        assertEquals(3, e.panels().size());

        Geometry relaxed = obstacle.buffer(-2.5, GeomUtils.BUFFER_SEGMENTS);
        Geometry inner = ROOF.buffer(-10 + 1e-6);
        boolean insideFullClearance = false;
        for (Polygon p : e.panels()) {
            assertTrue(inner.covers(p), "panel dentro del anillo perimetral");
            assertEquals(0.0, p.intersection(relaxed).getArea(), 1e-6, "panel sobre el obstáculo relajado");
            insideFullClearance |= p.intersection(obstacle).getArea() > 0;
        }
        assertTrue(insideFullClearance, "la relajación cede parte de la holgura");

        assertTrue(search.search().warnings().contains(ObstacleSubtractor.Note.RELAXED.warning()));
    }

    @Test
    void nothingFits_fallbackWithSmallerRingPlacesOnePanel() {
        // 2.90 x 1.66 m a 50 px/m: con 0.35 m de anillo quedan 0.96 m; con 0.30 m, 1.06 m
        Polygon small = GeomUtils.rectangle(10, 10, 145, 83);
        LayoutParams params = new LayoutParams().panelSize("small").edgeClearanceM(0.35).minBoundaryClearanceM(0)
                .obstacleMode(ObstacleMode.OFF).fillRelativeTo(FillReference.ROOF).fillPct(90);

        AngleSearch.Outcome out = search(small, 0.0, 50.0, params, null).search();

        assertTrue(out.fallbackUsed());
        assertTrue(out.warnings().contains(AngleSearch.WARN_FALLBACK));
        assertFalse(out.warnings().contains(AngleSearch.WARN_NO_FIT));
        assertEquals(1, out.best().panels().size());
        assertEquals(0.30, out.best().boundaryClearanceM(), 1e-12);
        assertEquals(0.0, out.best().angleDeg());
        assertEquals(PanelOrientation.LANDSCAPE, out.best().orientation());
        assertEquals(1.0, out.best().usedLengthM());
        assertEquals(2.0, out.best().usedWidthM());
    }

    @Test
    void nothingFitsEvenAfterFallback_emptyLayoutWithWarning() {
        Polygon tiny = GeomUtils.rectangle(0, 0, 60, 40);
        LayoutParams params = new LayoutParams().panelSize("small").obstacleMode(ObstacleMode.OFF);

        AngleSearch.Outcome out = search(tiny, 0.0, 50.0, params, null).search();

        assertTrue(out.fallbackUsed());
        assertTrue(out.best().panels().isEmpty());
        assertEquals(List.of(AngleSearch.WARN_FALLBACK, AngleSearch.WARN_NO_FIT), out.warnings());
    }
}
