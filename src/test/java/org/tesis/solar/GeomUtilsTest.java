package org.tesis.solar;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.opencv.core.Point;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeomUtilsTest {

    @Test
    void fromContour_dropsRepeatedPointsAndCloses() {
        Polygon p = GeomUtils.fromContour(new Point[]{
                new Point(0, 0), new Point(10, 0), new Point(10, 0), new Point(10, 5), new Point(0, 5)});
        assertNotNull(p);
        assertEquals(50, p.getArea(), 1e-9);
        assertEquals(5, p.getNumPoints());
        assertTrue(p.isValid());
    }

    @Test
    void fromContour_degenerateOutlinesGiveNull() {
        assertNull(GeomUtils.fromContour(new Point[]{new Point(0, 0), new Point(4, 0)}));
        // contorno de una línea de un píxel: ida y vuelta, área nula
        assertNull(GeomUtils.fromContour(new Point[]{new Point(0, 0), new Point(4, 0), new Point(8, 0), new Point(4, 0)}));
    }

    @Test
    void fromContour_selfCrossingOutlineIsRepaired() {
        Polygon p = GeomUtils.fromContour(new Point[]{
                new Point(0, 0), new Point(20, 10), new Point(20, 0), new Point(0, 4)});
        assertNotNull(p);
        assertTrue(p.isValid());
    }

    @Test
    void normalizeAngle_wrapsIntoHalfTurn() {
        assertEquals(175.0, GeomUtils.normalizeAngle(-5), 1e-12);
        assertEquals(0.0, GeomUtils.normalizeAngle(180), 1e-12);
        assertEquals(5.0, GeomUtils.normalizeAngle(365), 1e-12);
        assertEquals(90.0, GeomUtils.normalizeAngle(90), 1e-12);
    }

    @Test
    void rotate_thereAndBackIsIdentity() {
        Polygon r = GeomUtils.rectangle(10, 20, 30, 40);
        Geometry back = GeomUtils.rotate(GeomUtils.rotate(r, -37, 50, 60), 37, 50, 60);
        assertEquals(0.0, back.symDifference(r).getArea(), 1e-6);
    }

    @Test
    void inset_removesRingOrEmpties() {
        Polygon r = GeomUtils.rectangle(0, 0, 100, 60);
        assertEquals(80 * 40, GeomUtils.inset(r, 10).getArea(), 1e-6);
        assertTrue(GeomUtils.inset(r, 31).isEmpty());
    }

    @Test
    void union_mergesOverlaps() {
        Geometry u = GeomUtils.union(List.of(GeomUtils.rectangle(0, 0, 10, 10), GeomUtils.rectangle(5, 0, 10, 10)));
        assertEquals(150, u.getArea(), 1e-9);
        assertTrue(GeomUtils.union(List.of()).isEmpty());
    }
}
