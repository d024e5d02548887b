package org.tesis.solar;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;

import static org.junit.jupiter.api.Assertions.*;

class PolygonBuilderTest {

    private final PolygonBuilder builder = new PolygonBuilder();

    @Test
    void uprightRectangle_axisFollowsTheLongSide() {
        RoofGeometry roof = builder.build(GeomUtils.rectangle(20, 20, 200, 240));
        assertEquals(90.0, roof.orientationDeg(), 1e-6);
        assertEquals(1.2, roof.aspectRatio(), 1e-9);
        assertEquals(200 * 240, roof.polygon().getArea(), 1e-6);
    }

    @Test
    void rotatedRectangle_axisIsTheRotation() {
        Polygon rect = GeomUtils.rectangle(100, 100, 240, 100);
        Polygon rotated = (Polygon) GeomUtils.rotate(rect, 30, 220, 150);

        RoofGeometry roof = builder.build(rotated);
        assertEquals(30.0, roof.orientationDeg(), 1e-6);
    }

    @Test
    void lengthWidth_estimatedFromAreaAndAspect() {
        RoofGeometry roof = builder.build(GeomUtils.rectangle(0, 0, 200, 240));
        double[] lw = roof.estimateLengthWidth(120.0);
        assertEquals(12.0, lw[0], 1e-9);
        assertEquals(10.0, lw[1], 1e-9);
    }

    @Test
    void noisyContour_isSimplified() {
        // escalera de 1 px sobre un lado: se reduce a pocos vértices
        Polygon stair = GeomUtils.GF.createPolygon(new Coordinate[]{
                new Coordinate(0, 0),
                new Coordinate(100, 0),
                new Coordinate(100, 50),
                new Coordinate(99, 50),
                new Coordinate(99, 51),
                new Coordinate(98, 51),
                new Coordinate(98, 100),
                new Coordinate(0, 100),
                new Coordinate(0, 0)
        });
        RoofGeometry roof = builder.build(stair);
        assertTrue(roof.polygon().getNumPoints() < stair.getNumPoints());
        assertEquals(stair.getArea(), roof.polygon().getArea(), stair.getArea() * 0.05);
    }
}
