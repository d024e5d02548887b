package org.tesis.solar;

// conversión píxel <-> metro a partir del área real conocida del techo
public class ScaleCalibrator {

    /**
     * @return metros por píxel = sqrt(areaM2 / pixelCount)
     * @throws ZeroAreaMaskException si la máscara no tiene píxeles
     */
    public double metersPerPixel(double roofAreaM2, long pixelCount) {
        if (pixelCount <= 0) {
            throw new ZeroAreaMaskException("Roof mask area is zero");
        }
        return Math.sqrt(roofAreaM2 / pixelCount);
    }
}
