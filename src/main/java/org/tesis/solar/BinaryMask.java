package org.tesis.solar;

/**
 * Máscara binaria por píxel, en el mismo marco que la imagen procesada (fila mayor).
 * Es la forma en que el motor expone la máscara del techo; el trabajo raster se hace en OpenCV.
 */
public class BinaryMask {

    final int width;
    final int height;
    final boolean[] data;

    public BinaryMask(int width, int height) {
        this(width, height, new boolean[width * height]);
    }

    BinaryMask(int width, int height, boolean[] data) {
        if (data.length != width * height) throw new IllegalArgumentException("Tamaño de máscara inconsistente");
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public int width()  { return width; }
    public int height() { return height; }

    public boolean get(int x, int y) {
        return data[y * width + x];
    }

    public void set(int x, int y, boolean v) {
        data[y * width + x] = v;
    }

    public int count() {
        int n = 0;
        for (boolean b : data) if (b) n++;
        return n;
    }

    public boolean isEmpty() {
        for (boolean b : data) if (b) return false;
        return true;
    }
}
