package org.tesis.solar;

// la imagen no tiene ningún contorno de techo (imagen vacía o degenerada)
public class NoRoofDetectedException extends LayoutException {

    public NoRoofDetectedException(String message) {
        super(message);
    }
}
