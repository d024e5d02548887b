package org.tesis.solar;

// el área real del techo (entrada externa) debe ser positiva y finita
public class InvalidRoofAreaException extends LayoutException {

    public InvalidRoofAreaException(double areaM2) {
        super("roof area must be a positive finite number of m2, got " + areaM2);
    }
}
