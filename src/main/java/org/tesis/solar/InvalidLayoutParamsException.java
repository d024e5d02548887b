package org.tesis.solar;

// parámetro de configuración fuera de rango (distancias negativas, modos desconocidos, ...)
public class InvalidLayoutParamsException extends LayoutException {

    public InvalidLayoutParamsException(String message) {
        super(message);
    }
}
