package org.tesis.solar;

// la máscara del techo no tiene píxeles, no se puede calibrar la escala
public class ZeroAreaMaskException extends LayoutException {

    public ZeroAreaMaskException(String message) {
        super(message);
    }
}
