package org.tesis.solar;

/**
 * Error fatal del motor de layout: entradas inutilizables que se devuelven al llamador
 * sin reintentos. Las anomalías recuperables no lanzan, se reportan como warnings.
 */
public abstract class LayoutException extends RuntimeException {

    protected LayoutException(String message) {
        super(message);
    }
}
