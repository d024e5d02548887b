package org.tesis.solar;

// PORTRAIT: el lado largo del panel va en el eje Y del marco rotado; LANDSCAPE: en el eje X
public enum PanelOrientation {
    PORTRAIT,
    LANDSCAPE
}
