package org.tesis.solar;

import java.util.Arrays;

public class UnknownPanelSizeException extends LayoutException {

    private final String panelSize;

    public UnknownPanelSizeException(String panelSize) {
        super("panelSize must be one of " + Arrays.toString(PanelSpec.keys()) + ", got '" + panelSize + "'");
        this.panelSize = panelSize;
    }

    public String getPanelSize() {
        return panelSize;
    }
}
