package org.tesis.solar;

import java.util.Locale;

// base sobre la que se calcula el área objetivo de relleno
public enum FillReference {
    USABLE,
    ROOF;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FillReference fromKey(String key) {
        if (key != null) {
            String k = key.trim().toUpperCase(Locale.ROOT);
            for (FillReference f : values()) {
                if (f.name().equals(k)) return f;
            }
        }
        throw new InvalidLayoutParamsException("fillRelativeTo must be 'usable' or 'roof', got '" + key + "'");
    }
}
