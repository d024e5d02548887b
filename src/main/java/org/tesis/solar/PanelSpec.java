package org.tesis.solar;

import java.util.Locale;

/**
 * Catálogo fijo de paneles (medidas en metros, potencia nominal en W).
 */
public enum PanelSpec {
    TINY("tiny", 1.70, 1.00, 340),      // 60 celdas / 120 half-cut
    SMALL("small", 2.00, 1.00, 400),    // 72 celdas / 144 half-cut
    MEDIUM("medium", 2.278, 1.134, 520), // 182 mm / 144 half-cut
    LARGE("large", 2.384, 1.303, 620);  // 210 mm / 132 half-cut

    private final String key;
    private final double lengthM;
    private final double widthM;
    private final int ratedWatts;

    PanelSpec(String key, double lengthM, double widthM, int ratedWatts) {
        this.key = key;
        this.lengthM = lengthM;
        this.widthM = widthM;
        this.ratedWatts = ratedWatts;
    }

    public String key()        { return key; }
    public double lengthM()    { return lengthM; }
    public double widthM()     { return widthM; }
    public int    ratedWatts() { return ratedWatts; }
    public double areaM2()     { return lengthM * widthM; }

    // busca por clave del catálogo (tiny/small/medium/large), sin distinguir mayúsculas
    public static PanelSpec fromKey(String key) {
        if (key != null) {
            String k = key.trim().toLowerCase(Locale.ROOT);
            for (PanelSpec p : values()) {
                if (p.key.equals(k)) return p;
            }
        }
        throw new UnknownPanelSizeException(key);
    }

    static String[] keys() {
        PanelSpec[] v = values();
        String[] out = new String[v.length];
        for (int i = 0; i < v.length; i++) out[i] = v[i].key;
        return out;
    }
}
