package org.tesis.solar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Línea de comandos: {@code SolarLayout <imagen> <areaTechoM2> [prefijoSalida] [clave=valor ...]}.
 * Escribe {@code <prefijo>.png} (overlay) y {@code <prefijo>.svg}.
 */
public class SolarLayout {

    private static final Logger log = LoggerFactory.getLogger(SolarLayout.class);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Uso: SolarLayout <imagen> <areaTechoM2> [prefijoSalida] [clave=valor ...]");
            System.err.println("Claves: panelSize, fillPct, spacingM, edgeClearanceM, minBoundaryClearanceM,");
            System.err.println("        obstacleClearanceM, obstacleMode, angleDeg, fillRelativeTo,");
            System.err.println("        overshootToleranceFrac, parallelism, roofLengthM, roofWidthM");
            System.exit(2);
        }
        String inputImage = args[0];
        double areaM2 = parseNumber("roofAreaM2", args[1]);
        String outputPrefix = "out/layout";

        // el tercer argumento es el prefijo sólo si no es clave=valor
        int firstOption = 2;
        if (args.length >= 3 && !args[2].contains("=")) {
            outputPrefix = args[2];
            firstOption = 3;
        }
        Properties props = new Properties();
        for (int i = firstOption; i < args.length; i++) {
            int eq = args[i].indexOf('=');
            if (eq <= 0) throw new IllegalArgumentException("Opción inválida (se espera clave=valor): " + args[i]);
            props.setProperty(args[i].substring(0, eq).trim(), args[i].substring(eq + 1).trim());
        }

        // 1) Parámetros
        LayoutParams params = LayoutParams.fromProperties(props);
        Double lengthM = optionalDouble(props, "roofLengthM");
        Double widthM = optionalDouble(props, "roofWidthM");

        // 2) Leer imagen
        BufferedImage image = ImageIO.read(new File(inputImage));
        if (image == null) throw new IOException("Formato de imagen no soportado: " + inputImage);

        // 3) Layout
        LayoutResult result = new SolarLayoutEngine().layout(image, areaM2, lengthM, widthM, params);

        // 4) Exportar PNG + SVG
        File png = new File(outputPrefix + ".png");
        File svgFile = new File(outputPrefix + ".svg");
        File parent = png.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();

        ImageIO.write(result.overlay, "png", png);
        try (Writer w = new OutputStreamWriter(new FileOutputStream(svgFile), StandardCharsets.UTF_8)) {
            w.write(SvgWriter.toSVG(result));
        }
        log.info("PNG generado en: {}", png.getPath());
        log.info("SVG generado en: {}", svgFile.getPath());
        System.out.println(result.stats.toMap());
    }

    static Double optionalDouble(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return null;
        return parseNumber(key, v);
    }

    static double parseNumber(String key, String v) {
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new InvalidLayoutParamsException("Valor numérico inválido para " + key + ": " + v);
        }
    }
}
