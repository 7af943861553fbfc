package labelbuilder.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Layout and rendering defaults read from {@code /label.properties} on the classpath.
 * Keys that are missing fall back to the built-in values.
 */
public final class LabelSettings {

    public static final String RESOURCE = "/label.properties";

    private static final Logger logger = LoggerFactory.getLogger(LabelSettings.class);

    private final float margin;
    private final Color background;
    private final String fontFamily;
    private final int barcodeMargin;
    private final Path templateDirectory;

    private LabelSettings(Properties properties) {
        this.margin = Float.parseFloat(properties.getProperty("label.margin", "5"));
        this.background = Colors.parse(properties.getProperty("label.background", "#FFFFFFFF"));
        this.fontFamily = properties.getProperty("label.font.family", "SansSerif");
        this.barcodeMargin = Integer.parseInt(properties.getProperty("barcode.margin", "10"));
        String directory = properties.getProperty("template.directory", "");
        this.templateDirectory = directory.isBlank()
                ? Paths.get(System.getProperty("user.home"), "label-templates")
                : Paths.get(directory);
    }

    public static LabelSettings getDefault() {
        return Holder.INSTANCE;
    }

    public static LabelSettings fromProperties(Properties properties) {
        return new LabelSettings(properties);
    }

    static LabelSettings load(String resource) {
        Properties properties = new Properties();
        try (InputStream input = LabelSettings.class.getResourceAsStream(resource)) {
            if (input == null) {
                logger.warn("Unable to find {} in resources, using built-in defaults.", resource);
            } else {
                properties.load(input);
            }
        } catch (IOException e) {
            logger.error("Failed to read {}, using built-in defaults.", resource, e);
        }
        try {
            return new LabelSettings(properties);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid value in {}, using built-in defaults.", resource, e);
            return new LabelSettings(new Properties());
        }
    }

    public float getMargin() {
        return margin;
    }

    public Color getBackground() {
        return background;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public int getBarcodeMargin() {
        return barcodeMargin;
    }

    public Path getTemplateDirectory() {
        return templateDirectory;
    }

    private static final class Holder {
        private static final LabelSettings INSTANCE = load(RESOURCE);
    }
}
