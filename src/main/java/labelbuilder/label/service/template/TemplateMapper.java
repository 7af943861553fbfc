package labelbuilder.label.service.template;

import labelbuilder.config.Colors;
import labelbuilder.label.model.Label;
import labelbuilder.label.model.element.BarcodeElement;
import labelbuilder.label.model.element.ConditionRegistry;
import labelbuilder.label.model.element.ConditionalElement;
import labelbuilder.label.model.element.ContextCondition;
import labelbuilder.label.model.element.ImageElement;
import labelbuilder.label.model.element.LabelElement;
import labelbuilder.label.model.element.TextElement;
import labelbuilder.label.model.template.BarcodeTemplate;
import labelbuilder.label.model.template.ConditionalTemplate;
import labelbuilder.label.model.template.ElementTemplate;
import labelbuilder.label.model.template.ImageTemplate;
import labelbuilder.label.model.template.LabelTemplate;
import labelbuilder.label.model.template.TextTemplate;
import labelbuilder.label.render.BarcodeEncoder;
import labelbuilder.label.render.FontSpec;
import labelbuilder.label.render.LabelImages;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Objects;

/**
 * Converts between live labels and their persisted {@link LabelTemplate} form.
 */
public class TemplateMapper {

    private final BarcodeEncoder barcodeEncoder;
    private final ConditionRegistry conditions;

    public TemplateMapper(BarcodeEncoder barcodeEncoder, ConditionRegistry conditions) {
        this.barcodeEncoder = Objects.requireNonNull(barcodeEncoder, "barcodeEncoder");
        this.conditions = Objects.requireNonNull(conditions, "conditions");
    }

    public LabelTemplate toTemplate(String name, Label label) throws LabelTemplateException {
        LabelTemplate template = new LabelTemplate();
        template.setName(name);
        template.setWidth(label.getWidth());
        template.setHeight(label.getHeight());
        template.setBackground(Colors.format(label.getBackground()));
        for (LabelElement element : label.getElements()) {
            template.getElements().add(toTemplate(element));
        }
        return template;
    }

    public Label toLabel(LabelTemplate template) throws LabelTemplateException {
        Label label;
        try {
            label = new Label(template.getWidth(), template.getHeight(), Colors.parse(template.getBackground()));
        } catch (IllegalArgumentException e) {
            throw new LabelTemplateException("Invalid label in template '" + template.getName() + "': " + e.getMessage(), e);
        }
        for (ElementTemplate element : template.getElements()) {
            label.addElement(toElement(element));
        }
        return label;
    }

    private ElementTemplate toTemplate(LabelElement element) throws LabelTemplateException {
        if (element instanceof TextElement text) {
            TextTemplate t = new TextTemplate();
            t.setText(text.getText());
            t.setFontFamily(text.getFont().family());
            t.setFontStyle(text.getFont().style());
            t.setFontSize(text.getFontSize());
            t.setColor(Colors.format(text.getColor()));
            return position(t, element);
        }
        if (element instanceof BarcodeElement barcode) {
            BarcodeTemplate t = new BarcodeTemplate();
            t.setContent(barcode.getContent());
            t.setSymbology(barcode.getSymbology());
            t.setWidth(barcode.getWidth());
            t.setHeight(barcode.getHeight());
            return position(t, element);
        }
        if (element instanceof ImageElement image) {
            ImageTemplate t = new ImageTemplate();
            t.setWidth(image.getWidth());
            t.setHeight(image.getHeight());
            t.setPngData(encodePng(image));
            return position(t, element);
        }
        if (element instanceof ConditionalElement<?> conditional) {
            ContextCondition<?> condition = conditional.getCondition();
            if (!condition.isNamed()) {
                throw new LabelTemplateException("Conditional elements need a registered condition name to be saved.");
            }
            ConditionalTemplate t = new ConditionalTemplate();
            t.setCondition(condition.name());
            t.setElement(toTemplate(conditional.getElement()));
            return t;
        }
        throw new LabelTemplateException("Unsupported element type: " + element.getClass().getName());
    }

    private LabelElement toElement(ElementTemplate template) throws LabelTemplateException {
        try {
            if (template instanceof TextTemplate t) {
                if (t.getFontFamily() == null || t.getFontStyle() == null) {
                    throw new LabelTemplateException("Text element '" + t.getText() + "' has no font family or style.");
                }
                return new TextElement(t.getText(), t.getX(), t.getY(),
                        new FontSpec(t.getFontFamily(), t.getFontStyle()), t.getFontSize(),
                        Colors.parse(t.getColor()), t.getRotation());
            }
            if (template instanceof BarcodeTemplate t) {
                if (t.getSymbology() == null) {
                    throw new LabelTemplateException("Barcode element '" + t.getContent() + "' has no symbology.");
                }
                return new BarcodeElement(t.getContent(), t.getSymbology(), barcodeEncoder,
                        t.getX(), t.getY(), t.getWidth(), t.getHeight(), t.getRotation());
            }
            if (template instanceof ImageTemplate t) {
                if (t.getPngData() == null) {
                    throw new LabelTemplateException("Image element has no image data.");
                }
                return new ImageElement(LabelImages.read(Base64.getDecoder().decode(t.getPngData())),
                        t.getX(), t.getY(), t.getWidth(), t.getHeight(), t.getRotation());
            }
            if (template instanceof ConditionalTemplate t) {
                ContextCondition<?> condition = conditions.find(t.getCondition())
                        .orElseThrow(() -> new LabelTemplateException("Unknown condition: " + t.getCondition()));
                if (t.getElement() == null) {
                    throw new LabelTemplateException("Conditional element '" + t.getCondition() + "' wraps nothing.");
                }
                return wrap(toElement(t.getElement()), condition);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new LabelTemplateException("Invalid element in template: " + e.getMessage(), e);
        }
        throw new LabelTemplateException("Unsupported element template: " + template);
    }

    private static <T> ConditionalElement<T> wrap(LabelElement element, ContextCondition<T> condition) {
        return new ConditionalElement<>(element, condition);
    }

    private static ElementTemplate position(ElementTemplate template, LabelElement element) {
        template.setX(element.getX());
        template.setY(element.getY());
        template.setRotation(element.getRotation());
        return template;
    }

    private static String encodePng(ImageElement image) throws LabelTemplateException {
        return encodeImage(image.getImage(), "png");
    }

    static String encodeImage(BufferedImage image, String format) throws LabelTemplateException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, format, out)) {
                throw new LabelTemplateException("No " + format + " writer available for image element.");
            }
        } catch (IOException e) {
            throw new LabelTemplateException("Could not encode image element as " + format + ".", e);
        }
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }
}
