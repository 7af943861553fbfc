package labelbuilder.label.builder;

import labelbuilder.config.LabelSettings;
import labelbuilder.label.model.HorizontalAlignment;
import labelbuilder.label.model.Label;
import labelbuilder.label.model.element.BarcodeElement;
import labelbuilder.label.model.element.ConditionalElement;
import labelbuilder.label.model.element.ContextCondition;
import labelbuilder.label.model.element.ImageElement;
import labelbuilder.label.model.element.LabelElement;
import labelbuilder.label.model.element.TextElement;
import labelbuilder.label.render.BarcodeEncoder;
import labelbuilder.label.render.BarcodeSymbology;
import labelbuilder.label.render.FontSpec;
import labelbuilder.label.render.Java2DRenderBackend;
import labelbuilder.label.render.LabelImages;
import labelbuilder.label.render.RenderBackend;
import labelbuilder.label.render.ZxingBarcodeEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;
import java.util.function.Predicate;

/**
 * Fluent composition of a {@link Label}.
 * <p>
 * Every added element is aligned horizontally, then clamped so it stays on the canvas. The
 * builder tracks the lowest edge reached so far ({@link #getLastY()}), which drives
 * {@link #centerVertically()}.
 */
public class LabelBuilder {

    private static final Logger logger = LoggerFactory.getLogger(LabelBuilder.class);

    private final Label label;
    private final RenderBackend backend;
    private final BarcodeEncoder barcodeEncoder;
    private final float margin;
    private final FontSpec defaultFont;
    private Object context;
    private float lastY;

    public LabelBuilder(float width, float height) {
        this(width, height, new Java2DRenderBackend(), new ZxingBarcodeEncoder());
    }

    public LabelBuilder(float width, float height, RenderBackend backend, BarcodeEncoder barcodeEncoder) {
        this(width, height, backend, barcodeEncoder, LabelSettings.getDefault());
    }

    public LabelBuilder(float width, float height, RenderBackend backend, BarcodeEncoder barcodeEncoder,
                        LabelSettings settings) {
        this.label = new Label(width, height, settings.getBackground());
        this.backend = Objects.requireNonNull(backend, "backend");
        this.barcodeEncoder = Objects.requireNonNull(barcodeEncoder, "barcodeEncoder");
        this.margin = settings.getMargin();
        this.defaultFont = FontSpec.of(settings.getFontFamily());
    }

    public LabelBuilder withContext(Object context) {
        this.context = context;
        return this;
    }

    // --- Elements ---

    /**
     * Adds text in the configured default font family.
     */
    public LabelBuilder addText(String text, float x, float y, float size, Color color,
                                HorizontalAlignment alignment) {
        return addText(text, x, y, defaultFont, size, color, alignment, 0f);
    }

    public LabelBuilder addText(String text, float x, float y, FontSpec font, float size, Color color,
                                HorizontalAlignment alignment) {
        return addText(text, x, y, font, size, color, alignment, 0f);
    }

    public LabelBuilder addText(String text, float x, float y, FontSpec font, float size, Color color,
                                HorizontalAlignment alignment, float rotation) {
        return addElement(new TextElement(text, x, y, font, size, color, rotation), alignment);
    }

    public LabelBuilder addBarcode(String code, float x, float y, float width, float height,
                                   HorizontalAlignment alignment) {
        return addBarcode(code, BarcodeSymbology.CODE_128, x, y, width, height, alignment, 0f);
    }

    public LabelBuilder addBarcode(String code, float x, float y, float width, float height,
                                   HorizontalAlignment alignment, float rotation) {
        return addBarcode(code, BarcodeSymbology.CODE_128, x, y, width, height, alignment, rotation);
    }

    public LabelBuilder addBarcode(String code, BarcodeSymbology symbology, float x, float y, float width,
                                   float height, HorizontalAlignment alignment, float rotation) {
        return addElement(new BarcodeElement(code, symbology, barcodeEncoder, x, y, width, height, rotation), alignment);
    }

    public LabelBuilder addImage(BufferedImage image, float x, float y, float width, float height,
                                 HorizontalAlignment alignment) {
        return addImage(image, x, y, width, height, alignment, 0f);
    }

    public LabelBuilder addImage(BufferedImage image, float x, float y, float width, float height,
                                 HorizontalAlignment alignment, float rotation) {
        return addElement(new ImageElement(image, x, y, width, height, rotation), alignment);
    }

    public LabelBuilder addImage(Path file, float x, float y, float width, float height,
                                 HorizontalAlignment alignment) throws IOException {
        return addImage(LabelImages.read(file), x, y, width, height, alignment, 0f);
    }

    /**
     * Adds {@code text} as consecutive lines of at most {@code maxLength} characters,
     * line {@code i} placed at {@code y + i * lineSpacing}.
     */
    public LabelBuilder addSplitText(String text, float x, float y, FontSpec font, float size, int maxLength,
                                     float lineSpacing, Color color, HorizontalAlignment alignment) {
        Objects.requireNonNull(font, "font");
        List<String> lines = TextSplitter.split(text, maxLength);
        for (int i = 0; i < lines.size(); i++) {
            addElement(new TextElement(lines.get(i), x, y + i * lineSpacing, font, size, color), alignment);
        }
        return this;
    }

    public <T> LabelBuilder addConditional(Class<T> contextType, Predicate<? super T> condition,
                                           LabelElement element, HorizontalAlignment alignment) {
        return addConditional(ContextCondition.of(contextType, condition), element, alignment);
    }

    /**
     * Adds {@code element} so that it is only drawn when the render-time context satisfies
     * {@code condition}. Layout treats it like any other element.
     */
    public <T> LabelBuilder addConditional(ContextCondition<T> condition, LabelElement element,
                                           HorizontalAlignment alignment) {
        return addElement(new ConditionalElement<>(element, condition), alignment);
    }

    public LabelBuilder addElement(LabelElement element, HorizontalAlignment alignment) {
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(alignment, "alignment");
        align(element, alignment);
        clamp(element);
        label.addElement(element);
        lastY = Math.max(lastY, element.getY() + element.getMeasuredHeight());
        logger.debug("Placed {} at ({}, {}), lastY={}", element.getClass().getSimpleName(),
                element.getX(), element.getY(), lastY);
        return this;
    }

    private void align(LabelElement element, HorizontalAlignment alignment) {
        float elementWidth = element.getMeasuredWidth(backend);
        switch (alignment) {
            case LEFT -> element.setX(margin);
            case CENTER -> element.setX((label.getWidth() - elementWidth) / 2f);
            case RIGHT -> element.setX(label.getWidth() - elementWidth - margin);
            case NONE -> {
            }
        }
    }

    private void clamp(LabelElement element) {
        float elementWidth = element.getMeasuredWidth(backend);
        float elementHeight = element.getMeasuredHeight();
        if (element.getX() < 0) element.setX(0);
        if (element.getY() < 0) element.setY(0);
        if (element.getX() + elementWidth > label.getWidth()) element.setX(label.getWidth() - elementWidth);
        if (element.getY() + elementHeight > label.getHeight()) element.setY(label.getHeight() - elementHeight);
    }

    // --- Decisions and iteration ---

    /**
     * Starts a decision chain. {@code configure} runs when the bound context is a
     * {@code contextType} and satisfies {@code condition}.
     */
    public <T> DecisionChain ifContext(Class<T> contextType, Predicate<? super T> condition,
                                       Consumer<LabelBuilder> configure) {
        return new DecisionChain(this).evaluate(ContextCondition.of(contextType, condition), configure);
    }

    public DecisionChain ifContext(ContextCondition<?> condition, Consumer<LabelBuilder> configure) {
        return new DecisionChain(this).evaluate(condition, configure);
    }

    /**
     * Calls {@code configure} for every {@code i} from {@code start} inclusive to {@code end} exclusive.
     */
    public LabelBuilder forRange(int start, int end, ObjIntConsumer<LabelBuilder> configure) {
        Objects.requireNonNull(configure, "configure");
        for (int i = start; i < end; i++) {
            configure.accept(this, i);
        }
        return this;
    }

    public <T> LabelBuilder forEach(Iterable<T> items, BiConsumer<LabelBuilder, ? super T> configure) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(configure, "configure");
        for (T item : items) {
            configure.accept(this, item);
        }
        return this;
    }

    // --- Scaling and centering ---

    public LabelBuilder scale(float factor) {
        if (!(factor > 0f)) {
            throw new IllegalArgumentException("Scale factor must be greater than 0, was " + factor);
        }
        label.scale(factor);
        lastY *= factor;
        return this;
    }

    /**
     * Scales uniformly by the largest factor that fits the label inside the target size.
     */
    public LabelBuilder scaleToFit(float targetWidth, float targetHeight) {
        if (!(targetWidth > 0f) || !(targetHeight > 0f)) {
            throw new IllegalArgumentException(
                    String.format("Target dimensions must be greater than 0, were %s x %s", targetWidth, targetHeight));
        }
        float factor = Math.min(targetWidth / label.getWidth(), targetHeight / label.getHeight());
        logger.debug("Scaling {}x{} label by {} to fit {}x{}", label.getWidth(), label.getHeight(), factor,
                targetWidth, targetHeight);
        label.scale(factor);
        lastY *= factor;
        return this;
    }

    public LabelBuilder centerVertically() {
        if (label.getElements().isEmpty()) {
            return this;
        }
        float offset = (label.getHeight() - lastY) / 2f;
        for (LabelElement element : label.getElements()) {
            element.setY(element.getY() + offset);
        }
        lastY += offset;
        return this;
    }

    public float getLastY() {
        return lastY;
    }

    Object getContext() {
        return context;
    }

    // --- Output ---

    public Label build() {
        return label;
    }

    public LabelBuilder generate(Consumer<BufferedImage> sink) {
        label.render(backend, sink, context);
        return this;
    }
}
