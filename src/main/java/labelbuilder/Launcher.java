package labelbuilder;

import labelbuilder.label.model.Label;
import labelbuilder.label.model.element.ConditionRegistry;
import labelbuilder.label.model.template.ConditionalTemplate;
import labelbuilder.label.model.template.ElementTemplate;
import labelbuilder.label.model.template.LabelTemplate;
import labelbuilder.label.render.Java2DRenderBackend;
import labelbuilder.label.render.ZxingBarcodeEncoder;
import labelbuilder.label.service.LabelImageWriter;
import labelbuilder.label.service.template.LabelTemplateException;
import labelbuilder.label.service.template.TemplateMapper;
import labelbuilder.label.service.template.TemplateService;
import labelbuilder.label.service.template.TemplateVariableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Renders a JSON label template to an image file.
 * <pre>
 * java -jar label-builder.jar template.json out.png serial=ABC123 sku=42
 * </pre>
 * The {@code key=value} pairs fill {@code ${key}} placeholders and are also the render context.
 * Conditional elements may use a condition named {@code has.<key>}, which holds when a non-blank
 * value was supplied for {@code key}.
 */
public class Launcher {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    static final String HAS_VALUE_PREFIX = "has.";

    private static final Logger logger = LoggerFactory.getLogger(Launcher.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: Launcher <template.json> <output.png> [key=value ...]");
            return EXIT_USAGE;
        }
        Path templateFile = Paths.get(args[0]);
        Path output = Paths.get(args[1]);
        Map<String, String> data = new LinkedHashMap<>();
        for (int i = 2; i < args.length; i++) {
            int separator = args[i].indexOf('=');
            if (separator <= 0) {
                System.err.println("Expected key=value but got: " + args[i]);
                return EXIT_USAGE;
            }
            data.put(args[i].substring(0, separator), args[i].substring(separator + 1));
        }

        try {
            TemplateService templateService = new TemplateService(templateFile.toAbsolutePath().getParent());
            TemplateVariableResolver resolver = new TemplateVariableResolver();
            LabelTemplate template = templateService.readTemplate(templateFile);

            Set<String> missing = resolver.findVariables(template);
            missing.removeAll(data.keySet());
            if (!missing.isEmpty()) {
                logger.warn("No values supplied for {}, they will be left empty.", missing);
            }

            TemplateMapper mapper = new TemplateMapper(new ZxingBarcodeEncoder(), conditionsFor(template));
            Label label = mapper.toLabel(resolver.resolve(template, data));
            label.render(new Java2DRenderBackend(), LabelImageWriter.toFile(output, formatOf(output)), data);
            logger.info("Rendered template '{}' to {}", template.getName(), output);
            return EXIT_OK;
        } catch (IOException | UncheckedIOException | LabelTemplateException e) {
            logger.error("Failed to render {}: {}", templateFile, e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            logger.error("Rendering {} failed.", templateFile, e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Registers a {@code has.<key>} condition over the argument map for every such name the
     * template refers to.
     */
    static ConditionRegistry conditionsFor(LabelTemplate template) {
        ConditionRegistry registry = new ConditionRegistry();
        for (ElementTemplate element : template.getElements()) {
            registerHasValue(registry, element);
        }
        return registry;
    }

    private static void registerHasValue(ConditionRegistry registry, ElementTemplate element) {
        if (!(element instanceof ConditionalTemplate conditional)) {
            return;
        }
        String name = conditional.getCondition();
        if (name != null && name.startsWith(HAS_VALUE_PREFIX) && name.length() > HAS_VALUE_PREFIX.length()) {
            String key = name.substring(HAS_VALUE_PREFIX.length());
            registry.register(name, Map.class, values -> {
                Object value = values.get(key);
                return value != null && !value.toString().isBlank();
            });
        }
        registerHasValue(registry, conditional.getElement());
    }

    private static String formatOf(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase() : "png";
    }
}
