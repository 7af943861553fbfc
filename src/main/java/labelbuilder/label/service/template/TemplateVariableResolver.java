package labelbuilder.label.service.template;

import labelbuilder.label.model.template.BarcodeTemplate;
import labelbuilder.label.model.template.ConditionalTemplate;
import labelbuilder.label.model.template.ElementTemplate;
import labelbuilder.label.model.template.LabelTemplate;
import labelbuilder.label.model.template.TextTemplate;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code ${key}} placeholders in text and barcode payloads.
 */
public class TemplateVariableResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\$\\{(.+?)\\}");

    /**
     * Replaces placeholders in place. Keys missing from {@code data} become empty strings.
     */
    public LabelTemplate resolve(LabelTemplate template, Map<String, String> data) {
        for (ElementTemplate element : template.getElements()) {
            resolve(element, data);
        }
        return template;
    }

    public Set<String> findVariables(LabelTemplate template) {
        Set<String> variables = new LinkedHashSet<>();
        for (ElementTemplate element : template.getElements()) {
            collect(element, variables);
        }
        return variables;
    }

    static String substitute(String value, Map<String, String> data) {
        if (value == null) {
            return null;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = data.getOrDefault(matcher.group(1), "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement != null ? replacement : ""));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private void resolve(ElementTemplate element, Map<String, String> data) {
        if (element instanceof TextTemplate text) {
            text.setText(substitute(text.getText(), data));
        } else if (element instanceof BarcodeTemplate barcode) {
            barcode.setContent(substitute(barcode.getContent(), data));
        } else if (element instanceof ConditionalTemplate conditional && conditional.getElement() != null) {
            resolve(conditional.getElement(), data);
        }
    }

    private void collect(ElementTemplate element, Set<String> variables) {
        String value = null;
        if (element instanceof TextTemplate text) {
            value = text.getText();
        } else if (element instanceof BarcodeTemplate barcode) {
            value = barcode.getContent();
        } else if (element instanceof ConditionalTemplate conditional && conditional.getElement() != null) {
            collect(conditional.getElement(), variables);
        }
        if (value != null) {
            Matcher matcher = VARIABLE_PATTERN.matcher(value);
            while (matcher.find()) {
                variables.add(matcher.group(1));
            }
        }
    }
}
