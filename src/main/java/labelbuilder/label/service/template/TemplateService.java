package labelbuilder.label.service.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import labelbuilder.config.LabelSettings;
import labelbuilder.label.model.template.LabelTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores label templates as pretty-printed JSON files, one {@code <name>.json} per template.
 */
public class TemplateService {

    private static final Logger logger = LoggerFactory.getLogger(TemplateService.class);

    private final ObjectMapper objectMapper;
    private final Path templatesDirectory;

    public TemplateService() throws IOException {
        this(LabelSettings.getDefault().getTemplateDirectory());
    }

    public TemplateService(Path templatesDirectory) throws IOException {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.templatesDirectory = templatesDirectory;
        Files.createDirectories(templatesDirectory);
    }

    public Path saveTemplate(LabelTemplate template) throws IOException {
        String fileName = template.getName().replaceAll("[^a-zA-Z0-9.-]", "_") + ".json";
        Path file = templatesDirectory.resolve(fileName);
        objectMapper.writeValue(file.toFile(), template);
        logger.info("Saved template '{}' to {}", template.getName(), file);
        return file;
    }

    public LabelTemplate loadTemplate(String templateName) throws IOException {
        String fileName = templateName.endsWith(".json") ? templateName : templateName + ".json";
        return readTemplate(templatesDirectory.resolve(fileName));
    }

    public LabelTemplate readTemplate(Path file) throws IOException {
        LabelTemplate template = objectMapper.readValue(file.toFile(), LabelTemplate.class);
        logger.info("Loaded template '{}' with {} elements from {}", template.getName(), template.getElements().size(), file);
        return template;
    }

    public List<String> getTemplateNames() {
        try (Stream<Path> stream = Files.list(templatesDirectory)) {
            return stream.filter(file -> !Files.isDirectory(file)).map(Path::getFileName).map(Path::toString).filter(name -> name.endsWith(".json")).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            logger.error("Could not read template directory {}", templatesDirectory, e);
            return new ArrayList<>();
        }
    }

    public String toJson(LabelTemplate template) throws JsonProcessingException {
        return objectMapper.writeValueAsString(template);
    }

    public LabelTemplate fromJson(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, LabelTemplate.class);
    }

    public Path getTemplatesDirectory() {
        return templatesDirectory;
    }
}
