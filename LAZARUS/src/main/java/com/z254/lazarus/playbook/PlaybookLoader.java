package com.z254.lazarus.playbook;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.z254.lazarus.config.LazarusProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Loads playbook documents at startup and publishes them into the {@link PlaybookRegistry}.
 * <p>
 * A document holds either one playbook or a list of them. A document that does not parse or a
 * playbook that fails validation stops startup.
 */
@Slf4j
@Component
public class PlaybookLoader {

    private final PlaybookRegistry registry;
    private final LazarusProperties properties;
    private final ResourcePatternResolver resolver;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public PlaybookLoader(PlaybookRegistry registry, LazarusProperties properties) {
        this.registry = registry;
        this.properties = properties;
        this.resolver = new PathMatchingResourcePatternResolver();
    }

    @PostConstruct
    public void loadBundled() throws IOException {
        String location = properties.getPlaybooks().getLocation();
        Resource[] resources = resolver.getResources(location);
        Arrays.sort(resources, Comparator.comparing(r -> String.valueOf(r.getFilename())));
        int loaded = 0;
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                for (PlaybookDefinition definition : parse(in)) {
                    registry.publish(PlaybookDefinitionMapper.toPlaybook(definition));
                    loaded++;
                }
            }
        }
        log.info("Loaded {} playbooks from {} documents at {}", loaded, resources.length, location);
    }

    /**
     * Parse one YAML or JSON document into playbook definitions.
     */
    public List<PlaybookDefinition> parse(InputStream in) throws IOException {
        JsonNode root = yamlMapper.readTree(in);
        List<PlaybookDefinition> definitions = new ArrayList<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return definitions;
        }
        if (root.isArray()) {
            for (JsonNode node : root) {
                definitions.add(yamlMapper.treeToValue(node, PlaybookDefinition.class));
            }
        } else {
            definitions.add(yamlMapper.treeToValue(root, PlaybookDefinition.class));
        }
        return definitions;
    }
}
