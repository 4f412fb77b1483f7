package com.mythos.core.manager;

import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;
import com.mythos.core.objective.ObjectiveParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registered objective types and templates.
 */
public class ObjectiveRegistry {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveRegistry.class);

    private final Map<String, ObjectiveFactory> types = new LinkedHashMap<>();
    private final Map<String, ObjectiveTemplate> templates = new LinkedHashMap<>();

    public void registerType(String typeName, ObjectiveFactory factory) {
        if (types.put(typeName, factory) != null) {
            log.warn("Replacing registered objective type {}", typeName);
        }
        log.debug("Registered objective type {}", typeName);
    }

    public void registerTemplate(ObjectiveTemplate template) {
        if (!types.containsKey(template.typeName())) {
            throw new ObjectiveManagerException("Template " + template.name()
                    + " refers to unknown objective type " + template.typeName());
        }
        templates.put(template.name(), template);
        log.debug("Registered objective template {}", template.name());
    }

    /**
     * Instantiates an objective of a registered type.
     *
     * @throws ObjectiveManagerException for an unknown type or when construction fails
     */
    public Objective create(String typeName, String objectiveId, Map<String, ?> attributes, Clock clock) {
        ObjectiveFactory factory = types.get(typeName);
        if (factory == null) {
            throw new ObjectiveManagerException("Unknown objective type: " + typeName);
        }
        try {
            ObjectiveParams params = new ObjectiveParams(attributes);
            return factory.create(ObjectiveDefinition.fromParams(objectiveId, params), params, clock);
        } catch (ObjectiveManagerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ObjectiveManagerException("Failed to create objective " + objectiveId
                    + " of type " + typeName + ": " + e.getMessage(), e);
        }
    }

    public ObjectiveTemplate getTemplate(String templateName) {
        ObjectiveTemplate template = templates.get(templateName);
        if (template == null) {
            throw new ObjectiveManagerException("Unknown objective template: " + templateName);
        }
        return template;
    }

    public Optional<ObjectiveFactory> getType(String typeName) {
        return Optional.ofNullable(types.get(typeName));
    }

    public Set<String> getTypeNames() {
        return Set.copyOf(types.keySet());
    }

    public Set<String> getTemplateNames() {
        return Set.copyOf(templates.keySet());
    }
}
