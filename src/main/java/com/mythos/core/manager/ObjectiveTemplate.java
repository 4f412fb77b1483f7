package com.mythos.core.manager;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named, reusable set of creation attributes for one registered objective type.
 *
 * @param name        template name, e.g. {@code library_investigation}
 * @param typeName    registered objective type to instantiate
 * @param attributes  default creation attributes; overrides win when instantiating
 */
public record ObjectiveTemplate(String name, String typeName, Map<String, Object> attributes) {

    public ObjectiveTemplate {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
