package org.islandora.handle.config;

import java.util.Collection;
import java.util.List;

/**
 * Source of the Handle associations configured per content model.
 */
public interface ConfigurationStore {
    /**
     * Look up every association configured for the given content models.
     *
     * @param contentModels Content models of an object, in the object's order
     * @return Associations ordered by the given content models, then by configuration order
     */
    List<Association> associationsFor(Collection<String> contentModels);
}
