package org.terrastories.policy.application.exceptions;

import org.springframework.http.HttpStatus;
import org.terrastories.policy.domain.model.Decision;
import org.terrastories.policy.domain.model.ResourceType;

/**
 * Raised for cross-community access. Indistinguishable from a resource that does not exist.
 */
public class ResourceNotFoundException extends CulturalAccessException {

    public ResourceNotFoundException(ResourceType type, Long resourceId, Decision decision) {
        super(message(type, resourceId), decision);
    }

    private static String message(ResourceType type, Long resourceId) {
        String name = Character.toUpperCase(type.getValue().charAt(0)) + type.getValue().substring(1);
        return resourceId != null
            ? name + " with ID " + resourceId + " not found"
            : name + " not found";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
