package org.terrastories.policy.application.exceptions;

import org.springframework.http.HttpStatus;
import org.terrastories.policy.domain.model.Decision;

public class InsufficientPermissionsException extends CulturalAccessException {

    public InsufficientPermissionsException(Decision decision) {
        super("Insufficient permissions to perform this action", decision);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.FORBIDDEN;
    }
}
