package org.terrastories.policy.application.exceptions;

import org.springframework.http.HttpStatus;
import org.terrastories.policy.domain.model.Decision;

public class CulturalProtocolViolationException extends CulturalAccessException {

    public CulturalProtocolViolationException(Decision decision) {
        super("Access denied due to cultural protocol restrictions", decision);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.FORBIDDEN;
    }
}
