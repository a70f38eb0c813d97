package org.terrastories.policy.application.exceptions;

import org.springframework.http.HttpStatus;
import org.terrastories.policy.domain.model.Decision;

public class DataSovereigntyViolationException extends CulturalAccessException {

    public DataSovereigntyViolationException(Decision decision) {
        super("Access denied due to data sovereignty restrictions", decision);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.FORBIDDEN;
    }
}
