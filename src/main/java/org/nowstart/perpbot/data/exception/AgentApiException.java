package org.nowstart.perpbot.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class AgentApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public AgentApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
