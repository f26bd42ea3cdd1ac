package org.nowstart.perpbot.data.exception;

import lombok.Getter;

/**
 * Raised when the exchange accepts the HTTP call but rejects the action in its response body.
 */
@Getter
public class ExchangeRequestException extends RuntimeException {

    private final String coin;

    public ExchangeRequestException(String coin, String message) {
        super(message);
        this.coin = coin;
    }
}
