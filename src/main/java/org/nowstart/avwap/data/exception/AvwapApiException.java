package org.nowstart.avwap.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class AvwapApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public AvwapApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}
