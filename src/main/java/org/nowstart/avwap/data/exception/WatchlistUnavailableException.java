package org.nowstart.avwap.data.exception;

import org.springframework.http.HttpStatus;

public class WatchlistUnavailableException extends AvwapApiException {

    public WatchlistUnavailableException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "watchlist_unavailable", message);
    }
}
