package com.gas_supply_forecast.dto.response;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Envelope of every REST payload. A success carries data and an empty error code,
 * a failure carries an error code and no data. Both are stamped with fresh {@link Metadata}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GenericResponse<T> {
    private final T dataHeader;
    private final String errorCode;
    private final String message;
    private final Metadata metadata;

    public static <T> GenericResponse<T> success(String message, T dataHeader) {
        return new GenericResponse<>(dataHeader, "", message, Metadata.now());
    }

    public static <T> GenericResponse<T> failure(String errorCode, String message) {
        return new GenericResponse<>(null, errorCode, message, Metadata.now());
    }
}
