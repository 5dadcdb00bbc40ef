package com.cgi.fielddiscovery.common.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Standard API response wrapper.
 *
 * @param <T> Type of data contained in the response
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * Whether the request was successful.
     */
    private boolean success;

    /**
     * Response data.
     */
    private T data;

    /**
     * Optional human readable message.
     */
    private String message;

    /**
     * Error message in case of failure.
     */
    private String error;

    /**
     * Error code in case of failure.
     */
    private String errorCode;

    /**
     * Creates a successful response with data.
     *
     * @param data Response data
     * @param <T> Type of data
     * @return Successful API response
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null, null, null);
    }

    /**
     * Creates a successful response with data and a message.
     *
     * @param data Response data
     * @param message Message
     * @param <T> Type of data
     * @return Successful API response
     */
    public static <T> ApiResponse<T> success(T data, String message) {
        return new ApiResponse<>(true, data, message, null, null);
    }

    /**
     * Creates an error response with a message and code.
     *
     * @param errorMessage Error message
     * @param errorCode Error code
     * @param <T> Type of data
     * @return Error API response
     */
    public static <T> ApiResponse<T> error(String errorMessage, String errorCode) {
        return new ApiResponse<>(false, null, null, errorMessage, errorCode);
    }
}
