package com.livestockmart.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Error body returned by every endpoint. Optional sections are left out of
 * the JSON when empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private int status;
    private String error;
    private String message;
    private String path;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime timestamp;

    private String errorCode;

    // also written to the log line of the failure
    private String correlationId;

    // field -> message, only for bean validation failures
    private Map<String, String> validationErrors;

    // Listing ids that blocked a reservation, so the client can trim its basket
    private List<String> conflictingIds;
}
