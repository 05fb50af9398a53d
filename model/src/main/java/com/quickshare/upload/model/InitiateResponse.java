package com.quickshare.upload.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response returned by the server when an upload session is opened.
 *
 * <p>
 * The only field clients rely on is the session identifier; every chunk and the
 * final completion call are addressed by it. Unknown fields are ignored so the
 * server can extend the payload without breaking older clients.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InitiateResponse {

    /** Upload session identifier assigned by the server. */
    @NotBlank(message = "Upload ID is required")
    @JsonProperty("upload_id")
    private String uploadId;
}
