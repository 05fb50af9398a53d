package com.quickshare.upload.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;

/**
 * Response returned by the server once every chunk of a session has been
 * persisted and the session was closed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompleteResponse {

    /** Location the assembled file can be downloaded from. */
    @NotBlank(message = "Download URL is required")
    @URL(message = "Download URL must be a valid URL")
    @JsonProperty("download_url")
    private String downloadUrl;
}
