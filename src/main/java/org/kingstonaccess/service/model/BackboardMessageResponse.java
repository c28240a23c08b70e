package org.kingstonaccess.service.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackboardMessageResponse {

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("message_id")
    private String messageId;

    private String role;
    private String content;
    private String status;
}
