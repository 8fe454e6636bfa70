package dev.forgelink.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Repository descriptor embedded in every Gitea event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventRepository(@JsonProperty("full_name") String fullName,
                              @JsonProperty("html_url") String htmlUrl) {
}
