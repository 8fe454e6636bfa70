package dev.forgelink.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PushEventPayload(String ref, EventRepository repository, List<CommitEntry> commits)
        implements GiteaEvent {

    public PushEventPayload {
        if (commits == null) commits = List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommitEntry(String id, String message, String timestamp, String url, Person author) {
        public String authorEmail() {
            return author != null ? author.email() : null;
        }

        public String authorName() {
            return author != null ? author.name() : null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Person(String name, String email, String username) {}
}
