package dev.forgelink.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestEventPayload(
        String action,
        @JsonProperty("pull_request") PullRequest pullRequest,
        EventRepository repository
) implements GiteaEvent {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequest(Integer number, String title, String body,
                              @JsonProperty("created_at") String createdAt,
                              User user, boolean merged,
                              @JsonProperty("merge_commit_sha") String mergeCommitSha) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(String username, String email) {}

    /**
     * Names of the fields required for ingestion that this delivery lacks. {@code body} is optional.
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (pullRequest == null) {
            missing.add("pull_request");
            return missing;
        }
        if (pullRequest.number() == null) missing.add("pull_request.number");
        if (pullRequest.title() == null) missing.add("pull_request.title");
        if (pullRequest.createdAt() == null) missing.add("pull_request.created_at");
        if (pullRequest.user() == null) {
            missing.add("pull_request.user");
        } else {
            if (pullRequest.user().username() == null) missing.add("pull_request.user.username");
            if (pullRequest.user().email() == null || pullRequest.user().email().isBlank()) {
                missing.add("pull_request.user.email");
            }
        }
        return missing;
    }

    /** Merge commit hash, only for merged pull requests. */
    public String effectiveMergeCommitSha() {
        return pullRequest != null && pullRequest.merged() ? pullRequest.mergeCommitSha() : null;
    }
}
