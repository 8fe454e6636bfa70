package dev.forgelink.service;

import dev.forgelink.TestFixtures;
import dev.forgelink.domain.entity.Installation;
import dev.forgelink.dto.response.IssueResponse;
import dev.forgelink.exception.UpstreamRateLimitException;
import dev.forgelink.infrastructure.gitea.GiteaApiClient;
import dev.forgelink.infrastructure.gitea.GiteaApiClient.GiteaIssue;
import dev.forgelink.infrastructure.gitea.GiteaApiException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IssueBridgeServiceTest {

    @Mock
    private InstallationService installationService;
    @Mock
    private GiteaApiClient giteaApiClient;
    @InjectMocks
    private IssueBridgeService service;

    private final Installation installation = TestFixtures.installation(10L, TestFixtures.organization(1L, "acme"));

    @Test
    @DisplayName("createIssue returns the key, external key and web url of the new issue")
    void createsIssue() {
        when(installationService.requireForOrganization(1L, 10L)).thenReturn(installation);
        when(giteaApiClient.createIssue(installation, "acme/widgets", "Bug", "Steps"))
                .thenReturn(new GiteaIssue(12L, "Bug", "Steps", "h"));

        IssueResponse issue = service.createIssue(1L, 10L, "acme/widgets", "Bug", "Steps");

        assertThat(issue.key()).isEqualTo("acme/widgets#12");
        assertThat(issue.externalKey()).isEqualTo("gitea.example.com:acme/widgets#12");
        assertThat(issue.url()).isEqualTo("https://gitea.example.com/acme/widgets/issues/12");
        assertThat(issue.displayName()).isEqualTo("acme/widgets#12");
    }

    @Test
    @DisplayName("createIssue without repository is a bad request")
    void createRequiresRepo() {
        assertThatThrownBy(() -> service.createIssue(1L, 10L, " ", "Bug", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(giteaApiClient);
    }

    @Test
    @DisplayName("linkIssue comments only when a comment is given")
    void linksIssue() {
        when(installationService.requireForOrganization(1L, 10L)).thenReturn(installation);
        when(giteaApiClient.getIssue(installation, "acme/widgets", "12"))
                .thenReturn(new GiteaIssue(12L, "Bug", null, "h"));

        service.linkIssue(1L, 10L, "acme/widgets#12", "Tracked in forgelink");
        service.linkIssue(1L, 10L, "acme/widgets#12", "  ");

        verify(giteaApiClient, times(1)).createIssueComment(installation, "acme/widgets", "12", "Tracked in forgelink");
    }

    @Test
    @DisplayName("getIssue rejects malformed ids")
    void malformedId() {
        assertThatThrownBy(() -> service.getIssue(1L, 10L, "acme/widgets"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("search labels results as '#<n> <title>'")
    void searches() {
        when(installationService.requireForOrganization(1L, 10L)).thenReturn(installation);
        when(giteaApiClient.searchIssues(installation, "acme/widgets", "crash"))
                .thenReturn(List.of(new GiteaIssue(12L, "Crash on start", null, "h")));

        assertThat(service.searchIssues(1L, 10L, "externalIssue", "crash", "acme/widgets"))
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.label()).isEqualTo("#12 Crash on start");
                    assertThat(r.value()).isEqualTo(12L);
                });
    }

    @Test
    @DisplayName("search validates field, query and repo")
    void searchValidation() {
        when(installationService.requireForOrganization(1L, 10L)).thenReturn(installation);

        assertThatThrownBy(() -> service.searchIssues(1L, 10L, null, "q", "r"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("field");
        assertThatThrownBy(() -> service.searchIssues(1L, 10L, "externalIssue", null, "r"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("query");
        assertThatThrownBy(() -> service.searchIssues(1L, 10L, "externalIssue", "q", null))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("repo");
        assertThatThrownBy(() -> service.searchIssues(1L, 10L, "assignee", "q", "r"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Invalid field");
        verify(giteaApiClient, never()).searchIssues(any(), any(), any());
    }

    @Test
    @DisplayName("a 403 from Gitea during search becomes a rate limit error")
    void forbiddenIsRateLimit() {
        when(installationService.requireForOrganization(1L, 10L)).thenReturn(installation);
        when(giteaApiClient.searchIssues(any(), any(), any())).thenThrow(new GiteaApiException(403, "forbidden", null));

        assertThatThrownBy(() -> service.searchIssues(1L, 10L, "externalIssue", "q", "acme/widgets"))
                .isInstanceOf(UpstreamRateLimitException.class);
    }
}
