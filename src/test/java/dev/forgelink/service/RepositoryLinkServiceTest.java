package dev.forgelink.service;

import dev.forgelink.TestFixtures;
import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.entity.Organization;
import dev.forgelink.domain.entity.SourceRepository;
import dev.forgelink.dto.response.RepositoryResponse;
import dev.forgelink.exception.ResourceNotFoundException;
import dev.forgelink.infrastructure.gitea.GiteaApiClient;
import dev.forgelink.infrastructure.gitea.GiteaApiException;
import dev.forgelink.repository.InstallationRepository;
import dev.forgelink.repository.SourceRepositoryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RepositoryLinkServiceTest {

    @Mock
    private InstallationService installationService;
    @Mock
    private InstallationRepository installationRepository;
    @Mock
    private SourceRepositoryRepository repositories;
    @Mock
    private GiteaApiClient giteaApiClient;
    @InjectMocks
    private RepositoryLinkService service;

    private final Organization organization = TestFixtures.organization(1L, "acme");
    private final Installation installation = TestFixtures.installation(10L, organization);

    @Nested
    @DisplayName("linkRepository")
    class Link {

        @Test
        @DisplayName("creates the hook upstream and stores the repository with its config")
        void links() {
            when(installationService.requireForOrganization(1L, 10L)).thenReturn(installation);
            when(repositories.findByOrganizationIdAndProviderAndExternalId(1L, "integrations:gitea",
                    "gitea.example.com:acme/widgets")).thenReturn(Optional.empty());
            when(giteaApiClient.getRepository(installation, "acme/widgets"))
                    .thenReturn(new GiteaApiClient.GiteaRepository(5L, "acme/widgets", "https://g/acme/widgets"));
            when(giteaApiClient.createRepositoryWebhook(installation, "acme/widgets")).thenReturn(31L);
            when(repositories.save(any())).thenAnswer(inv -> {
                SourceRepository saved = inv.getArgument(0);
                ReflectionTestUtils.setField(saved, "id", 100L);
                return saved;
            });

            RepositoryResponse response = service.linkRepository(1L, 10L, "acme/widgets");

            ArgumentCaptor<SourceRepository> captor = ArgumentCaptor.forClass(SourceRepository.class);
            verify(repositories).save(captor.capture());
            SourceRepository stored = captor.getValue();
            assertThat(stored.getExternalId()).isEqualTo("gitea.example.com:acme/widgets");
            assertThat(stored.getUrl()).isEqualTo("https://g/acme/widgets");
            assertThat(stored.getConfig())
                    .containsEntry("instance", "gitea.example.com")
                    .containsEntry("webhook_id", 31L)
                    .containsEntry("repo", "acme/widgets");
            assertThat(response.id()).isEqualTo(100L);
            assertThat(response.provider()).isEqualTo("integrations:gitea");
        }

        @Test
        @DisplayName("refuses to link the same repository twice")
        void conflict() {
            when(installationService.requireForOrganization(1L, 10L)).thenReturn(installation);
            when(repositories.findByOrganizationIdAndProviderAndExternalId(any(), any(), any()))
                    .thenReturn(Optional.of(TestFixtures.repository(100L, 1L, "acme/widgets")));

            assertThatThrownBy(() -> service.linkRepository(1L, 10L, "acme/widgets"))
                    .isInstanceOf(IllegalStateException.class);
            verifyNoInteractions(giteaApiClient);
        }

        @Test
        @DisplayName("fails with not-found when the installation is not linked to the organization")
        void foreignInstallation() {
            when(installationService.requireForOrganization(2L, 10L))
                    .thenThrow(new ResourceNotFoundException("not linked"));

            assertThatThrownBy(() -> service.linkRepository(2L, 10L, "acme/widgets"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("unlinkRepository")
    class Unlink {

        @Test
        @DisplayName("removes the hook and the record, tolerating a hook already deleted upstream")
        void unlinks() {
            SourceRepository stored = TestFixtures.repository(100L, 1L, "acme/widgets");
            when(repositories.findByIdAndOrganizationId(100L, 1L)).thenReturn(Optional.of(stored));
            when(installationRepository.findById(1L)).thenReturn(Optional.of(installation));
            doThrow(new GiteaApiException(404, "gone", null))
                    .when(giteaApiClient).deleteRepositoryWebhook(installation, "acme/widgets", 7L);

            service.unlinkRepository(1L, 100L);

            verify(repositories).delete(stored);
        }

        @Test
        @DisplayName("keeps the record when Gitea fails for another reason")
        void upstreamFailure() {
            SourceRepository stored = TestFixtures.repository(100L, 1L, "acme/widgets");
            when(repositories.findByIdAndOrganizationId(100L, 1L)).thenReturn(Optional.of(stored));
            when(installationRepository.findById(1L)).thenReturn(Optional.of(installation));
            doThrow(new GiteaApiException(500, "down", null))
                    .when(giteaApiClient).deleteRepositoryWebhook(any(), any(), anyLong());

            assertThatThrownBy(() -> service.unlinkRepository(1L, 100L)).isInstanceOf(GiteaApiException.class);
            verify(repositories, never()).delete(any());
        }

        @Test
        @DisplayName("unknown repository is not found")
        void unknown() {
            when(repositories.findByIdAndOrganizationId(100L, 1L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.unlinkRepository(1L, 100L)).isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("lists the user's repositories by full name")
    void listsAvailable() {
        when(installationService.requireForOrganization(1L, 10L)).thenReturn(installation);
        when(giteaApiClient.listUserRepositories(installation)).thenReturn(List.of(
                new GiteaApiClient.GiteaRepository(5L, "acme/widgets", "u")));

        assertThat(service.listAvailableRepositories(1L, 10L))
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.identifier()).isEqualTo("acme/widgets");
                    assertThat(r.name()).isEqualTo("acme/widgets");
                });
    }
}
