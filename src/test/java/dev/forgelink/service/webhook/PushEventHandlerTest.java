package dev.forgelink.service.webhook;

import dev.forgelink.TestFixtures;
import dev.forgelink.config.GiteaProperties;
import dev.forgelink.domain.entity.Commit;
import dev.forgelink.domain.entity.Installation;
import dev.forgelink.domain.entity.Organization;
import dev.forgelink.dto.request.EventRepository;
import dev.forgelink.dto.request.PushEventPayload;
import dev.forgelink.dto.request.PushEventPayload.CommitEntry;
import dev.forgelink.dto.request.PushEventPayload.Person;
import dev.forgelink.repository.CommitAuthorRepository;
import dev.forgelink.repository.CommitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PushEventHandlerTest {

    @Mock
    private RepositoryResolver repositoryResolver;
    @Mock
    private CommitRepository commitRepository;
    @Mock
    private CommitAuthorRepository authorRepository;

    private final Organization organization = TestFixtures.organization(1L, "acme");
    private final Installation installation = TestFixtures.installation(10L, organization);
    private final EventRepository eventRepository =
            new EventRepository("acme/widgets", "https://gitea.example.com/acme/widgets");

    private PushEventHandler handler;

    @BeforeEach
    void setUp() {
        GiteaProperties properties = new GiteaProperties(null, null, null, null);
        handler = new PushEventHandler(repositoryResolver, new CommitMessageFilter(properties),
                commitRepository, authorRepository);
    }

    @Test
    @DisplayName("inserts each commit with its author and a UTC timestamp")
    void insertsCommits() {
        trackRepository();
        when(authorRepository.getOrCreate(any())).thenAnswer(inv -> inv.getArgument(0));
        when(commitRepository.insertIfAbsent(any())).thenReturn(true);

        handler.handle(organization, installation, push(
                commit("c1", "First", "2024-03-01T10:15:00+02:00", "ada@example.com"),
                commit("c2", "Second", "2024-03-01T11:00:00Z", "ada@example.com")));

        ArgumentCaptor<Commit> captor = ArgumentCaptor.forClass(Commit.class);
        verify(commitRepository, times(2)).insertIfAbsent(captor.capture());
        Commit first = captor.getAllValues().get(0);
        assertThat(first.getKey()).isEqualTo("c1");
        assertThat(first.getRepositoryId()).isEqualTo(100L);
        assertThat(first.getDateAdded()).isEqualTo(Instant.parse("2024-03-01T08:15:00Z"));
        assertThat(first.getAuthor().getEmail()).isEqualTo("ada@example.com");
        // same email twice in one push resolves the author once
        verify(authorRepository, times(1)).getOrCreate(any());
    }

    @Test
    @DisplayName("commits whose message carries the skip marker are not recorded")
    void skipsIgnoredMessages() {
        trackRepository();
        when(commitRepository.insertIfAbsent(any())).thenReturn(true);

        handler.handle(organization, installation, push(
                commit("c1", "WIP #skipforgelink", "2024-03-01T10:15:00Z", null),
                commit("c2", "Real change", "2024-03-01T10:16:00Z", null)));

        ArgumentCaptor<Commit> captor = ArgumentCaptor.forClass(Commit.class);
        verify(commitRepository).insertIfAbsent(captor.capture());
        assertThat(captor.getValue().getKey()).isEqualTo("c2");
    }

    @Test
    @DisplayName("blank or over-long author emails leave the commit without an author")
    void unusableEmailsYieldNoAuthor() {
        trackRepository();
        when(commitRepository.insertIfAbsent(any())).thenReturn(true);

        handler.handle(organization, installation, push(
                commit("c1", "a", "2024-03-01T10:15:00Z", ""),
                commit("c2", "b", "2024-03-01T10:15:00Z", "x".repeat(70) + "@e.com"),
                commit("c3", "c", "2024-03-01T10:15:00Z", null)));

        ArgumentCaptor<Commit> captor = ArgumentCaptor.forClass(Commit.class);
        verify(commitRepository, times(3)).insertIfAbsent(captor.capture());
        assertThat(captor.getAllValues()).allSatisfy(c -> assertThat(c.getAuthor()).isNull());
        verifyNoInteractions(authorRepository);
    }

    @Test
    @DisplayName("an author that cannot be stored leaves the commit recorded without an author")
    void authorFailureKeepsCommit() {
        trackRepository();
        when(authorRepository.getOrCreate(any()))
                .thenThrow(new DataIntegrityViolationException("value too long for type character varying(128)"));
        when(commitRepository.insertIfAbsent(any())).thenReturn(true);

        handler.handle(organization, installation, push(new CommitEntry("c1", "a", "2024-03-01T10:15:00Z", null,
                new Person("A".repeat(200), "ada@example.com", "ada"))));

        ArgumentCaptor<Commit> captor = ArgumentCaptor.forClass(Commit.class);
        verify(commitRepository, times(1)).insertIfAbsent(captor.capture());
        assertThat(captor.getValue().getKey()).isEqualTo("c1");
        assertThat(captor.getValue().getAuthor()).isNull();
    }

    @Test
    @DisplayName("one failing commit does not prevent the rest from being recorded")
    void continuesAfterFailure() {
        trackRepository();
        when(commitRepository.insertIfAbsent(any()))
                .thenThrow(new IllegalStateException("constraint"))
                .thenReturn(true);

        handler.handle(organization, installation, push(
                commit("c1", "a", "2024-03-01T10:15:00Z", null),
                commit("c2", "b", "not-a-date", null),
                commit("c3", "c", "2024-03-01T10:17:00Z", null)));

        // c2 never reaches the repository: its timestamp is unusable
        ArgumentCaptor<Commit> captor = ArgumentCaptor.forClass(Commit.class);
        verify(commitRepository, times(2)).insertIfAbsent(captor.capture());
        assertThat(captor.getAllValues()).extracting(Commit::getKey).containsExactly("c1", "c3");
    }

    @Test
    @DisplayName("entries without id are skipped")
    void skipsEntriesWithoutId() {
        trackRepository();
        when(commitRepository.insertIfAbsent(any())).thenReturn(true);

        handler.handle(organization, installation, push(
                commit(null, "a", "2024-03-01T10:15:00Z", null),
                commit("c2", "b", "2024-03-01T10:15:00Z", null)));

        verify(commitRepository, times(1)).insertIfAbsent(any());
    }

    @Test
    @DisplayName("does nothing when the organization does not track the repository")
    void untrackedRepository() {
        when(repositoryResolver.resolve(eq(1L), eq(installation), eq(eventRepository))).thenReturn(Optional.empty());

        handler.handle(organization, installation, push(commit("c1", "a", "2024-03-01T10:15:00Z", null)));

        verifyNoInteractions(commitRepository, authorRepository);
    }

    @Test
    @DisplayName("redelivered commits are accepted without error")
    void redeliveryIsNoOp() {
        trackRepository();
        when(commitRepository.insertIfAbsent(any())).thenReturn(false);

        handler.handle(organization, installation, push(commit("c1", "a", "2024-03-01T10:15:00Z", null)));

        verify(commitRepository).insertIfAbsent(any());
    }

    private void trackRepository() {
        when(repositoryResolver.resolve(eq(1L), eq(installation), eq(eventRepository)))
                .thenReturn(Optional.of(TestFixtures.repository(100L, 1L, "acme/widgets")));
    }

    private PushEventPayload push(CommitEntry... commits) {
        return new PushEventPayload("refs/heads/main", eventRepository, List.copyOf(Arrays.asList(commits)));
    }

    private static CommitEntry commit(String id, String message, String timestamp, String email) {
        return new CommitEntry(id, message, timestamp, null, new Person("Ada", email, "ada"));
    }
}
