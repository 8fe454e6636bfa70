package dev.forgelink.controller;

import dev.forgelink.dto.request.LinkRepositoryRequest;
import dev.forgelink.dto.response.AvailableRepositoryResponse;
import dev.forgelink.dto.response.RepositoryResponse;
import dev.forgelink.service.RepositoryLinkService;
import dev.forgelink.service.RepositoryQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/organizations/{organizationId}")
public class RepositoryController {
    private final RepositoryQueryService queryService;
    private final RepositoryLinkService linkService;

    public RepositoryController(RepositoryQueryService queryService, RepositoryLinkService linkService) {
        this.queryService = queryService;
        this.linkService = linkService;
    }

    @GetMapping("/repositories")
    public List<RepositoryResponse> listRepositories(@PathVariable long organizationId) {
        return queryService.listRepositories(organizationId);
    }

    @GetMapping("/repositories/{repositoryId}")
    public ResponseEntity<RepositoryResponse> getRepository(@PathVariable long organizationId,
                                                            @PathVariable long repositoryId) {
        return queryService.findById(organizationId, repositoryId)
                .map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/repositories")
    public ResponseEntity<RepositoryResponse> linkRepository(@PathVariable long organizationId,
                                                             @RequestBody LinkRepositoryRequest request) {
        RepositoryResponse created = linkService.linkRepository(organizationId, request.installationId(),
                request.identifier());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @DeleteMapping("/repositories/{repositoryId}")
    public ResponseEntity<Void> unlinkRepository(@PathVariable long organizationId, @PathVariable long repositoryId) {
        linkService.unlinkRepository(organizationId, repositoryId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/installations/{installationId}/repositories")
    public List<AvailableRepositoryResponse> listAvailable(@PathVariable long organizationId,
                                                           @PathVariable long installationId) {
        return linkService.listAvailableRepositories(organizationId, installationId);
    }
}
