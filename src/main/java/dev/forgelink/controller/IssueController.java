package dev.forgelink.controller;

import dev.forgelink.dto.request.CreateIssueRequest;
import dev.forgelink.dto.request.LinkIssueRequest;
import dev.forgelink.dto.response.IssueResponse;
import dev.forgelink.dto.response.IssueSearchResult;
import dev.forgelink.service.IssueBridgeService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Issue bridge. Issue ids are {@code owner/repo#index} and travel as a query parameter.
 */
@RestController
public class IssueController {
    private final IssueBridgeService issueService;

    public IssueController(IssueBridgeService issueService) {
        this.issueService = issueService;
    }

    @PostMapping("/organizations/{organizationId}/installations/{installationId}/issues")
    public ResponseEntity<IssueResponse> createIssue(@PathVariable long organizationId,
                                                     @PathVariable long installationId,
                                                     @RequestBody CreateIssueRequest request) {
        IssueResponse issue = issueService.createIssue(organizationId, installationId,
                request.repo(), request.title(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(issue);
    }

    @GetMapping("/organizations/{organizationId}/installations/{installationId}/issues")
    public IssueResponse getIssue(@PathVariable long organizationId, @PathVariable long installationId,
                                  @RequestParam("id") String issueId) {
        return issueService.getIssue(organizationId, installationId, issueId);
    }

    @PostMapping("/organizations/{organizationId}/installations/{installationId}/issues/link")
    public IssueResponse linkIssue(@PathVariable long organizationId, @PathVariable long installationId,
                                   @RequestBody LinkIssueRequest request) {
        return issueService.linkIssue(organizationId, installationId, request.externalIssue(), request.comment());
    }

    @GetMapping("/extensions/gitea/search/{organizationId}/{installationId}")
    public List<IssueSearchResult> search(@PathVariable long organizationId, @PathVariable long installationId,
                                          @RequestParam(required = false) String field,
                                          @RequestParam(required = false) String query,
                                          @RequestParam(required = false) String repo) {
        return issueService.searchIssues(organizationId, installationId, field, query, repo);
    }
}
