package com.tradearena.backend.controller;

import com.tradearena.backend.dto.CreateChallengeRequest;
import com.tradearena.backend.dto.CreateCompetitionRequest;
import com.tradearena.backend.dto.UserActionRequest;
import com.tradearena.backend.model.Contest;
import com.tradearena.backend.model.LeaderboardEntry;
import com.tradearena.backend.model.Participant;
import com.tradearena.backend.service.ContestLifecycleService;
import com.tradearena.backend.service.ContestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/contests")
@RequiredArgsConstructor
@Tag(name = "Contests")
public class ContestController {

    private final ContestService contestService;
    private final ContestLifecycleService contestLifecycleService;

    @PostMapping
    @Operation(summary = "Create a competition in DRAFT")
    public ResponseEntity<Contest> create(@Valid @RequestBody CreateCompetitionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contestService.createCompetition(request));
    }

    @PostMapping("/{contestId}/publish")
    @Operation(summary = "Open a competition for registration")
    public ResponseEntity<Contest> publish(@PathVariable Long contestId) {
        return ResponseEntity.ok(contestService.publish(contestId));
    }

    @PostMapping("/{contestId}/join")
    @Operation(summary = "Join a contest and pay the entry fee")
    public ResponseEntity<Participant> join(@PathVariable Long contestId,
                                            @Valid @RequestBody UserActionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contestService.join(contestId, request.getUserId()));
    }

    @PostMapping("/challenges")
    @Operation(summary = "Issue a head-to-head challenge")
    public ResponseEntity<Contest> challenge(@Valid @RequestBody CreateChallengeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contestService.createChallenge(request));
    }

    @PostMapping("/challenges/{contestId}/accept")
    @Operation(summary = "Accept a pending challenge")
    public ResponseEntity<Contest> accept(@PathVariable Long contestId,
                                          @Valid @RequestBody UserActionRequest request) {
        return ResponseEntity.ok(contestService.acceptChallenge(contestId, request.getUserId()));
    }

    @GetMapping("/{contestId}")
    public ResponseEntity<Contest> get(@PathVariable Long contestId) {
        return ResponseEntity.ok(contestService.get(contestId));
    }

    @GetMapping("/{contestId}/participants")
    public ResponseEntity<List<Participant>> participants(@PathVariable Long contestId) {
        return ResponseEntity.ok(contestService.participants(contestId));
    }

    @GetMapping("/{contestId}/leaderboard")
    @Operation(summary = "Final standings of a completed contest")
    public ResponseEntity<List<LeaderboardEntry>> leaderboard(@PathVariable Long contestId) {
        return ResponseEntity.ok(contestLifecycleService.leaderboard(contestId));
    }
}
