package com.tradearena.backend.controller;

import com.tradearena.backend.dto.OpenPositionRequest;
import com.tradearena.backend.model.Position;
import com.tradearena.backend.model.TradeHistoryRecord;
import com.tradearena.backend.service.PositionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Positions")
public class PositionController {

    private final PositionService positionService;

    @PostMapping("/contests/{contestId}/positions")
    @Operation(summary = "Open a leveraged position at market")
    public ResponseEntity<Position> open(@PathVariable Long contestId,
                                         @Valid @RequestBody OpenPositionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(positionService.openPosition(contestId, request));
    }

    @PostMapping("/positions/{positionId}/close")
    @Operation(summary = "Close a position at market")
    public ResponseEntity<TradeHistoryRecord> close(@PathVariable Long positionId) {
        return ResponseEntity.ok(positionService.closePosition(positionId, Position.CloseReason.USER));
    }

    @GetMapping("/participants/{participantId}/positions")
    public ResponseEntity<List<Position>> openPositions(@PathVariable Long participantId) {
        return ResponseEntity.ok(positionService.openPositions(participantId));
    }
}
