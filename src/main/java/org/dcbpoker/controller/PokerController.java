package org.dcbpoker.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.dcbpoker.dto.ApiResponse;
import org.dcbpoker.dto.poker.*;
import org.dcbpoker.model.poker.EngineResult;
import org.dcbpoker.model.poker.HandResult;
import org.dcbpoker.model.poker.PokerTable;
import org.dcbpoker.model.poker.Seat;
import org.dcbpoker.service.PokerTableService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/poker")
@RequiredArgsConstructor
public class PokerController {

    private final PokerTableService service;

    @PostMapping("/table")
    public ResponseEntity<ApiResponse<TableView>> create(@Valid @RequestBody CreateTableReq req) {
        PokerTable t = service.createTable(req);
        return ResponseEntity.ok(ApiResponse.success(service.view(t.getId(), req.getHostId())));
    }

    @GetMapping("/table/{id}")
    public ResponseEntity<ApiResponse<TableView>> table(@PathVariable Long id,
                                                        @RequestParam(required = false) String viewer) {
        return ResponseEntity.ok(ApiResponse.success(service.view(id, viewer)));
    }

    @PostMapping("/table/{id}/join")
    public ResponseEntity<ApiResponse<Map<String, Object>>> join(@PathVariable Long id, @Valid @RequestBody JoinMsg msg) {
        Seat seat = service.join(id, msg.getPlayerId(), msg.getDisplayName());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("playerId", seat.getPlayerId());
        out.put("displayName", seat.getDisplayName());
        out.put("chips", seat.getChips());
        return ResponseEntity.ok(ApiResponse.success(out));
    }

    @PostMapping("/table/{id}/leave")
    public ResponseEntity<ApiResponse<Map<String, Object>>> leave(@PathVariable Long id, @Valid @RequestBody JoinMsg msg) {
        return ResponseEntity.ok(ApiResponse.success(result(service.leave(id, msg.getPlayerId()))));
    }

    @PostMapping("/table/{id}/start")
    public ResponseEntity<ApiResponse<Map<String, Object>>> start(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(result(service.startHand(id))));
    }

    @PostMapping("/table/{id}/action")
    public ResponseEntity<ApiResponse<Map<String, Object>>> act(@PathVariable Long id, @Valid @RequestBody ActionMsg msg) {
        EngineResult r = service.act(id, msg.getPlayerId(), msg.getAction(), msg.getAmount());
        return ResponseEntity.ok(ApiResponse.success(result(r)));
    }

    @PostMapping("/table/{id}/timeout")
    public ResponseEntity<ApiResponse<Map<String, Object>>> timeout(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(result(service.timeout(id))));
    }

    @GetMapping("/table/{id}/actions")
    public ResponseEntity<ApiResponse<List<String>>> validActions(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(service.validActions(id)));
    }

    @PostMapping("/evaluate")
    public ResponseEntity<ApiResponse<Map<String, Object>>> evaluate(@Valid @RequestBody EvaluateReq req) {
        HandResult h = service.evaluate(req.getCards());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("rank", h.rank().score());
        out.put("name", h.name());
        out.put("kickers", h.kickers());
        out.put("cards", h.cards());
        return ResponseEntity.ok(ApiResponse.success(out));
    }

    private Map<String, Object> result(EngineResult r) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", r.ok());
        if (r.phase() != null) out.put("phase", r.phase().name().toLowerCase());
        if (r.outcome() != null) out.put("result", r.outcome());
        return out;
    }
}
