package com.fitcoach.backend.resolution.controller;

import com.fitcoach.backend.resolution.model.ProgramHistory;
import com.fitcoach.backend.resolution.service.ProgramResolutionService;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/program-resolution")
@RequiredArgsConstructor
public class ProgramResolutionController {

    // 所有 id 都是 UUID 字串
    static final int ID_MAX = 36;

    private final ProgramResolutionService service;

    /** customerId / leadId 都沒帶 → 200 + 空結果 */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProgramHistory> resolve(
            @RequestParam(required = false) @Size(max = ID_MAX) String customerId,
            @RequestParam(required = false) @Size(max = ID_MAX) String leadId
    ) {
        return ResponseEntity.ok(service.resolve(customerId, leadId));
    }

    @GetMapping(value = "/leads/{leadId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProgramHistory> resolveForLead(@PathVariable @Size(max = ID_MAX) String leadId) {
        return ResponseEntity.ok(service.resolveForLead(leadId));
    }
}
