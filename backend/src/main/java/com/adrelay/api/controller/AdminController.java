package com.adrelay.api.controller;

import com.adrelay.admin.AdminReconciliationService;
import com.adrelay.api.dto.CampaignResponse;
import com.adrelay.api.dto.ForceMatchRequest;
import com.adrelay.api.dto.ObservedTransactionResponse;
import com.adrelay.api.dto.ProvisionRequest;
import com.adrelay.api.dto.ReclassifyRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Audited manual reconciliation. Authentication is expected in front of this service.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminReconciliationService adminReconciliationService;

    @GetMapping("/transactions/unresolved")
    public ResponseEntity<List<ObservedTransactionResponse>> unresolved() {
        return ResponseEntity.ok(adminReconciliationService.listUnresolved().stream()
                .map(ObservedTransactionResponse::from)
                .toList());
    }

    @PostMapping("/transactions/{txId}/force-match")
    public ResponseEntity<CampaignResponse> forceMatch(@PathVariable String txId,
                                                       @Valid @RequestBody ForceMatchRequest request) {
        return ResponseEntity.ok(CampaignResponse.from(adminReconciliationService.forceMatch(
                txId, request.orderId(), request.actor(), request.reason())));
    }

    @PostMapping("/transactions/{txId}/reclassify")
    public ResponseEntity<ObservedTransactionResponse> reclassify(@PathVariable String txId,
                                                                  @Valid @RequestBody ReclassifyRequest request) {
        return ResponseEntity.ok(ObservedTransactionResponse.from(adminReconciliationService.reclassify(
                txId, request.expectedOutcome(), request.newOutcome(), request.actor(), request.reason())));
    }

    @PostMapping("/orders/{orderId}/provision")
    public ResponseEntity<CampaignResponse> provision(@PathVariable String orderId,
                                                      @Valid @RequestBody ProvisionRequest request) {
        return ResponseEntity.ok(CampaignResponse.from(
                adminReconciliationService.retryProvisioning(orderId, request.actor())));
    }
}
