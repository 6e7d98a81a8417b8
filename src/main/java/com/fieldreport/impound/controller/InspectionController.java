package com.fieldreport.impound.controller;

import com.fieldreport.impound.controller.dto.InspectionRequest;
import com.fieldreport.impound.controller.dto.InspectionView;
import com.fieldreport.impound.controller.dto.IntakeResponse;
import com.fieldreport.impound.controller.dto.ReleaseRequest;
import com.fieldreport.impound.model.Operator;
import com.fieldreport.impound.model.ReleaseReceipt;
import com.fieldreport.impound.model.ReleaseRecord;
import com.fieldreport.impound.service.InspectionIntakeService;
import com.fieldreport.impound.service.InspectionQueryService;
import com.fieldreport.impound.service.ReconciliationCoordinator;
import com.fieldreport.impound.service.ReleaseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Inspection intake, browsing and releases.
 *
 * POST /api/inspections                                 → intake
 * GET  /api/inspections?q=                              → list / search
 * GET  /api/inspections/{id}                            → detail
 * GET  /api/inspections/{id}/releases                   → release history
 * GET  /api/inspections/{id}/releases/{releaseId}       → resolve one release
 * POST /api/inspections/{id}/releases                   → submit a release
 */
@RestController
@RequestMapping("/api/inspections")
@Slf4j
@RequiredArgsConstructor
public class InspectionController {

    static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private final InspectionIntakeService intakeService;
    private final InspectionQueryService queryService;
    private final ReleaseService releaseService;
    private final ReconciliationCoordinator coordinator;

    @PostMapping
    public ResponseEntity<IntakeResponse> create(
            @RequestBody InspectionRequest request,
            @RequestHeader(value = OperatorHeaders.ID, required = false) String operatorId,
            @RequestHeader(value = OperatorHeaders.EMAIL, required = false) String operatorEmail,
            @RequestHeader(value = OperatorHeaders.NAME, required = false) String operatorName) {
        Operator operator = OperatorHeaders.resolve(operatorId, operatorEmail, operatorName);
        IntakeResponse response = IntakeResponse.from(intakeService.submit(request.toNewInspection(), operator));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public List<InspectionView> list(@RequestParam(value = "q", required = false) String filter) {
        return queryService.list(filter).stream().map(InspectionView::from).toList();
    }

    @GetMapping("/{id}")
    public InspectionView get(@PathVariable("id") String inspectionId) {
        return InspectionView.from(queryService.get(inspectionId));
    }

    @GetMapping("/{id}/releases")
    public List<ReleaseRecord> releases(@PathVariable("id") String inspectionId) {
        return queryService.releases(inspectionId);
    }

    @GetMapping("/{id}/releases/{releaseId}")
    public ReleaseRecord release(@PathVariable("id") String inspectionId, @PathVariable("releaseId") String releaseId) {
        return coordinator.findRelease(inspectionId, releaseId).record();
    }

    @PostMapping("/{id}/releases")
    public ResponseEntity<ReleaseReceipt> submitRelease(
            @PathVariable("id") String inspectionId,
            @RequestBody ReleaseRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestHeader(value = OperatorHeaders.ID, required = false) String operatorId,
            @RequestHeader(value = OperatorHeaders.EMAIL, required = false) String operatorEmail,
            @RequestHeader(value = OperatorHeaders.NAME, required = false) String operatorName) {
        Operator operator = OperatorHeaders.resolve(operatorId, operatorEmail, operatorName);
        log.info("Release of {} boxes requested on inspection {} by {}",
                request.boxesReleased(), inspectionId, operator.identity());
        ReleaseReceipt receipt = releaseService.submit(inspectionId, request.toSubmission(), idempotencyKey, operator);
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }
}
