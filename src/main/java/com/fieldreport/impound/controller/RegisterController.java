package com.fieldreport.impound.controller;

import com.fieldreport.impound.controller.dto.RegisterEntryRequest;
import com.fieldreport.impound.model.Operator;
import com.fieldreport.impound.model.RegisterEntry;
import com.fieldreport.impound.service.InspectionRegisterService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * POST /api/register → append an entry
 * GET  /api/register → all entries, newest visit first
 */
@RestController
@RequestMapping("/api/register")
@RequiredArgsConstructor
public class RegisterController {

    private final InspectionRegisterService registerService;

    @PostMapping
    public ResponseEntity<RegisterEntry> create(
            @RequestBody RegisterEntryRequest request,
            @RequestHeader(value = OperatorHeaders.ID, required = false) String operatorId,
            @RequestHeader(value = OperatorHeaders.EMAIL, required = false) String operatorEmail,
            @RequestHeader(value = OperatorHeaders.NAME, required = false) String operatorName) {
        Operator operator = OperatorHeaders.resolve(operatorId, operatorEmail, operatorName);
        RegisterEntry entry = registerService.record(request.toNewEntry(), operator);
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping
    public List<RegisterEntry> list() {
        return registerService.list();
    }
}
