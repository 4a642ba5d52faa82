package com.jay.compliance.controller;

import com.jay.compliance.entity.ForgetRequest;
import com.jay.compliance.forget.ForgetService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Admin API.
 *   POST /forget — queue removal of a company's cached data; answers 202 with the job id
 */
@RestController
@RequiredArgsConstructor
public class AdminController {

    private final ForgetService forgetService;

    @PostMapping("/forget")
    public ResponseEntity<Map<String, Object>> forget(@RequestBody ForgetRequestBody body) {
        ForgetRequest job = forgetService.submit(body.companyId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
            "jobId", job.getId(),
            "status", job.getStatus().name()
        ));
    }
}
