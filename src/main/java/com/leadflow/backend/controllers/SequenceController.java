package com.leadflow.backend.controllers;

import com.leadflow.backend.dto.sequence.AppendStepRequest;
import com.leadflow.backend.dto.sequence.EnrollLeadRequest;
import com.leadflow.backend.dto.sequence.EnrollmentDto;
import com.leadflow.backend.dto.sequence.StepDto;
import com.leadflow.backend.models.sequence.SequenceStep;
import com.leadflow.backend.services.sequence.SequenceEnrollmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SequenceController {

    private final SequenceEnrollmentService enrollmentService;

    @PostMapping("/sequences/{sequenceId}/steps")
    public ResponseEntity<StepDto> appendStep(@RequestHeader("X-User-Id") Long userId,
                                              @PathVariable Long sequenceId,
                                              @Valid @RequestBody AppendStepRequest request) {
        SequenceStep step = enrollmentService.appendStep(sequenceId, userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(StepDto.fromEntity(step, sequenceId));
    }

    @PostMapping("/sequences/{sequenceId}/enrollments")
    public ResponseEntity<EnrollmentDto> enroll(@RequestHeader("X-User-Id") Long userId,
                                                @PathVariable Long sequenceId,
                                                @Valid @RequestBody EnrollLeadRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(EnrollmentDto.fromEntity(enrollmentService.manualEnroll(sequenceId, request.getLeadId(), userId)));
    }

    @DeleteMapping("/enrollments/{enrollmentId}")
    public EnrollmentDto cancel(@RequestHeader("X-User-Id") Long userId,
                                @PathVariable Long enrollmentId,
                                @RequestParam(value = "reason", required = false) String reason) {
        return EnrollmentDto.fromEntity(enrollmentService.cancel(enrollmentId, userId,
                reason != null ? reason : "Canceled by owner"));
    }
}
