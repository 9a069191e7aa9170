package com.babytrack.backend.intake.controller;

import com.babytrack.backend.intake.dto.IntakeDtos.IntakeLogDto;
import com.babytrack.backend.intake.dto.IntakeDtos.LogIntakeRequest;
import com.babytrack.backend.intake.service.IntakeLogService;
import com.babytrack.backend.report.service.ReportZoneResolver;
import com.babytrack.backend.report.service.SubjectIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/subjects/{identity}/intake-logs")
public class IntakeLogController {

    private final IntakeLogService svc;
    private final ReportZoneResolver zoneResolver;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<IntakeLogDto> log(@PathVariable String identity,
                                            @Valid @RequestBody LogIntakeRequest body,
                                            HttpServletRequest req) {
        Long uid = SubjectIds.parse(identity);
        var dto = svc.log(uid, body, zoneResolver.resolve(req));
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<IntakeLogDto> history(@PathVariable String identity,
                                      @RequestParam("category") String category,
                                      @RequestParam(value = "limit", defaultValue = "50") int limit,
                                      HttpServletRequest req) {
        Long uid = SubjectIds.parse(identity);
        return svc.history(uid, category, limit, zoneResolver.resolve(req));
    }
}
