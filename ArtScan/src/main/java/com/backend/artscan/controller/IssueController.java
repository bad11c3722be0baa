package com.backend.artscan.controller;

import com.backend.artscan.dto.IssueReportRequest;
import com.backend.artscan.dto.IssueReportResponse;
import com.backend.artscan.exception.ArtworkNotFoundException;
import com.backend.artscan.model.IssueReport;
import com.backend.artscan.service.IssueReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@Tag(name = "Issues", description = "User corrections for catalog entries")
public class IssueController {

    private final IssueReportService issueReportService;

    public IssueController(IssueReportService issueReportService) {
        this.issueReportService = issueReportService;
    }

    @Operation(summary = "Report an issue", description = "Flag a wrong title, wrong artist, or a non-artwork entry")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Report accepted"),
            @ApiResponse(responseCode = "404", description = "Artwork not found")
    })
    @PostMapping("/report-issue")
    public ResponseEntity<IssueReportResponse> reportIssue(@Valid @RequestBody IssueReportRequest request) {
        String userId = StringUtils.hasText(request.getUserId()) ? request.getUserId() : "anonymous";
        IssueReport report = issueReportService.reportIssue(request.getArtworkId(), userId,
                request.getIssueType(), request.getDescription());
        return ResponseEntity.ok(new IssueReportResponse(true, report.getId(), "Your report has been submitted."));
    }

    @ExceptionHandler(ArtworkNotFoundException.class)
    public ResponseEntity<IssueReportResponse> handleUnknownArtwork(ArtworkNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new IssueReportResponse(false, null, e.getMessage()));
    }
}
