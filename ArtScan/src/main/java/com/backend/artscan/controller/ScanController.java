package com.backend.artscan.controller;

import com.backend.artscan.dto.ScanEventDto;
import com.backend.artscan.dto.ScanResponse;
import com.backend.artscan.model.ScanResult;
import com.backend.artscan.service.ScanLedgerService;
import com.backend.artscan.service.ScanService;
import com.backend.artscan.util.DescriptionJson;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/scan")
@Tag(name = "Scan", description = "Artwork recognition API")
@Validated
public class ScanController {

    private final ScanService scanService;
    private final ScanLedgerService scanLedgerService;
    private final DescriptionJson descriptionJson;

    public ScanController(ScanService scanService, ScanLedgerService scanLedgerService,
                          DescriptionJson descriptionJson) {
        this.scanService = scanService;
        this.scanLedgerService = scanLedgerService;
        this.descriptionJson = descriptionJson;
    }

    @Operation(
            summary = "Identify an artwork",
            description = "Upload a photo and the capture location. Returns the matched catalog entry, or an AI "
                    + "analysis that is catalogued on first sight, or not_art."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Scan completed",
                    content = @Content(schema = @Schema(implementation = ScanResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid image or coordinates"),
            @ApiResponse(responseCode = "503", description = "Embedding or analysis service unavailable, retryable")
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ScanResponse> scan(
            @Parameter(description = "Photo of the artwork (JPEG, PNG, etc.)") @RequestParam("image") MultipartFile image,
            @Parameter(description = "Latitude of the capture location") @RequestParam("latitude") double latitude,
            @Parameter(description = "Longitude of the capture location") @RequestParam("longitude") double longitude,
            @Parameter(description = "Scanning user") @RequestParam(value = "user_id", defaultValue = "anonymous") String userId)
            throws IOException {

        ScanResult result = scanService.submitScan(image.getBytes(), image.getContentType(),
                image.getOriginalFilename(), latitude, longitude, userId);
        return ResponseEntity.ok(ScanResponse.fromModel(result, descriptionJson));
    }

    @Operation(summary = "Scan history", description = "A user's completed scans, newest first")
    @GetMapping("/history")
    public ResponseEntity<List<ScanEventDto>> history(
            @RequestParam("user_id") String userId,
            @RequestParam(value = "page", defaultValue = "0") @Min(0) int page,
            @RequestParam(value = "size", defaultValue = "20") @Min(1) @Max(100) int size) {
        List<ScanEventDto> events = scanLedgerService.history(userId, page, size).getContent().stream()
                .map(ScanEventDto::fromModel)
                .collect(Collectors.toList());
        return ResponseEntity.ok(events);
    }
}
