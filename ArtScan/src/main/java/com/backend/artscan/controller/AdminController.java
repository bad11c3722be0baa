package com.backend.artscan.controller;

import com.backend.artscan.dto.ArtworkDto;
import com.backend.artscan.dto.IssueReportDto;
import com.backend.artscan.dto.IssueResolveRequest;
import com.backend.artscan.dto.MuseumDto;
import com.backend.artscan.dto.MuseumRequest;
import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.ArtworkSource;
import com.backend.artscan.model.IssueState;
import com.backend.artscan.service.CatalogAdminService;
import com.backend.artscan.service.IssueReportService;
import com.backend.artscan.util.DescriptionJson;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin")
@Tag(name = "Administration", description = "Catalog maintenance and issue moderation")
public class AdminController {

    private final CatalogAdminService catalogAdminService;
    private final IssueReportService issueReportService;
    private final ObjectMapper objectMapper;
    private final DescriptionJson descriptionJson;

    public AdminController(CatalogAdminService catalogAdminService,
                           IssueReportService issueReportService,
                           ObjectMapper objectMapper,
                           DescriptionJson descriptionJson) {
        this.catalogAdminService = catalogAdminService;
        this.issueReportService = issueReportService;
        this.objectMapper = objectMapper;
        this.descriptionJson = descriptionJson;
    }

    @Operation(summary = "List museums")
    @GetMapping("/museums")
    public ResponseEntity<List<MuseumDto>> listMuseums() {
        return ResponseEntity.ok(catalogAdminService.listMuseums().stream()
                .map(MuseumDto::fromModel)
                .collect(Collectors.toList()));
    }

    @Operation(summary = "Create a museum", description = "Register a museum and its geofence")
    @PostMapping("/museums")
    public ResponseEntity<MuseumDto> createMuseum(@Valid @RequestBody MuseumRequest request) {
        MuseumDto created = MuseumDto.fromModel(catalogAdminService.createMuseum(request.toModel()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Update a museum")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Museum updated"),
            @ApiResponse(responseCode = "404", description = "Museum not found")
    })
    @PutMapping("/museums/{id}")
    public ResponseEntity<MuseumDto> updateMuseum(@PathVariable Long id, @Valid @RequestBody MuseumRequest request) {
        return ResponseEntity.ok(MuseumDto.fromModel(catalogAdminService.updateMuseum(id, request.toModel())));
    }

    @Operation(summary = "Get an artwork")
    @GetMapping("/artworks/{id}")
    public ResponseEntity<ArtworkDto> getArtwork(@PathVariable Long id) {
        return ResponseEntity.ok(ArtworkDto.fromModel(catalogAdminService.getArtwork(id), null, descriptionJson));
    }

    @Operation(summary = "Add a verified artwork", description = "Curated entry embedded from an uploaded image")
    @PostMapping(value = "/artworks", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ArtworkDto> createArtwork(
            @Parameter(description = "Reference image of the artwork") @RequestParam("image") MultipartFile image,
            @RequestParam("title") String title,
            @RequestParam(value = "artist", required = false) String artist,
            @Parameter(description = "JSON object with style, year, narrative...")
            @RequestParam(value = "description", required = false) String descriptionJson,
            @RequestParam(value = "museum_id", required = false) Long museumId,
            @RequestParam(value = "source", defaultValue = "admin") String source) throws IOException {

        Map<String, Object> description = descriptionJson == null ? null
                : objectMapper.readValue(descriptionJson, new TypeReference<Map<String, Object>>() {
                });
        Artwork artwork = catalogAdminService.createVerifiedArtwork(image.getBytes(), image.getContentType(),
                image.getOriginalFilename(), title, artist, description, museumId, ArtworkSource.fromValue(source));
        return ResponseEntity.status(HttpStatus.CREATED).body(ArtworkDto.fromModel(artwork, null, this.descriptionJson));
    }

    @Operation(summary = "Moderation queue", description = "Issue reports in the given state, oldest first")
    @GetMapping("/issues")
    public ResponseEntity<List<IssueReportDto>> listIssues(
            @RequestParam(value = "state", defaultValue = "open") String state) {
        return ResponseEntity.ok(issueReportService.listIssues(IssueState.fromValue(state)).stream()
                .map(IssueReportDto::fromModel)
                .collect(Collectors.toList()));
    }

    @Operation(summary = "Resolve an issue report",
            description = "Dismiss it, correct the artwork's title/artist/description, or delete the artwork")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Report resolved"),
            @ApiResponse(responseCode = "404", description = "Report or artwork not found"),
            @ApiResponse(responseCode = "409", description = "Report is no longer open")
    })
    @PostMapping("/issues/{id}/resolve")
    public ResponseEntity<IssueReportDto> resolveIssue(@PathVariable Long id,
                                                       @Valid @RequestBody IssueResolveRequest request) {
        return ResponseEntity.ok(IssueReportDto.fromModel(issueReportService.resolveIssue(id, request.toModel())));
    }
}
