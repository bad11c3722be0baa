package com.backend.artscan.service;

import com.backend.artscan.exception.ArtworkNotFoundException;
import com.backend.artscan.exception.IssueReportNotFoundException;
import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.IssueKind;
import com.backend.artscan.model.IssueReport;
import com.backend.artscan.model.IssueResolution;
import com.backend.artscan.model.IssueState;
import com.backend.artscan.repository.ArtworkRepository;
import com.backend.artscan.repository.IssueReportRepository;
import com.backend.artscan.repository.ScanEventRepository;
import com.backend.artscan.util.DescriptionJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * User-submitted corrections and their moderation. Reports change state only through {@link #resolveIssue}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IssueReportService {

    private final IssueReportRepository issueReportRepository;
    private final ArtworkRepository artworkRepository;
    private final ScanEventRepository scanEventRepository;
    private final DescriptionJson descriptionJson;

    public IssueReport reportIssue(Long artworkId, String userId, IssueKind kind, String note) {
        if (artworkId == null || !artworkRepository.existsById(artworkId)) {
            throw new ArtworkNotFoundException(artworkId);
        }
        IssueReport report = IssueReport.builder()
                .artworkId(artworkId)
                .userId(userId)
                .kind(kind)
                .note(note)
                .state(IssueState.OPEN)
                .build();
        IssueReport saved = issueReportRepository.save(report);
        log.info("Issue report {} ({}) filed against artwork {}", saved.getId(), kind.getValue(), artworkId);
        return saved;
    }

    public List<IssueReport> listIssues(IssueState state) {
        return issueReportRepository.findByStateOrderByCreatedAtAsc(state);
    }

    public IssueReport getIssue(Long reportId) {
        return issueReportRepository.findById(reportId)
                .orElseThrow(() -> new IssueReportNotFoundException(reportId));
    }

    @Transactional
    public IssueReport resolveIssue(Long reportId, IssueResolution resolution) {
        IssueReport report = getIssue(reportId);
        if (report.getState() != IssueState.OPEN) {
            throw new IllegalStateException("Issue report " + reportId + " is already " + report.getState().getValue());
        }
        if (resolution.getAction() == null) {
            throw new IllegalArgumentException("Resolution action is required");
        }

        switch (resolution.getAction()) {
            case DISMISS:
                report.setState(IssueState.DISMISSED);
                break;
            case CORRECT:
                applyCorrection(report.getArtworkId(), resolution);
                report.setState(IssueState.RESOLVED);
                break;
            case DELETE_ARTWORK:
                deleteArtwork(report.getArtworkId());
                report.setState(IssueState.RESOLVED);
                break;
            default:
                throw new IllegalArgumentException("Unsupported resolution action: " + resolution.getAction());
        }
        report.setResolvedBy(resolution.getModeratorId());
        report.setResolutionNote(resolution.getNote());
        report.setResolvedAt(Instant.now());
        log.info("Issue report {} {} by {}", reportId, report.getState().getValue(), resolution.getModeratorId());
        return issueReportRepository.save(report);
    }

    private void applyCorrection(Long artworkId, IssueResolution resolution) {
        boolean hasTitle = StringUtils.hasText(resolution.getTitle());
        boolean hasArtist = resolution.getArtist() != null;
        boolean hasDescription = resolution.getDescription() != null && !resolution.getDescription().isEmpty();
        if (!hasTitle && !hasArtist && !hasDescription) {
            throw new IllegalArgumentException("A correction needs a title, artist or description");
        }

        Artwork artwork = artworkRepository.findById(artworkId)
                .orElseThrow(() -> new ArtworkNotFoundException(artworkId));
        if (hasTitle) {
            artwork.setTitle(resolution.getTitle().trim());
        }
        if (hasArtist) {
            artwork.setArtist(StringUtils.hasText(resolution.getArtist()) ? resolution.getArtist().trim() : null);
        }
        if (hasDescription) {
            Map<String, Object> description = descriptionJson.read(artwork.getDescriptionJson());
            description.putAll(resolution.getDescription());
            artwork.setDescriptionJson(descriptionJson.write(description));
        }
        artworkRepository.save(artwork);
    }

    private void deleteArtwork(Long artworkId) {
        Artwork artwork = artworkRepository.findById(artworkId)
                .orElseThrow(() -> new ArtworkNotFoundException(artworkId));
        int detached = scanEventRepository.clearArtworkReference(artworkId);
        artworkRepository.delete(artwork);
        log.info("Deleted artwork {} '{}', detached {} scan events", artworkId, artwork.getTitle(), detached);
    }
}
