package com.backend.artscan.service;

import com.backend.artscan.exception.ArtworkNotFoundException;
import com.backend.artscan.exception.IssueReportNotFoundException;
import com.backend.artscan.model.Artwork;
import com.backend.artscan.model.ArtworkSource;
import com.backend.artscan.model.IssueKind;
import com.backend.artscan.model.IssueReport;
import com.backend.artscan.model.IssueResolution;
import com.backend.artscan.model.IssueState;
import com.backend.artscan.model.ResolutionAction;
import com.backend.artscan.repository.ArtworkRepository;
import com.backend.artscan.repository.IssueReportRepository;
import com.backend.artscan.repository.ScanEventRepository;
import com.backend.artscan.util.DescriptionJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class IssueReportServiceTest {

    @Mock
    private IssueReportRepository issueReportRepository;

    @Mock
    private ArtworkRepository artworkRepository;

    @Mock
    private ScanEventRepository scanEventRepository;

    @Spy
    private DescriptionJson descriptionJson = new DescriptionJson(new ObjectMapper());

    @InjectMocks
    private IssueReportService issueReportService;

    private static IssueReport openReport() {
        return IssueReport.builder().id(5L).artworkId(42L).userId("alice")
                .kind(IssueKind.WRONG_TITLE).state(IssueState.OPEN).build();
    }

    private static Artwork communityArtwork() {
        return Artwork.builder().id(42L).title("Unknown Artwork").artist("Unknown")
                .descriptionJson("{\"style\":\"Baroque\"}")
                .source(ArtworkSource.AI_GENERATED).confidenceScore(0.6).build();
    }

    @Test
    public void reportAgainstExistingArtworkStartsOpen() {
        when(artworkRepository.existsById(42L)).thenReturn(true);
        when(issueReportRepository.save(any(IssueReport.class))).thenAnswer(invocation -> invocation.getArgument(0));

        IssueReport report = issueReportService.reportIssue(42L, "alice", IssueKind.WRONG_ARTIST, "It is a Vermeer");

        assertThat(report.getState()).isEqualTo(IssueState.OPEN);
        assertThat(report.getKind()).isEqualTo(IssueKind.WRONG_ARTIST);
        assertThat(report.getNote()).isEqualTo("It is a Vermeer");
    }

    @Test
    public void reportAgainstUnknownArtworkIsRejected() {
        when(artworkRepository.existsById(99L)).thenReturn(false);

        assertThatThrownBy(() -> issueReportService.reportIssue(99L, "alice", IssueKind.NOT_ARTWORK, null))
                .isInstanceOf(ArtworkNotFoundException.class);
        verify(issueReportRepository, never()).save(any());
    }

    @Test
    public void dismissLeavesArtworkUntouched() {
        when(issueReportRepository.findById(5L)).thenReturn(Optional.of(openReport()));
        when(issueReportRepository.save(any(IssueReport.class))).thenAnswer(invocation -> invocation.getArgument(0));

        IssueReport resolved = issueReportService.resolveIssue(5L, IssueResolution.builder()
                .action(ResolutionAction.DISMISS).moderatorId("mod").note("looks right").build());

        assertThat(resolved.getState()).isEqualTo(IssueState.DISMISSED);
        assertThat(resolved.getResolvedBy()).isEqualTo("mod");
        assertThat(resolved.getResolvedAt()).isNotNull();
        verify(artworkRepository, never()).save(any());
    }

    @Test
    public void correctionPatchesOnlyGivenFieldsAndMergesDescription() {
        Artwork artwork = communityArtwork();
        when(issueReportRepository.findById(5L)).thenReturn(Optional.of(openReport()));
        when(artworkRepository.findById(42L)).thenReturn(Optional.of(artwork));
        when(issueReportRepository.save(any(IssueReport.class))).thenAnswer(invocation -> invocation.getArgument(0));

        IssueReport resolved = issueReportService.resolveIssue(5L, IssueResolution.builder()
                .action(ResolutionAction.CORRECT).moderatorId("mod")
                .title(" The Night Watch ").description(Map.of("year", "1642")).build());

        assertThat(resolved.getState()).isEqualTo(IssueState.RESOLVED);
        assertThat(artwork.getTitle()).isEqualTo("The Night Watch");
        assertThat(artwork.getArtist()).isEqualTo("Unknown");
        assertThat(descriptionJson.read(artwork.getDescriptionJson()))
                .containsEntry("style", "Baroque")
                .containsEntry("year", "1642");
        verify(artworkRepository).save(artwork);
    }

    @Test
    public void emptyCorrectionIsRejected() {
        when(issueReportRepository.findById(5L)).thenReturn(Optional.of(openReport()));

        assertThatThrownBy(() -> issueReportService.resolveIssue(5L, IssueResolution.builder()
                .action(ResolutionAction.CORRECT).moderatorId("mod").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void deleteDetachesScanHistoryBeforeRemovingArtwork() {
        Artwork artwork = communityArtwork();
        when(issueReportRepository.findById(5L)).thenReturn(Optional.of(openReport()));
        when(artworkRepository.findById(42L)).thenReturn(Optional.of(artwork));
        when(scanEventRepository.clearArtworkReference(42L)).thenReturn(3);
        when(issueReportRepository.save(any(IssueReport.class))).thenAnswer(invocation -> invocation.getArgument(0));

        IssueReport resolved = issueReportService.resolveIssue(5L, IssueResolution.builder()
                .action(ResolutionAction.DELETE_ARTWORK).moderatorId("mod").build());

        assertThat(resolved.getState()).isEqualTo(IssueState.RESOLVED);
        verify(scanEventRepository).clearArtworkReference(42L);
        verify(artworkRepository).delete(artwork);
    }

    @Test
    public void closedReportCannotBeResolvedAgain() {
        IssueReport report = openReport();
        report.setState(IssueState.RESOLVED);
        when(issueReportRepository.findById(5L)).thenReturn(Optional.of(report));

        assertThatThrownBy(() -> issueReportService.resolveIssue(5L, IssueResolution.builder()
                .action(ResolutionAction.DISMISS).moderatorId("mod").build()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void unknownReportIsNotFound() {
        when(issueReportRepository.findById(77L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> issueReportService.getIssue(77L))
                .isInstanceOf(IssueReportNotFoundException.class);
    }
}
