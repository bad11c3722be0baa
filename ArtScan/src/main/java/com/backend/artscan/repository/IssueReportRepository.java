package com.backend.artscan.repository;

import com.backend.artscan.model.IssueReport;
import com.backend.artscan.model.IssueState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface IssueReportRepository extends JpaRepository<IssueReport, Long> {

    List<IssueReport> findByStateOrderByCreatedAtAsc(IssueState state);

    List<IssueReport> findByArtworkId(Long artworkId);
}
