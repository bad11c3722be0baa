package com.backend.artscan.dto;

import com.backend.artscan.model.IssueResolution;
import com.backend.artscan.model.ResolutionAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueResolveRequest {
    @NotNull(message = "Action is required")
    private ResolutionAction action;

    @NotBlank(message = "Moderator ID is required")
    private String resolvedBy;

    private String note;
    private String title;
    private String artist;
    private Map<String, Object> description;

    public IssueResolution toModel() {
        return IssueResolution.builder()
                .action(action)
                .moderatorId(resolvedBy)
                .note(note)
                .title(title)
                .artist(artist)
                .description(description)
                .build();
    }
}
