package com.evaluate.mockinterview.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionResponseDto {
    private String id;
    private String candidateId;
    private String jobTitle;
    private String experienceLevel;
    private List<String> keySkills;
    private String status;
    private Integer questionsAsked;
    private Integer answersRecorded;
    private Integer currentIndex;
    private String stopReason;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Long version;
}
