package com.evaluate.mockinterview.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnswerFeedbackDto {
    private String questionId;
    private String transcript;
    private Double technicalScore;
    private Double communicationScore;
    private Double fluency;
    private Double confidence;
    private Double sentiment;
    private Boolean degraded;
    private Integer answeredCount;
    private String status;
    private Boolean interviewComplete;
    private String stopReason;
}
