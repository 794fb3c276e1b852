package com.evaluate.mockinterview.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuestionResponseDto {
    private String id;
    private String sessionId;
    private String questionText;
    private String questionType;
    private String difficulty;
    private String category;
    private List<String> expectedKeywords;
    private String source;
    private Integer questionNumber;
}
