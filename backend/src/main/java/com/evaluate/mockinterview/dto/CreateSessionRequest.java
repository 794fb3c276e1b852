package com.evaluate.mockinterview.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {
    private String jobTitle;
    private String jobDescription;
    private String candidateId;
}
