package com.evaluate.mockinterview.service;

import com.evaluate.mockinterview.domain.PerformanceSnapshot;
import com.evaluate.mockinterview.domain.QaExchange;
import com.evaluate.mockinterview.domain.Question;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Builds the prompts sent to the language model. Every prompt asks for a bare JSON reply.
 */
@Service
public class PromptService {

    private static final int ASKED_IDS_SHOWN = 5;

    public String jobAnalysisPrompt(String jobTitle, String jobDescription) {
        return """
                Analyze this job description and extract key requirements, skills, and qualifications.

                Job Title: %s
                Job Description: %s

                Provide a JSON object with:
                - key_skills: list of technical skills required
                - experience_level: one of beginner, intermediate, advanced, expert
                - key_responsibilities: list of main responsibilities
                - preferred_qualifications: list of preferred qualifications

                IMPORTANT: Return ONLY valid JSON without any additional text or formatting.
                """.formatted(jobTitle, jobDescription);
    }

    public String questionPoolPrompt(String jobTitle, String jobDescription) {
        return """
                Analyze this job description and generate 20 diverse interview questions for a %s position.

                Job Description: %s

                Generate questions with a natural progression in difficulty:
                - 3 beginner questions (warm-up, basic knowledge)
                - 5 intermediate questions (practical application)
                - 7 advanced questions (complex scenarios)
                - 5 expert questions (architecture, design patterns)

                Format as a JSON array of objects containing:
                - id: unique identifier
                - text: question text, conversational and natural
                - type: one of technical, behavioral, situational, problem_solving, cultural_fit
                - difficulty: one of beginner, intermediate, advanced, expert
                - category: question category
                - expected_keywords: array of keywords a good answer would mention

                IMPORTANT: Return ONLY valid JSON without any additional text or formatting.
                Make the questions sound like a human interviewer would ask them.
                """.formatted(jobTitle, jobDescription);
    }

    public String contextualQuestionPrompt(String jobDescription,
                                           List<QaExchange> history,
                                           Collection<String> askedIds,
                                           PerformanceSnapshot performance) {
        StringBuilder historyText = new StringBuilder();
        for (int i = 0; i < history.size(); i++) {
            historyText.append("Q").append(i + 1).append(": ").append(history.get(i).getQuestion()).append('\n');
            historyText.append("A").append(i + 1).append(": ").append(history.get(i).getAnswer()).append("\n\n");
        }
        List<String> asked = new ArrayList<>(askedIds);
        List<String> recentAsked = asked.subList(Math.max(0, asked.size() - ASKED_IDS_SHOWN), asked.size());
        String difficulty = performance.getTargetDifficulty().label();

        return """
                You are an expert interviewer conducting a mock interview for the following position:

                Job Description: %s

                Current Performance:
                - Technical Score: %s
                - Communication Score: %s
                - Confidence Score: %s

                Conversation History:
                %s
                Already Asked Questions: %s

                Generate the next question with these requirements:
                1. Difficulty level: %s
                2. Make it sound natural and conversational
                3. Build upon previous answers when relevant
                4. If the candidate is struggling, make the question simpler and more encouraging
                5. If the candidate is doing well, make the question more challenging
                6. Focus on a different aspect than the previous questions

                Provide a JSON object with:
                - id: unique identifier
                - text: the question text
                - type: one of technical, behavioral, situational, problem_solving, cultural_fit
                - difficulty: %s
                - category: question category
                - expected_keywords: array of keywords for a good answer

                IMPORTANT: Return ONLY valid JSON without any additional text or formatting.
                """.formatted(jobDescription,
                score(performance.getTechnical()),
                score(performance.getCommunication()),
                score(performance.getConfidence()),
                historyText,
                String.join(", ", recentAsked),
                difficulty,
                difficulty);
    }

    public String answerAnalysisPrompt(Question question, String transcript) {
        return """
                Analyze this interview response and score it.

                Question: %s
                Response: %s
                Expected Keywords: %s

                Provide a JSON object with:
                - technical_score: 0 to 1 score for technical accuracy
                - sentiment_score: -1 to 1 (-1 negative, 0 neutral, 1 positive)
                - confidence_score: 0 to 1 score for confidence level

                IMPORTANT: Return ONLY valid JSON without any additional text or formatting.
                """.formatted(question.getText(), transcript, String.join(", ", question.getExpectedKeywords()));
    }

    private static String score(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
