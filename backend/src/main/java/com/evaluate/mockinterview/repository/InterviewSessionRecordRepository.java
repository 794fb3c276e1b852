package com.evaluate.mockinterview.repository;

import com.evaluate.mockinterview.model.InterviewSessionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InterviewSessionRecordRepository extends JpaRepository<InterviewSessionRecord, String> {

    List<InterviewSessionRecord> findByCandidateIdOrderByCreatedAtDesc(String candidateId);
}
