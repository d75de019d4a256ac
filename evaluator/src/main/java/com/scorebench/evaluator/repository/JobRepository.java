package com.scorebench.evaluator.repository;

import com.scorebench.evaluator.model.Job;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/** Job rows are looked up by id only, when a worker callback names one. */
public interface JobRepository extends JpaRepository<Job, UUID> {
}
