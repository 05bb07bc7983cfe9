package com.shortlink.repository;

import com.shortlink.model.Visit;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VisitRepository extends JpaRepository<Visit, Long> {

    List<Visit> findByCodeOrderByVisitedAtDesc(String code, Pageable pageable);
}
