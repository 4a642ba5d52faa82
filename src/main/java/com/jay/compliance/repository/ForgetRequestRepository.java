package com.jay.compliance.repository;

import com.jay.compliance.entity.ForgetRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ForgetRequestRepository extends JpaRepository<ForgetRequest, Long> {

    List<ForgetRequest> findByStatusOrderByIdAsc(ForgetRequest.Status status, Pageable page);

    long countByStatus(ForgetRequest.Status status);
}
