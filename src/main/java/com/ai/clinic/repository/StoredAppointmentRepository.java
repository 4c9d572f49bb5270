package com.ai.clinic.repository;

import com.ai.clinic.entity.StoredAppointment;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StoredAppointmentRepository extends JpaRepository<StoredAppointment, String> {

    List<StoredAppointment> findByUserId(String userId);

    List<StoredAppointment> findByUserIdOrderByStartTimeAsc(String userId, Pageable pageable);
}
