package com.kabadi.pickupservice.repository;

import com.kabadi.pickupservice.model.VendorBackend;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VendorBackendRepository extends JpaRepository<VendorBackend, String> {

    // Candidate pool for dispatch
    List<VendorBackend> findByIsAvailableTrue();
}
