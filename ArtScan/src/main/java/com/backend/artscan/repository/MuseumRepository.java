package com.backend.artscan.repository;

import com.backend.artscan.model.Museum;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface MuseumRepository extends JpaRepository<Museum, Long> {

    Optional<Museum> findByName(String name);
}
