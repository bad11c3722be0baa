package com.backend.artscan.repository;

import com.backend.artscan.model.Artwork;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ArtworkRepository extends JpaRepository<Artwork, Long> {

    List<Artwork> findByMuseumIsNull();

    @Query("select a from Artwork a left join a.museum m where m is null or m.id in :museumIds")
    List<Artwork> findUnaffiliatedOrInMuseums(@Param("museumIds") Collection<Long> museumIds);
}
