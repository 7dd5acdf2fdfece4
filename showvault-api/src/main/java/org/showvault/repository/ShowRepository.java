package org.showvault.repository;

import org.showvault.model.entity.ShowEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ShowRepository extends JpaRepository<ShowEntity, Long> {

    @Query("SELECT s.id FROM ShowEntity s WHERE s.paused = true")
    List<Long> findPausedShowIds();

    List<ShowEntity> findAllByOrderByNameAsc();
}
