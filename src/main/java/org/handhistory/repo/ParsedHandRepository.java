package org.handhistory.repo;

import org.handhistory.model.ParsedHand;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ParsedHandRepository extends JpaRepository<ParsedHand, Long> {
    Optional<ParsedHand> findFirstByIdent(String ident);
    Optional<ParsedHand> findByRoomAndIdent(String room, String ident);
    List<ParsedHand> findAllByOrderByParsedAtDesc(Pageable pageable);
}
