package com.shortlink.repository;

import com.shortlink.model.ShortLink;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ShortLinkRepository extends JpaRepository<ShortLink, String> {

    List<ShortLink> findByOwnerOrderByCreatedAtDesc(String owner);

    /**
     * Adds {@code delta} to the stored count in a single UPDATE, so concurrent merges stay additive.
     *
     * @return number of rows touched, 0 when the code does not exist
     */
    @Modifying
    @Transactional
    @Query("update ShortLink l set l.visitCount = l.visitCount + :delta where l.code = :code")
    int addToVisitCount(@Param("code") String code, @Param("delta") long delta);
}
