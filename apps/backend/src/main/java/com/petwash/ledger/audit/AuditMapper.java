package com.petwash.ledger.audit;

import com.petwash.ledger.audit.entity.AuditLedgerEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Persistence boundary of the ledger. Insert-only; SQL lives in {@code mapper/AuditMapper.xml}.
 */
@Mapper
public interface AuditMapper {

    int insert(AuditLedgerEntity row);

    /** Highest-seq record of the subject, or null. */
    AuditLedgerEntity selectTail(@Param("subjectId") String subjectId);

    /** Whole chain, seq ascending. */
    List<AuditLedgerEntity> selectChain(@Param("subjectId") String subjectId);

    /** Newest first. */
    List<AuditLedgerEntity> selectRecent(@Param("subjectId") String subjectId,
                                         @Param("limit") int limit);

    List<String> selectSubjects();
}
