package tw.gc.well.activity.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.well.activity.entities.WellCompletionStatus;

import java.util.List;

@Repository
public interface WellCompletionStatusRepository extends JpaRepository<WellCompletionStatus, Long> {

    List<WellCompletionStatus> findByOperationIdOrderByWellNameAscCompletionNameAscReservoirAscYearAscMonthAsc(Long operationId);

    long countByOperationId(Long operationId);

    @Modifying
    @Query("DELETE FROM WellCompletionStatus c WHERE c.operationId = :operationId")
    int deleteByOperationId(@Param("operationId") Long operationId);
}
